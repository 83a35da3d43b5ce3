package com.example.cleaner;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Random;

/**
 * Generates a semicolon-delimited user file for volume testing.
 *
 * Usage example:
 *   java -cp ... com.example.cleaner.SampleDataGenerator users.csv 1000000 0.1 UTF-8
 *
 * Roughly {@code badShare} of the rows are broken in one way (bad email, missing name,
 * bad birthday, or a repeat of the previous row); the rest are valid.
 */
@Slf4j
public class SampleDataGenerator {

    static final String HEADER = "ID;Name;Email;Date_of_Birth;Salary;Gender;City";

    private static final String[] NAMES = {"alice", "bob", "chen_wei", "dana", "émile", "li.na", "o'brien", "zoë"};
    private static final String[] DOMAINS = {"example.com", "mail.example.org", "corp-mail.net"};
    private static final String[] CITIES = {"Beijing", "Lyon", "Austin", "Kraków"};

    public static void main(String[] args) throws Exception {
        if (args.length < 3) {
            System.out.println("Usage: SampleDataGenerator <outputFile> <numRows> <badShare> [encoding]");
            System.out.println("Example: SampleDataGenerator /tmp/users.csv 500000 0.1 UTF-8");
            return;
        }
        Path out = Path.of(args[0]);
        long numRows = Long.parseLong(args[1]);
        double badShare = Double.parseDouble(args[2]);
        Charset cs = args.length > 3 ? Charset.forName(args[3]) : Charset.forName("UTF-8");
        generate(out, numRows, badShare, 12345L, cs);
    }

    /**
     * Writes {@code numRows} data rows plus a header. The same seed yields the same file.
     *
     * @return number of rows deliberately made invalid
     */
    public static long generate(Path out, long numRows, double badShare, long seed, Charset cs) throws IOException {
        Random rnd = new Random(seed);
        long bad = 0;
        String previous = null;
        try (Writer w = new BufferedWriter(new OutputStreamWriter(Files.newOutputStream(out), cs), 1 << 16)) {
            w.write(HEADER);
            w.write('\n');
            for (long i = 0; i < numRows; i++) {
                String name = NAMES[rnd.nextInt(NAMES.length)] + i;
                String email = name.replace("'", "") + "@" + DOMAINS[rnd.nextInt(DOMAINS.length)];
                String birthday = String.format("%04d-%02d-%02d", 1950 + rnd.nextInt(55), 1 + rnd.nextInt(12), 1 + rnd.nextInt(28));
                String salary = String.valueOf(20_000 + rnd.nextInt(180_000));
                String gender = rnd.nextBoolean() ? "F" : "M";
                String city = CITIES[rnd.nextInt(CITIES.length)];

                boolean breakRow = rnd.nextDouble() < badShare;
                String line;
                if (breakRow && previous != null && rnd.nextInt(4) == 0) {
                    line = previous;
                    bad += 2;
                } else {
                    if (breakRow) {
                        switch (rnd.nextInt(3)) {
                            case 0: email = "no email"; break;
                            case 1: name = ""; break;
                            default: birthday = "31/31/1999"; break;
                        }
                        bad++;
                    }
                    line = String.join(";", String.valueOf(i + 1), name, email, birthday, salary, gender, city);
                }
                w.write(line);
                w.write('\n');
                previous = line;
                if ((i & 0xFFFF) == 0) {
                    log.info("Generated {} rows", i);
                }
            }
        }
        log.info("Wrote sample file {} rows={}, broken~{}, encoding={}", out.toAbsolutePath(), numRows, bad, cs);
        return bad;
    }
}
