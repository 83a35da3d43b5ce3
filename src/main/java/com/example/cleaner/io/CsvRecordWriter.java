package com.example.cleaner.io;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Comma-separated UTF-8 output with a header row, written through a memory-mapped stream.
 * Null cells are written as empty fields; quoting is applied only where needed.
 */
@Slf4j
public class CsvRecordWriter implements Closeable {

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT
            .withDelimiter(',')
            .withQuote('"')
            .withRecordSeparator('\n');

    private final Path file;
    private final ChunkedMappedOutputStream out;
    private final CSVPrinter printer;
    private long rows;

    private CsvRecordWriter(Path file, ChunkedMappedOutputStream out, CSVPrinter printer) {
        this.file = file;
        this.out = out;
        this.printer = printer;
    }

    /**
     * Creates or replaces {@code file} and writes the header line.
     */
    public static CsvRecordWriter create(Path file, long windowBytes, String[] header) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        ChunkedMappedOutputStream out = new ChunkedMappedOutputStream(file, windowBytes);
        try {
            BufferedWriter writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8), 1 << 16);
            CSVPrinter printer = new CSVPrinter(writer, FORMAT);
            printer.printRecord((Object[]) header);
            return new CsvRecordWriter(file, out, printer);
        } catch (IOException | RuntimeException e) {
            out.close();
            throw e;
        }
    }

    public void write(String[] row) throws IOException {
        printer.printRecord((Object[]) row);
        rows++;
        if ((rows % 100_000) == 0) {
            log.debug("{}: {} rows written", file.getFileName(), rows);
        }
    }

    public Path file() {
        return file;
    }

    /** Data rows written, header excluded. */
    public long rowCount() {
        return rows;
    }

    /** Bytes on disk; exact only after {@link #close()} has flushed the buffers. */
    public long bytesWritten() {
        return out.bytesWritten();
    }

    @Override
    public void close() throws IOException {
        try {
            printer.close(true);
        } finally {
            out.close();
        }
    }
}
