package com.example.cleaner.io;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.Iterator;

/**
 * Apache Commons CSV implementation (alternative to uniVocity).
 */
@Slf4j
public class CommonsCsvParserStrategy implements CsvParserStrategy {

    @Data
    public static class Config {
        private char delimiter = ';';
        private char quoteChar = '"';
    }

    private final Config cfg;

    public CommonsCsvParserStrategy(Config cfg) {
        this.cfg = cfg;
    }

    @Override
    public RowCursor open(Reader inputReader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT
                .withDelimiter(cfg.delimiter)
                .withQuote(cfg.quoteChar)
                .withIgnoreSurroundingSpaces()
                .withIgnoreEmptyLines(true);

        CSVParser parser = format.parse(inputReader);
        Iterator<CSVRecord> records = parser.iterator();
        return new RowCursor() {
            private long line;

            @Override
            public String[] nextRow() throws IOException {
                try {
                    if (!records.hasNext()) return null;
                    CSVRecord rec = records.next();
                    line = parser.getCurrentLineNumber();
                    return rec.values();
                } catch (UncheckedIOException ex) {
                    log.error("commons-csv failed after line {}: {}", line, ex.getMessage());
                    throw ex.getCause();
                }
            }

            @Override
            public long currentLine() {
                return line;
            }

            @Override
            public void close() throws IOException {
                parser.close();
            }
        };
    }
}
