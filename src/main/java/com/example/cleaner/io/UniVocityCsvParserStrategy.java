package com.example.cleaner.io;

import com.univocity.parsers.common.TextParsingException;
import com.univocity.parsers.csv.CsvParser;
import com.univocity.parsers.csv.CsvParserSettings;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Reader;

/**
 * uniVocity parser implementation.
 */
@Slf4j
public class UniVocityCsvParserStrategy implements CsvParserStrategy {

    @Data
    public static class Config {
        private char delimiter = ';';
        private char quoteChar = '"';
        private boolean skipEmptyLines = true;
        private int maxColumns = 512;
        private int maxCharsPerColumn = 1_000_000;
    }

    private final Config cfg;

    public UniVocityCsvParserStrategy(Config cfg) {
        this.cfg = cfg;
    }

    @Override
    public RowCursor open(Reader inputReader) {
        CsvParserSettings settings = new CsvParserSettings();
        settings.getFormat().setDelimiter(cfg.delimiter);
        settings.getFormat().setQuote(cfg.quoteChar);
        settings.getFormat().setComment('\0');
        settings.setLineSeparatorDetectionEnabled(true);
        settings.setHeaderExtractionEnabled(false);
        settings.setIgnoreLeadingWhitespaces(true);
        settings.setIgnoreTrailingWhitespaces(true);
        settings.setSkipEmptyLines(cfg.skipEmptyLines);
        settings.setNullValue(null);
        settings.setEmptyValue(null);
        settings.setMaxColumns(cfg.maxColumns);
        settings.setMaxCharsPerColumn(cfg.maxCharsPerColumn);

        CsvParser parser = new CsvParser(settings);
        parser.beginParsing(inputReader);
        return new RowCursor() {
            @Override
            public String[] nextRow() throws IOException {
                try {
                    return parser.parseNext();
                } catch (TextParsingException ex) {
                    log.error("uniVocity parser failed near line {}: {}", ex.getLineIndex() + 1, ex.getMessage());
                    throw new IOException("Unparseable input near line " + (ex.getLineIndex() + 1), ex);
                }
            }

            @Override
            public long currentLine() {
                return parser.getContext().currentLine();
            }

            @Override
            public void close() {
                parser.stopParsing();
            }
        };
    }
}
