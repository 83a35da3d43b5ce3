package com.example.cleaner.io;

import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;

/**
 * CSV parser strategy interface to allow switching between uniVocity and Commons CSV.
 * Implementations open a row cursor over the Reader; the first row returned is the header.
 */
public interface CsvParserStrategy {

    RowCursor open(Reader inputReader) throws IOException;

    /**
     * Forward-only view of parsed rows. Cells may be null or empty for missing values.
     */
    interface RowCursor extends Closeable {

        /** Returns the next row, or null once the input is exhausted. */
        String[] nextRow() throws IOException;

        /** 1-based line of the last row returned, for diagnostics. */
        long currentLine();
    }
}
