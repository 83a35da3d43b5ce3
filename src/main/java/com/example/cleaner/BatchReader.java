package com.example.cleaner;

import com.example.cleaner.io.ChunkedMappedInputStream;
import com.example.cleaner.io.CommonsCsvParserStrategy;
import com.example.cleaner.io.CsvParserStrategy;
import com.example.cleaner.io.UniVocityCsvParserStrategy;
import com.example.cleaner.util.CharsetResolver;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Splits the input file into sequential batches of at most {@code batchSize} rows.
 * The first parsed row is taken as the header and shared by all batches.
 * Single pass only: once exhausted the reader cannot be restarted.
 */
@Slf4j
public class BatchReader implements Iterator<RawBatch>, Closeable {

    private final ChunkedMappedInputStream in;
    private final CsvParserStrategy.RowCursor cursor;
    private final int batchSize;
    private final String[] header;

    private String[] pending;
    private int nextIndex = 1;

    private BatchReader(ChunkedMappedInputStream in, CsvParserStrategy.RowCursor cursor, int batchSize) throws IOException {
        this.in = in;
        this.cursor = cursor;
        this.batchSize = batchSize;
        this.header = cursor.nextRow();
        this.pending = header == null ? null : cursor.nextRow();
    }

    /**
     * Opens the configured input.
     *
     * @throws FileNotFoundException if the input file does not exist
     */
    public static BatchReader open(CleanerConfig config) throws IOException {
        Path file = config.getInputFile();
        if (!Files.isRegularFile(file)) {
            throw new FileNotFoundException("File not found: " + file);
        }
        Charset charset = CharsetResolver.resolve(config.getInputCharset(), file);
        CsvParserStrategy strategy = strategyFor(config);

        ChunkedMappedInputStream in = new ChunkedMappedInputStream(file, config.getInputWindowBytes());
        try {
            Reader reader = new BufferedReader(new InputStreamReader(in, charset), 1 << 16);
            return new BatchReader(in, strategy.open(reader), config.getBatchSize());
        } catch (IOException | RuntimeException e) {
            in.close();
            throw e;
        }
    }

    static CsvParserStrategy strategyFor(CleanerConfig config) {
        if (CleanerConfig.PARSER_COMMONS.equalsIgnoreCase(config.getParser())) {
            CommonsCsvParserStrategy.Config ccfg = new CommonsCsvParserStrategy.Config();
            ccfg.setDelimiter(config.getDelimiter());
            ccfg.setQuoteChar(config.getQuoteChar());
            return new CommonsCsvParserStrategy(ccfg);
        }
        UniVocityCsvParserStrategy.Config ucfg = new UniVocityCsvParserStrategy.Config();
        ucfg.setDelimiter(config.getDelimiter());
        ucfg.setQuoteChar(config.getQuoteChar());
        return new UniVocityCsvParserStrategy(ucfg);
    }

    /** Header row as parsed, or null for an empty input. */
    String[] header() {
        return header == null ? null : header.clone();
    }

    @Override
    public boolean hasNext() {
        return pending != null;
    }

    @Override
    public RawBatch next() {
        if (pending == null) throw new NoSuchElementException("No more batches");
        List<String[]> rows = new ArrayList<>(Math.min(batchSize, 65_536));
        try {
            while (pending != null && rows.size() < batchSize) {
                rows.add(pending);
                pending = cursor.nextRow();
            }
        } catch (IOException e) {
            throw new PipelineException("Failed reading batch " + nextIndex + " near line " + cursor.currentLine(), e);
        }
        return new RawBatch(nextIndex++, header, rows);
    }

    /** Share of the input bytes consumed so far, between 0 and 1. */
    public double progress() {
        long size = in.size();
        return size == 0 ? 1.0 : Math.min(1.0, (double) in.bytesRead() / size);
    }

    @Override
    public void close() throws IOException {
        try {
            cursor.close();
        } finally {
            in.close();
        }
    }
}
