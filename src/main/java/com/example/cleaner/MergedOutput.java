package com.example.cleaner;

import com.example.cleaner.io.CsvRecordWriter;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Final clean and garbage datasets, appended to batch by batch in batch order.
 * Both files are created by the first {@link #append}; with no append neither exists.
 * The files are kept only if {@link #commit} was called before {@link #close}; a run that
 * aborts part way leaves no final files behind.
 */
@Slf4j
public class MergedOutput implements Closeable {

    private final CleanerConfig config;
    private final RowLayout layout;

    private CsvRecordWriter clean;
    private CsvRecordWriter garbage;
    private Path cleanFile;
    private Path garbageFile;
    private boolean committed;

    public MergedOutput(CleanerConfig config, RowLayout layout) {
        this.config = config;
        this.layout = layout;
    }

    public void append(PartitionedBatch batch) throws IOException {
        if (clean == null) {
            open();
        }
        for (UserRecord r : batch.getValid()) {
            clean.write(layout.cleanRow(r));
        }
        for (ValidatedRecord v : batch.getGarbage()) {
            garbage.write(layout.garbageRow(v));
        }
        log.debug("Appended batch {} to final datasets", batch.getIndex());
    }

    private void open() throws IOException {
        clean = CsvRecordWriter.create(config.cleanFinalFile(), config.getOutputWindowBytes(), layout.cleanHeader());
        try {
            garbage = CsvRecordWriter.create(config.garbageFinalFile(), config.getOutputWindowBytes(), layout.garbageHeader());
        } catch (IOException | RuntimeException e) {
            clean.close();
            clean = null;
            throw e;
        }
    }

    /** Marks the datasets complete; called once the whole input has been processed. */
    public void commit() {
        committed = true;
    }

    /** Path of the final clean file, or null if nothing was appended or the run aborted. */
    public Path cleanFile() {
        return cleanFile;
    }

    public Path garbageFile() {
        return garbageFile;
    }

    @Override
    public void close() throws IOException {
        if (clean == null) {
            log.info("No batch succeeded, final datasets not written");
            return;
        }
        try {
            clean.close();
        } finally {
            garbage.close();
        }
        if (!committed) {
            Files.deleteIfExists(clean.file());
            Files.deleteIfExists(garbage.file());
            log.warn("Run aborted, removed incomplete final datasets {} and {}", clean.file(), garbage.file());
            return;
        }
        cleanFile = clean.file();
        garbageFile = garbage.file();
        log.info("Saved final cleaned dataset ({} rows) to {}", clean.rowCount(), cleanFile);
        log.info("Saved final garbage dataset ({} rows) to {}", garbage.rowCount(), garbageFile);
    }
}
