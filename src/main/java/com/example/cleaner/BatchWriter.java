package com.example.cleaner;

import com.example.cleaner.io.CsvRecordWriter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes the per-batch output files. The clean file is always written, the garbage file
 * only when the batch has garbage rows. If writing fails, files already produced for the
 * batch are removed so a dropped batch leaves nothing behind.
 */
@Slf4j
public class BatchWriter {

    private final CleanerConfig config;
    private final RowLayout layout;

    public BatchWriter(CleanerConfig config, RowLayout layout) {
        this.config = config;
        this.layout = layout;
    }

    public void write(PartitionedBatch batch) throws IOException {
        int i = batch.getIndex();
        Path cleanFile = config.cleanChunkFile(i);
        Path garbageFile = config.garbageChunkFile(i);
        try {
            try (CsvRecordWriter w = CsvRecordWriter.create(cleanFile, config.getOutputWindowBytes(), layout.cleanHeader())) {
                for (UserRecord r : batch.getValid()) {
                    w.write(layout.cleanRow(r));
                }
            }
            log.info("Saved cleaned data chunk {} ({} rows) to {}", i, batch.getValid().size(), cleanFile);

            if (batch.getGarbage().isEmpty()) {
                log.info("No garbage data in chunk {}.", i);
                Files.deleteIfExists(garbageFile);
                return;
            }
            try (CsvRecordWriter w = CsvRecordWriter.create(garbageFile, config.getOutputWindowBytes(), layout.garbageHeader())) {
                for (ValidatedRecord v : batch.getGarbage()) {
                    w.write(layout.garbageRow(v));
                }
            }
            log.info("Saved garbage data chunk {} ({} rows) to {}", i, batch.getGarbage().size(), garbageFile);
        } catch (IOException | RuntimeException e) {
            discard(cleanFile);
            discard(garbageFile);
            throw e;
        }
    }

    /** Removes chunk files left from a failed batch, including ones from an earlier run. */
    public void discard(int batchIndex) {
        discard(config.cleanChunkFile(batchIndex));
        discard(config.garbageChunkFile(batchIndex));
    }

    private static void discard(Path file) {
        try {
            if (Files.deleteIfExists(file)) {
                log.info("Removed partial output {}", file);
            }
        } catch (IOException e) {
            log.warn("Could not remove partial output {}: {}", file, e.getMessage());
        }
    }
}
