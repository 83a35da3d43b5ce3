package com.example.cleaner;

import lombok.extern.slf4j.Slf4j;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the batch loop: read, normalize, clean fields, validate, partition, write chunk files,
 * append to the final datasets. A batch that fails anywhere before the final append is logged,
 * reported as {@link BatchOutcome.Failed} and skipped; the loop continues with the next one.
 * A failure outside a batch aborts the run and the final datasets are removed.
 */
@Slf4j
public class CleaningPipeline {

    private final CleanerConfig config;
    private final RecordNormalizer normalizer;
    private final FieldTransformer transformer;
    private final RowLayout layout;
    private final BatchWriter batchWriter;

    public CleaningPipeline(CleanerConfig config) {
        this(config.validate(), new RecordNormalizer(config), new FieldTransformer(config));
    }

    CleaningPipeline(CleanerConfig config, RecordNormalizer normalizer, FieldTransformer transformer) {
        this.config = config;
        this.normalizer = normalizer;
        this.transformer = transformer;
        this.layout = new RowLayout(config);
        this.batchWriter = new BatchWriter(config, layout);
    }

    /**
     * Processes the whole input.
     *
     * @throws FileNotFoundException if the input file is missing; nothing is written then
     * @throws PipelineException     on I/O failure reading the input or writing a final file;
     *                               no final file is left behind then
     */
    public PipelineReport run() throws IOException {
        Path input = config.getInputFile();
        log.info("Starting data processing for {} with batch size {}", input, config.getBatchSize());
        if (!Files.isRegularFile(input)) {
            log.error("File not found: {}", input);
            throw new FileNotFoundException("File not found: " + input);
        }
        Files.deleteIfExists(config.cleanFinalFile());
        Files.deleteIfExists(config.garbageFinalFile());

        RecordValidator validator = newValidator(createDuplicateDetector());
        List<BatchOutcome> outcomes = new ArrayList<>();
        MergedOutput merged = new MergedOutput(config, layout);
        try (BatchReader reader = BatchReader.open(config); merged) {
            while (reader.hasNext()) {
                RawBatch raw = reader.next();
                log.info("Processing chunk {} ({} rows, {}% of input read)",
                        raw.getIndex(), raw.size(), Math.round(reader.progress() * 100));

                PartitionedBatch partitioned;
                try {
                    partitioned = process(validator, raw);
                } catch (BatchProcessingException e) {
                    log.error("Error processing chunk {}: {}", raw.getIndex(), e.getMessage(), e);
                    batchWriter.discard(raw.getIndex());
                    outcomes.add(BatchOutcome.failed(raw.getIndex(), String.valueOf(e.getCause())));
                    continue;
                }
                try {
                    merged.append(partitioned);
                } catch (IOException e) {
                    throw new PipelineException("Failed appending chunk " + raw.getIndex() + " to final datasets", e);
                }
                outcomes.add(BatchOutcome.success(raw.getIndex(),
                        partitioned.getValid().size(), partitioned.getGarbage().size()));
            }
            merged.commit();
        }

        PipelineReport report = new PipelineReport(List.copyOf(outcomes), merged.cleanFile(), merged.garbageFile());
        log.info("Data processing complete. Batches: {} ok, {} dropped. Rows: {} valid, {} garbage",
                report.succeededBatches(), report.failedBatches(), report.validRows(), report.garbageRows());
        return report;
    }

    /**
     * Everything that belongs to one batch; any failure here drops only this batch.
     */
    PartitionedBatch process(RecordValidator validator, RawBatch raw) {
        int i = raw.getIndex();
        try {
            List<UserRecord> records = transformer.transform(normalizer.normalize(raw));
            List<ValidatedRecord> validated = validator.validate(i, records);
            PartitionedBatch partitioned = Partitioner.partition(i, validated);
            log.info("Chunk {} has {} garbage rows (including duplicates).", i, partitioned.getGarbage().size());
            batchWriter.write(partitioned);
            return partitioned;
        } catch (IOException | RuntimeException e) {
            throw new BatchProcessingException(i, e.getMessage(), e);
        }
    }

    /** Hook for the validator used by {@link #run()}. */
    protected RecordValidator newValidator(DuplicateDetector duplicates) {
        return new RecordValidator(duplicates);
    }

    private DuplicateDetector createDuplicateDetector() throws IOException {
        if (config.getDuplicateScope() == DuplicateScope.DATASET) {
            log.info("Scanning {} for dataset-wide duplicates", config.getInputFile());
            return DatasetDuplicateIndex.build(config, normalizer, transformer);
        }
        return DuplicateDetector.batchScoped();
    }
}
