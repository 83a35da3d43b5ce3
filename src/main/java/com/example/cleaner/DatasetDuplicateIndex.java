package com.example.cleaner;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Key occurrence counts over the whole input, built by a separate read pass that runs the
 * same normalization and field cleanup as the main pass. Batches that fail during the scan
 * are skipped there as well.
 */
@Slf4j
public class DatasetDuplicateIndex implements DuplicateDetector {

    private final Map<DuplicateKey, Integer> counts;

    DatasetDuplicateIndex(Map<DuplicateKey, Integer> counts) {
        this.counts = counts;
    }

    public static DatasetDuplicateIndex build(CleanerConfig config, RecordNormalizer normalizer,
                                              FieldTransformer transformer) throws IOException {
        Map<DuplicateKey, Integer> counts = new HashMap<>();
        long rows = 0;
        try (BatchReader reader = BatchReader.open(config)) {
            while (reader.hasNext()) {
                RawBatch batch = reader.next();
                try {
                    for (UserRecord r : transformer.transform(normalizer.normalize(batch))) {
                        counts.merge(DuplicateKey.of(r), 1, Integer::sum);
                        rows++;
                    }
                } catch (RuntimeException e) {
                    log.error("Duplicate scan skipped batch {}: {}", batch.getIndex(), e.getMessage());
                }
            }
        }
        long repeated = counts.values().stream().filter(c -> c > 1).count();
        log.info("Duplicate scan read {} rows, {} distinct keys, {} keys repeated", rows, counts.size(), repeated);
        return new DatasetDuplicateIndex(counts);
    }

    @Override
    public boolean[] flagDuplicates(List<UserRecord> batch) {
        boolean[] flags = new boolean[batch.size()];
        for (int i = 0; i < flags.length; i++) {
            flags[i] = counts.getOrDefault(DuplicateKey.of(batch.get(i)), 0) > 1;
        }
        return flags;
    }
}
