package com.example.cleaner;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Decides which records of a batch are duplicates. All members of a duplicate group are
 * flagged, not only the later occurrences.
 */
public interface DuplicateDetector {

    /** One flag per record, in the order given. */
    boolean[] flagDuplicates(List<UserRecord> batch);

    /** Compares rows inside the batch only. */
    static DuplicateDetector batchScoped() {
        return batch -> {
            Map<DuplicateKey, Integer> counts = new HashMap<>();
            for (UserRecord r : batch) {
                counts.merge(DuplicateKey.of(r), 1, Integer::sum);
            }
            boolean[] flags = new boolean[batch.size()];
            for (int i = 0; i < flags.length; i++) {
                flags[i] = counts.get(DuplicateKey.of(batch.get(i))) > 1;
            }
            return flags;
        };
    }
}
