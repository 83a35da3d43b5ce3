package com.example.cleaner;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a validated batch into valid records and garbage. Relative order is preserved.
 */
public final class Partitioner {

    private Partitioner() {}

    public static PartitionedBatch partition(int batchIndex, List<ValidatedRecord> validated) {
        List<UserRecord> valid = new ArrayList<>();
        List<ValidatedRecord> garbage = new ArrayList<>();
        for (ValidatedRecord v : validated) {
            if (v.isValid()) {
                valid.add(v.getRecord());
            } else {
                garbage.add(v);
            }
        }
        return new PartitionedBatch(batchIndex, List.copyOf(valid), List.copyOf(garbage));
    }
}
