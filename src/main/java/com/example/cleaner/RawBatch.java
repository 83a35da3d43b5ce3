package com.example.cleaner;

import lombok.Value;

import java.util.List;

/**
 * A slice of source rows as parsed, before normalization.
 */
@Value
public class RawBatch {
    /** 1-based position of the batch in the input. */
    int index;
    String[] header;
    List<String[]> rows;

    public int size() {
        return rows.size();
    }
}
