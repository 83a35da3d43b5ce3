package com.example.cleaner;

import java.util.Arrays;

/**
 * Column layout of the clean and garbage outputs.
 */
public final class RowLayout {

    public static final String REJECTION_REASONS_COLUMN = "rejection_reasons";

    private final boolean withReasons;

    public RowLayout(CleanerConfig config) {
        this.withReasons = config.isRejectionReasonColumn();
    }

    public String[] cleanHeader() {
        return CanonicalField.columnNames();
    }

    public String[] garbageHeader() {
        String[] names = CanonicalField.columnNames();
        if (!withReasons) return names;
        String[] header = Arrays.copyOf(names, names.length + 1);
        header[names.length] = REJECTION_REASONS_COLUMN;
        return header;
    }

    public String[] cleanRow(UserRecord record) {
        return record.toArray();
    }

    public String[] garbageRow(ValidatedRecord v) {
        String[] values = v.getRecord().toArray();
        if (!withReasons) return values;
        String[] row = Arrays.copyOf(values, values.length + 1);
        row[values.length] = v.rejectionLabel();
        return row;
    }
}
