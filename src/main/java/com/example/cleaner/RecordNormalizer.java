package com.example.cleaner;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Maps raw rows onto the canonical schema: renames source columns, drops unknown ones,
 * fills absent canonical columns with null and discards rows with no value at all.
 */
@Slf4j
public class RecordNormalizer {

    private static final int CANONICAL_COUNT = CanonicalField.values().length;

    private final Map<String, String> renames;
    private final Set<String> missingTokens;

    // header the cached mapping was built from
    private String[] mappedHeader;
    // canonical ordinal -> source column index, -1 when absent
    private int[] sourceIndex;

    public RecordNormalizer(CleanerConfig config) {
        this.renames = config.getRenames();
        this.missingTokens = config.getMissingValueTokens().stream()
                .map(t -> t.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public List<UserRecord> normalize(RawBatch batch) {
        int[] mapping = mappingFor(batch.getHeader());
        List<UserRecord> out = new ArrayList<>(batch.size());
        int dropped = 0;
        for (String[] row : batch.getRows()) {
            String[] values = new String[CANONICAL_COUNT];
            for (int f = 0; f < CANONICAL_COUNT; f++) {
                int src = mapping[f];
                values[f] = src >= 0 && src < row.length ? cell(row[src]) : null;
            }
            UserRecord record = UserRecord.fromCanonical(values);
            if (record.isEmpty()) {
                dropped++;
            } else {
                out.add(record);
            }
        }
        if (dropped > 0) {
            log.debug("Batch {}: dropped {} empty rows", batch.getIndex(), dropped);
        }
        return out;
    }

    private String cell(String raw) {
        if (raw == null || raw.isBlank()) return null;
        if (missingTokens.contains(raw.trim().toLowerCase(Locale.ROOT))) return null;
        return raw;
    }

    int[] mappingFor(String[] header) {
        if (mappedHeader != header) {
            sourceIndex = buildMapping(header);
            mappedHeader = header;
        }
        return sourceIndex;
    }

    private int[] buildMapping(String[] header) {
        int[] mapping = new int[CANONICAL_COUNT];
        Arrays.fill(mapping, -1);
        List<String> ignored = new ArrayList<>();
        for (int i = 0; i < header.length; i++) {
            String target = canonicalName(header[i], i == 0);
            CanonicalField field = target == null ? null : CanonicalField.byColumnName(target).orElse(null);
            if (field == null) {
                ignored.add(header[i]);
            } else if (mapping[field.ordinal()] < 0) {
                mapping[field.ordinal()] = i;
            } else {
                log.warn("Column '{}' also maps to {}, keeping the first occurrence", header[i], field.columnName());
            }
        }
        if (!ignored.isEmpty()) {
            log.info("Dropping non-canonical source columns: {}", ignored);
        }
        for (CanonicalField f : CanonicalField.values()) {
            if (mapping[f.ordinal()] < 0) {
                log.info("Source has no column for {}, filling with nulls", f.columnName());
            }
        }
        return mapping;
    }

    private String canonicalName(String sourceName, boolean first) {
        if (sourceName == null) return null;
        String name = sourceName.trim();
        if (first && name.startsWith("\uFEFF")) name = name.substring(1).trim();
        String renamed = renames.get(name);
        if (renamed != null) return renamed;
        return name.toLowerCase(Locale.ROOT).replace(' ', '_');
    }
}
