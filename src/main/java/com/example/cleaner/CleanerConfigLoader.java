package com.example.cleaner;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;

/**
 * Overlays {@code cleaner.*} keys from a properties file onto a config builder.
 * Keys that are absent leave the builder's value untouched. Any {@code cleaner.rename.*}
 * key replaces the whole default rename map.
 */
@Slf4j
public final class CleanerConfigLoader {

    static final String PREFIX = "cleaner.";
    static final String RENAME_PREFIX = PREFIX + "rename.";

    private CleanerConfigLoader() {}

    public static CleanerConfig.CleanerConfigBuilder load(Path file, CleanerConfig.CleanerConfigBuilder builder) throws IOException {
        Properties props = new Properties();
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            props.load(r);
        }
        log.info("Loaded {} settings from {}", props.size(), file);
        return apply(props, builder);
    }

    public static CleanerConfig.CleanerConfigBuilder apply(Properties props, CleanerConfig.CleanerConfigBuilder b) {
        String v;
        if ((v = get(props, "input-file")) != null) b.inputFile(Path.of(v));
        if ((v = get(props, "clean-prefix")) != null) b.cleanPrefix(v);
        if ((v = get(props, "garbage-prefix")) != null) b.garbagePrefix(v);
        if ((v = get(props, "batch-size")) != null) b.batchSize(parseInt("batch-size", v));
        if ((v = get(props, "delimiter")) != null) b.delimiter(singleChar("delimiter", v));
        if ((v = get(props, "quote-char")) != null) b.quoteChar(singleChar("quote-char", v));
        if ((v = get(props, "input-charset")) != null) b.inputCharset(v);
        if ((v = get(props, "parser")) != null) b.parser(v.toLowerCase(Locale.ROOT));
        if ((v = get(props, "strip-columns")) != null) b.strippedColumns(parseColumns(v));
        if ((v = get(props, "strip-pattern")) != null) b.stripPattern(v);
        if ((v = get(props, "missing-value-tokens")) != null) b.missingValueTokens(parseTokens(v));
        if ((v = get(props, "lowercase-mail-address")) != null) b.lowercaseMailAddress(Boolean.parseBoolean(v));
        if ((v = get(props, "duplicate-scope")) != null) b.duplicateScope(parseScope(v));
        if ((v = get(props, "rejection-reason-column")) != null) b.rejectionReasonColumn(Boolean.parseBoolean(v));
        if ((v = get(props, "input-window-bytes")) != null) b.inputWindowBytes(parseLong("input-window-bytes", v));
        if ((v = get(props, "output-window-bytes")) != null) b.outputWindowBytes(parseLong("output-window-bytes", v));

        Map<String, String> renames = new LinkedHashMap<>();
        for (String key : new TreeSet<>(props.stringPropertyNames())) {
            if (key.startsWith(RENAME_PREFIX)) {
                renames.put(key.substring(RENAME_PREFIX.length()), props.getProperty(key).trim());
            }
        }
        if (!renames.isEmpty()) b.renames(renames);
        return b;
    }

    private static String get(Properties props, String key) {
        String v = props.getProperty(PREFIX + key);
        if (v == null) return null;
        // keep delimiter-like values such as a single space intact
        return v.isBlank() ? v : v.trim();
    }

    private static int parseInt(String key, String v) {
        try {
            return Integer.parseInt(v.replace("_", ""));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(PREFIX + key + " is not a number: " + v, e);
        }
    }

    private static long parseLong(String key, String v) {
        try {
            return Long.parseLong(v.replace("_", ""));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(PREFIX + key + " is not a number: " + v, e);
        }
    }

    static char singleChar(String key, String v) {
        if ("\\t".equals(v) || "tab".equalsIgnoreCase(v)) return '\t';
        if (v.length() != 1) {
            throw new IllegalArgumentException(PREFIX + key + " must be a single character: '" + v + "'");
        }
        return v.charAt(0);
    }

    private static List<CanonicalField> parseColumns(String v) {
        List<CanonicalField> columns = new ArrayList<>();
        for (String name : v.split(",")) {
            String n = name.trim();
            if (n.isEmpty()) continue;
            columns.add(CanonicalField.byColumnName(n).orElseThrow(
                    () -> new IllegalArgumentException(PREFIX + "strip-columns: unknown column '" + n + "'")));
        }
        return List.copyOf(columns);
    }

    private static Set<String> parseTokens(String v) {
        Set<String> tokens = new LinkedHashSet<>();
        for (String t : v.split(",")) {
            if (!t.isBlank()) tokens.add(t.trim());
        }
        return Set.copyOf(tokens);
    }

    private static DuplicateScope parseScope(String v) {
        try {
            return DuplicateScope.valueOf(v.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(PREFIX + "duplicate-scope must be BATCH or DATASET: " + v, e);
        }
    }
}
