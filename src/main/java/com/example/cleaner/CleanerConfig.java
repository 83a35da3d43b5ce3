package com.example.cleaner;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Immutable settings for one pipeline run. Collections handed to the builder are copied.
 */
@Value
@Builder(toBuilder = true, buildMethodName = "buildUncopied")
public class CleanerConfig {

    public static final String PARSER_UNIVOCITY = "univocity";
    public static final String PARSER_COMMONS = "commons";

    public static final Map<String, String> DEFAULT_RENAMES = Map.of(
            "ID", "id",
            "Name", "login_id",
            "Email", "mail_address",
            "Date_of_Birth", "birthday_on",
            "Salary", "password");

    Path inputFile;
    String cleanPrefix;
    String garbagePrefix;

    @Builder.Default
    int batchSize = 900_000;
    @Builder.Default
    char delimiter = ';';
    @Builder.Default
    char quoteChar = '"';
    /** Charset name, or {@code auto} to detect. */
    @Builder.Default
    String inputCharset = "UTF-8";
    @Builder.Default
    String parser = PARSER_UNIVOCITY;

    /** Source header to canonical column name. */
    @With(AccessLevel.PRIVATE)
    @Builder.Default
    Map<String, String> renames = DEFAULT_RENAMES;
    @With(AccessLevel.PRIVATE)
    @Builder.Default
    List<CanonicalField> strippedColumns = List.of(CanonicalField.LOGIN_ID, CanonicalField.MAIL_ADDRESS);
    /** Characters matching this class are removed from the stripped columns. */
    @Builder.Default
    String stripPattern = "[^\\w\\s@.\\-]";
    /** Cell values treated as missing, compared case-insensitively. */
    @With(AccessLevel.PRIVATE)
    @Builder.Default
    Set<String> missingValueTokens = Set.of("no email");
    @Builder.Default
    boolean lowercaseMailAddress = true;

    @Builder.Default
    DuplicateScope duplicateScope = DuplicateScope.BATCH;
    /** Adds a {@code rejection_reasons} column to garbage files. */
    @Builder.Default
    boolean rejectionReasonColumn = false;

    @Builder.Default
    long inputWindowBytes = 64L * 1024 * 1024;
    @Builder.Default
    long outputWindowBytes = 8L * 1024 * 1024;

    /**
     * Checks the settings before any file is touched.
     *
     * @throws IllegalArgumentException naming the first offending setting
     */
    public CleanerConfig validate() {
        if (inputFile == null) throw new IllegalArgumentException("inputFile is required");
        if (cleanPrefix == null || cleanPrefix.isBlank()) throw new IllegalArgumentException("cleanPrefix is required");
        if (garbagePrefix == null || garbagePrefix.isBlank()) throw new IllegalArgumentException("garbagePrefix is required");
        if (cleanPrefix.equals(garbagePrefix)) throw new IllegalArgumentException("cleanPrefix and garbagePrefix must differ");
        if (renames == null || strippedColumns == null || missingValueTokens == null) {
            throw new IllegalArgumentException("renames, strippedColumns and missingValueTokens must not be null");
        }
        if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        if (!PARSER_UNIVOCITY.equalsIgnoreCase(parser) && !PARSER_COMMONS.equalsIgnoreCase(parser)) {
            throw new IllegalArgumentException("Unknown parser '" + parser + "', expected univocity or commons");
        }
        if (inputWindowBytes <= 0 || outputWindowBytes <= 0) {
            throw new IllegalArgumentException("Mapped window sizes must be positive");
        }
        for (Map.Entry<String, String> e : renames.entrySet()) {
            if (CanonicalField.byColumnName(e.getValue()).isEmpty()) {
                throw new IllegalArgumentException("Rename target '" + e.getValue() + "' for '" + e.getKey() + "' is not a canonical column");
            }
        }
        try {
            compiledStripPattern();
        } catch (PatternSyntaxException ex) {
            throw new IllegalArgumentException("Invalid stripPattern: " + ex.getDescription(), ex);
        }
        return this;
    }

    public Pattern compiledStripPattern() {
        return Pattern.compile(stripPattern, Pattern.UNICODE_CHARACTER_CLASS);
    }

    public Path cleanChunkFile(int batchIndex) {
        return Path.of(cleanPrefix + "_chunk_" + batchIndex + ".csv");
    }

    public Path garbageChunkFile(int batchIndex) {
        return Path.of(garbagePrefix + "_chunk_" + batchIndex + ".csv");
    }

    public Path cleanFinalFile() {
        return Path.of(cleanPrefix + "_final.csv");
    }

    public Path garbageFinalFile() {
        return Path.of(garbagePrefix + "_final.csv");
    }

    public static class CleanerConfigBuilder {

        public CleanerConfig build() {
            CleanerConfig config = buildUncopied();
            return config
                    .withRenames(config.renames == null ? null : Map.copyOf(config.renames))
                    .withStrippedColumns(config.strippedColumns == null ? null : List.copyOf(config.strippedColumns))
                    .withMissingValueTokens(config.missingValueTokens == null ? null : Set.copyOf(config.missingValueTokens));
        }
    }
}
