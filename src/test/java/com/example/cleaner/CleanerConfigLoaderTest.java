package com.example.cleaner;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CleanerConfig and CleanerConfigLoader Tests")
class CleanerConfigLoaderTest {

    @TempDir
    Path tmp;

    private CleanerConfig.CleanerConfigBuilder minimal() {
        return CleanerConfig.builder().inputFile(tmp.resolve("in.csv")).cleanPrefix("clean").garbagePrefix("garbage");
    }

    @Test
    void defaults() {
        CleanerConfig cfg = minimal().build().validate();

        assertThat(cfg.getBatchSize()).isEqualTo(900_000);
        assertThat(cfg.getDelimiter()).isEqualTo(';');
        assertThat(cfg.getParser()).isEqualTo(CleanerConfig.PARSER_UNIVOCITY);
        assertThat(cfg.getStrippedColumns()).containsExactly(CanonicalField.LOGIN_ID, CanonicalField.MAIL_ADDRESS);
        assertThat(cfg.getDuplicateScope()).isEqualTo(DuplicateScope.BATCH);
        assertThat(cfg.getRenames()).containsEntry("Name", "login_id").containsEntry("Salary", "password").hasSize(5);
        assertThat(cfg.isRejectionReasonColumn()).isFalse();
        assertThat(cfg.isLowercaseMailAddress()).isTrue();
    }

    @Test
    @DisplayName("Collections given to the builder are copied, later changes do not reach the config")
    void build_copiesCollections() {
        Map<String, String> renames = new HashMap<>(CleanerConfig.DEFAULT_RENAMES);
        List<CanonicalField> stripped = new ArrayList<>(List.of(CanonicalField.LOGIN_ID));
        Set<String> tokens = new HashSet<>(Set.of("no email"));

        CleanerConfig cfg = minimal().renames(renames).strippedColumns(stripped).missingValueTokens(tokens).build();
        renames.put("Mail", "mail_address");
        stripped.add(CanonicalField.GENDER);
        tokens.add("n/a");

        assertThat(cfg.getRenames()).doesNotContainKey("Mail").hasSize(5);
        assertThat(cfg.getStrippedColumns()).containsExactly(CanonicalField.LOGIN_ID);
        assertThat(cfg.getMissingValueTokens()).containsExactly("no email");
        assertThatThrownBy(() -> cfg.getRenames().put("Mail", "mail_address"))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(cfg.toBuilder().build()).isEqualTo(cfg);
    }

    @Test
    void outputPaths() {
        CleanerConfig cfg = CleanerConfig.builder().cleanPrefix("out/Clean_Users").garbagePrefix("out/Garbage_Users").build();

        assertThat(cfg.cleanChunkFile(3)).isEqualTo(Path.of("out/Clean_Users_chunk_3.csv"));
        assertThat(cfg.garbageChunkFile(1)).isEqualTo(Path.of("out/Garbage_Users_chunk_1.csv"));
        assertThat(cfg.cleanFinalFile()).isEqualTo(Path.of("out/Clean_Users_final.csv"));
        assertThat(cfg.garbageFinalFile()).isEqualTo(Path.of("out/Garbage_Users_final.csv"));
    }

    @Test
    @DisplayName("Rejects bad settings before any I/O")
    void validate_rejectsBadSettings() {
        assertThatThrownBy(() -> minimal().batchSize(0).build().validate())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("batchSize");
        assertThatThrownBy(() -> minimal().parser("jackson").build().validate())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("jackson");
        assertThatThrownBy(() -> minimal().cleanPrefix(" ").build().validate())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("cleanPrefix");
        assertThatThrownBy(() -> minimal().garbagePrefix("clean").build().validate())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("differ");
        assertThatThrownBy(() -> minimal().stripPattern("[unclosed").build().validate())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("stripPattern");
        assertThatThrownBy(() -> minimal().renames(Map.of("Phone", "mobile")).build().validate())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("mobile");
    }

    @Test
    @DisplayName("Properties file overrides defaults")
    void load_appliesPropertiesFile() throws Exception {
        Path file = tmp.resolve("cleaner.properties");
        try (InputStream in = getClass().getResourceAsStream("/cleaner-test.properties")) {
            Files.copy(in, file);
        }

        CleanerConfig cfg = CleanerConfigLoader.load(file, minimal()).build().validate();

        assertThat(cfg.getBatchSize()).isEqualTo(1000);
        assertThat(cfg.getDelimiter()).isEqualTo(',');
        assertThat(cfg.getParser()).isEqualTo("commons");
        assertThat(cfg.getInputCharset()).isEqualTo("auto");
        assertThat(cfg.getStrippedColumns()).containsExactly(CanonicalField.LOGIN_ID, CanonicalField.MAIL_ADDRESS, CanonicalField.GENDER);
        assertThat(cfg.getStripPattern()).isEqualTo("[^\\w@.]");
        assertThat(cfg.getMissingValueTokens()).containsExactlyInAnyOrder("n/a", "none");
        assertThat(cfg.isLowercaseMailAddress()).isFalse();
        assertThat(cfg.getDuplicateScope()).isEqualTo(DuplicateScope.DATASET);
        assertThat(cfg.isRejectionReasonColumn()).isTrue();
        assertThat(cfg.getRenames()).containsOnly(
                Map.entry("Nom", "login_id"),
                Map.entry("Courriel", "mail_address"),
                Map.entry("Naissance", "birthday_on"));
        assertThat(cfg.getCleanPrefix()).isEqualTo("clean");
    }

    @Test
    void apply_tabDelimiterAndBadValues() {
        Properties props = new Properties();
        props.setProperty("cleaner.delimiter", "\\t");
        assertThat(CleanerConfigLoader.apply(props, minimal()).build().getDelimiter()).isEqualTo('\t');

        Properties badSize = new Properties();
        badSize.setProperty("cleaner.batch-size", "lots");
        assertThatThrownBy(() -> CleanerConfigLoader.apply(badSize, minimal()))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("cleaner.batch-size");

        Properties badColumn = new Properties();
        badColumn.setProperty("cleaner.strip-columns", "login_id,phone");
        assertThatThrownBy(() -> CleanerConfigLoader.apply(badColumn, minimal()))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("phone");

        Properties badScope = new Properties();
        badScope.setProperty("cleaner.duplicate-scope", "galaxy");
        assertThatThrownBy(() -> CleanerConfigLoader.apply(badScope, minimal()))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("BATCH or DATASET");
    }

    @Test
    @DisplayName("Positional arguments win over the properties file")
    void parseArgs_positionalOverridesFile() throws Exception {
        Path file = tmp.resolve("p.properties");
        Files.write(file, List.of("cleaner.batch-size=5", "cleaner.parser=commons", "cleaner.rejection-reason-column=true"));

        CleanerConfig cfg = CleanerMain.parseArgs(new String[]{"users.csv", "c", "g", "250_000", "univocity", file.toString()});

        assertThat(cfg.getInputFile()).isEqualTo(Path.of("users.csv"));
        assertThat(cfg.getBatchSize()).isEqualTo(250_000);
        assertThat(cfg.getParser()).isEqualTo("univocity");
        assertThat(cfg.isRejectionReasonColumn()).isTrue();
        assertThat(cfg.getMissingValueTokens()).isEqualTo(Set.of("no email"));
    }

    @Test
    void parseArgs_rejectsNonNumericBatchSize() {
        assertThatThrownBy(() -> CleanerMain.parseArgs(new String[]{"users.csv", "c", "g", "many"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("many");
    }
}
