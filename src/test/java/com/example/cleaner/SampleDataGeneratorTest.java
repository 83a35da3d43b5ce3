package com.example.cleaner;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SampleDataGeneratorTest {

    @TempDir
    Path tmp;

    @Test
    void generate_isDeterministic() throws Exception {
        Path a = tmp.resolve("a.csv");
        Path b = tmp.resolve("b.csv");

        SampleDataGenerator.generate(a, 500, 0.2, 7L, StandardCharsets.UTF_8);
        SampleDataGenerator.generate(b, 500, 0.2, 7L, StandardCharsets.UTF_8);

        List<String> lines = Files.readAllLines(a);
        assertThat(lines).hasSize(501);
        assertThat(lines.get(0)).isEqualTo(SampleDataGenerator.HEADER);
        assertThat(Files.readAllBytes(a)).isEqualTo(Files.readAllBytes(b));
    }

    @Test
    @DisplayName("Generated files run through the pipeline with every row accounted for")
    void generate_feedsThePipeline() throws Exception {
        Path input = tmp.resolve("users.csv");
        long broken = SampleDataGenerator.generate(input, 2_000, 0.1, 99L, StandardCharsets.UTF_8);
        CleanerConfig cfg = CleanerConfig.builder()
                .inputFile(input)
                .cleanPrefix(tmp.resolve("Clean_Users").toString())
                .garbagePrefix(tmp.resolve("Garbage_Users").toString())
                .batchSize(300)
                .build();

        PipelineReport report = new CleaningPipeline(cfg).run();

        assertThat(report.getOutcomes()).hasSize(7).allMatch(BatchOutcome::isSuccess);
        assertThat(report.validRows() + report.garbageRows()).isEqualTo(2_000);
        assertThat(report.garbageRows()).isPositive().isLessThanOrEqualTo(broken);
        assertThat(Files.readAllLines(cfg.cleanFinalFile())).hasSize((int) report.validRows() + 1);
        assertThat(Files.readAllLines(cfg.garbageFinalFile())).hasSize((int) report.garbageRows() + 1);
    }
}
