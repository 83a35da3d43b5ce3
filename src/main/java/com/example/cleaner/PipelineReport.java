package com.example.cleaner;

import lombok.Value;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Per-batch outcomes of a run, in batch order, plus the final files actually written.
 */
@Value
public class PipelineReport {
    List<BatchOutcome> outcomes;
    Path cleanFinalFile;
    Path garbageFinalFile;

    public long succeededBatches() {
        return outcomes.stream().filter(BatchOutcome::isSuccess).count();
    }

    public long failedBatches() {
        return outcomes.size() - succeededBatches();
    }

    public long validRows() {
        return successes().mapToLong(BatchOutcome.Success::getValidCount).sum();
    }

    public long garbageRows() {
        return successes().mapToLong(BatchOutcome.Success::getGarbageCount).sum();
    }

    /** Final clean file, absent when no batch succeeded. */
    public Optional<Path> cleanFinal() {
        return Optional.ofNullable(cleanFinalFile);
    }

    public Optional<Path> garbageFinal() {
        return Optional.ofNullable(garbageFinalFile);
    }

    private Stream<BatchOutcome.Success> successes() {
        return outcomes.stream()
                .filter(BatchOutcome::isSuccess)
                .map(BatchOutcome.Success.class::cast);
    }
}
