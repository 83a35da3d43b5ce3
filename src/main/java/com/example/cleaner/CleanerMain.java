package com.example.cleaner;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Command-line entry point for cleaning a user-records file.
 *
 * Example usage:
 * java -jar user-records-cleaner.jar users.csv out/clean out/garbage 900000 univocity cleaner.properties
 *
 * Settings come from built-in defaults, then the optional properties file, then the
 * positional arguments.
 */
@Slf4j
public class CleanerMain {

    public static void main(String[] args) throws Exception {
        if (args.length < 3) {
            System.out.println("Usage: java -jar user-records-cleaner.jar <inputFile> <cleanPrefix> <garbagePrefix> [batchSize] [parser=univocity|commons] [propertiesFile]");
            System.out.println("Example: java -jar ... users.csv out/Clean_Users out/Garbage_Users 900000 univocity cleaner.properties");
            return;
        }
        try {
            CleanerConfig config = parseArgs(args);
            log.info("Options: {}", config);
            PipelineReport report = new CleaningPipeline(config).run();
            if (report.failedBatches() > 0) {
                log.warn("{} batch(es) were dropped: {}", report.failedBatches(), report.getOutcomes());
            }
        } catch (Throwable t) {
            log.error("Cleaning failed: {}", t.getMessage(), t);
            System.err.println("Cleaning failed: " + t);
            throw t;
        }
    }

    static CleanerConfig parseArgs(String[] args) throws IOException {
        CleanerConfig.CleanerConfigBuilder builder = CleanerConfig.builder();
        if (args.length > 5) {
            CleanerConfigLoader.load(Path.of(args[5]), builder);
        }
        builder.inputFile(Path.of(args[0]));
        builder.cleanPrefix(args[1]);
        builder.garbagePrefix(args[2]);
        if (args.length > 3 && !args[3].isBlank()) {
            try {
                builder.batchSize(Integer.parseInt(args[3].replace("_", "")));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("batchSize is not a number: " + args[3], e);
            }
        }
        if (args.length > 4 && !args[4].isBlank()) builder.parser(args[4]);
        return builder.build().validate();
    }
}
