package com.example.cleaner.util;

import com.ibm.icu.text.CharsetDetector;
import com.ibm.icu.text.CharsetMatch;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Resolves the input charset name from configuration. {@code auto} sniffs the head of the
 * file with ICU4J; other names go through {@link Charset#forName} with a few Windows/IBM
 * code-page aliases tried before falling back to UTF-8.
 */
@Slf4j
public final class CharsetResolver {

    public static final String AUTO = "auto";

    private static final int SNIFF_BYTES = 64 * 1024;
    private static final int MIN_CONFIDENCE = 50;

    private CharsetResolver() {}

    public static Charset resolve(String name, Path file) throws IOException {
        if (name != null && AUTO.equalsIgnoreCase(name.trim())) {
            return detect(file);
        }
        return resolve(name);
    }

    public static Charset resolve(String name) {
        if (name == null || name.isBlank()) return StandardCharsets.UTF_8;
        String n = name.trim();
        Set<String> candidates = new LinkedHashSet<>();
        candidates.add(n);
        String digits = n.replaceAll("\\D+", "");
        if (!digits.isEmpty()) {
            candidates.add("Cp" + digits);
            candidates.add("windows-" + digits);
            candidates.add("IBM" + digits);
        }
        for (String c : candidates) {
            try {
                Charset cs = Charset.forName(c);
                if (!c.equals(n)) {
                    log.info("Resolved charset '{}' -> '{}'", name, cs.name());
                }
                return cs;
            } catch (IllegalArgumentException ex) {
                log.debug("Charset candidate '{}' rejected: {}", c, ex.getMessage());
            }
        }
        log.warn("Failed to resolve charset '{}', falling back to UTF-8", name);
        return StandardCharsets.UTF_8;
    }

    static Charset detect(Path file) throws IOException {
        byte[] head;
        try (InputStream in = Files.newInputStream(file)) {
            head = in.readNBytes(SNIFF_BYTES);
        }
        if (head.length == 0) return StandardCharsets.UTF_8;

        CharsetDetector detector = new CharsetDetector();
        detector.setText(head);
        CharsetMatch match = detector.detect();
        if (match == null || match.getConfidence() < MIN_CONFIDENCE) {
            log.info("Charset detection inconclusive for {}, using UTF-8", file);
            return StandardCharsets.UTF_8;
        }
        log.info("Detected charset {} (confidence {}) for {}", match.getName(), match.getConfidence(), file);
        return resolve(match.getName());
    }
}
