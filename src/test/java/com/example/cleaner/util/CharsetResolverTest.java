package com.example.cleaner.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class CharsetResolverTest {

    @TempDir
    Path tmp;

    @Test
    void resolve_knownNames() {
        assertThat(CharsetResolver.resolve("UTF-8")).isEqualTo(StandardCharsets.UTF_8);
        assertThat(CharsetResolver.resolve("gbk")).isEqualTo(Charset.forName("GBK"));
        assertThat(CharsetResolver.resolve(null)).isEqualTo(StandardCharsets.UTF_8);
        assertThat(CharsetResolver.resolve("  ")).isEqualTo(StandardCharsets.UTF_8);
    }

    @Test
    void resolve_codePageAlias() {
        assertThat(CharsetResolver.resolve("win1252")).isEqualTo(Charset.forName("windows-1252"));
    }

    @Test
    void resolve_unknownFallsBackToUtf8() {
        assertThat(CharsetResolver.resolve("no-such-charset")).isEqualTo(StandardCharsets.UTF_8);
    }

    @Test
    void resolve_autoDetectsUtf8() throws Exception {
        Path file = tmp.resolve("users.csv");
        StringBuilder sb = new StringBuilder("ID;Name;Email\n");
        for (int i = 0; i < 200; i++) {
            sb.append(i).append(";Zoë Müller Ångström ").append(i).append(";z").append(i).append("@exemple.fr\n");
        }
        Files.writeString(file, sb.toString(), StandardCharsets.UTF_8);

        assertThat(CharsetResolver.resolve("auto", file)).isEqualTo(StandardCharsets.UTF_8);
    }

    @Test
    void resolve_autoOnEmptyFile() throws Exception {
        Path file = tmp.resolve("empty.csv");
        Files.write(file, new byte[0]);

        assertThat(CharsetResolver.resolve("AUTO", file)).isEqualTo(StandardCharsets.UTF_8);
    }

    @Test
    void resolve_namedCharsetIgnoresFileContent() throws Exception {
        Path file = tmp.resolve("x.csv");
        Files.writeString(file, "abc");

        assertThat(CharsetResolver.resolve("ISO-8859-1", file)).isEqualTo(StandardCharsets.ISO_8859_1);
    }
}
