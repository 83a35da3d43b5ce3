package com.example.cleaner.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class CsvRecordWriterTest {

    @TempDir
    Path tmp;

    @Test
    void writesHeaderNullsAndQuotedValues() throws Exception {
        Path file = tmp.resolve("nested/dir/out.csv");

        CsvRecordWriter writer = CsvRecordWriter.create(file, 32, new String[]{"id", "name", "note"});
        writer.write(new String[]{"1", "Zoë", null});
        writer.write(new String[]{"2", "a,b", "say \"hi\""});
        writer.close();

        assertThat(writer.rowCount()).isEqualTo(2);
        assertThat(writer.file()).isEqualTo(file);
        assertThat(Files.readString(file, StandardCharsets.UTF_8))
                .isEqualTo("id,name,note\n1,Zoë,\n2,\"a,b\",\"say \"\"hi\"\"\"\n");
        assertThat(writer.bytesWritten()).isEqualTo(Files.size(file));
    }

    @Test
    void headerOnly() throws Exception {
        Path file = tmp.resolve("empty.csv");

        try (CsvRecordWriter writer = CsvRecordWriter.create(file, 1024, new String[]{"a", "b"})) {
            assertThat(writer.rowCount()).isZero();
        }

        assertThat(Files.readAllLines(file)).containsExactly("a,b");
    }
}
