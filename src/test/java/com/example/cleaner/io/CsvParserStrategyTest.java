package com.example.cleaner.io;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Both strategies must yield the same rows for the same input.
 */
class CsvParserStrategyTest {

    static Stream<Arguments> strategies() {
        return Stream.of(
                Arguments.of("univocity", new UniVocityCsvParserStrategy(new UniVocityCsvParserStrategy.Config())),
                Arguments.of("commons", new CommonsCsvParserStrategy(new CommonsCsvParserStrategy.Config())));
    }

    private static List<String[]> readAll(CsvParserStrategy strategy, String text) throws IOException {
        List<String[]> rows = new ArrayList<>();
        try (CsvParserStrategy.RowCursor cursor = strategy.open(new StringReader(text))) {
            String[] row;
            while ((row = cursor.nextRow()) != null) {
                rows.add(row);
            }
        }
        return rows;
    }

    private static String cell(String[] row, int i) {
        if (i >= row.length || row[i] == null || row[i].isEmpty()) return null;
        return row[i];
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("strategies")
    void parsesSemicolonRowsWithQuotesAndBlanks(String name, CsvParserStrategy strategy) throws IOException {
        String text = "ID;Name;Email\n"
                + "1;alice;a@x.com\n"
                + "\n"
                + "2;\"b;ob\";\n"
                + "3;  carol  ;\"line\nbreak\"\n";

        List<String[]> rows = readAll(strategy, text);

        assertThat(rows).hasSize(4);
        assertThat(rows.get(0)).containsExactly("ID", "Name", "Email");
        assertThat(rows.get(1)).containsExactly("1", "alice", "a@x.com");
        assertThat(cell(rows.get(2), 1)).isEqualTo("b;ob");
        assertThat(cell(rows.get(2), 2)).isNull();
        assertThat(cell(rows.get(3), 1)).isEqualTo("carol");
        assertThat(cell(rows.get(3), 2)).isEqualTo("line\nbreak");
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("strategies")
    void emptyInputHasNoRows(String name, CsvParserStrategy strategy) throws IOException {
        assertThat(readAll(strategy, "")).isEmpty();
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("strategies")
    void hashIsNotAComment(String name, CsvParserStrategy strategy) throws IOException {
        List<String[]> rows = readAll(strategy, "#tag;x\n");

        assertThat(rows).hasSize(1);
        assertThat(rows.get(0)[0]).isEqualTo("#tag");
    }
}
