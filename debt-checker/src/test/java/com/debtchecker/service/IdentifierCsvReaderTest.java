package com.debtchecker.service;

import com.debtchecker.config.DebtCheckerProperties;
import com.debtchecker.model.InputRow;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IdentifierCsvReaderTest {

    @TempDir
    Path tempDir;

    private final IdentifierCsvReader reader = new IdentifierCsvReader(new DebtCheckerProperties());

    private Path csv(String content) throws IOException {
        Path file = tempDir.resolve("numbers.csv");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    void readsIdentifiersAndKnownAmounts() throws IOException {
        Path file = csv("""
                id,number,Debt Amount
                1,111/22/33-IP,
                2,222/22/33-IP,1520.75
                3,333/22/33-IP,nan
                4,,
                """);

        List<InputRow> rows = reader.read(file);

        assertThat(rows).containsExactly(
                new InputRow(1, "111/22/33-IP", null),
                new InputRow(2, "222/22/33-IP", new BigDecimal("1520.75")),
                new InputRow(3, "333/22/33-IP", null));
    }

    @Test
    void fallsBackToFirstColumnWithoutIdentifierHeader() throws IOException {
        Path file = csv("""
                ip
                A
                B
                """);

        assertThat(reader.read(file)).extracting(InputRow::identifier).containsExactly("A", "B");
    }

    @Test
    void findsHeaderCaseInsensitivelyAndIgnoresBom() throws IOException {
        Path file = csv("\uFEFFNUMBER,debt amount\n\"X,1\",12 000\n");

        assertThat(reader.read(file)).containsExactly(new InputRow(1, "X,1", new BigDecimal("12000")));
    }

    @Test
    void emptyFileYieldsNoRows() throws IOException {
        assertThat(reader.read(csv(""))).isEmpty();
    }

    @Test
    void missingFileIsRejected() {
        assertThatThrownBy(() -> reader.read(tempDir.resolve("absent.csv")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Input file not found");
    }
}
