package com.debtchecker.service;

import com.debtchecker.config.DebtCheckerProperties;
import com.debtchecker.model.InputRow;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads enforcement-procedure numbers from the input CSV.
 *
 * The first row is a header. The identifier column is found by name and falls
 * back to the first column; the known amount column is optional.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IdentifierCsvReader {

    private final DebtCheckerProperties properties;

    public List<InputRow> read(Path inputPath) {
        if (!Files.isRegularFile(inputPath)) {
            throw new IllegalArgumentException("Input file not found: " + inputPath.toAbsolutePath());
        }

        List<InputRow> rows = new ArrayList<>();
        int blank = 0;

        try (CSVReader reader = new CSVReader(Files.newBufferedReader(inputPath, StandardCharsets.UTF_8))) {
            String[] header = reader.readNext();
            if (header == null) {
                log.warn("Input file {} is empty", inputPath);
                return List.of();
            }

            int idCol = columnIndex(header, properties.getInput().getIdentifierColumn());
            if (idCol < 0) {
                log.warn("Column '{}' not found in {}, using the first column",
                        properties.getInput().getIdentifierColumn(), inputPath);
                idCol = 0;
            }
            int amountCol = columnIndex(header, properties.getInput().getAmountColumn());

            String[] cols;
            int line = 0;
            while ((cols = reader.readNext()) != null) {
                line++;
                String identifier = safeGet(cols, idCol);
                if (identifier.isBlank()) {
                    blank++;
                    continue;
                }
                BigDecimal known = amountCol < 0 ? null : parseAmount(safeGet(cols, amountCol), line);
                rows.add(new InputRow(line, identifier, known));
            }

        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read input file " + inputPath, e);
        } catch (CsvValidationException e) {
            throw new IllegalArgumentException("Malformed CSV in " + inputPath + ": " + e.getMessage(), e);
        }

        log.info("Read {} numbers from {}{}", rows.size(), inputPath,
                blank > 0 ? " (" + blank + " blank rows skipped)" : "");
        return rows;
    }

    static int columnIndex(String[] header, String name) {
        if (name == null || name.isBlank()) return -1;
        for (int i = 0; i < header.length; i++) {
            String col = header[i].replace("\uFEFF", "").trim();
            if (col.equalsIgnoreCase(name.trim())) return i;
        }
        return -1;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private BigDecimal parseAmount(String raw, int line) {
        if (raw.isBlank() || raw.equalsIgnoreCase("nan")) return null;
        BigDecimal amount = FsspReplyMapper.parseAmount(raw);
        if (amount == null) {
            log.warn("Ignoring unparseable amount '{}' on line {}", raw, line);
        }
        return amount;
    }

    private String safeGet(String[] cols, int idx) {
        return idx < cols.length ? cols[idx].trim() : "";
    }
}
