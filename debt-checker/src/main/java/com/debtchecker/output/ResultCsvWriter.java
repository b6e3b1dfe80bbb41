package com.debtchecker.output;

import com.debtchecker.config.DebtCheckerProperties;
import com.debtchecker.model.InputRow;
import com.debtchecker.model.LookupOutcome;
import com.debtchecker.model.RunResult;
import com.opencsv.CSVWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Writes the final result in the original input order, merged by identifier.
 *
 * Output: number,Debt Amount,status,attempts,error
 *  - FOUND: the amount reported by the API
 *  - NOT_FOUND: 0
 *  - FAILED / PENDING: the amount already in the input file, if any
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ResultCsvWriter {

    private final DebtCheckerProperties properties;

    static final String[] HEADERS = {"number", "Debt Amount", "status", "attempts", "error"};

    public void write(List<InputRow> rows, RunResult result, Path outputPath) {
        ensureDirectory(outputPath.toAbsolutePath().getParent());

        try (CSVWriter writer = new CSVWriter(
                Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8),
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {

            if (properties.getOutput().isIncludeHeader()) {
                writer.writeNext(HEADERS);
            }

            for (InputRow row : rows) {
                writer.writeNext(toRow(row, result.results().get(row.identifier())));
            }

            log.info("Written {} rows to {}{}", rows.size(), outputPath, result.partial() ? " (partial run)" : "");

        } catch (IOException e) {
            log.error("Failed to write result file {}: {}", outputPath, e.getMessage(), e);
            throw new UncheckedIOException("Result write failed", e);
        }
    }

    private String[] toRow(InputRow row, Optional<LookupOutcome> outcome) {
        String known = str(row.knownAmount());
        if (outcome.isEmpty()) {
            return new String[]{row.identifier(), known, "PENDING", "", ""};
        }
        LookupOutcome o = outcome.get();
        if (o instanceof LookupOutcome.Found found) {
            return new String[]{row.identifier(), found.amount().toPlainString(), "FOUND", str(found.attempts()), ""};
        }
        if (o instanceof LookupOutcome.NotFound notFound) {
            return new String[]{row.identifier(), "0", "NOT_FOUND", str(notFound.attempts()), ""};
        }
        LookupOutcome.Failed failed = (LookupOutcome.Failed) o;
        String error = failed.detail() == null ? failed.reason().name() : failed.reason() + ": " + failed.detail();
        return new String[]{row.identifier(), known, "FAILED", str(failed.attempts()), error};
    }

    private String str(Object val) {
        if (val instanceof BigDecimal amount) return amount.toPlainString();
        return val == null ? "" : val.toString();
    }

    private void ensureDirectory(Path dir) {
        if (dir == null) return;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create output directory: " + dir, e);
        }
    }
}
