package com.intervue.evaluation.runner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.intervue.evaluation.model.RunnerCheck;
import com.intervue.evaluation.model.RunnerResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Local, side-effect free checks on a candidate answer.
 * <p>
 * Textual answers spanning several lines are read as CSV (header row first) and must contain at
 * least one data row; any other non-empty answer passes a presence check. A question spec may
 * list {@code expected_columns} that the header must contain. Faults become a failed
 * {@code exception} check instead of propagating.
 */
@Component
public class DeterministicRunner {

    private static final Logger log = LoggerFactory.getLogger(DeterministicRunner.class);

    static final String CHECK_ROWS_PRESENT = "rows_present";
    static final String CHECK_NON_EMPTY = "non_empty_submission";
    static final String CHECK_EXPECTED_COLUMNS = "expected_columns";
    static final String CHECK_EXCEPTION = "exception";
    static final String SPEC_EXPECTED_COLUMNS = "expected_columns";

    private final CsvMapper csvMapper = CsvMapper.builder()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .enable(CsvParser.Feature.TRIM_SPACES)
            .build();

    public RunnerResult run(JsonNode spec, JsonNode answer) {
        try {
            if (isEmpty(answer)) {
                return RunnerResult.of(List.of());
            }
            if (answer.isTextual() && isTabular(answer.textValue())) {
                return runTabularChecks(spec, answer.textValue());
            }
            return RunnerResult.of(List.of(RunnerCheck.of(CHECK_NON_EMPTY, true)));
        } catch (IOException | RuntimeException ex) {
            log.debug("Deterministic checks failed: {}", ex.getMessage());
            return RunnerResult.failed(RunnerCheck.of(CHECK_EXCEPTION, false, "error", describe(ex)));
        }
    }

    private RunnerResult runTabularChecks(JsonNode spec, String table) throws IOException {
        List<List<String>> rows = readRows(table);
        if (rows.isEmpty()) {
            return RunnerResult.of(List.of(RunnerCheck.of(CHECK_ROWS_PRESENT, false, "rows", 0)));
        }

        List<String> header = rows.get(0);
        List<List<String>> dataRows = rows.subList(1, rows.size());
        for (int i = 0; i < dataRows.size(); i++) {
            List<String> row = dataRows.get(i);
            if (row.size() > header.size()) {
                throw new IllegalArgumentException(
                        "Expected " + header.size() + " fields in line " + (i + 2) + ", saw " + row.size()
                );
            }
        }

        List<RunnerCheck> checks = new ArrayList<>();
        int rowCount = dataRows.size();
        checks.add(RunnerCheck.of(CHECK_ROWS_PRESENT, rowCount > 0, "rows", rowCount));

        List<String> expectedColumns = expectedColumns(spec);
        if (!expectedColumns.isEmpty()) {
            List<String> missing = expectedColumns.stream()
                    .filter(column -> !header.contains(column))
                    .toList();
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("missing", missing);
            checks.add(new RunnerCheck(CHECK_EXPECTED_COLUMNS, missing.isEmpty(), details));
        }
        return RunnerResult.of(checks);
    }

    private List<List<String>> readRows(String table) throws IOException {
        List<List<String>> rows = new ArrayList<>();
        try (MappingIterator<List<String>> iterator = csvMapper
                .readerForListOf(String.class)
                .readValues(table)) {
            while (iterator.hasNextValue()) {
                List<String> row = iterator.nextValue();
                if (!isBlankRow(row)) {
                    rows.add(row);
                }
            }
        }
        return rows;
    }

    private static List<String> expectedColumns(JsonNode spec) {
        if (spec == null || !spec.isObject()) {
            return List.of();
        }
        JsonNode columns = spec.get(SPEC_EXPECTED_COLUMNS);
        if (columns == null || !columns.isArray()) {
            return List.of();
        }
        List<String> names = new ArrayList<>();
        columns.forEach(column -> {
            if (column.isTextual() && !column.textValue().isBlank()) {
                names.add(column.textValue().trim());
            }
        });
        return names;
    }

    static boolean isTabular(String text) {
        return text.strip().contains("\n");
    }

    static boolean isEmpty(JsonNode answer) {
        if (answer == null || answer.isNull() || answer.isMissingNode()) {
            return true;
        }
        if (answer.isTextual()) {
            return answer.textValue().isBlank();
        }
        if (answer.isContainerNode()) {
            return answer.isEmpty();
        }
        if (answer.isBoolean()) {
            return !answer.booleanValue();
        }
        if (answer.isNumber()) {
            return answer.doubleValue() == 0.0;
        }
        return false;
    }

    private static boolean isBlankRow(List<String> row) {
        return row.isEmpty() || row.stream().allMatch(cell -> cell == null || cell.isBlank());
    }

    private static String describe(Exception ex) {
        String message = ex.getMessage();
        return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message;
    }
}
