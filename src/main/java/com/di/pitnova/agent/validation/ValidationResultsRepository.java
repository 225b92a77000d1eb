package com.di.pitnova.agent.validation;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Stores a {@link ValidationReport} as {@code validation_details.csv} (one row per decision, header
 * row, empty cells for undefined values) and {@code validation_summary.txt} ({@code key: value}
 * lines, an undefined mean written as {@code None}).
 */
@Slf4j
@Component
public class ValidationResultsRepository {

    static final String NONE = "None";

    private final CsvMapper csvMapper;
    private final CsvSchema schema;
    private final ValidationProperties properties;

    @Autowired
    public ValidationResultsRepository(ValidationProperties properties) {
        this.properties = properties != null ? properties : new ValidationProperties();
        this.csvMapper = CsvMapper.builder()
                .enable(CsvParser.Feature.EMPTY_STRING_AS_NULL)
                .build();
        this.schema = csvMapper.schemaFor(ValidationDecision.class).withHeader();
    }

    public ValidationResultsRepository() {
        this(new ValidationProperties());
    }

    public Path save(ValidationReport report) {
        return save(report, properties.getResultsPath());
    }

    /** Writes both files into {@code dir}, creating it when needed. */
    public Path save(ValidationReport report, Path dir) {
        try {
            Files.createDirectories(dir);
            try (BufferedWriter w = Files.newBufferedWriter(dir.resolve(properties.getDetailsFile()), StandardCharsets.UTF_8)) {
                csvMapper.writer(schema).writeValue(w, report.getDecisions());
            }
            try (BufferedWriter w = Files.newBufferedWriter(dir.resolve(properties.getSummaryFile()), StandardCharsets.UTF_8)) {
                for (Map.Entry<String, Object> e : report.getSummary().asMap().entrySet()) {
                    w.write(e.getKey() + ": " + (e.getValue() == null ? NONE : e.getValue()));
                    w.newLine();
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write validation results to " + dir, e);
        }
        log.info("[VALIDATION] results saved: {} rows → {}", report.getDecisions().size(), dir.toAbsolutePath());
        return dir;
    }

    public ValidationReport load() {
        return load(properties.getResultsPath());
    }

    /**
     * Reads both files back. Missing files yield an empty row list and a summary recomputed from
     * the rows.
     */
    public ValidationReport load(Path dir) {
        Path details = dir.resolve(properties.getDetailsFile());
        Path summaryFile = dir.resolve(properties.getSummaryFile());

        List<ValidationDecision> rows = List.of();
        try {
            if (Files.exists(details)) {
                try (MappingIterator<ValidationDecision> it = csvMapper.readerFor(ValidationDecision.class)
                        .with(schema)
                        .readValues(details.toFile())) {
                    rows = it.readAll();
                }
            }
            ValidationSummary summary = Files.exists(summaryFile)
                    ? parseSummary(Files.readAllLines(summaryFile, StandardCharsets.UTF_8))
                    : ValidationSummary.of(rows);
            log.info("[VALIDATION] results loaded: {} rows ← {}", rows.size(), dir.toAbsolutePath());
            return new ValidationReport(List.copyOf(rows), summary);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read validation results from " + dir, e);
        }
    }

    static ValidationSummary parseSummary(List<String> lines) {
        Map<String, String> kv = new HashMap<>();
        for (String line : lines) {
            int idx = line.indexOf(':');
            if (idx <= 0) continue;
            kv.put(line.substring(0, idx).trim(), line.substring(idx + 1).trim());
        }
        return ValidationSummary.builder()
                .totalDecisions(parseInt(kv, ValidationSummary.TOTAL_DECISIONS))
                .countWithin3(parseInt(kv, ValidationSummary.COUNT_WITHIN_3))
                .pctWithin3(parseDouble(kv, ValidationSummary.PCT_WITHIN_3, 0.0))
                .meanAbsLapDelta(parseDouble(kv, ValidationSummary.MEAN_ABS_LAP_DELTA, null))
                .countErrors(parseInt(kv, ValidationSummary.COUNT_ERRORS))
                .build();
    }

    private static int parseInt(Map<String, String> kv, String key) {
        String v = kv.get(key);
        if (v == null || v.isEmpty() || NONE.equals(v)) return 0;
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for " + key + " in validation summary: " + v, e);
        }
    }

    private static Double parseDouble(Map<String, String> kv, String key, Double fallback) {
        String v = kv.get(key);
        if (v == null || v.isEmpty() || NONE.equals(v)) return fallback;
        try {
            return Double.parseDouble(v);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid number for " + key + " in validation summary: " + v, e);
        }
    }
}
