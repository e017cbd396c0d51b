package com.ssau.pipeline.service;

import java.io.IOException;
import java.io.Serializable;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.ssau.pipeline.model.FrameInstant;
import com.ssau.pipeline.report.QuotePolicy;
import com.ssau.pipeline.report.TsvReportWriter;

/**
 * Sparse table of per-instant metrics. Columns are discovered as fields are
 * recorded and keep their first-seen order; rows are keyed by the canonical
 * instant string.
 *
 * <p>Not thread-safe. The pipeline driver is its only writer.
 */
@Slf4j
public class ResultRecorder implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String INSTANT_COLUMN = "Instant";
    public static final String MISSING = "NA";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private final List<String> fields = new ArrayList<>();
    private final Map<String, Map<String, Object>> data = new HashMap<>();
    @Getter
    private final QuotePolicy quotePolicy;

    public ResultRecorder() {
        this(QuotePolicy.NUMERIC);
    }

    public ResultRecorder(QuotePolicy quotePolicy) {
        this.quotePolicy = quotePolicy;
    }

    public void record(FrameInstant instant, Map<String, ?> values) {
        record(instant.toString(), values);
    }

    /**
     * Upserts the fields of one row. A field recorded again for the same instant
     * replaces the earlier value.
     */
    public void record(String instant, Map<String, ?> values) {
        Map<String, Object> row = data.computeIfAbsent(instant, k -> new LinkedHashMap<>());
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            if (!fields.contains(entry.getKey())) {
                fields.add(entry.getKey());
            }
            row.put(entry.getKey(), entry.getValue());
        }
    }

    public List<String> getFields() {
        return Collections.unmodifiableList(fields);
    }

    public Map<String, Object> get(FrameInstant instant) {
        Map<String, Object> row = data.get(instant.toString());
        return row == null ? null : Collections.unmodifiableMap(row);
    }

    public int size() {
        return data.size();
    }

    public boolean isEmpty() {
        return data.isEmpty();
    }

    /**
     * Overwrites {@code outputPath} with the report, rows sorted by instant. Does
     * nothing, and creates no file, while no rows have been recorded.
     */
    public void save(Path outputPath) throws IOException {
        if (data.isEmpty()) {
            log.debug("No results recorded yet, not writing {}", outputPath);
            return;
        }

        TsvReportWriter writer = new TsvReportWriter(quotePolicy);
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        try (Writer out = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8)) {
            List<Object> header = new ArrayList<>(fields.size() + 1);
            header.add(INSTANT_COLUMN);
            header.addAll(fields);
            writer.writeRow(header, out);

            for (Map.Entry<String, Map<String, Object>> entry : new TreeMap<>(data).entrySet()) {
                List<Object> line = new ArrayList<>(fields.size() + 1);
                line.add(entry.getKey());
                for (String field : fields) {
                    line.add(cell(entry.getValue().get(field)));
                }
                writer.writeRow(line, out);
            }
        }
        log.info("Saved {} result rows to {}", data.size(), outputPath);
    }

    private static Object cell(Object value) {
        if (value == null) {
            return MISSING;
        }
        if (value instanceof CharSequence) {
            return WHITESPACE.matcher((CharSequence) value).replaceAll(" ");
        }
        if (value instanceof Number) {
            return value;
        }
        return WHITESPACE.matcher(String.valueOf(value)).replaceAll(" ");
    }
}
