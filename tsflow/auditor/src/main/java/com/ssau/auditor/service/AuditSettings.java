package com.ssau.auditor.service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

import com.ssau.pipeline.report.QuotePolicy;

public record AuditSettings(Path inputDir,
                            Path reportFile,
                            int workers,
                            int checkpointInterval,
                            QuotePolicy quotePolicy,
                            boolean imageStats,
                            Path mirrorDir,
                            String extraSteps) {

    public AuditSettings {
        if (checkpointInterval < 1) {
            throw new IllegalArgumentException("audit.checkpoint.interval must be positive, got " + checkpointInterval);
        }
    }

    public static AuditSettings fromProperties(Properties props) {
        String input = props.getProperty("audit.input.dir");
        String report = props.getProperty("audit.report.file");
        if (input == null || input.isBlank()) {
            throw new IllegalStateException("audit.input.dir must be set");
        }
        if (report == null || report.isBlank()) {
            throw new IllegalStateException("audit.report.file must be set");
        }

        String mirror = props.getProperty("audit.mirror.dir");
        return new AuditSettings(
            Paths.get(input.trim()),
            Paths.get(report.trim()),
            Integer.parseInt(props.getProperty("audit.workers", "1").trim()),
            Integer.parseInt(props.getProperty("audit.checkpoint.interval", "1000").trim()),
            QuotePolicy.fromString(props.getProperty("audit.report.quoting")),
            Boolean.parseBoolean(props.getProperty("audit.image.stats", "true").trim()),
            mirror == null || mirror.isBlank() ? null : Paths.get(mirror.trim()),
            props.getProperty("audit.extra.steps", ""));
    }
}
