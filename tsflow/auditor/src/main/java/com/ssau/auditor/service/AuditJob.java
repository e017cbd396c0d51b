package com.ssau.auditor.service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.ssau.pipeline.model.Frame;
import com.ssau.pipeline.service.Pipeline;
import com.ssau.pipeline.service.PipelineRun;
import com.ssau.pipeline.service.ResultRecorder;
import com.ssau.pipeline.sink.DirectoryFrameSink;
import com.ssau.pipeline.source.DirectoryFrameSource;
import com.ssau.pipeline.step.FileStatsStep;
import com.ssau.pipeline.step.Step;
import com.ssau.pipeline.step.StepLoader;
import com.ssau.pipeline.step.WriteFileStep;

/**
 * Audits every frame under a directory: file statistics, optionally image
 * statistics, optionally a mirrored copy of each file. The report is checkpointed
 * every {@code checkpointInterval} frames and always saved when the run ends.
 */
@Slf4j
public class AuditJob {

    private final AuditSettings settings;
    @Getter
    private final Pipeline pipeline;

    public AuditJob(AuditSettings settings) {
        this.settings = settings;
        this.pipeline = buildPipeline(settings);
    }

    static Pipeline buildPipeline(AuditSettings settings) {
        List<Step> auditSteps = new ArrayList<>();
        auditSteps.add(new FileStatsStep());
        if (settings.imageStats()) {
            auditSteps.add(new ImageStatsStep());
        }
        auditSteps.addAll(StepLoader.loadAll(settings.extraSteps()));

        Pipeline pipeline = new Pipeline(new ResultRecorder(settings.quotePolicy()));
        if (settings.mirrorDir() != null) {
            pipeline.addStep(new WriteFileStep(new DirectoryFrameSink(settings.mirrorDir())));
        }
        // audit failures are recorded by the nested pipeline; the outer chain carries on
        return pipeline.addStep(new Pipeline(auditSteps.toArray(new Step[0])));
    }

    public long run() throws Exception {
        log.info("Auditing {} with {} workers, report at {}",
            settings.inputDir(), settings.workers(), settings.reportFile());
        DirectoryFrameSource source = new DirectoryFrameSource(settings.inputDir());
        try (PipelineRun run = pipeline.process(source, settings.workers())) {
            while (run.hasNext()) {
                Frame frame = run.next();
                if (pipeline.getProcessedCount() % settings.checkpointInterval() == 0) {
                    log.debug("Checkpoint after {}", frame.getInstant());
                    saveReport();
                }
            }
        } finally {
            // file channels refuse to write on an interrupted thread
            boolean interrupted = Thread.interrupted();
            try {
                pipeline.finish();
            } finally {
                try {
                    saveReport();
                    log.info("Audited {}, found {} files", settings.inputDir(), pipeline.getProcessedCount());
                } finally {
                    if (interrupted) {
                        Thread.currentThread().interrupt();
                    }
                }
            }
        }
        return pipeline.getProcessedCount();
    }

    private void saveReport() throws IOException {
        pipeline.getRecorder().save(settings.reportFile());
    }
}
