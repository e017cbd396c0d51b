package com.ssau.auditor;

import java.util.Properties;

import lombok.extern.slf4j.Slf4j;

import com.ssau.auditor.service.AuditJob;
import com.ssau.auditor.service.AuditSettings;
import com.ssau.auditor.utils.ConfigLoader;
import com.ssau.pipeline.exception.PipelineInterruptedException;

@Slf4j
public class AuditorApp {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_INTERRUPTED = 130;

    private static final long SHUTDOWN_WAIT_MS = 30_000;

    public static void main(String[] args) {
        AuditJob job;
        try {
            Properties props = args.length > 0 ? ConfigLoader.load(args[0]) : ConfigLoader.loadDefault();
            job = new AuditJob(AuditSettings.fromProperties(props));
        } catch (Exception e) {
            log.error("Failed to start audit", e);
            System.exit(EXIT_FAILED);
            return;
        }

        // interrupt the run and wait for its final report save
        Thread worker = Thread.currentThread();
        Thread hook = new Thread(() -> {
            log.info("Shutting down audit, saving results...");
            worker.interrupt();
            try {
                worker.join(SHUTDOWN_WAIT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "auditor-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        int exitCode = runJob(job);
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // System.exit would block behind the hook that is waiting for this thread
            log.debug("Shutdown already in progress, leaving exit to the JVM");
            return;
        }
        if (exitCode != EXIT_OK) {
            System.exit(exitCode);
        }
    }

    /**
     * Runs the job to completion and maps the outcome to a process exit code. An
     * interrupted run has already saved its report and is not logged as a failure.
     */
    static int runJob(AuditJob job) {
        try {
            job.run();
            return EXIT_OK;
        } catch (PipelineInterruptedException e) {
            log.warn("Audit interrupted after {} files", job.getPipeline().getProcessedCount());
            return EXIT_INTERRUPTED;
        } catch (Exception e) {
            log.error("Audit failed", e);
            return EXIT_FAILED;
        }
    }
}
