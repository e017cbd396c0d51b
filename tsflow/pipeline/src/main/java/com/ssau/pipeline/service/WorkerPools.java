package com.ssau.pipeline.service;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public final class WorkerPools {

    private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

    private WorkerPools() {}

    /**
     * Size used when no explicit parallelism is asked for: enough threads to overlap
     * I/O, capped at 32.
     */
    public static int defaultSize() {
        return Math.min(32, Runtime.getRuntime().availableProcessors() + 4);
    }

    /**
     * Pool size for a requested worker count. More than one worker gets exactly that
     * many threads, anything else gets {@link #defaultSize()}.
     */
    public static int sizeFor(int workers) {
        return workers > 1 ? workers : defaultSize();
    }

    public static ExecutorService create(int workers) {
        int size = sizeFor(workers);
        int pool = POOL_SEQUENCE.incrementAndGet();
        AtomicInteger threadSequence = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "pipeline-" + pool + "-worker-" + threadSequence.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        log.debug("Starting worker pool {} with {} threads (requested workers={})", pool, size, workers);
        return Executors.newFixedThreadPool(size, factory);
    }
}
