package com.ssau.pipeline.service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Consumer;

import lombok.extern.slf4j.Slf4j;

import com.ssau.pipeline.exception.PipelineInterruptedException;
import com.ssau.pipeline.model.Frame;
import com.ssau.pipeline.step.Step;

/**
 * One pass of a pipeline over an input sequence. Frames are submitted to a worker
 * pool ahead of the consumer and handed back in input order, whatever order the
 * workers finish in.
 *
 * <p>The pool belongs to this run: it is shut down when the input is exhausted,
 * when {@link #close()} is called, or when waiting for a result fails.
 */
@Slf4j
public class PipelineRun implements Iterator<Frame>, AutoCloseable {

    private final Step chain;
    private final Iterator<? extends Frame> input;
    private final ExecutorService executor;
    private final int window;
    private final Consumer<Frame> onResult;
    private final Deque<Future<Frame>> inFlight = new ArrayDeque<>();

    private Frame next;
    private boolean closed;

    PipelineRun(Step chain, Iterator<? extends Frame> input, ExecutorService executor, int window,
                Consumer<Frame> onResult) {
        this.chain = chain;
        this.input = input;
        this.executor = executor;
        this.window = Math.max(1, window);
        this.onResult = onResult;
    }

    @Override
    public boolean hasNext() {
        if (next != null) {
            return true;
        }
        if (closed) {
            return false;
        }
        try {
            submitAvailable();
            while (!inFlight.isEmpty()) {
                Frame result = await(inFlight.removeFirst());
                submitAvailable();
                if (result != null) {
                    onResult.accept(result);
                    next = result;
                    return true;
                }
            }
        } catch (RuntimeException | Error e) {
            close();
            throw e;
        }
        close();
        return false;
    }

    @Override
    public Frame next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        Frame result = next;
        next = null;
        return result;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (inFlight.isEmpty()) {
            executor.shutdown();
        } else {
            log.info("Abandoning {} in-flight frames", inFlight.size());
            inFlight.forEach(f -> f.cancel(true));
            inFlight.clear();
            executor.shutdownNow();
        }
    }

    private void submitAvailable() {
        while (inFlight.size() < window && input.hasNext()) {
            Frame frame = input.next();
            if (frame == null) {
                log.warn("Skipping null frame from input");
                continue;
            }
            inFlight.addLast(executor.submit(() -> chain.process(frame)));
        }
    }

    private static Frame await(Future<Frame> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineInterruptedException("Interrupted while waiting for frame results", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof InterruptedException) {
                throw new PipelineInterruptedException("Worker interrupted while processing a frame", cause);
            }
            throw new IllegalStateException("Frame processing failed", cause);
        }
    }
}
