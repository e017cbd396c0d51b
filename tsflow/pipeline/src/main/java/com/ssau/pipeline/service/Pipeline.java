package com.ssau.pipeline.service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.ssau.pipeline.exception.StepContractViolationException;
import com.ssau.pipeline.model.Frame;
import com.ssau.pipeline.sink.FrameSink;
import com.ssau.pipeline.step.Step;

/**
 * An ordered chain of steps, and the driver that runs the chain over a sequence of
 * frames on a worker pool while recording each frame's report.
 *
 * <p>A pipeline is also a {@link Step}, so a whole pipeline can sit inside another
 * one. A step that throws stops the chain for that frame only: the error message
 * goes into the frame's report under {@value #ERRORS_FIELD} and the partly
 * processed frame carries on.
 */
@Slf4j
public class Pipeline implements Step {

    private static final long serialVersionUID = 1L;

    public static final String ERRORS_FIELD = "Errors";
    public static final int PROGRESS_INTERVAL = 1000;

    private final List<Step> steps = new ArrayList<>();
    @Getter
    private final ResultRecorder recorder;
    private volatile long processedCount;

    public Pipeline(Step... steps) {
        this(new ResultRecorder(), Arrays.asList(steps));
    }

    public Pipeline(ResultRecorder recorder, Step... steps) {
        this(recorder, Arrays.asList(steps));
    }

    public Pipeline(ResultRecorder recorder, List<? extends Step> steps) {
        this.recorder = recorder == null ? new ResultRecorder() : recorder;
        steps.forEach(this::addStep);
    }

    public Pipeline addStep(Step step) {
        if (step == null) {
            throw new StepContractViolationException("step doesn't seem to be a pipeline step: null");
        }
        steps.add(step);
        return this;
    }

    public List<Step> getSteps() {
        return Collections.unmodifiableList(steps);
    }

    public long getProcessedCount() {
        return processedCount;
    }

    /**
     * Runs one frame through every step, in order, on the calling thread.
     */
    @Override
    public Frame process(Frame frame) throws InterruptedException {
        Frame current = frame;
        for (Step step : steps) {
            try {
                current = step.process(current);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw e;
            } catch (Exception e) {
                String message = e.getMessage() == null ? e.toString() : e.getMessage();
                log.warn("pipeline failed at {}: {}", Step.nameOf(step), message);
                current.getReport().put(ERRORS_FIELD, message);
                return current;
            }
            if (current == null) {
                log.debug("Frame dropped by {}", Step.nameOf(step));
                return null;
            }
        }
        return current;
    }

    public PipelineRun process(Iterable<? extends Frame> input) {
        return process(input.iterator(), 1);
    }

    public PipelineRun process(Iterable<? extends Frame> input, int workers) {
        return process(input.iterator(), workers);
    }

    /**
     * Starts processing {@code input} on a new worker pool. With more than one worker
     * the pool has exactly {@code workers} threads, otherwise it uses
     * {@link WorkerPools#defaultSize()}. Frames come back in input order; each one is
     * recorded and counted as the caller pulls it.
     *
     * <p>The pool is released when the run is drained. A caller that may stop
     * iterating early must close the run, usually with try-with-resources; the same
     * holds for the stream returned by {@link #stream}.
     */
    public PipelineRun process(Iterator<? extends Frame> input, int workers) {
        int size = WorkerPools.sizeFor(workers);
        return new PipelineRun(this, input, WorkerPools.create(workers), 2 * size, this::recordResult);
    }

    public Stream<Frame> stream(Iterable<? extends Frame> input, int workers) {
        PipelineRun run = process(input, workers);
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(run, Spliterator.ORDERED), false)
            .onClose(run::close);
    }

    public void processTo(Iterable<? extends Frame> input, FrameSink output) throws IOException {
        processTo(input, output, 1);
    }

    public void processTo(Iterable<? extends Frame> input, FrameSink output, int workers) throws IOException {
        try (PipelineRun run = process(input, workers)) {
            while (run.hasNext()) {
                output.write(run.next());
            }
        }
    }

    @Override
    public void finish() throws Exception {
        for (Step step : steps) {
            step.finish();
        }
    }

    private void recordResult(Frame frame) {
        recorder.record(frame.getInstant(), frame.getReport());
        processedCount++;
        log.debug("Processed {}", frame.getInstant());
        if (processedCount % PROGRESS_INTERVAL == 0) {
            log.info("Processed {} files", processedCount);
        }
    }
}
