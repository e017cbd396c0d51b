package com.ssau.pipeline.step;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.ssau.pipeline.model.Frame;
import com.ssau.pipeline.service.ResultRecorder;

/**
 * Records every frame it sees into its own {@link ResultRecorder} and saves the
 * report every {@code writeInterval} frames and on {@link #finish()}.
 */
@Slf4j
public class ResultRecorderStep implements Step {

    private static final long serialVersionUID = 1L;

    public static final int DEFAULT_WRITE_INTERVAL = 1000;

    private final String outputFile;
    private final int writeInterval;
    @Getter
    private final ResultRecorder recorder;
    private long count;

    public ResultRecorderStep(Path outputFile) {
        this(outputFile, DEFAULT_WRITE_INTERVAL);
    }

    public ResultRecorderStep(Path outputFile, int writeInterval) {
        this(outputFile, writeInterval, new ResultRecorder());
    }

    public ResultRecorderStep(Path outputFile, int writeInterval, ResultRecorder recorder) {
        if (writeInterval < 1) {
            throw new IllegalArgumentException("writeInterval must be positive, got " + writeInterval);
        }
        this.outputFile = outputFile.toString();
        this.writeInterval = writeInterval;
        this.recorder = recorder;
    }

    // workers call this concurrently
    @Override
    public synchronized Frame process(Frame frame) throws IOException {
        recorder.record(frame.getInstant(), frame.getReport());
        count++;
        if (count % writeInterval == 0) {
            log.debug("Checkpointing {} recorded frames to {}", count, outputFile);
            recorder.save(Paths.get(outputFile));
        }
        return frame;
    }

    @Override
    public synchronized void finish() throws IOException {
        recorder.save(Paths.get(outputFile));
    }

    public synchronized long getCount() {
        return count;
    }
}
