package com.ssau.pipeline.sink;

import java.io.IOException;

import com.ssau.pipeline.model.Frame;

/**
 * Destination for processed frames. Implementations used inside a
 * {@code WriteFileStep} are called from pool workers and must be thread-safe.
 */
public interface FrameSink {

    void write(Frame frame) throws IOException;
}
