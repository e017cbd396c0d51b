package com.ssau.pipeline.step;

import java.io.IOException;

import lombok.RequiredArgsConstructor;

import com.ssau.pipeline.model.Frame;
import com.ssau.pipeline.sink.FrameSink;

/**
 * Writes each frame to a sink without changing it.
 */
@RequiredArgsConstructor
public class WriteFileStep implements Step {

    private static final long serialVersionUID = 1L;

    private final FrameSink output;

    @Override
    public Frame process(Frame frame) throws IOException {
        output.write(frame);
        return frame;
    }
}
