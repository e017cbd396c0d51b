package com.ssau.pipeline.source;

import com.ssau.pipeline.model.Frame;

/**
 * A finite sequence of frames. Iteration is not required to be restartable.
 */
public interface FrameSource extends Iterable<Frame> {
}
