package com.ssau.pipeline.step;

import java.io.Serializable;

import com.ssau.pipeline.model.Frame;

/**
 * A unit of work applied to one frame at a time.
 *
 * <p>Steps run on pool workers, possibly several frames at once, so a step must not
 * rely on mutable state shared between frames unless it guards that state itself.
 * Steps are {@link Serializable} and should hold only plain configuration, no open
 * handles. A {@code Pipeline} is itself a step, which lets pipelines nest.
 */
public interface Step extends Serializable {

    /**
     * Transforms or annotates a frame. Returning {@code null} drops the frame.
     */
    default Frame process(Frame frame) throws Exception {
        return frame;
    }

    /**
     * Called once after every frame has been processed, to flush step-local state.
     */
    default void finish() throws Exception {
    }

    static Step of(FrameFunction function) {
        return new Step() {
            @Override
            public Frame process(Frame frame) throws Exception {
                return function.apply(frame);
            }
        };
    }

    static String nameOf(Step step) {
        String name = step.getClass().getSimpleName();
        return name.isEmpty() ? step.getClass().getName() : name;
    }

    @FunctionalInterface
    interface FrameFunction extends Serializable {
        Frame apply(Frame frame) throws Exception;
    }
}
