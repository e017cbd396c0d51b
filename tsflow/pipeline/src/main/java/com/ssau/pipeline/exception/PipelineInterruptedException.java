package com.ssau.pipeline.exception;

/**
 * Thrown to the consumer of a pipeline run when its thread is interrupted while
 * waiting for the next frame. The interrupt flag is left set.
 */
public class PipelineInterruptedException extends RuntimeException {

    public PipelineInterruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
