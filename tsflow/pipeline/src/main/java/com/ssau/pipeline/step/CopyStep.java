package com.ssau.pipeline.step;

/**
 * Passes frames through unchanged.
 */
public class CopyStep implements Step {

    private static final long serialVersionUID = 1L;
}
