package com.ssau.pipeline.exception;

public class StepContractViolationException extends IllegalArgumentException {

    public StepContractViolationException(String message) {
        super(message);
    }

    public StepContractViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
