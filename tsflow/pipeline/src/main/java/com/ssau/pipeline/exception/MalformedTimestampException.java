package com.ssau.pipeline.exception;

import lombok.Getter;

@Getter
public class MalformedTimestampException extends IllegalArgumentException {

    private final String timestamp;

    public MalformedTimestampException(String timestamp) {
        super("date string '" + timestamp + "' doesn't match valid date formats");
        this.timestamp = timestamp;
    }
}
