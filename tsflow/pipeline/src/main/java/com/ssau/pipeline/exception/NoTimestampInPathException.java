package com.ssau.pipeline.exception;

import lombok.Getter;

@Getter
public class NoTimestampInPathException extends IllegalArgumentException {

    private final String path;

    public NoTimestampInPathException(String path) {
        super("path '" + path + "' doesn't contain a timestream date");
        this.path = path;
    }
}
