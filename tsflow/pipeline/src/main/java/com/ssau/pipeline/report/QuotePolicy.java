package com.ssau.pipeline.report;

/**
 * Which report cells are wrapped in quotes.
 */
public enum QuotePolicy {

    /** Numeric cells are quoted, text cells are written bare with backslash escapes. */
    NUMERIC,

    /** Text cells are quoted, numeric cells are written bare. */
    NON_NUMERIC;

    public static QuotePolicy fromString(String value) {
        if (value == null || value.isBlank()) {
            return NUMERIC;
        }
        return valueOf(value.trim().toUpperCase().replace('-', '_'));
    }
}
