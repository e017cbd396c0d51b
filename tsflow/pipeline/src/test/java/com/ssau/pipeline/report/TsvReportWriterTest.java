package com.ssau.pipeline.report;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TsvReportWriterTest {

    @Test
    void numericPolicy_quotesNumbersOnly() throws Exception {
        StringBuilder out = new StringBuilder();

        new TsvReportWriter(QuotePolicy.NUMERIC).writeRow(Arrays.asList("name", 3, 0.25, 7L), out);

        assertEquals("name\t\"3\"\t\"0.25\"\t\"7\"\n", out.toString());
    }

    @Test
    void numericPolicy_escapesDelimiterInText() throws Exception {
        StringBuilder out = new StringBuilder();

        new TsvReportWriter(QuotePolicy.NUMERIC).writeRow(Arrays.asList("a\tb", "c"), out);

        assertEquals("a\\\tb\tc\n", out.toString());
    }

    @Test
    void nonNumericPolicy_quotesTextOnly() throws Exception {
        StringBuilder out = new StringBuilder();

        new TsvReportWriter(QuotePolicy.NON_NUMERIC).writeRow(Arrays.asList("name", 3), out);

        assertEquals("\"name\"\t3\n", out.toString());
    }

    @Test
    void fromString_defaultsToNumeric() {
        assertEquals(QuotePolicy.NUMERIC, QuotePolicy.fromString(null));
        assertEquals(QuotePolicy.NUMERIC, QuotePolicy.fromString(" "));
        assertEquals(QuotePolicy.NON_NUMERIC, QuotePolicy.fromString("non-numeric"));
        assertThrows(IllegalArgumentException.class, () -> QuotePolicy.fromString("sometimes"));
    }
}
