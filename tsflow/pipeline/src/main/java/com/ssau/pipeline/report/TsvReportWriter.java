package com.ssau.pipeline.report;

import java.io.IOException;
import java.util.List;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.QuoteMode;

import lombok.Getter;

/**
 * Writes report rows as tab separated values: LF line endings, {@code "} as the
 * quote character, {@code \} as the escape character and no doubled quotes.
 */
public class TsvReportWriter {

    private static final CSVFormat BASE = CSVFormat.Builder.create()
        .setDelimiter('\t')
        .setQuote('"')
        .setEscape('\\')
        .setRecordSeparator("\n")
        .build();

    private static final CSVFormat QUOTED = BASE.builder().setQuoteMode(QuoteMode.ALL).build();
    private static final CSVFormat BARE = BASE.builder().setQuoteMode(QuoteMode.NONE).build();
    private static final CSVFormat NON_NUMERIC = BASE.builder().setQuoteMode(QuoteMode.NON_NUMERIC).build();

    @Getter
    private final QuotePolicy quotePolicy;

    public TsvReportWriter(QuotePolicy quotePolicy) {
        this.quotePolicy = quotePolicy;
    }

    public void writeRow(List<?> values, Appendable out) throws IOException {
        boolean newRecord = true;
        for (Object value : values) {
            formatFor(value).print(value, out, newRecord);
            newRecord = false;
        }
        BASE.println(out);
    }

    private CSVFormat formatFor(Object value) {
        if (quotePolicy == QuotePolicy.NON_NUMERIC) {
            return NON_NUMERIC;
        }
        return value instanceof Number ? QUOTED : BARE;
    }
}
