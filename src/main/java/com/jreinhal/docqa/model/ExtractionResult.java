package com.jreinhal.docqa.model;

/**
 * Final answer produced by reconciliation, tagged with where the text came from.
 */
public record ExtractionResult(String text, Source source) {

    public enum Source {
        VERBATIM,
        CONTEXT_PERCENTAGE,
        CONTEXT_FRACTION,
        CONTEXT_INTEGER,
        CONTEXT_DATE,
        CONTEXT_NAME,
        SALVAGED_SENTENCE,
        FALLBACK
    }

    public static ExtractionResult verbatim(String text) {
        return new ExtractionResult(text, Source.VERBATIM);
    }

    public static ExtractionResult fallback(String text) {
        return new ExtractionResult(text, Source.FALLBACK);
    }

    public boolean trusted() {
        return this.source == Source.VERBATIM;
    }
}
