package com.jreinhal.docqa.rag.answer;

import java.util.regex.Pattern;

/**
 * Value matchers shared by reranking and answer reconciliation.
 */
public final class AnswerPatterns {

    // "69%", "92.5 %"
    public static final Pattern PERCENT_EXPLICIT = Pattern.compile("\\d[\\d.,]*\\s*%");

    // 45/75, 22/25, 35.63/75
    public static final Pattern FRACTION = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*/\\s*(\\d+(?:\\.\\d+)?)");

    public static final Pattern DATE = Pattern.compile(
            "\\b\\d{1,2}[/\\-]\\d{1,2}[/\\-]\\d{2,4}\\b"
            + "|\\b\\d{4}[/\\-]\\d{2}[/\\-]\\d{2}\\b"
            + "|\\b(?:jan|feb|mar|apr|may|jun|jul|aug|sep|oct|nov|dec)\\w*[\\s,]+\\d{4}\\b",
            Pattern.CASE_INSENSITIVE);

    // Title Case, two or more words: "John Doe"
    public static final Pattern PROPER_NOUN = Pattern.compile("\\b[A-Z][a-z]+(?:\\s+[A-Z][a-z]+)+");

    // Certificates often print the holder in capitals: "RADADIYA HETVI HASMUKHBHAI"
    public static final Pattern ALLCAPS_NAME = Pattern.compile("\\b[A-Z]{2,}(?:\\s+[A-Z]{2,}){1,4}\\b");

    static final Pattern PUNCTUATION_ONLY = Pattern.compile("^\\s*[^\\w\\d]*\\s*$");

    // "2 or 3" comes from credit recommendation text, never a count
    static final Pattern RANGE_ANSWER = Pattern.compile("\\b\\d+\\s+or\\s+\\d+\\b", Pattern.CASE_INSENSITIVE);

    static final Pattern DENOMINATOR_HINT = Pattern.compile("\\b(?:from|out\\s+of|in)\\s+(\\d+)(?:\\s+marks?)?\\b", Pattern.CASE_INSENSITIVE);

    static final Pattern RECORD_METADATA = Pattern.compile(
            "NPTEL\\d+[A-Z0-9]+"
            + "|Roll\\s+No"
            + "|To verify.*certificate"
            + "|No\\.\\s*of\\s*credits"
            + "|recommended\\s*:\\s*\\d"
            + "|\\b[A-Z]{2,}\\d{4}[A-Z]{2}\\d+S\\w+\\b",
            Pattern.CASE_INSENSITIVE);

    // Roll numbers and course codes that look like capitalised words
    static final Pattern METADATA_TOKEN = Pattern.compile("NPTEL\\d|[A-Z]\\d{4}", Pattern.CASE_INSENSITIVE);

    static final Pattern DECIMAL = Pattern.compile("\\d+\\.\\d+");
    static final Pattern INTEGER = Pattern.compile("\\b(\\d+)\\b");
    static final Pattern DIGIT = Pattern.compile("\\d");
    static final Pattern SENTENCE_END = Pattern.compile("[.!?]");
    static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+");

    private AnswerPatterns() {
    }
}
