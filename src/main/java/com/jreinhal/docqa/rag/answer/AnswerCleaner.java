package com.jreinhal.docqa.rag.answer;

import java.util.regex.Pattern;

/**
 * Removes prompt echoes from a raw generation before reconciliation.
 */
public final class AnswerCleaner {
    static final String ANSWER_MARKER = "Answer:";
    private static final Pattern LEADING_LABEL = Pattern.compile("^(?:answer|a)\\s*:\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern SURROUNDING_QUOTES = Pattern.compile("^[\\s\"'`]+|[\\s\"'`]+$");

    private AnswerCleaner() {
    }

    /**
     * @return cleaned text, empty when nothing is left
     */
    public static String clean(String raw, String question) {
        if (raw == null) {
            return "";
        }
        String text = raw;
        int marker = text.lastIndexOf(ANSWER_MARKER);
        if (marker >= 0) {
            text = text.substring(marker + ANSWER_MARKER.length());
        }
        text = text.strip();
        if (question != null && !question.isBlank()) {
            String q = question.strip();
            if (text.regionMatches(true, 0, q, 0, q.length())) {
                text = text.substring(q.length()).strip();
            }
        }
        text = LEADING_LABEL.matcher(text).replaceFirst("");
        return SURROUNDING_QUOTES.matcher(text).replaceAll("");
    }
}
