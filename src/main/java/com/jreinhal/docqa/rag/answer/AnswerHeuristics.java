package com.jreinhal.docqa.rag.answer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Stateless checks on generated text and retrieved context.
 */
public final class AnswerHeuristics {
    static final int DUMP_WORD_LIMIT = 30;
    static final int UNPUNCTUATED_WORD_LIMIT = 15;

    private AnswerHeuristics() {
    }

    /**
     * True for answers that carry no information: empty, one or two non-digit characters,
     * or nothing but punctuation and whitespace (a bare "%").
     */
    public static boolean isGarbage(String answer) {
        if (answer == null) {
            return true;
        }
        String s = answer.strip();
        if (s.isEmpty()) {
            return true;
        }
        if (s.length() <= 2 && !s.chars().allMatch(Character::isDigit)) {
            return true;
        }
        return AnswerPatterns.PUNCTUATION_ONLY.matcher(s).matches();
    }

    /**
     * True when the text looks like retrieved context copied back rather than an answer.
     */
    public static boolean isContextDump(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        String stripped = text.strip();
        int words = wordCount(stripped);
        if (words > DUMP_WORD_LIMIT) {
            return true;
        }
        if (words > UNPUNCTUATED_WORD_LIMIT && !AnswerPatterns.SENTENCE_END.matcher(stripped).find()) {
            return true;
        }
        return AnswerPatterns.RECORD_METADATA.matcher(stripped).find();
    }

    public static boolean isUsable(String answer) {
        return !isGarbage(answer) && !isContextDump(answer);
    }

    public static int wordCount(String text) {
        String s = text == null ? "" : text.strip();
        return s.isEmpty() ? 0 : s.split("\\s+").length;
    }

    public static boolean containsDigit(String text) {
        return AnswerPatterns.DIGIT.matcher(text).find();
    }

    /**
     * Denominator named in the question ("from 25", "out of 75", "in 25 marks").
     */
    public static Optional<String> denominator(String question) {
        Matcher m = AnswerPatterns.DENOMINATOR_HINT.matcher(question);
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }

    /**
     * Integers in {@code [min, max]} that are not part of a fraction or a decimal, in order of
     * appearance. Recovers an aggregate such as 58 from "22/25 35.63/75 58 1696".
     */
    public static List<Integer> standaloneIntegers(String text, int min, int max) {
        String masked = AnswerPatterns.FRACTION.matcher(text).replaceAll("FRACTION");
        masked = AnswerPatterns.DECIMAL.matcher(masked).replaceAll("DECIMAL");
        List<Integer> values = new ArrayList<>();
        Matcher m = AnswerPatterns.INTEGER.matcher(masked);
        while (m.find()) {
            String digits = m.group(1);
            if (digits.length() > 9) {
                continue;
            }
            int value = Integer.parseInt(digits);
            if (value >= min && value <= max) {
                values.add(value);
            }
        }
        return values;
    }

    /**
     * Most frequent element; ties go to the value seen first.
     */
    public static <T> Optional<T> mostFrequent(List<T> values) {
        Map<T, Integer> counts = new LinkedHashMap<>();
        for (T value : values) {
            counts.merge(value, 1, Integer::sum);
        }
        T best = null;
        int bestCount = 0;
        for (Map.Entry<T, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return Optional.ofNullable(best);
    }

    public static String firstSentence(String text) {
        String[] sentences = AnswerPatterns.SENTENCE_BREAK.split(text.strip());
        return sentences.length == 0 ? "" : sentences[0];
    }
}
