package com.jreinhal.docqa.rag.answer;

import com.jreinhal.docqa.model.AnswerType;
import com.jreinhal.docqa.model.ExtractionResult;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

final class CountExtractor implements TypedExtractor {
    static final int MAX_ANSWER_WORDS = 10;

    @Override
    public AnswerType type() {
        return AnswerType.COUNT;
    }

    @Override
    public ExtractionResult extract(String answer, String question, String context) {
        Optional<String> denominator = AnswerHeuristics.denominator(question);
        if (denominator.isPresent()) {
            String n = denominator.get();
            Matcher specific = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*/\\s*" + Pattern.quote(n) + "\\b").matcher(context);
            if (specific.find()) {
                return outOf(specific.group(1), n);
            }
            Matcher any = AnswerPatterns.FRACTION.matcher(context);
            if (any.find()) {
                return outOf(any.group(1), any.group(2));
            }
        }
        String candidate = AnswerPatterns.RANGE_ANSWER.matcher(answer).find() ? "" : answer;
        if (AnswerHeuristics.containsDigit(candidate)
                && AnswerHeuristics.isUsable(candidate)
                && AnswerHeuristics.wordCount(candidate) <= MAX_ANSWER_WORDS) {
            return ExtractionResult.verbatim(candidate);
        }
        Matcher fraction = AnswerPatterns.FRACTION.matcher(context);
        if (fraction.find()) {
            return outOf(fraction.group(1), fraction.group(2));
        }
        Matcher integer = AnswerPatterns.INTEGER.matcher(context);
        if (integer.find()) {
            return new ExtractionResult(integer.group(1), ExtractionResult.Source.CONTEXT_INTEGER);
        }
        return ExtractionResult.fallback(AnswerType.COUNT.notFoundMessage());
    }

    private static ExtractionResult outOf(String numerator, String denominator) {
        return new ExtractionResult(numerator + " out of " + denominator, ExtractionResult.Source.CONTEXT_FRACTION);
    }
}
