package com.jreinhal.docqa.rag.answer;

import com.jreinhal.docqa.model.AnswerType;
import com.jreinhal.docqa.model.ExtractionResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;

final class PercentageExtractor implements TypedExtractor {
    static final int MIN_AGGREGATE = 30;
    static final int MAX_AGGREGATE = 100;

    @Override
    public AnswerType type() {
        return AnswerType.PERCENTAGE;
    }

    @Override
    public ExtractionResult extract(String answer, String question, String context) {
        if (AnswerHeuristics.isUsable(answer) && AnswerPatterns.PERCENT_EXPLICIT.matcher(answer).find()) {
            return ExtractionResult.verbatim(answer);
        }
        List<String> percentages = new ArrayList<>();
        Matcher m = AnswerPatterns.PERCENT_EXPLICIT.matcher(context);
        while (m.find()) {
            percentages.add(m.group().replace(" ", ""));
        }
        Optional<String> explicit = AnswerHeuristics.mostFrequent(percentages);
        if (explicit.isPresent()) {
            return new ExtractionResult(explicit.get(), ExtractionResult.Source.CONTEXT_PERCENTAGE);
        }
        // component scores appear as fractions; the aggregate is the bare integer beside them
        Optional<Integer> aggregate = AnswerHeuristics.mostFrequent(
                AnswerHeuristics.standaloneIntegers(context, MIN_AGGREGATE, MAX_AGGREGATE));
        if (aggregate.isPresent()) {
            return new ExtractionResult(aggregate.get() + "%", ExtractionResult.Source.CONTEXT_INTEGER);
        }
        Matcher fraction = AnswerPatterns.FRACTION.matcher(context);
        if (fraction.find()) {
            return new ExtractionResult(fraction.group(1) + "/" + fraction.group(2), ExtractionResult.Source.CONTEXT_FRACTION);
        }
        return ExtractionResult.fallback(AnswerType.PERCENTAGE.notFoundMessage());
    }
}
