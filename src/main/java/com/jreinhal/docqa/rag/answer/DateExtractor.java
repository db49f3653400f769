package com.jreinhal.docqa.rag.answer;

import com.jreinhal.docqa.model.AnswerType;
import com.jreinhal.docqa.model.ExtractionResult;
import java.util.regex.Matcher;

final class DateExtractor implements TypedExtractor {

    @Override
    public AnswerType type() {
        return AnswerType.DATE;
    }

    @Override
    public ExtractionResult extract(String answer, String question, String context) {
        if (AnswerHeuristics.isUsable(answer) && AnswerPatterns.DATE.matcher(answer).find()) {
            return ExtractionResult.verbatim(answer);
        }
        Matcher date = AnswerPatterns.DATE.matcher(context);
        if (date.find()) {
            return new ExtractionResult(date.group(), ExtractionResult.Source.CONTEXT_DATE);
        }
        return ExtractionResult.fallback(AnswerType.DATE.notFoundMessage());
    }
}
