package com.jreinhal.docqa.rag.answer;

import com.jreinhal.docqa.model.AnswerType;
import com.jreinhal.docqa.model.ExtractionResult;

final class GeneralExtractor implements TypedExtractor {
    static final int MAX_SALVAGED_WORDS = 20;
    static final String UNEXTRACTABLE = "I found relevant information but could not extract a specific answer.";

    @Override
    public AnswerType type() {
        return AnswerType.GENERAL;
    }

    @Override
    public ExtractionResult extract(String answer, String question, String context) {
        if (AnswerHeuristics.isContextDump(answer)) {
            String first = AnswerHeuristics.firstSentence(answer);
            if (!first.isEmpty() && AnswerHeuristics.wordCount(first) <= MAX_SALVAGED_WORDS) {
                return new ExtractionResult(first, ExtractionResult.Source.SALVAGED_SENTENCE);
            }
            return ExtractionResult.fallback(UNEXTRACTABLE);
        }
        if (AnswerHeuristics.isGarbage(answer)) {
            return ExtractionResult.fallback(AnswerType.GENERAL.notFoundMessage());
        }
        return ExtractionResult.verbatim(answer);
    }
}
