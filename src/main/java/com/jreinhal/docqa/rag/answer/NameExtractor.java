package com.jreinhal.docqa.rag.answer;

import com.jreinhal.docqa.model.AnswerType;
import com.jreinhal.docqa.model.ExtractionResult;
import java.util.regex.Matcher;

final class NameExtractor implements TypedExtractor {

    @Override
    public AnswerType type() {
        return AnswerType.NAME;
    }

    @Override
    public ExtractionResult extract(String answer, String question, String context) {
        if (AnswerHeuristics.isUsable(answer)
                && (AnswerPatterns.PROPER_NOUN.matcher(answer).find() || AnswerPatterns.ALLCAPS_NAME.matcher(answer).find())) {
            return ExtractionResult.verbatim(answer);
        }
        // longest capitalised run wins so a full name beats a two-word label
        String longest = null;
        Matcher caps = AnswerPatterns.ALLCAPS_NAME.matcher(context);
        while (caps.find()) {
            String candidate = caps.group();
            if (AnswerPatterns.METADATA_TOKEN.matcher(candidate).find()) {
                continue;
            }
            if (longest == null || candidate.length() > longest.length()) {
                longest = candidate;
            }
        }
        if (longest != null) {
            return new ExtractionResult(longest, ExtractionResult.Source.CONTEXT_NAME);
        }
        Matcher titleCase = AnswerPatterns.PROPER_NOUN.matcher(context);
        if (titleCase.find()) {
            return new ExtractionResult(titleCase.group(), ExtractionResult.Source.CONTEXT_NAME);
        }
        return ExtractionResult.fallback(AnswerType.NAME.notFoundMessage());
    }
}
