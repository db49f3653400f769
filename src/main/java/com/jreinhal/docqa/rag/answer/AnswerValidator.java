package com.jreinhal.docqa.rag.answer;

import com.jreinhal.docqa.model.AnswerType;
import com.jreinhal.docqa.model.ExtractionResult;
import com.jreinhal.docqa.rag.planner.QueryPlanner;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns a raw generation into the final answer. Short well-formed answers of the expected type
 * pass through unchanged; garbage (a bare "%") and context dumps are replaced by a value pulled
 * straight from the retrieved context.
 *
 * <p>Reconciliation is a pure function of answer, question and context. It always returns
 * non-empty text: when nothing can be extracted the type's not-found message is used.</p>
 */
@Component
public class AnswerValidator {
    private static final Logger log = LoggerFactory.getLogger(AnswerValidator.class);
    private final QueryPlanner queryPlanner;
    private final Map<AnswerType, TypedExtractor> extractors = new EnumMap<>(AnswerType.class);

    public AnswerValidator(QueryPlanner queryPlanner) {
        this.queryPlanner = queryPlanner;
        for (TypedExtractor extractor : List.of(new PercentageExtractor(), new CountExtractor(), new DateExtractor(), new NameExtractor(), new GeneralExtractor())) {
            this.extractors.put(extractor.type(), extractor);
        }
    }

    public ExtractionResult reconcile(String rawAnswer, String question, String context) {
        return this.reconcile(rawAnswer, question, context, this.queryPlanner.classify(question));
    }

    /**
     * Reconciles against an already classified type.
     */
    public ExtractionResult reconcile(String rawAnswer, String question, String context, AnswerType answerType) {
        String answer = rawAnswer == null ? "" : rawAnswer.strip();
        ExtractionResult result = this.extractors.get(answerType).extract(
                answer, question == null ? "" : question, context == null ? "" : context);
        if (!result.trusted()) {
            log.debug("Generated answer replaced for {} question (source={}, garbage={}, dump={})",
                    answerType, result.source(), AnswerHeuristics.isGarbage(answer), AnswerHeuristics.isContextDump(answer));
        }
        return result;
    }
}
