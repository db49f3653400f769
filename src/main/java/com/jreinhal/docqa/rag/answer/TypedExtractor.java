package com.jreinhal.docqa.rag.answer;

import com.jreinhal.docqa.model.AnswerType;
import com.jreinhal.docqa.model.ExtractionResult;

/**
 * Reconciliation policy for one answer type. Implementations are pure and never return null
 * or empty text.
 */
interface TypedExtractor {

    AnswerType type();

    /**
     * @param answer   stripped generation, possibly empty
     * @param question the user's question
     * @param context  retrieved chunks joined as sent to the model
     */
    ExtractionResult extract(String answer, String question, String context);
}
