package com.jreinhal.docqa.dto;

import com.jreinhal.docqa.model.AnswerType;
import com.jreinhal.docqa.model.ExtractionResult;
import java.util.List;

/**
 * @param answerType classified type, null when the request never reached retrieval
 * @param source     how the answer text was obtained, null unless generation ran
 */
public record AskResponse(String answer, ResponseStatus status, AnswerType answerType, ExtractionResult.Source source, List<SourceRef> sources) {

    public static AskResponse message(String answer, ResponseStatus status) {
        return new AskResponse(answer, status, null, null, List.of());
    }
}
