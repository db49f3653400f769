package com.jreinhal.docqa.dto;

import java.util.List;

/**
 * Summary or comparison text.
 */
public record QaResponse(String text, ResponseStatus status, List<SourceRef> sources) {

    public static QaResponse message(String text, ResponseStatus status) {
        return new QaResponse(text, status, List.of());
    }
}
