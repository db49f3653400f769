package com.jreinhal.docqa.model;

/**
 * Semantic category a question is expected to resolve to. Declaration order is the
 * classification precedence: the first matching detector wins.
 */
public enum AnswerType {
    PERCENTAGE("The percentage could not be found in the document."),
    COUNT("The count could not be found in the document."),
    DATE("The date could not be found in the document."),
    NAME("The name could not be found in the document."),
    GENERAL("I could not find a relevant answer in the document.");

    private final String notFoundMessage;

    AnswerType(String notFoundMessage) {
        this.notFoundMessage = notFoundMessage;
    }

    public String notFoundMessage() {
        return this.notFoundMessage;
    }
}
