package com.jreinhal.docqa.exception;

public class RetrievalFailedException extends RuntimeException {
    public RetrievalFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
