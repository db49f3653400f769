package com.jreinhal.docqa.exception;

/**
 * Generation dependency is missing, timed out or failing. Callers degrade instead of failing the request.
 */
public class ModelUnavailableException extends RuntimeException {
    public ModelUnavailableException(String message) {
        super(message);
    }

    public ModelUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
