package com.jreinhal.docqa.exception;

/**
 * Upload could not be read: unsupported type, unreadable content or no extractable text.
 */
public class DocumentLoadException extends RuntimeException {
    public DocumentLoadException(String message) {
        super(message);
    }

    public DocumentLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
