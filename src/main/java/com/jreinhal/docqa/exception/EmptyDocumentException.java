package com.jreinhal.docqa.exception;

/**
 * Raised when an upload yields no text chunks to index. A caller error, surfaced immediately.
 */
public class EmptyDocumentException extends RuntimeException {
    public EmptyDocumentException(String message) {
        super(message);
    }
}
