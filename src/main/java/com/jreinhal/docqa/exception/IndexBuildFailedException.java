package com.jreinhal.docqa.exception;

/**
 * Embedding dependency failed while building an index. Retryable; never reported as a document problem.
 */
public class IndexBuildFailedException extends RuntimeException {
    public IndexBuildFailedException(String message) {
        super(message);
    }

    public IndexBuildFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
