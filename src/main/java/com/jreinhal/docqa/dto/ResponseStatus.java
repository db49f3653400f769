package com.jreinhal.docqa.dto;

/**
 * Outcome of a QA request. None of these map to an HTTP error: an expired session or a thin
 * context is an expected result, reported in the body.
 */
public enum ResponseStatus {
    OK,
    NO_SESSION,
    NOT_FOUND,
    NO_CONTEXT,
    INSUFFICIENT,
    UNAVAILABLE
}
