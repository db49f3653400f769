package com.jreinhal.docqa.exception;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import java.util.concurrent.RejectedExecutionException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void emptyDocumentIsBadRequest() {
        ResponseEntity<Map<String, Object>> res = handler.handleEmptyDocument(new EmptyDocumentException("no chunks"));

        assertEquals(HttpStatus.BAD_REQUEST, res.getStatusCode());
        assertEquals("The document contains no extractable text", res.getBody().get("error"));
        assertNotNull(res.getBody().get("timestamp"));
    }

    @Test
    void documentLoadMessageIsSanitized() {
        ResponseEntity<Map<String, Object>> plain = handler.handleDocumentLoad(new DocumentLoadException("Unsupported file type: image"));
        ResponseEntity<Map<String, Object>> leaky = handler.handleDocumentLoad(new DocumentLoadException("Failed at /tmp/docqa/upload-1.tmp"));

        assertEquals(HttpStatus.BAD_REQUEST, plain.getStatusCode());
        assertEquals("Unsupported file type: image", plain.getBody().get("error"));
        assertEquals("Invalid request", leaky.getBody().get("error"));
    }

    @Test
    void indexBuildFailureIsRetryable() {
        ResponseEntity<Map<String, Object>> res = handler.handleIndexBuild(new IndexBuildFailedException("embedding down"));

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, res.getStatusCode());
        assertEquals(Boolean.TRUE, res.getBody().get("retryable"));
    }

    @Test
    void saturatedPoolIsServiceUnavailable() {
        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, handler.handleOverload(new RejectedExecutionException("full")).getStatusCode());
    }

    @Test
    void oversizedUploadIsPayloadTooLarge() {
        assertEquals(HttpStatus.PAYLOAD_TOO_LARGE, handler.handleTooLarge(new MaxUploadSizeExceededException(1024L)).getStatusCode());
    }

    @Test
    void unhandledExceptionHidesDetails() {
        ResponseEntity<Map<String, Object>> res = handler.handleUnhandled(new IllegalStateException("com.example.Secret failed"));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, res.getStatusCode());
        assertEquals("Internal server error", res.getBody().get("error"));
    }

    @Test
    void sanitizeExceptionMessage() {
        assertEquals("Invalid request", GlobalExceptionHandler.sanitizeExceptionMessage(null));
        assertEquals("Invalid request", GlobalExceptionHandler.sanitizeExceptionMessage("java.io.IOException: boom"));
        assertEquals("Invalid request", GlobalExceptionHandler.sanitizeExceptionMessage("x".repeat(201)));
        assertEquals("Question must not be empty", GlobalExceptionHandler.sanitizeExceptionMessage("Question must not be empty"));
    }
}
