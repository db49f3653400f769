package com.jreinhal.docqa.dto;

/**
 * @param pageCount pages that yielded text; 0 for unpaged formats
 */
public record UploadResult(String sessionId, String filename, int chunkCount, int pageCount) {
}
