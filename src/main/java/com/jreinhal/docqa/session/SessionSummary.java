package com.jreinhal.docqa.session;

import java.time.Instant;

public record SessionSummary(String sessionId, String label, int indexCount, int chunkCount, Instant createdAt, Instant lastAccessed) {
}
