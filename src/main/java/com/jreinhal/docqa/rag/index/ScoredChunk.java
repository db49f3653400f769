package com.jreinhal.docqa.rag.index;

import com.jreinhal.docqa.model.Chunk;

/**
 * A search hit with its cosine similarity to the query.
 */
public record ScoredChunk(Chunk chunk, double similarity) {
}
