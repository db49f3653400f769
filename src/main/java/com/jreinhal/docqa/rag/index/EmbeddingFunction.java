package com.jreinhal.docqa.rag.index;

/**
 * Turns text into a fixed-length vector. Implementations must be deterministic for a given
 * text and model version; failures are reported as unchecked exceptions.
 */
@FunctionalInterface
public interface EmbeddingFunction {

    float[] embed(String text);
}
