package com.jreinhal.docqa.rag.index;

import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * Adapts the configured Spring AI {@link EmbeddingModel} to {@link EmbeddingFunction}.
 */
@Component
public class SpringAiEmbeddingFunction implements EmbeddingFunction {
    private final ObjectProvider<EmbeddingModel> embeddingModelProvider;

    public SpringAiEmbeddingFunction(ObjectProvider<EmbeddingModel> embeddingModelProvider) {
        this.embeddingModelProvider = embeddingModelProvider;
    }

    @Override
    public float[] embed(String text) {
        EmbeddingModel model = this.embeddingModelProvider.getIfAvailable();
        if (model == null) {
            throw new IllegalStateException("No EmbeddingModel bean is configured");
        }
        return model.embed(text);
    }
}
