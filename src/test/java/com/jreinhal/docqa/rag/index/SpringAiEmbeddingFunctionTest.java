package com.jreinhal.docqa.rag.index;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.jreinhal.docqa.exception.IndexBuildFailedException;
import com.jreinhal.docqa.model.Chunk;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.ObjectProvider;

class SpringAiEmbeddingFunctionTest {

    @Test
    @SuppressWarnings("unchecked")
    void delegatesToEmbeddingModel() {
        ObjectProvider<EmbeddingModel> provider = mock(ObjectProvider.class);
        EmbeddingModel model = mock(EmbeddingModel.class);
        when(provider.getIfAvailable()).thenReturn(model);
        when(model.embed("chunk text")).thenReturn(new float[]{0.5f, 0.25f});

        assertArrayEquals(new float[]{0.5f, 0.25f}, new SpringAiEmbeddingFunction(provider).embed("chunk text"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void missingModelFailsIndexBuild() {
        ObjectProvider<EmbeddingModel> provider = mock(ObjectProvider.class);
        SpringAiEmbeddingFunction embeddingFunction = new SpringAiEmbeddingFunction(provider);

        assertThrows(IllegalStateException.class, () -> embeddingFunction.embed("chunk text"));
        assertThrows(IndexBuildFailedException.class,
                () -> EmbeddingRetrievalIndex.build(List.of(Chunk.of("chunk text")), embeddingFunction));
    }
}
