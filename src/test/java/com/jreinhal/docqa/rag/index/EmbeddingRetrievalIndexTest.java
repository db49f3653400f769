package com.jreinhal.docqa.rag.index;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.jreinhal.docqa.exception.EmptyDocumentException;
import com.jreinhal.docqa.exception.IndexBuildFailedException;
import com.jreinhal.docqa.exception.RetrievalFailedException;
import com.jreinhal.docqa.model.Chunk;
import com.jreinhal.docqa.support.FakeEmbeddingFunction;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class EmbeddingRetrievalIndexTest {

    private final FakeEmbeddingFunction embedding = new FakeEmbeddingFunction();

    private static List<Chunk> chunks(String... texts) {
        return java.util.Arrays.stream(texts).map(Chunk::of).toList();
    }

    @Nested
    @DisplayName("search()")
    class SearchTest {

        @Test
        @DisplayName("Should rank the chunk matching the query text first")
        void ranksExactMatchFirst() {
            EmbeddingRetrievalIndex index = EmbeddingRetrievalIndex.build(
                    chunks("apples and oranges", "the cat sat on the mat", "quarterly revenue report"), embedding);

            List<Chunk> results = index.search("the cat sat on the mat", 1);

            assertThat(results).extracting(Chunk::text).containsExactly("the cat sat on the mat");
        }

        @Test
        @DisplayName("Should report similarities in descending order with an exact match scoring one")
        void scoredSearchCarriesSimilarity() {
            EmbeddingRetrievalIndex index = EmbeddingRetrievalIndex.build(
                    chunks("apples and oranges", "the cat sat on the mat", "quarterly revenue report"), embedding);

            List<ScoredChunk> hits = index.searchScored("the cat sat on the mat", 3);

            assertThat(hits).hasSize(3);
            assertThat(hits.get(0).chunk().text()).isEqualTo("the cat sat on the mat");
            assertThat(hits.get(0).similarity()).isCloseTo(1.0, within(1e-9));
            assertThat(hits).extracting(ScoredChunk::similarity).isSortedAccordingTo(java.util.Comparator.reverseOrder());
            assertThat(index.search("the cat sat on the mat", 3)).extracting(Chunk::text)
                    .containsExactlyElementsOf(hits.stream().map(hit -> hit.chunk().text()).toList());
        }

        @Test
        @DisplayName("Should return an empty list for k of zero or below without embedding the query")
        void nonPositiveKReturnsEmpty() {
            EmbeddingRetrievalIndex index = EmbeddingRetrievalIndex.build(chunks("one", "two"), embedding);
            int callsAfterBuild = embedding.calls();

            assertThat(index.search("one", 0)).isEmpty();
            assertThat(index.search("one", -3)).isEmpty();
            assertThat(embedding.calls()).isEqualTo(callsAfterBuild);
        }

        @Test
        @DisplayName("Should return every chunk when k exceeds the index size")
        void largeKReturnsAll() {
            EmbeddingRetrievalIndex index = EmbeddingRetrievalIndex.build(chunks("alpha", "beta", "gamma"), embedding);

            assertThat(index.search("alpha", 10)).hasSize(3);
        }

        @Test
        @DisplayName("Should break score ties by original chunk order")
        void tiesKeepChunkOrder() {
            List<Chunk> same = List.of(
                    new Chunk("same text", "first", null),
                    new Chunk("same text", "second", null),
                    new Chunk("same text", "third", null));
            EmbeddingRetrievalIndex index = EmbeddingRetrievalIndex.build(same, embedding);

            assertThat(index.search("same text", 3)).extracting(Chunk::sourceId)
                    .containsExactly("first", "second", "third");
        }

        @Test
        @DisplayName("Should wrap a failing query embedding in RetrievalFailedException")
        void queryEmbeddingFailure() {
            AtomicBoolean down = new AtomicBoolean(false);
            EmbeddingFunction flaky = text -> {
                if (down.get()) {
                    throw new IllegalStateException("backend down");
                }
                return embedding.embed(text);
            };
            EmbeddingRetrievalIndex index = EmbeddingRetrievalIndex.build(chunks("alpha"), flaky);
            down.set(true);

            assertThrows(RetrievalFailedException.class, () -> index.search("alpha", 1));
        }
    }

    @Nested
    @DisplayName("build()")
    class BuildTest {

        @Test
        @DisplayName("Should reject an empty chunk list")
        void emptyChunks() {
            assertThrows(EmptyDocumentException.class, () -> EmbeddingRetrievalIndex.build(List.of(), embedding));
            assertThrows(EmptyDocumentException.class, () -> EmbeddingRetrievalIndex.build(null, embedding));
        }

        @Test
        @DisplayName("Should fail the whole build when one chunk cannot be embedded")
        void allOrNothing() {
            AtomicInteger calls = new AtomicInteger();
            EmbeddingFunction failsOnSecond = text -> {
                if (calls.incrementAndGet() == 2) {
                    throw new IllegalStateException("timeout");
                }
                return new float[]{1f, 0f};
            };

            IndexBuildFailedException ex = assertThrows(IndexBuildFailedException.class,
                    () -> EmbeddingRetrievalIndex.build(chunks("a", "b", "c"), failsOnSecond));
            assertThat(ex.getCause()).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("Should fail when vector dimensions differ between chunks")
        void dimensionMismatch() {
            EmbeddingFunction inconsistent = text -> text.equals("a") ? new float[]{1f, 0f} : new float[]{1f, 0f, 0f};

            assertThrows(IndexBuildFailedException.class,
                    () -> EmbeddingRetrievalIndex.build(chunks("a", "b"), inconsistent));
        }

        @Test
        @DisplayName("Should fail when the embedding returns no vector")
        void emptyVector() {
            assertThrows(IndexBuildFailedException.class,
                    () -> EmbeddingRetrievalIndex.build(chunks("a"), text -> new float[0]));
        }

        @Test
        @DisplayName("Should keep chunks in input order")
        void keepsChunks() {
            List<Chunk> input = chunks("x", "y");

            assertThat(EmbeddingRetrievalIndex.build(input, embedding).chunks()).containsExactlyElementsOf(input);
        }
    }

    @Test
    void centroidIsMeanOfChunkVectors() {
        EmbeddingFunction axes = text -> text.equals("a") ? new float[]{1f, 0f} : new float[]{0f, 1f};
        EmbeddingRetrievalIndex index = EmbeddingRetrievalIndex.build(chunks("a", "b"), axes);

        assertThat(index.centroid()).containsExactly(0.5f, 0.5f);
    }

    @Test
    void cosineSimilarityOfOrthogonalAndEqualVectors() {
        assertThat(EmbeddingRetrievalIndex.cosineSimilarity(new float[]{1f, 0f}, new float[]{0f, 1f})).isEqualTo(0.0);
        assertThat(EmbeddingRetrievalIndex.cosineSimilarity(new float[]{2f, 2f}, new float[]{1f, 1f})).isCloseTo(1.0, org.assertj.core.data.Offset.offset(1e-9));
        assertThat(EmbeddingRetrievalIndex.cosineSimilarity(new float[]{0f, 0f}, new float[]{1f, 1f})).isEqualTo(0.0);
    }
}
