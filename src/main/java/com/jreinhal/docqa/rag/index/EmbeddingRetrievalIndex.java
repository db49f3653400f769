package com.jreinhal.docqa.rag.index;

import com.jreinhal.docqa.exception.EmptyDocumentException;
import com.jreinhal.docqa.exception.IndexBuildFailedException;
import com.jreinhal.docqa.exception.RetrievalFailedException;
import com.jreinhal.docqa.model.Chunk;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exact cosine-similarity index held in memory. Embeddings are computed once, at build time,
 * and the build is all-or-nothing: one failing chunk fails the whole index.
 */
public final class EmbeddingRetrievalIndex implements RetrievalIndex {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingRetrievalIndex.class);
    private final List<Chunk> chunks;
    private final float[][] embeddings;
    private final double[] norms;
    private final EmbeddingFunction embeddingFunction;

    private EmbeddingRetrievalIndex(List<Chunk> chunks, float[][] embeddings, EmbeddingFunction embeddingFunction) {
        this.chunks = chunks;
        this.embeddings = embeddings;
        this.embeddingFunction = embeddingFunction;
        this.norms = new double[embeddings.length];
        for (int i = 0; i < embeddings.length; ++i) {
            this.norms[i] = computeNorm(embeddings[i]);
        }
    }

    public static EmbeddingRetrievalIndex build(List<Chunk> chunks, EmbeddingFunction embeddingFunction) {
        if (chunks == null || chunks.isEmpty()) {
            throw new EmptyDocumentException("Cannot index a document with no text chunks");
        }
        List<Chunk> fixed = List.copyOf(chunks);
        float[][] vectors = new float[fixed.size()][];
        int dimensions = -1;
        for (int i = 0; i < fixed.size(); ++i) {
            float[] vector;
            try {
                vector = embeddingFunction.embed(fixed.get(i).text());
            }
            catch (RuntimeException e) {
                throw new IndexBuildFailedException("Embedding failed for chunk " + i + " of " + fixed.size(), e);
            }
            if (vector == null || vector.length == 0) {
                throw new IndexBuildFailedException("Embedding returned no vector for chunk " + i, null);
            }
            if (dimensions < 0) {
                dimensions = vector.length;
            } else if (vector.length != dimensions) {
                throw new IndexBuildFailedException("Embedding dimension changed from " + dimensions + " to " + vector.length + " at chunk " + i, null);
            }
            vectors[i] = vector.clone();
        }
        log.debug("Built retrieval index: chunks={}, dimensions={}", fixed.size(), dimensions);
        return new EmbeddingRetrievalIndex(fixed, vectors, embeddingFunction);
    }

    @Override
    public List<ScoredChunk> searchScored(String query, int k) {
        if (k <= 0 || query == null) {
            return List.of();
        }
        float[] queryVector;
        try {
            queryVector = this.embeddingFunction.embed(query);
        }
        catch (RuntimeException e) {
            throw new RetrievalFailedException("Query embedding failed", e);
        }
        double queryNorm = computeNorm(queryVector);
        List<Scored> scored = new ArrayList<>(this.chunks.size());
        for (int i = 0; i < this.chunks.size(); ++i) {
            scored.add(new Scored(i, cosine(queryVector, queryNorm, this.embeddings[i], this.norms[i])));
        }
        // List.sort is stable, so equal scores keep chunk order.
        scored.sort(Comparator.comparingDouble(Scored::score).reversed());
        int limit = Math.min(k, scored.size());
        List<ScoredChunk> results = new ArrayList<>(limit);
        for (int i = 0; i < limit; ++i) {
            Scored hit = scored.get(i);
            results.add(new ScoredChunk(this.chunks.get(hit.position()), hit.score()));
        }
        return results;
    }

    @Override
    public List<Chunk> chunks() {
        return this.chunks;
    }

    @Override
    public float[] centroid() {
        int dimensions = this.embeddings[0].length;
        float[] mean = new float[dimensions];
        for (float[] vector : this.embeddings) {
            for (int d = 0; d < dimensions; ++d) {
                mean[d] += vector[d];
            }
        }
        for (int d = 0; d < dimensions; ++d) {
            mean[d] /= this.embeddings.length;
        }
        return mean;
    }

    public static double cosineSimilarity(float[] a, float[] b) {
        return cosine(a, computeNorm(a), b, computeNorm(b));
    }

    private static double cosine(float[] v1, double normA, float[] v2, double normB) {
        if (v1 == null || v2 == null || v1.length == 0 || v1.length != v2.length) {
            return 0.0;
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        double dotProduct = 0.0;
        for (int i = 0; i < v1.length; ++i) {
            dotProduct += (double)v1[i] * (double)v2[i];
        }
        return dotProduct / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    private static double computeNorm(float[] embedding) {
        if (embedding == null || embedding.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (float f : embedding) {
            sum += (double)f * (double)f;
        }
        return sum;
    }

    private record Scored(int position, double score) {
    }
}
