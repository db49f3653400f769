package com.jreinhal.docqa.rag.index;

import com.jreinhal.docqa.model.Chunk;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Nearest-neighbor search over the chunks of one upload. The chunk set is fixed at build time.
 */
public interface RetrievalIndex {

    /**
     * Returns at most {@code k} chunks ordered by descending similarity to {@code query}.
     * Ties keep original chunk order; {@code k <= 0} yields an empty list.
     */
    default List<Chunk> search(String query, int k) {
        return this.searchScored(query, k).stream().map(ScoredChunk::chunk).collect(Collectors.toList());
    }

    /**
     * Same ordering as {@link #search}, keeping each hit's similarity so results from several
     * indices can be merged.
     */
    List<ScoredChunk> searchScored(String query, int k);

    List<Chunk> chunks();

    default int size() {
        return this.chunks().size();
    }

    /**
     * Mean chunk embedding, used to compare whole documents with each other.
     */
    float[] centroid();
}
