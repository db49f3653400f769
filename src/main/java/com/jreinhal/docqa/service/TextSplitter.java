package com.jreinhal.docqa.service;

import com.jreinhal.docqa.model.Chunk;
import com.jreinhal.docqa.model.TextSegment;
import java.util.List;

public interface TextSplitter {

    /**
     * Splits segments into chunks of at most {@code chunkSize} characters. Deterministic for
     * identical input.
     */
    List<Chunk> split(List<TextSegment> segments, int chunkSize, int overlap, String sourceId);
}
