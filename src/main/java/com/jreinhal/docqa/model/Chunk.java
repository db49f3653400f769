package com.jreinhal.docqa.model;

import java.util.Objects;

/**
 * Smallest retrievable unit of document text.
 *
 * @param text     chunk text as produced by the splitter
 * @param sourceId identifier of the upload the chunk came from (usually the file name)
 * @param page     0-based page number, or {@code null} when the format has no pages
 */
public record Chunk(String text, String sourceId, Integer page) {

    public Chunk {
        Objects.requireNonNull(text, "text");
        sourceId = sourceId == null ? "" : sourceId;
    }

    public static Chunk of(String text) {
        return new Chunk(text, "", null);
    }
}
