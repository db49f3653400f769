package com.jreinhal.docqa.dto;

/**
 * Where a context chunk came from. {@code page} is 0-based and absent for unpaged formats.
 */
public record SourceRef(String source, Integer page) {
}
