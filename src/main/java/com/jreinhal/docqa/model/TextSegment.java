package com.jreinhal.docqa.model;

/**
 * Raw text extracted from an upload before splitting; one per PDF page, or one for the whole file.
 */
public record TextSegment(String text, Integer page) {
}
