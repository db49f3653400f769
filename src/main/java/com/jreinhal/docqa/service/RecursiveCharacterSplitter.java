package com.jreinhal.docqa.service;

import com.jreinhal.docqa.model.Chunk;
import com.jreinhal.docqa.model.TextSegment;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Splits on paragraph breaks first, then lines, then words, then characters, so chunk
 * boundaries fall on the coarsest separator that keeps each chunk within the size limit.
 * Neighbouring chunks share up to {@code overlap} trailing characters.
 */
@Component
public class RecursiveCharacterSplitter implements TextSplitter {
    static final List<String> SEPARATORS = List.of("\n\n", "\n", " ", "");

    @Override
    public List<Chunk> split(List<TextSegment> segments, int chunkSize, int overlap, String sourceId) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive");
        }
        if (overlap < 0 || overlap >= chunkSize) {
            throw new IllegalArgumentException("Chunk overlap must be between 0 and chunk size");
        }
        List<Chunk> chunks = new ArrayList<>();
        if (segments == null) {
            return chunks;
        }
        for (TextSegment segment : segments) {
            if (segment == null || segment.text() == null || segment.text().isBlank()) {
                continue;
            }
            for (String piece : splitText(segment.text(), SEPARATORS, chunkSize, overlap)) {
                chunks.add(new Chunk(piece, sourceId, segment.page()));
            }
        }
        return chunks;
    }

    private static List<String> splitText(String text, List<String> separators, int chunkSize, int overlap) {
        String separator = separators.get(separators.size() - 1);
        List<String> finer = List.of();
        for (int i = 0; i < separators.size(); ++i) {
            String candidate = separators.get(i);
            if (candidate.isEmpty() || text.contains(candidate)) {
                separator = candidate;
                finer = separators.subList(i + 1, separators.size());
                break;
            }
        }
        List<String> result = new ArrayList<>();
        List<String> small = new ArrayList<>();
        for (String piece : splitOn(text, separator)) {
            if (piece.length() < chunkSize) {
                small.add(piece);
                continue;
            }
            if (!small.isEmpty()) {
                result.addAll(merge(small, separator, chunkSize, overlap));
                small.clear();
            }
            if (finer.isEmpty()) {
                result.add(piece.strip());
            } else {
                result.addAll(splitText(piece, finer, chunkSize, overlap));
            }
        }
        if (!small.isEmpty()) {
            result.addAll(merge(small, separator, chunkSize, overlap));
        }
        return result;
    }

    private static List<String> splitOn(String text, String separator) {
        List<String> pieces = new ArrayList<>();
        if (separator.isEmpty()) {
            for (int i = 0; i < text.length(); ++i) {
                pieces.add(String.valueOf(text.charAt(i)));
            }
            return pieces;
        }
        int start = 0;
        int idx;
        while ((idx = text.indexOf(separator, start)) >= 0) {
            if (idx > start) {
                pieces.add(text.substring(start, idx));
            }
            start = idx + separator.length();
        }
        if (start < text.length()) {
            pieces.add(text.substring(start));
        }
        return pieces;
    }

    private static List<String> merge(List<String> pieces, String separator, int chunkSize, int overlap) {
        int sepLength = separator.length();
        List<String> merged = new ArrayList<>();
        Deque<String> window = new ArrayDeque<>();
        int total = 0;
        for (String piece : pieces) {
            int joinCost = window.isEmpty() ? 0 : sepLength;
            if (total + piece.length() + joinCost > chunkSize && !window.isEmpty()) {
                addIfNotBlank(merged, String.join(separator, window));
                // slide: keep at most `overlap` characters of the tail as the next chunk's head
                while (total > overlap || (total > 0 && total + piece.length() + (window.isEmpty() ? 0 : sepLength) > chunkSize)) {
                    String dropped = window.removeFirst();
                    total -= dropped.length() + (window.isEmpty() ? 0 : sepLength);
                }
            }
            total += piece.length() + (window.isEmpty() ? 0 : sepLength);
            window.addLast(piece);
        }
        addIfNotBlank(merged, String.join(separator, window));
        return merged;
    }

    private static void addIfNotBlank(List<String> target, String text) {
        String stripped = text.strip();
        if (!stripped.isEmpty()) {
            target.add(stripped);
        }
    }
}
