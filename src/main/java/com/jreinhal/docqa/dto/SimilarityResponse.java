package com.jreinhal.docqa.dto;

import java.util.Map;

/**
 * Pairwise cosine similarity between document centroids, keyed by session id on both axes.
 */
public record SimilarityResponse(Map<String, Map<String, Double>> matrix, ResponseStatus status, String message) {
}
