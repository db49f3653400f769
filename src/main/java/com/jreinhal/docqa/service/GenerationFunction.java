package com.jreinhal.docqa.service;

/**
 * Text generation backend.
 */
@FunctionalInterface
public interface GenerationFunction {

    /**
     * @throws com.jreinhal.docqa.exception.ModelUnavailableException when the model is missing, failing or too slow
     */
    String generate(String prompt, int maxTokens);
}
