package com.jreinhal.docqa.service;

import com.jreinhal.docqa.exception.ModelUnavailableException;
import com.jreinhal.docqa.util.SimpleCircuitBreaker;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Generation through the configured Spring AI chat model. Every failure mode (no model bean,
 * open circuit, timeout, provider error) surfaces as {@link ModelUnavailableException}.
 */
@Component
public class ChatClientGenerationFunction implements GenerationFunction {
    private static final Logger log = LoggerFactory.getLogger(ChatClientGenerationFunction.class);
    private final ObjectProvider<ChatClient.Builder> chatClientBuilderProvider;
    private final SimpleCircuitBreaker circuitBreaker;
    private volatile ChatClient chatClient;
    @Value("${docqa.generation.timeout-seconds:60}")
    private long timeoutSeconds;

    @Autowired
    public ChatClientGenerationFunction(ObjectProvider<ChatClient.Builder> chatClientBuilderProvider,
            @Value("${docqa.generation.circuit-breaker.failure-threshold:3}") int failureThreshold,
            @Value("${docqa.generation.circuit-breaker.open-seconds:30}") long openSeconds) {
        this(chatClientBuilderProvider, new SimpleCircuitBreaker("generation", failureThreshold, Duration.ofSeconds(openSeconds)));
    }

    ChatClientGenerationFunction(ObjectProvider<ChatClient.Builder> chatClientBuilderProvider, SimpleCircuitBreaker circuitBreaker) {
        this.chatClientBuilderProvider = chatClientBuilderProvider;
        this.circuitBreaker = circuitBreaker;
        this.timeoutSeconds = 60L;
    }

    @Override
    public String generate(String prompt, int maxTokens) {
        if (!this.circuitBreaker.allowRequest()) {
            throw new ModelUnavailableException("Generation is paused after repeated failures");
        }
        ChatClient client = this.resolveClient();
        long startTime = System.currentTimeMillis();
        CompletableFuture<String> future = CompletableFuture.supplyAsync(() -> client.prompt()
                .user(prompt)
                .options(ChatOptions.builder().maxTokens(maxTokens).build())
                .call()
                .content());
        try {
            String content = future.get(this.timeoutSeconds, TimeUnit.SECONDS);
            this.circuitBreaker.recordSuccess();
            log.debug("Generation completed in {}ms", System.currentTimeMillis() - startTime);
            return content == null ? "" : content;
        }
        catch (TimeoutException e) {
            future.cancel(true);
            this.circuitBreaker.recordFailure(e);
            log.warn("Generation timed out after {}s", this.timeoutSeconds);
            throw new ModelUnavailableException("Generation timed out", e);
        }
        catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            this.circuitBreaker.recordFailure(cause);
            log.warn("Generation failed: {}", cause.getMessage());
            throw new ModelUnavailableException("Generation failed", cause);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            this.circuitBreaker.recordFailure(e);
            throw new ModelUnavailableException("Generation interrupted", e);
        }
    }

    SimpleCircuitBreaker.State circuitState() {
        return this.circuitBreaker.getState();
    }

    private ChatClient resolveClient() {
        ChatClient client = this.chatClient;
        if (client != null) {
            return client;
        }
        ChatClient.Builder builder = this.chatClientBuilderProvider.getIfAvailable();
        if (builder == null) {
            throw new ModelUnavailableException("No chat model is configured");
        }
        client = builder.build();
        this.chatClient = client;
        return client;
    }
}
