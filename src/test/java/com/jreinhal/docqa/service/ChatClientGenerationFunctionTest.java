package com.jreinhal.docqa.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.jreinhal.docqa.exception.ModelUnavailableException;
import com.jreinhal.docqa.util.SimpleCircuitBreaker;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.ObjectProvider;

class ChatClientGenerationFunctionTest {

    private ObjectProvider<ChatClient.Builder> provider;
    private ChatClient.Builder builder;
    private ChatClient client;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        this.provider = mock(ObjectProvider.class);
        this.builder = mock(ChatClient.Builder.class);
        this.client = mock(ChatClient.class, RETURNS_DEEP_STUBS);
        when(this.provider.getIfAvailable()).thenReturn(this.builder);
        when(this.builder.build()).thenReturn(this.client);
    }

    @Test
    @DisplayName("Should return model content and build the client once")
    void generatesContent() {
        when(client.prompt().user(anyString()).options(any()).call().content()).thenReturn("58%");
        ChatClientGenerationFunction generation = new ChatClientGenerationFunction(provider,
                new SimpleCircuitBreaker("test", 3, Duration.ofSeconds(30)));

        assertThat(generation.generate("prompt", 200)).isEqualTo("58%");
        assertThat(generation.generate("prompt", 200)).isEqualTo("58%");
        verify(builder, times(1)).build();
        assertThat(generation.circuitState()).isEqualTo(SimpleCircuitBreaker.State.CLOSED);
    }

    @Test
    void nullContentBecomesEmpty() {
        when(client.prompt().user(anyString()).options(any()).call().content()).thenReturn(null);
        ChatClientGenerationFunction generation = new ChatClientGenerationFunction(provider,
                new SimpleCircuitBreaker("test", 3, Duration.ofSeconds(30)));

        assertThat(generation.generate("prompt", 50)).isEmpty();
    }

    @Test
    @DisplayName("Should report a missing chat model as unavailable")
    @SuppressWarnings("unchecked")
    void noChatModel() {
        ObjectProvider<ChatClient.Builder> empty = mock(ObjectProvider.class);
        ChatClientGenerationFunction generation = new ChatClientGenerationFunction(empty,
                new SimpleCircuitBreaker("test", 3, Duration.ofSeconds(30)));

        assertThatThrownBy(() -> generation.generate("prompt", 200))
                .isInstanceOf(ModelUnavailableException.class)
                .hasMessageContaining("No chat model");
    }

    @Test
    @DisplayName("Should open the circuit after a provider failure and stop calling the model")
    void failureOpensCircuit() {
        when(client.prompt()).thenThrow(new IllegalStateException("connection refused"));
        ChatClientGenerationFunction generation = new ChatClientGenerationFunction(provider,
                new SimpleCircuitBreaker("test", 1, Duration.ofMinutes(5)));

        assertThatThrownBy(() -> generation.generate("prompt", 200))
                .isInstanceOf(ModelUnavailableException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(generation.circuitState()).isEqualTo(SimpleCircuitBreaker.State.OPEN);

        assertThatThrownBy(() -> generation.generate("prompt", 200))
                .isInstanceOf(ModelUnavailableException.class)
                .hasMessageContaining("paused");
        verify(client, times(1)).prompt();
    }

    @Test
    @SuppressWarnings("unchecked")
    void openCircuitSkipsModelLookup() {
        ObjectProvider<ChatClient.Builder> untouched = mock(ObjectProvider.class);
        SimpleCircuitBreaker breaker = new SimpleCircuitBreaker("test", 1, Duration.ofMinutes(5));
        breaker.recordFailure(new RuntimeException("earlier failure"));
        ChatClientGenerationFunction generation = new ChatClientGenerationFunction(untouched, breaker);

        assertThatThrownBy(() -> generation.generate("prompt", 200)).isInstanceOf(ModelUnavailableException.class);
        verifyNoInteractions(untouched);
    }

    @Test
    @DisplayName("Should reopen the circuit when a trial call is interrupted, then recover")
    void interruptedTrialCallDoesNotWedgeCircuit() throws Exception {
        AtomicLong now = new AtomicLong(1_000L);
        SimpleCircuitBreaker breaker = new SimpleCircuitBreaker("test", 1, Duration.ofMillis(100), 1, now::get);
        breaker.recordFailure(new RuntimeException("earlier failure"));
        CountDownLatch release = new CountDownLatch(1);
        when(client.prompt().user(anyString()).options(any()).call().content()).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return "58%";
        });
        ChatClientGenerationFunction generation = new ChatClientGenerationFunction(provider, breaker);
        now.addAndGet(100L);

        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> generation.generate("prompt", 200))
                    .isInstanceOf(ModelUnavailableException.class)
                    .hasMessageContaining("interrupted");
        }
        finally {
            Thread.interrupted();
            release.countDown();
        }
        assertThat(generation.circuitState()).isEqualTo(SimpleCircuitBreaker.State.OPEN);

        now.addAndGet(100L);
        assertThat(generation.generate("prompt", 200)).isEqualTo("58%");
        assertThat(generation.circuitState()).isEqualTo(SimpleCircuitBreaker.State.CLOSED);
    }
}
