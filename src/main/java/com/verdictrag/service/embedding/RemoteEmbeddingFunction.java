package com.verdictrag.service.embedding;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.springframework.cache.Cache;
import org.springframework.web.reactive.function.client.WebClient;

import com.verdictrag.config.LegalRagProperties;
import com.verdictrag.exception.EmbeddingException;
import com.verdictrag.exception.MalformedInputException;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Embeddings from an HTTP sentence-embedding service:
 * {@code POST /embed {"texts": [...]}} answering {@code {"embeddings": [[...], ...]}}.
 * Single-text vectors are kept in the {@code embeddings} cache; callers always get a copy.
 */
@Slf4j
@RequiredArgsConstructor
public class RemoteEmbeddingFunction implements EmbeddingFunction {

    private final LegalRagProperties.Embedding config;
    private final WebClient embeddingWebClient;
    private final Cache embeddingCache;

    @Override
    public String modelName() {
        return config.getModel();
    }

    @Override
    public int dimension() {
        return config.getDimension();
    }

    @Override
    @CircuitBreaker(name = "embedding", fallbackMethod = "embeddingUnavailable")
    public float[] embed(String text) {
        if (text == null || text.isBlank()) {
            throw new EmbeddingException("Text is empty");
        }
        float[] vector = embeddingCache.get(text, float[].class);
        if (vector == null) {
            vector = request(List.of(text)).get(0);
            embeddingCache.put(text, vector);
        }
        return vector.clone();
    }

    @Override
    @CircuitBreaker(name = "embedding", fallbackMethod = "batchEmbeddingUnavailable")
    public List<float[]> embedAll(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return Collections.emptyList();
        }
        return request(texts);
    }

    private List<float[]> request(List<String> texts) {
        log.debug("Calling embedding service for {} texts", texts.size());

        Map<String, Object> response;
        try {
            response = embeddingWebClient.post()
                    .uri("/embed")
                    .bodyValue(Map.of("texts", texts))
                    .retrieve()
                    .bodyToMono(Map.class)
                    .block(Duration.ofSeconds(config.getTimeoutSeconds()));
        } catch (Exception e) {
            log.error("Embedding service call failed: {}", e.getMessage());
            throw new EmbeddingException("Failed to generate embeddings", e);
        }

        if (response == null || !response.containsKey("embeddings")) {
            throw new EmbeddingException("Invalid response from embedding service");
        }

        @SuppressWarnings("unchecked")
        List<List<Number>> embeddings = (List<List<Number>>) response.get("embeddings");

        if (embeddings == null || embeddings.size() != texts.size()) {
            throw new EmbeddingException(String.format(
                    "Embedding service returned %d vectors for %d texts",
                    embeddings == null ? 0 : embeddings.size(), texts.size()));
        }

        List<float[]> vectors = new ArrayList<>(embeddings.size());
        for (List<Number> raw : embeddings) {
            if (raw.size() != config.getDimension()) {
                throw MalformedInputException.dimensionMismatch(
                        "Vector from " + config.getModel(), config.getDimension(), raw.size());
            }
            float[] vector = new float[raw.size()];
            for (int i = 0; i < vector.length; i++) {
                vector[i] = raw.get(i).floatValue();
            }
            vectors.add(vector);
        }
        return vectors;
    }

    private float[] embeddingUnavailable(String text, CallNotPermittedException e) {
        log.warn("Embedding circuit open, rejecting call: {}", e.getMessage());
        throw new EmbeddingException("Embedding service unavailable (circuit open)", e);
    }

    private List<float[]> batchEmbeddingUnavailable(List<String> texts, CallNotPermittedException e) {
        log.warn("Embedding circuit open, rejecting batch of {} texts", texts.size());
        throw new EmbeddingException("Embedding service unavailable (circuit open)", e);
    }
}
