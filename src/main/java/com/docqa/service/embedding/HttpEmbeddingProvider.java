package com.docqa.service.embedding;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.springframework.cache.annotation.Cacheable;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import com.docqa.config.EmbeddingConfig;
import com.docqa.exception.DimensionMismatchException;
import com.docqa.exception.RetrievalException;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Calls the embedding service: {@code POST /embed {"texts": [...]}} answering
 * {@code {"embeddings": [[...]]}}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HttpEmbeddingProvider implements EmbeddingProvider {

    private static final ParameterizedTypeReference<Map<String, Object>> RESPONSE_TYPE =
            new ParameterizedTypeReference<>() {};

    private final EmbeddingConfig embeddingConfig;
    private final WebClient embeddingWebClient;

    @Override
    @Cacheable(value = "embeddings", key = "#text")
    @CircuitBreaker(name = "embedding", fallbackMethod = "fallbackEmbedding")
    @Retry(name = "embedding")
    public List<Double> embed(String text) {
        if (text == null || text.isBlank()) {
            throw new RetrievalException("Text to embed is empty");
        }

        try {
            log.debug("Calling embedding service");

            Map<String, Object> response =
                embeddingWebClient.post()
                    .uri("/embed")
                    .bodyValue(Map.of("texts", List.of(text)))
                    .retrieve()
                    .bodyToMono(RESPONSE_TYPE)
                    .block(Duration.ofSeconds(embeddingConfig.getTimeoutSeconds()));

            List<Double> vector = firstVector(response);

            if (vector.size() != embeddingConfig.getDimension()) {
                throw new DimensionMismatchException(embeddingConfig.getDimension(), vector.size());
            }

            return vector;

        } catch (RetrievalException e) {
            throw e;
        } catch (Exception e) {
            log.error("Embedding service failed", e);
            throw new RetrievalException("Failed to generate embedding", e);
        }
    }

    @SuppressWarnings("unchecked")
    private List<Double> firstVector(Map<String, Object> response) {
        if (response == null || !response.containsKey("embeddings")) {
            throw new RetrievalException("Invalid response from embedding service");
        }

        List<List<Number>> embeddings = (List<List<Number>>) response.get("embeddings");
        if (embeddings == null || embeddings.isEmpty() || embeddings.get(0) == null) {
            throw new RetrievalException("Empty embedding response");
        }

        return embeddings.get(0).stream()
                .map(Number::doubleValue)
                .toList();
    }

    /**
     * Open-circuit path: surface the failure instead of a placeholder vector.
     */
    public List<Double> fallbackEmbedding(String text, Throwable ex) {
        log.warn("Embedding unavailable for text of length {}: {}",
            text != null ? text.length() : 0, ex.getMessage());

        if (ex instanceof RetrievalException) {
            throw (RetrievalException) ex;
        }
        throw new RetrievalException("Embedding service unavailable", ex);
    }
}
