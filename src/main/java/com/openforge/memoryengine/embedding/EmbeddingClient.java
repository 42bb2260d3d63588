package com.openforge.memoryengine.embedding;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;

/**
 * Embedding client for any OpenAI-compatible /embeddings endpoint.
 *
 * Raw {@link HttpClient} + Jackson; no vendor SDK. The response is validated
 * here (non-empty, declared length) so a misconfigured model never gets its
 * vectors into a collection built for another dimensionality.
 */
@Slf4j
@Component
@EnableConfigurationProperties(EmbeddingProperties.class)
public class EmbeddingClient implements EmbeddingPort {

    private final HttpClient          httpClient;
    private final ObjectMapper        objectMapper;
    private final EmbeddingProperties props;

    public EmbeddingClient(HttpClient httpClient,
                           ObjectMapper objectMapper,
                           EmbeddingProperties props) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.props        = props;
    }

    @Override
    public int dimensions() {
        return props.dimensions();
    }

    @Override
    public float[] embed(String text) {
        if (text == null || text.isBlank()) {
            throw new EmbeddingException("Cannot embed blank text");
        }
        if (props.baseUrl() == null || props.baseUrl().isBlank()) {
            throw new EmbeddingException("Embedding endpoint is not configured (memory.embedding.base-url)");
        }

        String input = text.length() > props.maxInputChars() ? text.substring(0, props.maxInputChars()) : text;
        String body  = serialize(EmbeddingRequest.forText(input, props.model(), props.dimensions()));

        log.debug("[Embed] → POST /embeddings model={} input-length={}", props.model(), input.length());

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(props.baseUrl() + "/embeddings"))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + props.apiKey())
                .timeout(Duration.ofSeconds(props.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingException("Interrupted while calling embedding API", e);
        } catch (IOException e) {
            throw new EmbeddingException("Network error calling embedding API", e);
        }

        return parseResponse(response);
    }

    private float[] parseResponse(HttpResponse<String> response) {
        int    status = response.statusCode();
        String body   = response.body();

        // 429 carries an IOException cause so the retry policy treats it as transient
        if (status == 429) throw new EmbeddingException("Embedding API rate-limited", new IOException("HTTP 429"));
        if (status < 200 || status >= 300)
            throw new EmbeddingException("Embedding API returned HTTP %d: %s".formatted(status, body));

        EmbeddingResponse parsed;
        try {
            parsed = objectMapper.readValue(body, EmbeddingResponse.class);
        } catch (JsonProcessingException e) {
            throw new EmbeddingException("Failed to parse embedding response: " + body, e);
        }

        List<Float> vector = parsed.firstEmbedding();
        if (vector.isEmpty()) {
            throw new EmbeddingException("Embedding response contained no vector");
        }
        if (vector.size() != props.dimensions()) {
            throw new EmbeddingException("Embedding model %s returned %d dimensions, expected %d"
                    .formatted(props.model(), vector.size(), props.dimensions()));
        }

        float[] out = new float[vector.size()];
        for (int i = 0; i < out.length; i++) {
            Float f = vector.get(i);
            if (f == null) throw new EmbeddingException("Embedding response contained a null component");
            out[i] = f;
        }
        log.debug("[Embed] ← vector dim={} tokens={}", out.length, parsed.totalTokens());
        return out;
    }

    private String serialize(Object obj) {
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new EmbeddingException("Failed to serialize embedding request", e);
        }
    }
}
