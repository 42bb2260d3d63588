package com.openforge.memoryengine.embedding;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * memory.embedding.* settings.
 *
 * @param baseUrl        OpenAI-compatible API root, without the trailing /embeddings
 * @param dimensions     declared vector length; every response is checked against it
 * @param maxInputChars  longer texts are truncated before being sent
 */
@ConfigurationProperties(prefix = "memory.embedding")
public record EmbeddingProperties(
        String baseUrl,
        String apiKey,
        @DefaultValue("text-embedding-3-small") String model,
        @DefaultValue("1536") int dimensions,
        @DefaultValue("30") int timeoutSeconds,
        @DefaultValue("8000") int maxInputChars
) {}
