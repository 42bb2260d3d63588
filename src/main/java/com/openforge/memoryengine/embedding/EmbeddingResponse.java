package com.openforge.memoryengine.embedding;

import java.util.List;

/**
 * Subset of the /embeddings response the engine reads:
 *
 *   { "data": [ { "index": 0, "embedding": [ ... ] } ], "usage": { "total_tokens": 8 } }
 */
public record EmbeddingResponse(
        List<Item> data,
        Usage      usage
) {

    /** Vector for input 0, matched on {@code index} rather than position; empty when absent. */
    public List<Float> firstEmbedding() {
        if (data == null) return List.of();
        return data.stream()
                .filter(item -> item.index() == 0 && item.embedding() != null)
                .findFirst()
                .map(Item::embedding)
                .orElse(List.of());
    }

    public int totalTokens() {
        return usage == null ? 0 : usage.totalTokens();
    }

    public record Item(int index, List<Float> embedding) {}

    public record Usage(int promptTokens, int totalTokens) {}
}
