package com.openforge.memoryengine.memory;

import lombok.Builder;

import java.util.Map;
import java.util.Set;

/**
 * Parameters of a recall query.
 *
 * topK and similarityThreshold are boxed so the builder can tell "not set"
 * (defaults 10 and 0.7) from an explicit value, which is then validated by
 * the engine. The threshold is expressed in the active metric mode's convention.
 */
@Builder(toBuilder = true)
public record MemoryQuery(
        String                     text,
        String                     userId,
        String                     sessionId,
        String                     conversationId,
        Set<String>                tags,
        String                     scope,
        String                     kind,
        Map<String, MetadataValue> metadataFilter,
        TimeRange                  timeRange,
        Integer                    topK,
        Double                     similarityThreshold,
        boolean                    includeEmbeddings
) {

    public static final int    DEFAULT_TOP_K     = 10;
    public static final double DEFAULT_THRESHOLD = 0.7;

    public MemoryQuery {
        tags           = tags == null ? Set.of() : Set.copyOf(tags);
        metadataFilter = metadataFilter == null ? Map.of() : Map.copyOf(metadataFilter);
        if (topK == null) topK = DEFAULT_TOP_K;
        if (similarityThreshold == null) similarityThreshold = DEFAULT_THRESHOLD;
    }

    public static MemoryQuery of(String text) {
        return MemoryQuery.builder().text(text).build();
    }
}
