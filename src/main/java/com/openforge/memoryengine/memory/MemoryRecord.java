package com.openforge.memoryengine.memory;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One stored memory.
 *
 * @param id              random UUID assigned at store time
 * @param content         original text, never mutated
 * @param embedding       vector; null in query results unless explicitly requested
 * @param metadata        open metadata; always contains {@code scope} and {@code kind}
 * @param scope           first-class classification, e.g. "pref" or "user:42"
 * @param kind            first-class classification, e.g. "like" or "fact"
 * @param createdAt       assigned at store time
 * @param expiresAt       null when the record never expires
 * @param similarityScore combined relevance score; present only on query results
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MemoryRecord(
        String                     id,
        String                     content,
        float[]                    embedding,
        Map<String, MetadataValue> metadata,
        String                     scope,
        String                     kind,
        Instant                    createdAt,
        Instant                    expiresAt,
        Double                     similarityScore
) {

    public MemoryRecord {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /**
     * Builds a fresh record, mirroring scope and kind into the metadata map.
     */
    public static MemoryRecord create(String id,
                                      String content,
                                      float[] embedding,
                                      Map<String, MetadataValue> metadata,
                                      String scope,
                                      String kind,
                                      Instant createdAt,
                                      Instant expiresAt) {
        Map<String, MetadataValue> merged = new LinkedHashMap<>();
        if (metadata != null) merged.putAll(metadata);
        if (scope != null) merged.put(MetadataKeys.SCOPE, MetadataValue.of(scope));
        if (kind != null)  merged.put(MetadataKeys.KIND, MetadataValue.of(kind));
        return new MemoryRecord(id, content, embedding, merged, scope, kind, createdAt, expiresAt, null);
    }

    public MemoryRecord withScore(double score) {
        return new MemoryRecord(id, content, embedding, metadata, scope, kind, createdAt, expiresAt, score);
    }

    public MemoryRecord withoutEmbedding() {
        if (embedding == null) return this;
        return new MemoryRecord(id, content, null, metadata, scope, kind, createdAt, expiresAt, similarityScore);
    }

    public String text(String key) {
        MetadataValue v = metadata.get(key);
        return v == null ? null : v.asText();
    }

    public List<String> tags() {
        MetadataValue v = metadata.get(MetadataKeys.TAGS);
        return v == null ? List.of() : v.asTextList();
    }

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }
}
