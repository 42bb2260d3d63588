package com.openforge.memoryengine.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.openforge.memoryengine.memory.MemoryEngineException;
import com.openforge.memoryengine.memory.MemoryQuery;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Cache key layout:
 *
 *   memory_query:{tenant}:{sha256 of the canonical query JSON}
 *   memory:{tenant}:{record id}
 *
 * The canonical JSON sorts map keys and tags, so two queries that differ only
 * in iteration order share a key.
 */
public final class QueryCacheKeys {

    private static final ObjectMapper CANONICAL = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private QueryCacheKeys() {}

    public static String queryPrefix(String tenant) {
        return "memory_query:" + tenant + ":";
    }

    public static String queryKey(String tenant, MemoryQuery query) {
        return queryPrefix(tenant) + sha256(canonicalJson(query));
    }

    public static String recordKey(String tenant, String id) {
        return "memory:" + tenant + ":" + id;
    }

    static String canonicalJson(MemoryQuery query) {
        Map<String, Object> canonical = new TreeMap<>();
        canonical.put("text", query.text());
        canonical.put("user_id", query.userId());
        canonical.put("session_id", query.sessionId());
        canonical.put("conversation_id", query.conversationId());
        canonical.put("tags", new TreeSet<>(query.tags()));
        canonical.put("scope", query.scope());
        canonical.put("kind", query.kind());
        canonical.put("metadata_filter", new TreeMap<>(query.metadataFilter()));
        if (query.timeRange() != null) {
            canonical.put("time_start", query.timeRange().start() == null ? null : query.timeRange().start().toString());
            canonical.put("time_end", query.timeRange().end() == null ? null : query.timeRange().end().toString());
        }
        canonical.put("top_k", query.topK());
        canonical.put("similarity_threshold", query.similarityThreshold());
        canonical.put("include_embeddings", query.includeEmbeddings());
        try {
            return CANONICAL.writeValueAsString(canonical);
        } catch (JsonProcessingException e) {
            throw new MemoryEngineException("Failed to serialize query for cache key: " + e.getMessage(), e);
        }
    }

    private static String sha256(String s) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(s.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
