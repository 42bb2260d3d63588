package com.openforge.memoryengine.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.memoryengine.domain.MemoryEntry;
import com.openforge.memoryengine.memory.MemoryRecord;
import com.openforge.memoryengine.memory.MetadataKeys;
import com.openforge.memoryengine.memory.MetadataValue;
import com.openforge.memoryengine.memory.ScopeKind;
import com.openforge.memoryengine.repository.MemoryEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * {@link RecordStore} on Spring Data JPA (MySQL in production).
 *
 * Any {@link DataAccessException} is rethrown as {@link RecordStoreException}
 * so the engine can treat every storage failure the same way.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "memory.record-store.type", havingValue = "jpa", matchIfMissing = true)
public class JpaRecordStore implements RecordStore {

    private static final TypeReference<Map<String, MetadataValue>> METADATA_TYPE = new TypeReference<>() {};

    private final MemoryEntryRepository repository;
    private final ObjectMapper          objectMapper;

    @Override
    @Transactional
    public void insert(String collection, MemoryRecord record) {
        guarded("insert", () -> repository.save(toEntity(collection, record)));
        log.debug("[RecordStore] Inserted {} into {}", record.id(), collection);
    }

    @Override
    @Transactional(readOnly = true)
    public List<MemoryRecord> fetchByIds(String collection, Collection<String> ids) {
        if (ids.isEmpty()) return List.of();
        return guarded("fetchByIds", () -> repository.findByCollectionNameAndMemoryIdIn(collection, ids)
                .stream().map(this::toRecord).toList());
    }

    @Override
    @Transactional
    public boolean delete(String collection, String id) {
        return guarded("delete", () -> repository.deleteByCollectionNameAndMemoryIdIn(collection, List.of(id))) > 0;
    }

    @Override
    @Transactional(readOnly = true)
    public List<MemoryRecord> scanRecent(String collection, int limit) {
        if (limit <= 0) return List.of();
        return guarded("scanRecent", () -> repository
                .findByCollectionNameOrderByCreatedAtMsDesc(collection, PageRequest.of(0, limit))
                .stream().map(this::toRecord).toList());
    }

    @Override
    public long count(String collection) {
        return guarded("count", () -> repository.countByCollectionName(collection));
    }

    @Override
    public long countSince(String collection, Instant since) {
        return guarded("countSince", () -> repository
                .countByCollectionNameAndCreatedAtMsGreaterThanEqual(collection, since.toEpochMilli()));
    }

    @Override
    public Map<ScopeKind, Long> countByScopeAndKind(String collection) {
        Map<ScopeKind, Long> out = new LinkedHashMap<>();
        for (Object[] row : guarded("countByScopeAndKind", () -> repository.countGroupedByScopeAndKind(collection))) {
            out.put(new ScopeKind((String) row[0], (String) row[1]), ((Number) row[2]).longValue());
        }
        return out;
    }

    @Override
    public Map<String, Long> countByUser(String collection) {
        Map<String, Long> out = new LinkedHashMap<>();
        for (Object[] row : guarded("countByUser", () -> repository.countGroupedByUser(collection))) {
            String user = row[0] == null ? "" : (String) row[0];
            out.merge(user, ((Number) row[1]).longValue(), Long::sum);
        }
        return out;
    }

    @Override
    public long countExpired(String collection, Instant now) {
        return guarded("countExpired", () -> repository
                .countByCollectionNameAndExpiresAtMsLessThanEqual(collection, now.toEpochMilli()));
    }

    @Override
    public List<String> findExpiredIds(String collection, Instant now) {
        return guarded("findExpiredIds", () -> repository.findExpiredMemoryIds(collection, now.toEpochMilli()));
    }

    @Override
    @Transactional
    public int deleteAll(String collection, Collection<String> ids) {
        if (ids.isEmpty()) return 0;
        return guarded("deleteAll", () -> repository.deleteByCollectionNameAndMemoryIdIn(collection, ids));
    }

    @Override
    public Set<String> collections() {
        return new LinkedHashSet<>(guarded("collections", repository::findDistinctCollectionNames));
    }

    // ── Mapping ──────────────────────────────────────────────────────────────

    private MemoryEntry toEntity(String collection, MemoryRecord r) {
        return MemoryEntry.builder()
                .collectionName(collection)
                .memoryId(r.id())
                .content(r.content())
                .scope(r.scope())
                .kind(r.kind())
                .userId(r.text(MetadataKeys.USER_ID))
                .sessionId(r.text(MetadataKeys.SESSION_ID))
                .conversationId(r.text(MetadataKeys.CONVERSATION_ID))
                .metadataJson(writeMetadata(r.metadata()))
                .embedding(toBytes(r.embedding()))
                .createdAtMs(r.createdAt().toEpochMilli())
                .expiresAtMs(r.expiresAt() == null ? null : r.expiresAt().toEpochMilli())
                .build();
    }

    private MemoryRecord toRecord(MemoryEntry e) {
        return new MemoryRecord(
                e.getMemoryId(),
                e.getContent(),
                toFloats(e.getEmbedding()),
                readMetadata(e.getMetadataJson()),
                e.getScope(),
                e.getKind(),
                Instant.ofEpochMilli(e.getCreatedAtMs()),
                e.getExpiresAtMs() == null ? null : Instant.ofEpochMilli(e.getExpiresAtMs()),
                null);
    }

    private String writeMetadata(Map<String, MetadataValue> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new RecordStoreException("Failed to serialize memory metadata", e);
        }
    }

    private Map<String, MetadataValue> readMetadata(String json) {
        if (json == null || json.isBlank()) return Map.of();
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            throw new RecordStoreException("Corrupt metadata JSON in memory_entries", e);
        }
    }

    static byte[] toBytes(float[] vector) {
        if (vector == null) return null;
        ByteBuffer buf = ByteBuffer.allocate(vector.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (float f : vector) buf.putFloat(f);
        return buf.array();
    }

    static float[] toFloats(byte[] bytes) {
        if (bytes == null) return null;
        ByteBuffer buf = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        float[] out = new float[bytes.length / Float.BYTES];
        for (int i = 0; i < out.length; i++) out[i] = buf.getFloat();
        return out;
    }

    private static <T> T guarded(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            throw new RecordStoreException("Record store %s failed: %s".formatted(operation, e.getMessage()), e);
        }
    }
}
