package com.openforge.memoryengine.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.memoryengine.config.AppConfig;
import com.openforge.memoryengine.memory.MemoryRecord;
import com.openforge.memoryengine.memory.MetadataKeys;
import com.openforge.memoryengine.memory.MetadataValue;
import com.openforge.memoryengine.memory.ScopeKind;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@Import({JpaRecordStore.class, JpaRecordStoreTest.JacksonConfig.class})
class JpaRecordStoreTest {

    private static final String  COLLECTION = "tenant_acme_memories";
    private static final Instant T0         = Instant.parse("2026-02-01T10:00:00Z");

    @TestConfiguration
    static class JacksonConfig {
        @Bean
        ObjectMapper objectMapper() {
            return new AppConfig().objectMapper();
        }
    }

    @Autowired
    private JpaRecordStore store;

    private static MemoryRecord record(String id, String user, Instant createdAt, Instant expiresAt) {
        Map<String, MetadataValue> metadata = user == null
                ? Map.of(MetadataKeys.TAGS, MetadataValue.of(List.of("food")))
                : Map.of(MetadataKeys.USER_ID, MetadataValue.of(user),
                         MetadataKeys.TAGS, MetadataValue.of(List.of("food")));
        return MemoryRecord.create(id, "content " + id, new float[]{0.25f, -1.5f, 3f},
                metadata, "pref", "like", createdAt, expiresAt);
    }

    @Test
    void insertedRecordsComeBackIntact() {
        var original = record("a", "u1", T0, T0.plus(Duration.ofDays(1)));
        store.insert(COLLECTION, original);

        var fetched = store.fetchByIds(COLLECTION, List.of("a", "missing"));

        assertEquals(1, fetched.size());
        var r = fetched.get(0);
        assertEquals("content a", r.content());
        assertArrayEquals(original.embedding(), r.embedding());
        assertEquals(original.metadata(), r.metadata());
        assertEquals(T0, r.createdAt());
        assertEquals(T0.plus(Duration.ofDays(1)), r.expiresAt());
        assertEquals("pref", r.scope());
    }

    @Test
    void collectionsAreIsolated() {
        store.insert(COLLECTION, record("a", "u1", T0, null));
        store.insert("tenant_other_memories", record("b", "u1", T0, null));

        assertEquals(1, store.count(COLLECTION));
        assertTrue(store.fetchByIds(COLLECTION, List.of("b")).isEmpty());
        assertTrue(store.collections().containsAll(List.of(COLLECTION, "tenant_other_memories")));
    }

    @Test
    void scanRecentIsNewestFirst() {
        store.insert(COLLECTION, record("old", null, T0, null));
        store.insert(COLLECTION, record("new", null, T0.plusSeconds(60), null));
        store.insert(COLLECTION, record("mid", null, T0.plusSeconds(30), null));

        var ids = store.scanRecent(COLLECTION, 2).stream().map(MemoryRecord::id).toList();

        assertEquals(List.of("new", "mid"), ids);
        assertTrue(store.scanRecent(COLLECTION, 0).isEmpty());
    }

    @Test
    void aggregateCounts() {
        store.insert(COLLECTION, record("a", "u1", T0, null));
        store.insert(COLLECTION, record("b", "u1", T0.minus(Duration.ofDays(3)), null));
        store.insert(COLLECTION, record("c", null, T0, T0.minusSeconds(1)));

        assertEquals(3, store.count(COLLECTION));
        assertEquals(2, store.countSince(COLLECTION, T0.minus(Duration.ofHours(24))));
        assertEquals(Map.of(new ScopeKind("pref", "like"), 3L), store.countByScopeAndKind(COLLECTION));
        assertEquals(Map.of("u1", 2L, "", 1L), store.countByUser(COLLECTION));
        assertEquals(1, store.countExpired(COLLECTION, T0));
        assertEquals(List.of("c"), store.findExpiredIds(COLLECTION, T0));
    }

    @Test
    void deletes() {
        store.insert(COLLECTION, record("a", null, T0, null));
        store.insert(COLLECTION, record("b", null, T0, null));
        store.insert(COLLECTION, record("c", null, T0, null));

        assertTrue(store.delete(COLLECTION, "a"));
        assertFalse(store.delete(COLLECTION, "a"));
        assertEquals(2, store.deleteAll(COLLECTION, List.of("b", "c", "zzz")));
        assertEquals(0, store.deleteAll(COLLECTION, List.of()));
        assertEquals(0, store.count(COLLECTION));
    }

    @Test
    void embeddingBytesAreLittleEndianFloats() {
        byte[] bytes = JpaRecordStore.toBytes(new float[]{1f});
        assertArrayEquals(new byte[]{0, 0, (byte) 0x80, 0x3f}, bytes);
        assertNull(JpaRecordStore.toBytes(null));
        assertArrayEquals(new float[]{1f}, JpaRecordStore.toFloats(bytes));
    }
}
