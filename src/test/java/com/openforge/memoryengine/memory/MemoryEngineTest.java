package com.openforge.memoryengine.memory;

import com.openforge.memoryengine.cache.LocalQueryCache;
import com.openforge.memoryengine.cache.QueryCache;
import com.openforge.memoryengine.embedding.EmbeddingException;
import com.openforge.memoryengine.store.RecordStore;
import com.openforge.memoryengine.store.RecordStoreException;
import com.openforge.memoryengine.support.EngineFixture;
import com.openforge.memoryengine.support.FailingVectorIndex;
import com.openforge.memoryengine.support.FakeEmbeddingPort;
import com.openforge.memoryengine.support.InMemoryVectorIndex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static com.openforge.memoryengine.support.EngineFixture.DIM;
import static com.openforge.memoryengine.support.EngineFixture.T0;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MemoryEngineTest {

    private static final String TENANT = "acme";

    private EngineFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
    }

    /** [1, slope, 0, ...]: cosine to the x axis is 1 / sqrt(1 + slope^2). */
    private static float[] tilted(float slope) {
        float[] v = new float[DIM];
        v[0] = 1f;
        v[1] = slope;
        return v;
    }

    private static MemoryQuery query(String text, int topK, double threshold) {
        return MemoryQuery.builder().text(text).topK(topK).similarityThreshold(threshold).build();
    }

    private static Map<String, MetadataValue> tags(String... tags) {
        return Map.of(MetadataKeys.TAGS, MetadataValue.of(List.of(tags)));
    }

    private static Set<String> ids(List<MemoryRecord> records) {
        return records.stream().map(MemoryRecord::id).collect(Collectors.toSet());
    }

    // ── Surprise filter ──────────────────────────────────────────────────────

    @Test
    void duplicateIsRejectedAndOriginalIsRecalled() {
        fixture.withSurprise(true, 0.95, true);
        fixture.embedding.register("I like pizza", tilted(0f)).register("pizza", tilted(0.2f));
        var engine = fixture.build();

        Optional<String> first  = engine.store(TENANT, "I like pizza", "pref", "like", Map.of());
        Optional<String> second = engine.store(TENANT, "I like pizza", "pref", "like", Map.of());

        assertTrue(first.isPresent());
        assertTrue(second.isEmpty());
        assertEquals(1, fixture.metrics.snapshot().stored());
        assertEquals(1, fixture.metrics.snapshot().duplicatesSkipped());

        var results = engine.query(TENANT, query("pizza", 5, 0.5));
        assertEquals(1, results.size());
        assertEquals(first.get(), results.get(0).id());

        double rawSimilarity = 1.0 / Math.sqrt(1.0 + (double) 0.2f * 0.2f);
        assertEquals(rawSimilarity, results.get(0).similarityScore(), 1e-9);
    }

    @Test
    void sameContentInAnotherPartitionIsNotADuplicate() {
        fixture.withSurprise(true, 0.95, true);
        var engine = fixture.build();

        assertTrue(engine.store(TENANT, "I like pizza", "pref", "like", Map.of()).isPresent());
        assertTrue(engine.store(TENANT, "I like pizza", "pref", "fact", Map.of()).isPresent());
    }

    @Test
    void missingIndexFailsOpenByDefault() {
        fixture.withoutIndex();
        var engine = fixture.build();

        assertTrue(engine.store(TENANT, "I like pizza", "pref", "like", Map.of()).isPresent());
        assertTrue(engine.store(TENANT, "I like pizza", "pref", "like", Map.of()).isPresent());
        assertEquals(2, engine.stats(TENANT).totalRecords());
    }

    @Test
    void missingIndexRejectsWhenFailClosed() {
        fixture.withoutIndex().withSurprise(true, 0.85, false);
        var engine = fixture.build();

        assertTrue(engine.store(TENANT, "I like pizza", "pref", "like", Map.of()).isEmpty());
        assertEquals(0, engine.stats(TENANT).totalRecords());
    }

    // ── Query paths ──────────────────────────────────────────────────────────

    @Test
    void fallbackScanFindsTheSameRecordsAsTheIndex() {
        fixture.withSurprise(false, 0.85, true);
        fixture.embedding.register("query", tilted(0f));
        for (int i = 0; i < 6; i++) {
            fixture.embedding.register("record " + i, tilted(i * 0.3f));
        }
        fixture.embedding.register("unrelated", FakeEmbeddingPort.axis(DIM, 5));
        var indexed = fixture.build();
        for (int i = 0; i < 6; i++) indexed.store(TENANT, "record " + i, "s", "k", Map.of());
        indexed.store(TENANT, "unrelated", "s", "k", Map.of());

        var scanOnly = new EngineFixture();
        scanOnly.recordStore = fixture.recordStore;
        scanOnly.embedding   = fixture.embedding;
        scanOnly.withoutIndex();
        var fallback = scanOnly.build();

        var viaIndex = indexed.query(TENANT, query("query", 10, 0.7));
        var viaScan  = fallback.query(TENANT, query("query", 10, 0.7));

        assertEquals(4, viaIndex.size());
        assertEquals(ids(viaIndex), ids(viaScan));
        assertEquals(1, scanOnly.metrics.snapshot().fallbackSearches());
        assertEquals(0, fixture.metrics.snapshot().fallbackSearches());
    }

    @Test
    void alwaysFailingIndexDegradesToTheScan() {
        var failing = new FailingVectorIndex();
        fixture.vectorIndex = failing;
        fixture.embedding.register("note", tilted(0f));
        var engine = fixture.build();

        Optional<String> id = engine.store(TENANT, "note", "s", "k", Map.of());
        assertTrue(id.isPresent());
        assertEquals(1, fixture.recordStore.count(TenantCollections.collectionName(TENANT)));

        var results = engine.query(TENANT, query("note", 5, 0.7));
        assertEquals(List.of(id.get()), results.stream().map(MemoryRecord::id).toList());
        assertEquals(1, fixture.metrics.snapshot().fallbackSearches());
        assertTrue(failing.calls.get() >= 3);
    }

    @Test
    void moreRecentRecordRanksFirstForEqualSimilarity() {
        fixture.withSurprise(false, 0.85, true);
        var engine = fixture.build();

        fixture.clock.set(T0.minus(Duration.ofDays(30)));
        String old = engine.store(TENANT, "standup at nine", "s", "k", Map.of(), null).orElseThrow();
        fixture.clock.set(T0);
        String fresh = engine.store(TENANT, "standup at nine", "s", "k", Map.of(), null).orElseThrow();

        var results = engine.query(TENANT, query("standup at nine", 5, 0.5));

        assertEquals(List.of(fresh, old), results.stream().map(MemoryRecord::id).toList());
        assertEquals(1.0, results.get(0).similarityScore(), 1e-6);
        assertEquals(Math.exp(-0.05 * 30), results.get(1).similarityScore(), 1e-6);
    }

    @Test
    void thresholdIsInclusiveOnTheIndexPath() {
        fixture.embedding.register("exact", tilted(0f));
        var engine = fixture.build();
        String id = engine.store(TENANT, "exact", "s", "k", Map.of()).orElseThrow();

        var results = engine.query(TENANT, query("exact", 5, 1.0));

        assertEquals(List.of(id), results.stream().map(MemoryRecord::id).toList());
    }

    @Test
    void thresholdIsInclusiveOnTheScanPath() {
        fixture.withoutIndex();
        fixture.embedding.register("stored", tilted(0.5f)).register("needle", tilted(0f));
        var engine = fixture.build();
        String id = engine.store(TENANT, "stored", "s", "k", Map.of()).orElseThrow();

        double exact = FallbackSimilarityScanner.cosine(tilted(0f), tilted(0.5f));
        assertEquals(List.of(id), engine.query(TENANT, query("needle", 5, exact))
                .stream().map(MemoryRecord::id).toList());
        assertTrue(engine.query(TENANT, query("needle", 5, Math.nextUp(exact))).isEmpty());
    }

    @Test
    void everyRequiredTagMustBePresent() {
        fixture.withSurprise(false, 0.85, true);
        var engine = fixture.build();
        String both = engine.store(TENANT, "release notes", "s", "k", tags("a", "b")).orElseThrow();
        engine.store(TENANT, "release notes", "s", "k", tags("a"));
        engine.store(TENANT, "release notes", "s", "k", tags("b", "c"));

        var q = MemoryQuery.builder().text("release notes").tags(Set.of("a", "b")).build();
        assertEquals(Set.of(both), ids(engine.query(TENANT, q)));

        var scanOnly = new EngineFixture();
        scanOnly.recordStore = fixture.recordStore;
        scanOnly.withoutIndex();
        assertEquals(Set.of(both), ids(scanOnly.build().query(TENANT, q)));
    }

    @Test
    void metadataAndIdentityFiltersAreApplied() {
        fixture.withSurprise(false, 0.85, true);
        var engine = fixture.build();
        String alice = engine.store(TENANT, "likes tea", "pref", "like",
                Map.of(MetadataKeys.USER_ID, MetadataValue.of("alice"),
                       "source", MetadataValue.of("chat"))).orElseThrow();
        engine.store(TENANT, "likes tea", "pref", "like",
                Map.of(MetadataKeys.USER_ID, MetadataValue.of("bob"),
                       "source", MetadataValue.of("chat")));
        engine.store(TENANT, "likes tea", "pref", "like",
                Map.of(MetadataKeys.USER_ID, MetadataValue.of("alice"),
                       "source", MetadataValue.of("import")));

        var q = MemoryQuery.builder()
                .text("likes tea")
                .userId("alice")
                .metadataFilter(Map.of("source", MetadataValue.of("chat")))
                .build();

        assertEquals(Set.of(alice), ids(engine.query(TENANT, q)));
    }

    @Test
    void timeRangeIsInclusive() {
        fixture.withSurprise(false, 0.85, true);
        var engine = fixture.build();
        fixture.clock.set(T0.minus(Duration.ofDays(3)));
        engine.store(TENANT, "daily log", "s", "k", Map.of(), null);
        fixture.clock.set(T0.minus(Duration.ofDays(1)));
        String inRange = engine.store(TENANT, "daily log", "s", "k", Map.of(), null).orElseThrow();
        fixture.clock.set(T0);

        var q = MemoryQuery.builder()
                .text("daily log")
                .timeRange(new TimeRange(T0.minus(Duration.ofDays(1)), T0))
                .build();

        assertEquals(Set.of(inRange), ids(engine.query(TENANT, q)));
    }

    @Test
    void neverReturnsMoreThanTopK() {
        fixture.withSurprise(false, 0.85, true);
        var engine = fixture.build();
        for (int i = 0; i < 10; i++) engine.store(TENANT, "same words", "s", "k", Map.of());

        assertEquals(3, engine.query(TENANT, query("same words", 3, 0.5)).size());

        var scanOnly = new EngineFixture();
        scanOnly.recordStore = fixture.recordStore;
        scanOnly.withoutIndex();
        assertEquals(3, scanOnly.build().query(TENANT, query("same words", 3, 0.5)).size());
    }

    @Test
    void noCandidatesGivesEmptyList() {
        var engine = fixture.build();
        assertTrue(engine.query(TENANT, MemoryQuery.of("anything")).isEmpty());
    }

    @Test
    void tenantsAreIsolated() {
        var engine = fixture.build();
        engine.store("tenant-a", "shared words", "s", "k", Map.of());

        assertTrue(engine.query("tenant-b", query("shared words", 5, 0.5)).isEmpty());
        assertEquals(1, engine.query("tenant-a", query("shared words", 5, 0.5)).size());
    }

    @Test
    void tenantsThatSanitizeAlikeStayIsolated() {
        fixture.withSurprise(false, 0.85, true);
        var engine = fixture.build();
        String id = engine.store("acme-1", "secret plan", "s", "k", Map.of()).orElseThrow();

        assertTrue(engine.query("acme_1", query("secret plan", 5, 0.5)).isEmpty());
        assertEquals(0, engine.stats("acme.1").totalRecords());
        assertFalse(engine.delete("acme_1", id));
        assertTrue(engine.find("acme_1", id).isEmpty());
        assertEquals(1, engine.query("acme-1", query("secret plan", 5, 0.5)).size());
    }

    @Test
    void oversizedIndexedFieldsAreRefusedBeforeEmbedding() {
        var engine = fixture.build();
        var longUser = Map.of(MetadataKeys.USER_ID, MetadataValue.of("u".repeat(FieldLimits.MAX_ID_LENGTH + 1)));

        assertThrows(InvalidQueryException.class, () -> engine.store(TENANT, "hello", "s", "k", longUser));
        assertEquals(0, fixture.embedding.calls());
        assertEquals(0, fixture.recordStore.count(TenantCollections.collectionName(TENANT)));

        var atLimit = Map.of(MetadataKeys.USER_ID, MetadataValue.of("u".repeat(FieldLimits.MAX_ID_LENGTH)));
        assertTrue(engine.store(TENANT, "hello", "s", "k", atLimit).isPresent());
    }

    @Test
    void embeddingsAreStrippedUnlessRequested() {
        var engine = fixture.build();
        engine.store(TENANT, "vector please", "s", "k", Map.of());

        var without = engine.query(TENANT, query("vector please", 5, 0.5));
        var with    = engine.query(TENANT, query("vector please", 5, 0.5).toBuilder().includeEmbeddings(true).build());

        assertNull(without.get(0).embedding());
        assertEquals(DIM, with.get(0).embedding().length);
    }

    @Test
    void distanceModeThresholdsAreConvertedOnce() {
        fixture.withMetricMode(MetricMode.DISTANCE).withSurprise(false, 0.5, true);
        fixture.vectorIndex = new InMemoryVectorIndex(MetricMode.DISTANCE);
        fixture.embedding.register("q", tilted(0f))
                .register("near", tilted(0f))
                .register("close", tilted(0.6f))
                .register("far", tilted(1.5f));
        var engine = fixture.build();
        String near  = engine.store(TENANT, "near", "s", "k", Map.of()).orElseThrow();
        String close = engine.store(TENANT, "close", "s", "k", Map.of()).orElseThrow();
        engine.store(TENANT, "far", "s", "k", Map.of());

        // distance 0.5 on unit vectors is cosine 0.75
        var results = engine.query(TENANT, query("q", 5, 0.5));

        assertEquals(List.of(near, close), results.stream().map(MemoryRecord::id).toList());
        assertEquals(1.0, results.get(0).similarityScore(), 1e-6);
    }

    // ── Validation ───────────────────────────────────────────────────────────

    @Test
    void rejectsInvalidQueries() {
        var engine = fixture.build();

        assertThrows(InvalidQueryException.class, () -> engine.query(TENANT, query("x", 0, 0.5)));
        assertThrows(InvalidQueryException.class, () -> engine.query(TENANT, query("x", -1, 0.5)));
        assertThrows(InvalidQueryException.class, () -> engine.query(TENANT, query("x", 5, 1.01)));
        assertThrows(InvalidQueryException.class, () -> engine.query(TENANT, query("x", 5, -1.5)));
        assertThrows(InvalidQueryException.class, () -> engine.query(TENANT, query(" ", 5, 0.5)));
        assertThrows(InvalidQueryException.class, () -> engine.query(" ", query("x", 5, 0.5)));
        assertEquals(0, fixture.embedding.calls());
    }

    @Test
    void distanceModeAcceptsItsOwnRange() {
        fixture.withMetricMode(MetricMode.DISTANCE);
        var engine = fixture.build();

        assertDoesNotThrow(() -> engine.query(TENANT, query("x", 5, 3.0)));
        assertThrows(InvalidQueryException.class, () -> engine.query(TENANT, query("x", 5, 4.5)));
        assertThrows(InvalidQueryException.class, () -> engine.query(TENANT, query("x", 5, -0.1)));
    }

    // ── Failures ─────────────────────────────────────────────────────────────

    @Test
    void embeddingFailureIsFatal() {
        fixture.embedding.setFailing(true);
        var engine = fixture.build();

        assertThrows(EmbeddingException.class, () -> engine.store(TENANT, "x", "s", "k", Map.of()));
        assertThrows(EmbeddingException.class, () -> engine.query(TENANT, MemoryQuery.of("x")));
    }

    @Test
    void wrongDimensionalityIsRejected() {
        fixture.embedding.register("short", new float[]{1f, 2f});
        fixture.embedding.register("empty", new float[0]);
        var engine = fixture.build();

        assertThrows(EmbeddingException.class, () -> engine.store(TENANT, "short", "s", "k", Map.of()));
        assertThrows(EmbeddingException.class, () -> engine.store(TENANT, "empty", "s", "k", Map.of()));
        assertEquals(0, engine.stats(TENANT).totalRecords());
    }

    @Test
    void recordStoreFailureIsPropagatedAndNothingIsIndexed() {
        RecordStore failing = mock(RecordStore.class);
        doThrow(new RecordStoreException("disk full", null)).when(failing).insert(any(), any());
        fixture.recordStore = failing;
        var index = new InMemoryVectorIndex();
        fixture.vectorIndex = index;
        var engine = fixture.build();

        assertThrows(RecordStoreException.class, () -> engine.store(TENANT, "x", "s", "k", Map.of()));
        assertEquals(0, index.size(TenantCollections.collectionName(TENANT)));
        assertEquals(0, fixture.metrics.snapshot().stored());
    }

    // ── Cache ────────────────────────────────────────────────────────────────

    @Test
    void repeatedQueryIsServedFromCache() {
        var engine = fixture.build();
        engine.store(TENANT, "cached words", "s", "k", Map.of());
        int callsAfterStore = fixture.embedding.calls();

        var first  = engine.query(TENANT, query("cached words", 5, 0.5));
        var second = engine.query(TENANT, query("cached words", 5, 0.5));

        assertEquals(callsAfterStore + 1, fixture.embedding.calls());
        assertEquals(1, fixture.metrics.snapshot().queriesCached());
        assertEquals(first, second);
        assertEquals(first.get(0).similarityScore(), second.get(0).similarityScore());
        assertEquals(first.get(0).metadata(), second.get(0).metadata());
    }

    @Test
    void storeInvalidatesCachedQueries() {
        fixture.withSurprise(false, 0.85, true);
        var engine = fixture.build();
        engine.store(TENANT, "cached words", "s", "k", Map.of());
        assertEquals(1, engine.query(TENANT, query("cached words", 5, 0.5)).size());

        engine.store(TENANT, "cached words", "s", "k", Map.of());

        assertEquals(2, engine.query(TENANT, query("cached words", 5, 0.5)).size());
        assertEquals(0, fixture.metrics.snapshot().queriesCached());
    }

    @Test
    void brokenCacheNeverFailsACall() {
        var broken = mock(QueryCache.class);
        doThrow(new IllegalStateException("cache down")).when(broken).put(any(), any(), any());
        doThrow(new IllegalStateException("cache down")).when(broken).invalidate(any());
        when(broken.get(any())).thenThrow(new IllegalStateException("cache down"));
        fixture.queryCache = broken;
        var engine = fixture.build();

        String id = engine.store(TENANT, "resilient", "s", "k", Map.of()).orElseThrow();
        assertEquals(List.of(id), engine.query(TENANT, query("resilient", 5, 0.5))
                .stream().map(MemoryRecord::id).toList());
        assertTrue(engine.delete(TENANT, id));
    }

    // ── Async ────────────────────────────────────────────────────────────────

    @Test
    void queryAsyncCompletesWithResults() throws Exception {
        var engine = fixture.build();
        String id = engine.store(TENANT, "async words", "s", "k", Map.of()).orElseThrow();

        CompletableFuture<List<MemoryRecord>> future = engine.queryAsync(TENANT, query("async words", 5, 0.5));

        assertEquals(List.of(id), future.get(5, TimeUnit.SECONDS).stream().map(MemoryRecord::id).toList());
    }

    @Test
    void cancelledQueryLeavesNoCacheEntry() {
        ExecutorService manual = mock(ExecutorService.class);
        fixture.executor = manual;
        var cache = new LocalQueryCache(100, fixture.clock);
        fixture.queryCache = cache;
        var engine = fixture.build();
        engine.store(TENANT, "async words", "s", "k", Map.of());
        long entriesAfterStore = cache.size();
        int callsAfterStore = fixture.embedding.calls();

        var future = engine.queryAsync(TENANT, query("async words", 5, 0.5));
        assertTrue(future.cancel(true));

        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(manual).execute(task.capture());
        task.getValue().run();

        assertTrue(future.isCancelled());
        assertEquals(entriesAfterStore, cache.size());
        assertEquals(callsAfterStore, fixture.embedding.calls());
    }

    @Test
    void queryAsyncReportsFailures() {
        var engine = fixture.build();
        var future = engine.queryAsync(TENANT, query("x", 0, 0.5));

        var ex = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertInstanceOf(InvalidQueryException.class, ex.getCause());
    }

    // ── Delete / find / stats / prune ────────────────────────────────────────

    @Test
    void deleteRemovesEverywhereAndReportsUnknownIds() {
        var index = new InMemoryVectorIndex();
        fixture.vectorIndex = index;
        var engine = fixture.build();
        String id = engine.store(TENANT, "to forget", "s", "k", Map.of()).orElseThrow();
        assertEquals(1, engine.query(TENANT, query("to forget", 5, 0.5)).size());

        assertTrue(engine.delete(TENANT, id));
        assertFalse(engine.delete(TENANT, id));
        assertFalse(engine.delete(TENANT, "no-such-id"));

        assertTrue(engine.query(TENANT, query("to forget", 5, 0.5)).isEmpty());
        assertTrue(engine.find(TENANT, id).isEmpty());
        assertEquals(0, index.size(TenantCollections.collectionName(TENANT)));
        assertEquals(1, fixture.metrics.snapshot().deleted());
    }

    @Test
    void deleteSucceedsWhenIndexIsDown() {
        fixture.vectorIndex = new FailingVectorIndex();
        var engine = fixture.build();
        String id = engine.store(TENANT, "to forget", "s", "k", Map.of()).orElseThrow();

        assertTrue(engine.delete(TENANT, id));
    }

    @Test
    void findReturnsRecordWithoutEmbedding() {
        var engine = fixture.build();
        String id = engine.store(TENANT, "find me", "pref", "fact",
                Map.of("source", MetadataValue.of("chat"))).orElseThrow();

        MemoryRecord found = engine.find(TENANT, id).orElseThrow();

        assertEquals("find me", found.content());
        assertEquals("pref", found.scope());
        assertEquals("fact", found.kind());
        assertEquals(MetadataValue.of("pref"), found.metadata().get(MetadataKeys.SCOPE));
        assertEquals(MetadataValue.of("chat"), found.metadata().get("source"));
        assertNull(found.embedding());
    }

    @Test
    void statsReportsCountsAndBreakdowns() {
        fixture.withSurprise(false, 0.85, true);
        var engine = fixture.build();
        fixture.clock.set(T0.minus(Duration.ofDays(2)));
        engine.store(TENANT, "old", "pref", "like", Map.of(MetadataKeys.USER_ID, MetadataValue.of("alice")));
        fixture.clock.set(T0);
        engine.store(TENANT, "new one", "pref", "like", Map.of(MetadataKeys.USER_ID, MetadataValue.of("alice")));
        engine.store(TENANT, "new two", "pref", "fact", Map.of());

        StatsSnapshot stats = engine.stats(TENANT);

        assertEquals("tenant_acme_822b33ad87c1_memories", stats.collectionName());
        assertEquals(3, stats.totalRecords());
        assertEquals(2, stats.recentRecords24h());
        assertEquals(Map.of(new ScopeKind("pref", "like"), 2L, new ScopeKind("pref", "fact"), 1L),
                stats.byScopeAndKind());
        assertEquals(Map.of("alice", 2L, "", 1L), stats.byUser());
        assertEquals(0, stats.expiredRecords());
        assertEquals(3, stats.metrics().stored());
    }

    @Test
    void expiredRecordsAreHiddenThenPruned() {
        fixture.withSurprise(false, 0.85, true);
        var index = new InMemoryVectorIndex();
        fixture.vectorIndex = index;
        var engine = fixture.build();
        String shortLived = engine.store(TENANT, "temp note", "s", "k", Map.of(), Duration.ofHours(1)).orElseThrow();
        String kept = engine.store(TENANT, "temp note", "s", "k", Map.of()).orElseThrow();

        fixture.clock.advance(Duration.ofHours(2));

        assertEquals(Set.of(kept), ids(engine.query(TENANT, query("temp note", 5, 0.5))));
        assertTrue(engine.find(TENANT, shortLived).isEmpty());
        assertEquals(1, engine.stats(TENANT).expiredRecords());

        assertEquals(1, engine.pruneExpired(TENANT));
        assertEquals(0, engine.pruneExpired(TENANT));
        assertEquals(1, engine.stats(TENANT).totalRecords());
        assertEquals(1, index.size(TenantCollections.collectionName(TENANT)));
        assertEquals(1, fixture.metrics.snapshot().pruned());
    }

    @Test
    void defaultTtlAppliesToPlainStore() {
        fixture.withDefaultTtlHours(24);
        var engine = fixture.build();
        String id = engine.store(TENANT, "expires tomorrow", "s", "k", Map.of()).orElseThrow();

        MemoryRecord stored = fixture.recordStore
                .fetchByIds(TenantCollections.collectionName(TENANT), List.of(id)).get(0);
        assertEquals(T0.plus(Duration.ofHours(24)), stored.expiresAt());
    }

    @Test
    void pruneAllCoversEveryCollection() {
        var engine = fixture.build();
        engine.store("a", "temp", "s", "k", Map.of(), Duration.ofMinutes(5));
        engine.store("b", "temp", "s", "k", Map.of(), Duration.ofMinutes(5));
        fixture.clock.advance(Duration.ofMinutes(10));

        assertEquals(2, engine.pruneAllExpired());
        assertTrue(engine.collections().isEmpty());
    }

    @Test
    void rejectsNonPositiveTtl() {
        var engine = fixture.build();
        assertThrows(InvalidQueryException.class,
                () -> engine.store(TENANT, "x", "s", "k", Map.of(), Duration.ZERO));
    }
}
