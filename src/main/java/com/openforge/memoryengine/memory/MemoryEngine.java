package com.openforge.memoryengine.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.memoryengine.cache.QueryCache;
import com.openforge.memoryengine.cache.QueryCacheKeys;
import com.openforge.memoryengine.embedding.EmbeddingException;
import com.openforge.memoryengine.embedding.EmbeddingPort;
import com.openforge.memoryengine.resilience.CollaboratorGuard;
import com.openforge.memoryengine.store.RecordStore;
import com.openforge.memoryengine.vector.VectorHit;
import com.openforge.memoryengine.vector.VectorIndex;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Hybrid memory engine: the single entry point for storing, recalling and
 * removing tenant memories.
 *
 * Call graph:
 *
 *   store(tenant, content, scope, kind, metadata)
 *     ├─ embeddingGuard → EmbeddingPort.embed            (fatal on failure)
 *     ├─ SurpriseFilter.isNovel                          (duplicate → Optional.empty)
 *     ├─ RecordStore.insert                              (fatal on failure)
 *     └─ VectorIndex.insert, QueryCache invalidate/put   (best effort)
 *
 *   query(tenant, query)
 *     ├─ QueryCache.get                                  (hit → return)
 *     ├─ embeddingGuard → EmbeddingPort.embed
 *     ├─ vectorIndexGuard → VectorIndex.search           (topK * 2)
 *     │     ↓ absent / error / timeout / open circuit
 *     │   FallbackSimilarityScanner.scan                 (topK * 2)
 *     ├─ RecordStore.fetchByIds                          (fatal on failure)
 *     ├─ MemoryFilter.matches                            (re-applied in memory)
 *     ├─ RecencyWeightedRanker.rank → trim to topK
 *     └─ QueryCache.put                                  (skipped when cancelled)
 *
 * Every score inside the engine is a similarity (higher = closer). Raw index
 * scores and caller thresholds are converted by {@link MetricMode} on entry.
 *
 * The vector index and query cache are optional: both may be null, and every
 * call site checks for presence explicitly.
 */
@Slf4j
@Service
public class MemoryEngine {

    static final int OVER_FETCH_FACTOR = 2;

    private static final Duration RECENT_WINDOW = Duration.ofHours(24);

    private final RecordStore               recordStore;
    private final EmbeddingPort             embeddingPort;
    /** May be null when Milvus is disabled or unreachable. */
    private final VectorIndex               vectorIndex;
    /** May be null when memory.engine.cache.enabled=false. */
    private final QueryCache                queryCache;
    private final SurpriseFilter            surpriseFilter;
    private final FallbackSimilarityScanner fallbackScanner;
    private final RecencyWeightedRanker     ranker;
    private final EngineMetrics             metrics;
    private final MemoryEngineProperties    properties;
    private final ObjectMapper              objectMapper;
    private final CollaboratorGuard         embeddingGuard;
    private final CollaboratorGuard         vectorIndexGuard;
    private final ExecutorService           executor;
    private final Clock                     clock;

    /** Embedding length per collection, pinned by the first vector seen. */
    private final Map<String, Integer> collectionDimensions = new ConcurrentHashMap<>();

    private final JavaType recordListType;

    @Autowired
    public MemoryEngine(RecordStore recordStore,
                        EmbeddingPort embeddingPort,
                        @Nullable VectorIndex vectorIndex,
                        @Nullable QueryCache queryCache,
                        SurpriseFilter surpriseFilter,
                        FallbackSimilarityScanner fallbackScanner,
                        RecencyWeightedRanker ranker,
                        EngineMetrics metrics,
                        MemoryEngineProperties properties,
                        ObjectMapper objectMapper,
                        @Qualifier("embeddingGuard") CollaboratorGuard embeddingGuard,
                        @Qualifier("vectorIndexGuard") CollaboratorGuard vectorIndexGuard,
                        @Qualifier("memoryEngineExecutor") ExecutorService executor,
                        Clock clock) {
        this.recordStore      = recordStore;
        this.embeddingPort    = embeddingPort;
        this.vectorIndex      = vectorIndex;
        this.queryCache       = queryCache;
        this.surpriseFilter   = surpriseFilter;
        this.fallbackScanner  = fallbackScanner;
        this.ranker           = ranker;
        this.metrics          = metrics;
        this.properties       = properties;
        this.objectMapper     = objectMapper;
        this.embeddingGuard   = embeddingGuard;
        this.vectorIndexGuard = vectorIndexGuard;
        this.executor         = executor;
        this.clock            = clock;
        this.recordListType   = objectMapper.getTypeFactory()
                .constructCollectionType(List.class, MemoryRecord.class);

        if (vectorIndex == null) {
            log.warn("[Memory] No vector index available, queries will use the linear-scan fallback.");
        } else if (vectorIndex.metricMode() != properties.metricMode()) {
            log.warn("[Memory] Vector index reports {} scores but memory.engine.metric-mode is {}; " +
                     "thresholds are read in the configured convention.",
                    vectorIndex.metricMode(), properties.metricMode());
        }
    }

    // ── Store ────────────────────────────────────────────────────────────────

    /** Stores with the configured default TTL (memory.engine.default-ttl-hours). */
    public Optional<String> store(String tenant,
                                  String content,
                                  String scope,
                                  String kind,
                                  @Nullable Map<String, MetadataValue> metadata) {
        return store(tenant, content, scope, kind, metadata, properties.defaultTtl());
    }

    /**
     * Embeds and stores one memory unless it is a near-duplicate.
     *
     * @param ttl null to keep the record until it is deleted
     * @return the new id, or empty when the surprise filter rejected the content
     * @throws EmbeddingException when the embedding is unavailable or malformed
     * @throws com.openforge.memoryengine.store.RecordStoreException when the authoritative write fails
     */
    public Optional<String> store(String tenant,
                                  String content,
                                  String scope,
                                  String kind,
                                  @Nullable Map<String, MetadataValue> metadata,
                                  @Nullable Duration ttl) {
        String collection = TenantCollections.collectionName(tenant);
        if (content == null || content.isBlank()) {
            throw new InvalidQueryException("content must not be blank");
        }
        if (ttl != null && (ttl.isZero() || ttl.isNegative())) {
            throw new InvalidQueryException("ttl must be positive, got " + ttl);
        }
        FieldLimits.check(scope, kind, metadata);

        float[] embedding = embed(collection, content);

        if (!surpriseFilter.isNovel(collection, embedding, scope, kind)) {
            metrics.recordDuplicateSkipped();
            log.debug("[Memory] Skipped duplicate in {} ({}/{})", collection, scope, kind);
            return Optional.empty();
        }

        Instant now = clock.instant();
        MemoryRecord record = MemoryRecord.create(
                UUID.randomUUID().toString(), content, embedding, metadata, scope, kind,
                now, ttl == null ? null : now.plus(ttl));

        recordStore.insert(collection, record);
        metrics.recordStored();

        indexBestEffort(collection, record);
        invalidateBestEffort(QueryCacheKeys.queryPrefix(tenant));
        cacheRecordBestEffort(tenant, record);

        log.debug("[Memory] Stored {} in {} ({}/{}, dim={})",
                record.id(), collection, scope, kind, embedding.length);
        return Optional.of(record.id());
    }

    // ── Query ────────────────────────────────────────────────────────────────

    /**
     * Recalls the memories most relevant to {@code query.text()}, best first.
     *
     * @throws InvalidQueryException for a non-positive topK or an out-of-range threshold
     */
    public List<MemoryRecord> query(String tenant, MemoryQuery query) {
        return runQuery(tenant, query, () -> false);
    }

    /**
     * Runs {@link #query} on the engine executor. Cancelling the returned future
     * stops the query at its next checkpoint and skips cache population.
     */
    public CompletableFuture<List<MemoryRecord>> queryAsync(String tenant, MemoryQuery query) {
        AtomicBoolean cancelled = new AtomicBoolean();
        CompletableFuture<List<MemoryRecord>> future = new CompletableFuture<>() {
            @Override
            public boolean cancel(boolean mayInterruptIfRunning) {
                cancelled.set(true);
                return super.cancel(mayInterruptIfRunning);
            }
        };
        executor.execute(() -> {
            if (cancelled.get()) return;
            try {
                future.complete(runQuery(tenant, query, cancelled::get));
            } catch (CancellationException e) {
                log.debug("[Memory] Query for {} cancelled", tenant);
            } catch (Throwable t) {
                future.completeExceptionally(t);
            }
        });
        return future;
    }

    private List<MemoryRecord> runQuery(String tenant, MemoryQuery query, BooleanSupplier cancelled) {
        validate(query);
        String collection = TenantCollections.collectionName(tenant);
        long   startNanos = System.nanoTime();
        metrics.recordQuery();

        String cacheKey = queryCache == null ? null : QueryCacheKeys.queryKey(tenant, query);
        Optional<List<MemoryRecord>> cached = readCachedResult(cacheKey);
        if (cached.isPresent()) {
            metrics.recordCacheHit();
            metrics.recordRetrieved(cached.get().size());
            metrics.recordQueryMillis(elapsedMillis(startNanos));
            log.debug("[Memory] Cache hit for query in {}", collection);
            return cached.get();
        }

        float[] vector = embed(collection, query.text());
        checkpoint(cancelled);

        Instant      now       = clock.instant();
        MemoryFilter filter    = MemoryFilter.fromQuery(query, now);
        double       threshold = properties.metricMode().toSimilarity(query.similarityThreshold());
        int          limit     = query.topK() * OVER_FETCH_FACTOR;

        List<ScoredCandidate> candidates = searchIndex(collection, vector, limit, filter, threshold);
        if (candidates == null) {
            metrics.recordFallbackSearch();
            candidates = fallbackScanner.scan(collection, vector, filter, threshold, limit);
        }
        checkpoint(cancelled);

        List<ScoredCandidate> surviving = candidates.stream()
                .filter(c -> filter.matches(c.record()))
                .toList();

        List<MemoryRecord> results = ranker.rank(surviving, now).stream()
                .limit(query.topK())
                .map(c -> {
                    MemoryRecord scored = c.record().withScore(c.score());
                    return query.includeEmbeddings() ? scored : scored.withoutEmbedding();
                })
                .toList();

        checkpoint(cancelled);
        writeCachedResult(cacheKey, results);

        metrics.recordRetrieved(results.size());
        metrics.recordQueryMillis(elapsedMillis(startNanos));
        log.debug("[Memory] Query in {} returned {} of {} candidate(s)",
                collection, results.size(), candidates.size());
        return results;
    }

    /**
     * @return candidates in index order, or null when the index is absent or failed
     */
    @Nullable
    private List<ScoredCandidate> searchIndex(String collection,
                                              float[] vector,
                                              int limit,
                                              MemoryFilter filter,
                                              double threshold) {
        if (vectorIndex == null) return null;

        List<VectorHit> hits;
        try {
            hits = vectorIndexGuard.call(() -> vectorIndex.search(collection, vector, limit, filter));
        } catch (Exception e) {
            log.warn("[Memory] Vector search in {} failed, falling back to linear scan: {}",
                    collection, e.getMessage());
            return null;
        }

        MetricMode mode = vectorIndex.metricMode();
        Map<String, Double> scoreById = new LinkedHashMap<>();
        for (VectorHit hit : hits) {
            double similarity = mode.toSimilarity(hit.score());
            if (similarity >= threshold) scoreById.putIfAbsent(hit.id(), similarity);
        }
        if (scoreById.isEmpty()) return List.of();

        Map<String, MemoryRecord> byId = recordStore.fetchByIds(collection, scoreById.keySet()).stream()
                .collect(Collectors.toMap(MemoryRecord::id, Function.identity(), (a, b) -> a));

        List<ScoredCandidate> candidates = new ArrayList<>(scoreById.size());
        scoreById.forEach((id, score) -> {
            MemoryRecord record = byId.get(id);
            if (record != null) candidates.add(new ScoredCandidate(record, score));
        });
        return candidates;
    }

    private void validate(MemoryQuery query) {
        if (query == null) throw new InvalidQueryException("query must not be null");
        if (query.text() == null || query.text().isBlank()) {
            throw new InvalidQueryException("query text must not be blank");
        }
        if (query.topK() <= 0) {
            throw new InvalidQueryException("topK must be positive, got " + query.topK());
        }
        MetricMode mode = properties.metricMode();
        if (!mode.isValidThreshold(query.similarityThreshold())) {
            throw new InvalidQueryException("similarityThreshold %s outside [%s, %s] for %s mode"
                    .formatted(query.similarityThreshold(), mode.minThreshold(), mode.maxThreshold(), mode));
        }
        TimeRange range = query.timeRange();
        if (range != null && range.start() != null && range.end() != null && range.start().isAfter(range.end())) {
            throw new InvalidQueryException("timeRange start is after end");
        }
    }

    // ── Lookup / delete ──────────────────────────────────────────────────────

    /**
     * Single record by id, served from the per-record cache when possible.
     * Expired records are reported as absent.
     */
    public Optional<MemoryRecord> find(String tenant, String id) {
        String collection = TenantCollections.collectionName(tenant);
        Instant now = clock.instant();

        Optional<MemoryRecord> cached = readCachedRecord(QueryCacheKeys.recordKey(tenant, id));
        if (cached.isPresent()) {
            return cached.filter(r -> !r.isExpiredAt(now));
        }

        Optional<MemoryRecord> stored = recordStore.fetchByIds(collection, List.of(id)).stream()
                .findFirst()
                .filter(r -> !r.isExpiredAt(now))
                .map(MemoryRecord::withoutEmbedding);
        stored.ifPresent(r -> cacheRecordBestEffort(tenant, r));
        return stored;
    }

    /**
     * @return false when no record with that id existed
     */
    public boolean delete(String tenant, String id) {
        String collection = TenantCollections.collectionName(tenant);

        deleteFromIndexBestEffort(collection, List.of(id));
        boolean existed = recordStore.delete(collection, id);

        invalidateBestEffort(QueryCacheKeys.recordKey(tenant, id));
        invalidateBestEffort(QueryCacheKeys.queryPrefix(tenant));

        if (existed) {
            metrics.recordDeleted();
            log.debug("[Memory] Deleted {} from {}", id, collection);
        }
        return existed;
    }

    /**
     * Removes every record of the tenant whose TTL has passed.
     *
     * @return number of records removed from the record store
     */
    public int pruneExpired(String tenant) {
        return pruneCollection(tenant, TenantCollections.collectionName(tenant));
    }

    /** Prunes every collection the record store knows about. */
    public int pruneAllExpired() {
        int total = 0;
        for (String collection : recordStore.collections()) {
            total += pruneCollection(null, collection);
        }
        return total;
    }

    private int pruneCollection(@Nullable String tenant, String collection) {
        List<String> expired = recordStore.findExpiredIds(collection, clock.instant());
        if (expired.isEmpty()) return 0;

        deleteFromIndexBestEffort(collection, expired);
        int removed = recordStore.deleteAll(collection, expired);

        if (tenant != null) {
            for (String id : expired) invalidateBestEffort(QueryCacheKeys.recordKey(tenant, id));
            invalidateBestEffort(QueryCacheKeys.queryPrefix(tenant));
        } else {
            // Tenant ids are not recoverable from collection names; drop every query result.
            invalidateBestEffort("memory_query:");
        }

        metrics.recordPruned(removed);
        log.info("[Memory] Pruned {} expired record(s) from {}", removed, collection);
        return removed;
    }

    // ── Stats ────────────────────────────────────────────────────────────────

    public StatsSnapshot stats(String tenant) {
        String  collection = TenantCollections.collectionName(tenant);
        Instant now        = clock.instant();
        return new StatsSnapshot(
                collection,
                recordStore.count(collection),
                recordStore.countSince(collection, now.minus(RECENT_WINDOW)),
                recordStore.countByScopeAndKind(collection),
                recordStore.countByUser(collection),
                recordStore.countExpired(collection, now),
                metrics.snapshot());
    }

    /** Collections that currently hold records. */
    public Set<String> collections() {
        return recordStore.collections();
    }

    // ── Embedding ────────────────────────────────────────────────────────────

    private float[] embed(String collection, String text) {
        long startNanos = System.nanoTime();
        float[] vector;
        try {
            vector = embeddingGuard.call(() -> embeddingPort.embed(text));
        } catch (EmbeddingException e) {
            throw e;
        } catch (Exception e) {
            throw new EmbeddingException("Embedding service unavailable: " + e.getMessage(), e);
        }
        metrics.recordEmbeddingMillis(elapsedMillis(startNanos));

        if (vector == null || vector.length == 0) {
            throw new EmbeddingException("Embedding service returned an empty vector");
        }
        int declared = embeddingPort.dimensions();
        if (vector.length != declared) {
            throw new EmbeddingException("Embedding has %d dimensions, port declares %d"
                    .formatted(vector.length, declared));
        }
        for (float f : vector) {
            if (!Float.isFinite(f)) throw new EmbeddingException("Embedding contains a non-finite component");
        }

        Integer pinned = collectionDimensions.putIfAbsent(collection, vector.length);
        if (pinned != null && pinned != vector.length) {
            throw new EmbeddingException("Collection %s holds %d-dimensional embeddings, got %d"
                    .formatted(collection, pinned, vector.length));
        }
        return vector;
    }

    // ── Best-effort collaborators ────────────────────────────────────────────

    private void indexBestEffort(String collection, MemoryRecord record) {
        if (vectorIndex == null) return;
        try {
            vectorIndexGuard.run(() -> vectorIndex.insert(collection, record));
        } catch (Exception e) {
            log.warn("[Memory] Vector index insert of {} into {} failed, record is only reachable " +
                     "through the fallback scan: {}", record.id(), collection, e.getMessage());
        }
    }

    private void deleteFromIndexBestEffort(String collection, Collection<String> ids) {
        if (vectorIndex == null) return;
        try {
            vectorIndexGuard.run(() -> vectorIndex.delete(collection, ids));
        } catch (Exception e) {
            log.warn("[Memory] Vector index delete of {} id(s) in {} failed: {}",
                    ids.size(), collection, e.getMessage());
        }
    }

    private void invalidateBestEffort(String keyOrPrefix) {
        if (queryCache == null) return;
        try {
            queryCache.invalidate(keyOrPrefix);
        } catch (Exception e) {
            log.warn("[Memory] Cache invalidation of {} failed: {}", keyOrPrefix, e.getMessage());
        }
    }

    private void cacheRecordBestEffort(String tenant, MemoryRecord record) {
        if (queryCache == null || !properties.cache().enabled()) return;
        try {
            queryCache.put(QueryCacheKeys.recordKey(tenant, record.id()),
                    objectMapper.writeValueAsString(record.withoutEmbedding()),
                    properties.cache().ttl());
        } catch (Exception e) {
            log.warn("[Memory] Caching record {} failed: {}", record.id(), e.getMessage());
        }
    }

    private Optional<List<MemoryRecord>> readCachedResult(@Nullable String key) {
        if (key == null || !properties.cache().enabled()) return Optional.empty();
        try {
            Optional<String> json = queryCache.get(key);
            if (json.isEmpty()) return Optional.empty();
            return Optional.of(objectMapper.readValue(json.get(), recordListType));
        } catch (Exception e) {
            log.warn("[Memory] Cache read of {} failed, treating as miss: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<MemoryRecord> readCachedRecord(String key) {
        if (queryCache == null || !properties.cache().enabled()) return Optional.empty();
        try {
            Optional<String> json = queryCache.get(key);
            if (json.isEmpty()) return Optional.empty();
            return Optional.of(objectMapper.readValue(json.get(), MemoryRecord.class));
        } catch (Exception e) {
            log.warn("[Memory] Cache read of {} failed, treating as miss: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeCachedResult(@Nullable String key, List<MemoryRecord> results) {
        if (key == null || !properties.cache().enabled()) return;
        try {
            queryCache.put(key, objectMapper.writeValueAsString(results), properties.cache().ttl());
        } catch (JsonProcessingException e) {
            log.warn("[Memory] Could not serialize query result for caching: {}", e.getMessage());
        } catch (Exception e) {
            log.warn("[Memory] Cache write of {} failed: {}", key, e.getMessage());
        }
    }

    private static void checkpoint(BooleanSupplier cancelled) {
        if (cancelled.getAsBoolean()) throw new CancellationException("query cancelled");
    }

    private static double elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}
