package com.openforge.memoryengine.store;

import com.openforge.memoryengine.memory.MemoryRecord;
import com.openforge.memoryengine.memory.ScopeKind;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Authoritative, durable storage of memory records, partitioned by collection
 * (one collection per tenant).
 *
 * Every method may throw {@link RecordStoreException}; the engine propagates it.
 */
public interface RecordStore {

    void insert(String collection, MemoryRecord record);

    /** Records for the given ids; order is not guaranteed and unknown ids are skipped. */
    List<MemoryRecord> fetchByIds(String collection, Collection<String> ids);

    /** @return false when no record with that id existed */
    boolean delete(String collection, String id);

    /** Up to {@code limit} records, newest {@code createdAt} first. */
    List<MemoryRecord> scanRecent(String collection, int limit);

    long count(String collection);

    long countSince(String collection, Instant since);

    Map<ScopeKind, Long> countByScopeAndKind(String collection);

    /** Keyed by user_id; records without one are counted under "". */
    Map<String, Long> countByUser(String collection);

    long countExpired(String collection, Instant now);

    List<String> findExpiredIds(String collection, Instant now);

    /** @return number of records actually removed */
    int deleteAll(String collection, Collection<String> ids);

    /** All collections that currently hold at least one record. */
    Set<String> collections();
}
