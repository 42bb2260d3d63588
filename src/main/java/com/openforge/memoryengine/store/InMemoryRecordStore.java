package com.openforge.memoryengine.store;

import com.openforge.memoryengine.memory.MemoryRecord;
import com.openforge.memoryengine.memory.MetadataKeys;
import com.openforge.memoryengine.memory.ScopeKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link RecordStore} for development and tests.
 * Enabled with {@code memory.record-store.type=in-memory}; data dies with the JVM.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "memory.record-store.type", havingValue = "in-memory")
public class InMemoryRecordStore implements RecordStore {

    // collection -> memoryId -> record
    private final Map<String, Map<String, MemoryRecord>> collections = new ConcurrentHashMap<>();

    @Override
    public void insert(String collection, MemoryRecord record) {
        partition(collection).put(record.id(), record);
    }

    @Override
    public List<MemoryRecord> fetchByIds(String collection, Collection<String> ids) {
        Map<String, MemoryRecord> p = collections.getOrDefault(collection, Map.of());
        return ids.stream().distinct().map(p::get).filter(Objects::nonNull).toList();
    }

    @Override
    public boolean delete(String collection, String id) {
        Map<String, MemoryRecord> p = collections.get(collection);
        return p != null && p.remove(id) != null;
    }

    @Override
    public List<MemoryRecord> scanRecent(String collection, int limit) {
        return records(collection).stream()
                .sorted(Comparator.comparing(MemoryRecord::createdAt).reversed())
                .limit(Math.max(0, limit))
                .toList();
    }

    @Override
    public long count(String collection) {
        return records(collection).size();
    }

    @Override
    public long countSince(String collection, Instant since) {
        return records(collection).stream().filter(r -> !r.createdAt().isBefore(since)).count();
    }

    @Override
    public Map<ScopeKind, Long> countByScopeAndKind(String collection) {
        Map<ScopeKind, Long> out = new LinkedHashMap<>();
        records(collection).forEach(r -> out.merge(new ScopeKind(r.scope(), r.kind()), 1L, Long::sum));
        return out;
    }

    @Override
    public Map<String, Long> countByUser(String collection) {
        Map<String, Long> out = new LinkedHashMap<>();
        records(collection).forEach(r -> {
            String user = r.text(MetadataKeys.USER_ID);
            out.merge(user == null ? "" : user, 1L, Long::sum);
        });
        return out;
    }

    @Override
    public long countExpired(String collection, Instant now) {
        return records(collection).stream().filter(r -> r.isExpiredAt(now)).count();
    }

    @Override
    public List<String> findExpiredIds(String collection, Instant now) {
        return records(collection).stream().filter(r -> r.isExpiredAt(now)).map(MemoryRecord::id).toList();
    }

    @Override
    public int deleteAll(String collection, Collection<String> ids) {
        Map<String, MemoryRecord> p = collections.get(collection);
        if (p == null) return 0;
        int removed = 0;
        for (String id : ids) {
            if (p.remove(id) != null) removed++;
        }
        return removed;
    }

    @Override
    public Set<String> collections() {
        Set<String> out = new TreeSet<>();
        collections.forEach((name, p) -> {
            if (!p.isEmpty()) out.add(name);
        });
        return out;
    }

    private Map<String, MemoryRecord> partition(String collection) {
        return collections.computeIfAbsent(collection, k -> {
            log.debug("[RecordStore] New in-memory collection {}", k);
            return new ConcurrentHashMap<>();
        });
    }

    private Collection<MemoryRecord> records(String collection) {
        return collections.getOrDefault(collection, Map.of()).values();
    }
}
