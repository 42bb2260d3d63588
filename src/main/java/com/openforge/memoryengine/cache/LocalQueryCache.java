package com.openforge.memoryengine.cache;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * In-process {@link QueryCache} on top of a size-bounded Guava cache.
 *
 * Guava only supports one expiry per cache, so each entry carries its own
 * deadline and is dropped lazily when read after it.
 */
@Slf4j
public class LocalQueryCache implements QueryCache {

    private record Entry(String value, Instant expiresAt) {}

    private final Cache<String, Entry> cache;
    private final Clock                clock;

    public LocalQueryCache(long maxEntries, Clock clock) {
        this.cache = CacheBuilder.newBuilder()
                .maximumSize(maxEntries)
                .build();
        this.clock = clock;
    }

    @Override
    public Optional<String> get(String key) {
        Entry entry = cache.getIfPresent(key);
        if (entry == null) return Optional.empty();
        if (!entry.expiresAt().isAfter(clock.instant())) {
            cache.invalidate(key);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        if (ttl.isZero() || ttl.isNegative()) return;
        cache.put(key, new Entry(value, clock.instant().plus(ttl)));
    }

    @Override
    public void invalidate(String keyOrPrefix) {
        if (keyOrPrefix.endsWith(":")) {
            cache.asMap().keySet().removeIf(k -> k.startsWith(keyOrPrefix));
            log.debug("[Cache] Invalidated prefix {}", keyOrPrefix);
        } else {
            cache.invalidate(keyOrPrefix);
        }
    }

    public long size() {
        return cache.size();
    }
}
