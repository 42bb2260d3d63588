package com.openforge.memoryengine.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Short-lived key/value cache for serialized query results and single records.
 *
 * Optional collaborator. Implementations may throw on any call; the engine
 * treats every failure as a miss (reads) or a no-op (writes).
 */
public interface QueryCache {

    Optional<String> get(String key);

    void put(String key, String value, Duration ttl);

    /**
     * Removes one key, or every key starting with {@code keyOrPrefix} when it
     * ends with {@code ':'}.
     */
    void invalidate(String keyOrPrefix);
}
