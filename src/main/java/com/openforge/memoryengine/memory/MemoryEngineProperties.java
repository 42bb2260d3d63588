package com.openforge.memoryengine.memory;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Tuning knobs of the memory engine.
 *
 * application.yml:
 *
 * memory:
 *   engine:
 *     metric-mode: similarity        # similarity | distance
 *     recency-alpha: 0.05            # per-day decay rate; smaller = slower decay
 *     fallback-scan-window: 200      # records scanned when the vector index is unavailable
 *     default-ttl-hours: 168         # 0 = records never expire
 *     surprise:
 *       enabled: true
 *       threshold: 0.85              # in metric-mode convention
 *       fail-open: true              # store anyway when novelty cannot be checked
 *     cache:
 *       enabled: true
 *       ttl-seconds: 300
 *       max-entries: 10000
 *     timeouts:
 *       embedding-ms: 30000
 *       vector-index-ms: 3000
 *     prune:
 *       enabled: true
 *       interval-minutes: 60
 */
@ConfigurationProperties(prefix = "memory.engine")
public record MemoryEngineProperties(
        @DefaultValue("SIMILARITY") MetricMode metricMode,
        @DefaultValue("0.05")       double     recencyAlpha,
        @DefaultValue("200")        int        fallbackScanWindow,
        @DefaultValue("168")        long       defaultTtlHours,
        @DefaultValue               Surprise   surprise,
        @DefaultValue               Cache      cache,
        @DefaultValue               Timeouts   timeouts,
        @DefaultValue               Prune      prune
) {

    public record Surprise(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("0.85") double  threshold,
            @DefaultValue("true") boolean failOpen
    ) {}

    public record Cache(
            @DefaultValue("true")  boolean enabled,
            @DefaultValue("300")   long    ttlSeconds,
            @DefaultValue("10000") long    maxEntries
    ) {
        public Duration ttl() {
            return Duration.ofSeconds(ttlSeconds);
        }
    }

    public record Timeouts(
            @DefaultValue("30000") long embeddingMs,
            @DefaultValue("3000")  long vectorIndexMs
    ) {}

    public record Prune(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("60")   long    intervalMinutes
    ) {}

    /** Defaults for programmatic construction (tests, embedded use). */
    public static MemoryEngineProperties defaults() {
        return new MemoryEngineProperties(
                MetricMode.SIMILARITY, 0.05, 200, 168,
                new Surprise(true, 0.85, true),
                new Cache(true, 300, 10_000),
                new Timeouts(30_000, 3_000),
                new Prune(true, 60));
    }

    public Duration defaultTtl() {
        return defaultTtlHours > 0 ? Duration.ofHours(defaultTtlHours) : null;
    }
}
