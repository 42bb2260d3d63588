package com.openforge.memoryengine.memory;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Engine-wide counters and rolling latencies.
 *
 * Counters are plain {@link AtomicLong}s. Latency averages are exponential
 * moving averages (0.9 old / 0.1 new) stored as double bits and updated with a
 * compare-and-swap loop, so concurrent writers never lose the structure of the
 * average, only (harmlessly) the exact ordering of samples.
 *
 * Every value is also exported as a Micrometer gauge under {@code memory.engine.*}.
 */
@Component
public class EngineMetrics {

    static final double EMA_WEIGHT = 0.1;

    private final AtomicLong stored            = new AtomicLong();
    private final AtomicLong duplicatesSkipped = new AtomicLong();
    private final AtomicLong queriesTotal      = new AtomicLong();
    private final AtomicLong queriesCached     = new AtomicLong();
    private final AtomicLong fallbackSearches  = new AtomicLong();
    private final AtomicLong memoriesRetrieved = new AtomicLong();
    private final AtomicLong deleted           = new AtomicLong();
    private final AtomicLong pruned            = new AtomicLong();

    private final AtomicLong avgEmbeddingMillisBits = new AtomicLong(Double.doubleToLongBits(0.0));
    private final AtomicLong avgQueryMillisBits     = new AtomicLong(Double.doubleToLongBits(0.0));

    public EngineMetrics(MeterRegistry registry) {
        gauge(registry, "memory.engine.stored", stored::get);
        gauge(registry, "memory.engine.duplicates.skipped", duplicatesSkipped::get);
        gauge(registry, "memory.engine.queries", queriesTotal::get);
        gauge(registry, "memory.engine.queries.cached", queriesCached::get);
        gauge(registry, "memory.engine.queries.fallback", fallbackSearches::get);
        gauge(registry, "memory.engine.retrieved", memoriesRetrieved::get);
        gauge(registry, "memory.engine.deleted", deleted::get);
        gauge(registry, "memory.engine.pruned", pruned::get);
        gauge(registry, "memory.engine.embedding.avg.ms", this::avgEmbeddingMillis);
        gauge(registry, "memory.engine.query.avg.ms", this::avgQueryMillis);
    }

    public void recordStored()                { stored.incrementAndGet(); }
    public void recordDuplicateSkipped()      { duplicatesSkipped.incrementAndGet(); }
    public void recordQuery()                 { queriesTotal.incrementAndGet(); }
    public void recordCacheHit()              { queriesCached.incrementAndGet(); }
    public void recordFallbackSearch()        { fallbackSearches.incrementAndGet(); }
    public void recordRetrieved(int count)    { memoriesRetrieved.addAndGet(count); }
    public void recordDeleted()               { deleted.incrementAndGet(); }
    public void recordPruned(int count)       { pruned.addAndGet(count); }

    public void recordEmbeddingMillis(double millis) {
        updateEma(avgEmbeddingMillisBits, millis);
    }

    public void recordQueryMillis(double millis) {
        updateEma(avgQueryMillisBits, millis);
    }

    public double avgEmbeddingMillis() {
        return Double.longBitsToDouble(avgEmbeddingMillisBits.get());
    }

    public double avgQueryMillis() {
        return Double.longBitsToDouble(avgQueryMillisBits.get());
    }

    public Snapshot snapshot() {
        return new Snapshot(
                stored.get(), duplicatesSkipped.get(), queriesTotal.get(), queriesCached.get(),
                fallbackSearches.get(), memoriesRetrieved.get(), deleted.get(), pruned.get(),
                avgEmbeddingMillis(), avgQueryMillis());
    }

    private static void updateEma(AtomicLong bits, double sample) {
        long current;
        long next;
        do {
            current = bits.get();
            double avg = Double.longBitsToDouble(current);
            next = Double.doubleToLongBits(avg * (1 - EMA_WEIGHT) + sample * EMA_WEIGHT);
        } while (!bits.compareAndSet(current, next));
    }

    private static void gauge(MeterRegistry registry, String name, Supplier<Number> value) {
        Gauge.builder(name, value).register(registry);
    }

    public record Snapshot(
            long   stored,
            long   duplicatesSkipped,
            long   queriesTotal,
            long   queriesCached,
            long   fallbackSearches,
            long   memoriesRetrieved,
            long   deleted,
            long   pruned,
            double avgEmbeddingMillis,
            double avgQueryMillis
    ) {}
}
