package com.openforge.memoryengine.memory;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class EngineMetricsTest {

    @Test
    void emaWeighsNewSamplesAtTenPercent() {
        var metrics = new EngineMetrics(new SimpleMeterRegistry());

        metrics.recordQueryMillis(100);
        assertEquals(10.0, metrics.avgQueryMillis(), 1e-9);
        metrics.recordQueryMillis(100);
        assertEquals(19.0, metrics.avgQueryMillis(), 1e-9);
    }

    @Test
    void countersAreExportedAsGauges() {
        var registry = new SimpleMeterRegistry();
        var metrics = new EngineMetrics(registry);

        metrics.recordStored();
        metrics.recordStored();
        metrics.recordRetrieved(5);
        metrics.recordEmbeddingMillis(50);

        assertEquals(2.0, registry.get("memory.engine.stored").gauge().value());
        assertEquals(5.0, registry.get("memory.engine.retrieved").gauge().value());
        assertEquals(5.0, registry.get("memory.engine.embedding.avg.ms").gauge().value(), 1e-9);

        var snapshot = metrics.snapshot();
        assertEquals(2, snapshot.stored());
        assertEquals(5, snapshot.memoriesRetrieved());
    }

    @Test
    void concurrentUpdatesAreNotLost() throws Exception {
        var metrics = new EngineMetrics(new SimpleMeterRegistry());
        ExecutorService pool = Executors.newFixedThreadPool(8);
        var done = new CountDownLatch(8);
        for (int t = 0; t < 8; t++) {
            pool.execute(() -> {
                for (int i = 0; i < 1_000; i++) {
                    metrics.recordQuery();
                    metrics.recordQueryMillis(10);
                }
                done.countDown();
            });
        }
        assertTrue(done.await(10, TimeUnit.SECONDS));
        pool.shutdown();

        assertEquals(8_000, metrics.snapshot().queriesTotal());
        // every sample is 10 ms, so the average converges to 10 from below
        assertTrue(metrics.avgQueryMillis() > 9.99 && metrics.avgQueryMillis() <= 10.0 + 1e-9);
    }
}
