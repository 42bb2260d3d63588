package com.openforge.memoryengine.memory;

import com.openforge.memoryengine.resilience.CollaboratorGuard;
import com.openforge.memoryengine.vector.VectorHit;
import com.openforge.memoryengine.vector.VectorIndex;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Novelty gate in front of {@code store}.
 *
 * Looks up the single nearest neighbour in the same (scope, kind) partition
 * and rejects the candidate when that neighbour is at least as close as the
 * configured threshold. When the check cannot run (no index, lookup failure,
 * timeout, open circuit) the outcome is memory.engine.surprise.fail-open.
 *
 * This is a heuristic: concurrent stores of the same text may both pass.
 */
@Slf4j
@Component
public class SurpriseFilter {

    /** May be null when Milvus is disabled or unreachable. */
    private final VectorIndex              vectorIndex;
    private final CollaboratorGuard        vectorIndexGuard;
    private final MemoryEngineProperties.Surprise config;
    private final double                   similarityThreshold;

    @Autowired
    public SurpriseFilter(@Nullable VectorIndex vectorIndex,
                          @Qualifier("vectorIndexGuard") CollaboratorGuard vectorIndexGuard,
                          MemoryEngineProperties properties) {
        this.vectorIndex         = vectorIndex;
        this.vectorIndexGuard    = vectorIndexGuard;
        this.config              = properties.surprise();
        this.similarityThreshold = properties.metricMode().toSimilarity(config.threshold());
    }

    /**
     * @return true when the content should be stored
     */
    public boolean isNovel(String collection, float[] embedding, String scope, String kind) {
        if (!config.enabled()) return true;

        if (vectorIndex == null) {
            log.warn("[Surprise] No vector index available, novelty cannot be checked (fail-open={})",
                    config.failOpen());
            return config.failOpen();
        }

        List<VectorHit> hits;
        try {
            hits = vectorIndexGuard.call(() ->
                    vectorIndex.search(collection, embedding, 1, MemoryFilter.partition(scope, kind)));
        } catch (Exception e) {
            log.warn("[Surprise] Nearest-neighbour lookup in {} failed (fail-open={}): {}",
                    collection, config.failOpen(), e.getMessage());
            return config.failOpen();
        }

        if (hits.isEmpty()) return true;

        double best = vectorIndex.metricMode().toSimilarity(hits.get(0).score());
        boolean novel = best < similarityThreshold;
        if (!novel) {
            log.debug("[Surprise] Rejected near-duplicate in {} {}/{} (similarity={} >= {})",
                    collection, scope, kind, best, similarityThreshold);
        }
        return novel;
    }
}
