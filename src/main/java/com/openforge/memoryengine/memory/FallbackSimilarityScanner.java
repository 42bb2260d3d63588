package com.openforge.memoryengine.memory;

import com.openforge.memoryengine.store.RecordStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Linear-scan cosine search over a tenant's most recent records.
 *
 * Used whenever the vector index is absent or fails. Always scores with cosine
 * similarity; callers pass a threshold already normalized to similarity, so
 * results agree with the index path whatever its metric mode. Cost is O(window)
 * per query.
 */
@Slf4j
@Component
public class FallbackSimilarityScanner {

    static final double EPSILON = 1e-8;

    private final RecordStore recordStore;
    private final int         scanWindow;

    public FallbackSimilarityScanner(RecordStore recordStore, MemoryEngineProperties properties) {
        this.recordStore = recordStore;
        this.scanWindow  = properties.fallbackScanWindow();
    }

    /**
     * @param similarityThreshold inclusive lower bound on cosine similarity
     * @param limit               maximum number of candidates returned
     * @return candidates best first; ties go to the newer record
     */
    public List<ScoredCandidate> scan(String collection,
                                      float[] query,
                                      MemoryFilter filter,
                                      double similarityThreshold,
                                      int limit) {
        List<MemoryRecord> window = recordStore.scanRecent(collection, scanWindow);
        List<ScoredCandidate> accepted = new ArrayList<>();

        for (MemoryRecord record : window) {
            if (!filter.matches(record)) continue;
            float[] embedding = record.embedding();
            if (embedding == null || embedding.length != query.length) continue;

            double score = cosine(query, embedding);
            if (score >= similarityThreshold) {
                accepted.add(new ScoredCandidate(record, score));
            }
        }

        accepted.sort(Comparator.comparingDouble(ScoredCandidate::score).reversed()
                .thenComparing(c -> c.record().createdAt(), Comparator.reverseOrder()));

        log.debug("[Fallback] Scanned {} record(s) in {}, {} above threshold {}",
                window.size(), collection, accepted.size(), similarityThreshold);
        return accepted.size() > limit ? List.copyOf(accepted.subList(0, limit)) : accepted;
    }

    static double cosine(float[] a, float[] b) {
        double dot = 0, normA = 0, normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot   += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB) + EPSILON);
    }
}
