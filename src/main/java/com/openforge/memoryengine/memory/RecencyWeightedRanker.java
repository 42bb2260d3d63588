package com.openforge.memoryengine.memory;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Final ordering: {@code combined = s * exp(-alpha * ageDays)}.
 *
 * A fresher, moderately similar record can outrank an older, very similar one.
 * That recency bias is intended; lower alpha to weaken it. Ties go to the newer
 * record, then to the incoming candidate order.
 */
@Component
public class RecencyWeightedRanker {

    private static final double SECONDS_PER_DAY = 86_400.0;

    private final double alpha;

    @Autowired
    public RecencyWeightedRanker(MemoryEngineProperties properties) {
        this(properties.recencyAlpha());
    }

    public RecencyWeightedRanker(double alpha) {
        if (alpha < 0 || Double.isNaN(alpha)) {
            throw new IllegalArgumentException("recency alpha must be >= 0, got " + alpha);
        }
        this.alpha = alpha;
    }

    /**
     * @return new candidates carrying the combined score, best first
     */
    public List<ScoredCandidate> rank(List<ScoredCandidate> candidates, Instant now) {
        List<ScoredCandidate> ranked = new ArrayList<>(candidates.size());
        for (ScoredCandidate c : candidates) {
            ranked.add(new ScoredCandidate(c.record(), combinedScore(c.score(), c.record().createdAt(), now)));
        }
        // List.sort is stable, so equal keys keep candidate order
        ranked.sort(Comparator.comparingDouble(ScoredCandidate::score).reversed()
                .thenComparing(c -> c.record().createdAt(), Comparator.nullsLast(Comparator.reverseOrder())));
        return ranked;
    }

    public double combinedScore(double score, Instant createdAt, Instant now) {
        if (Double.isNaN(score)) score = 0.0;
        return score * recencyWeight(createdAt, now);
    }

    public double recencyWeight(Instant createdAt, Instant now) {
        if (createdAt == null) return 1.0;
        double ageDays = Math.max(0.0, Duration.between(createdAt, now).toMillis() / 1000.0 / SECONDS_PER_DAY);
        return Math.exp(-alpha * ageDays);
    }
}
