package com.openforge.memoryengine.memory;

/**
 * Convention of the raw scores returned by the vector index.
 *
 * Everything inside the engine works with similarities (higher = closer).
 * Raw scores and caller thresholds are converted once, at the boundary.
 *
 * DISTANCE is squared Euclidean distance between L2-normalized vectors,
 * for which {@code d = 2 - 2 * cos}, so {@code cos = 1 - d / 2}.
 */
public enum MetricMode {

    SIMILARITY(-1.0, 1.0) {
        @Override
        public double toSimilarity(double raw) {
            return raw;
        }
    },

    DISTANCE(0.0, 4.0) {
        @Override
        public double toSimilarity(double raw) {
            return 1.0 - raw / 2.0;
        }
    };

    private final double minThreshold;
    private final double maxThreshold;

    MetricMode(double minThreshold, double maxThreshold) {
        this.minThreshold = minThreshold;
        this.maxThreshold = maxThreshold;
    }

    public abstract double toSimilarity(double raw);

    public boolean isValidThreshold(double threshold) {
        return !Double.isNaN(threshold) && threshold >= minThreshold && threshold <= maxThreshold;
    }

    public double minThreshold() {
        return minThreshold;
    }

    public double maxThreshold() {
        return maxThreshold;
    }
}
