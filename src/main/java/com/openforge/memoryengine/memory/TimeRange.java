package com.openforge.memoryengine.memory;

import java.time.Instant;

/**
 * Inclusive [start, end] bound on {@code createdAt}. Either end may be null (open).
 */
public record TimeRange(Instant start, Instant end) {

    public boolean contains(Instant t) {
        if (t == null) return false;
        if (start != null && t.isBefore(start)) return false;
        return end == null || !t.isAfter(end);
    }
}
