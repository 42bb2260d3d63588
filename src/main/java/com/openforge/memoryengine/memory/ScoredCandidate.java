package com.openforge.memoryengine.memory;

/** A record with its similarity; after ranking, the recency-weighted combined score. */
public record ScoredCandidate(MemoryRecord record, double score) {}
