package com.openforge.memoryengine.vector;

/**
 * @param id    memory id stored alongside the vector
 * @param score raw score in the index's metric convention
 */
public record VectorHit(String id, double score) {}
