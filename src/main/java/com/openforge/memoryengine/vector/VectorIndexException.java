package com.openforge.memoryengine.vector;

/** Transient vector index failure; always degraded, never surfaced to callers. */
public class VectorIndexException extends RuntimeException {

    public VectorIndexException(String message) {
        super(message);
    }

    public VectorIndexException(String message, Throwable cause) {
        super(message, cause);
    }
}
