package com.openforge.memoryengine.embedding;

import com.openforge.memoryengine.memory.MemoryEngineException;

/** Embedding service unavailable, or its output was malformed. */
public class EmbeddingException extends MemoryEngineException {

    public EmbeddingException(String message) {
        super(message);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
