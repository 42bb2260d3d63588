package com.openforge.memoryengine.embedding;

/**
 * Turns text into a fixed-length vector.
 */
public interface EmbeddingPort {

    /**
     * @throws EmbeddingException when the backing service is unavailable or
     *                            returns something that is not a vector
     */
    float[] embed(String text);

    /** Declared vector length; every {@link #embed} result must match it. */
    int dimensions();
}
