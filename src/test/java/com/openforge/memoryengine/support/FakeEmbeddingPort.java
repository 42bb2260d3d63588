package com.openforge.memoryengine.support;

import com.openforge.memoryengine.embedding.EmbeddingException;
import com.openforge.memoryengine.embedding.EmbeddingPort;

import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Deterministic embedder: registered texts map to fixed vectors, anything else
 * is hashed word by word into a bag-of-words vector.
 */
public class FakeEmbeddingPort implements EmbeddingPort {

    private final int                  dimensions;
    private final Map<String, float[]> vectors = new ConcurrentHashMap<>();
    private final AtomicInteger        calls   = new AtomicInteger();
    private volatile boolean           failing;

    public FakeEmbeddingPort(int dimensions) {
        this.dimensions = dimensions;
    }

    public FakeEmbeddingPort register(String text, float... vector) {
        vectors.put(text, vector);
        return this;
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    public int calls() {
        return calls.get();
    }

    @Override
    public float[] embed(String text) {
        calls.incrementAndGet();
        if (failing) throw new EmbeddingException("embedding service down");
        float[] registered = vectors.get(text);
        if (registered != null) return Arrays.copyOf(registered, registered.length);

        float[] v = new float[dimensions];
        for (String word : text.toLowerCase().split("\\W+")) {
            if (word.isEmpty()) continue;
            v[Math.floorMod(word.hashCode(), dimensions)] += 1f;
        }
        return v;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    /** Unit vector along one axis. */
    public static float[] axis(int dimensions, int index) {
        float[] v = new float[dimensions];
        v[index] = 1f;
        return v;
    }
}
