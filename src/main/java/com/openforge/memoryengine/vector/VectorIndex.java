package com.openforge.memoryengine.vector;

import com.openforge.memoryengine.memory.MemoryFilter;
import com.openforge.memoryengine.memory.MemoryRecord;
import com.openforge.memoryengine.memory.MetricMode;

import java.util.Collection;
import java.util.List;

/**
 * Approximate-nearest-neighbour index over memory embeddings.
 *
 * Optional collaborator: the engine works without one. Any call may throw
 * {@link VectorIndexException} (or any other runtime exception), which the
 * engine treats as "index unavailable for this call".
 */
public interface VectorIndex {

    /** Indexes the record's embedding together with its filterable metadata. */
    void insert(String collection, MemoryRecord record);

    /**
     * @param filter constraints the index applies natively where it can;
     *               callers re-check every hit, so partial support is fine
     * @return hits ordered best first, raw scores in {@link #metricMode()} convention
     */
    List<VectorHit> search(String collection, float[] vector, int topK, MemoryFilter filter);

    void delete(String collection, Collection<String> ids);

    /** Convention of the scores {@link #search} returns. */
    MetricMode metricMode();
}
