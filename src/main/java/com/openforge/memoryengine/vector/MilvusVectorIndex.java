package com.openforge.memoryengine.vector;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.openforge.memoryengine.memory.FieldLimits;
import com.openforge.memoryengine.memory.MemoryFilter;
import com.openforge.memoryengine.memory.MemoryRecord;
import com.openforge.memoryengine.memory.MetadataKeys;
import com.openforge.memoryengine.memory.MetadataValue;
import com.openforge.memoryengine.memory.MetricMode;
import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.common.ConsistencyLevel;
import io.milvus.v2.service.vector.request.DeleteReq;
import io.milvus.v2.service.vector.request.InsertReq;
import io.milvus.v2.service.vector.request.SearchReq;
import io.milvus.v2.service.vector.request.data.FloatVec;
import io.milvus.v2.service.vector.response.SearchResp;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * {@link VectorIndex} backed by Milvus.
 *
 * In distance mode vectors are L2-normalized before insert and search, which
 * makes the squared L2 score Milvus returns equal to {@code 2 - 2cos}.
 *
 * Searches run at {@link ConsistencyLevel#STRONG}: the duplicate check right
 * after a store must see that store, which Milvus' default (Bounded) does not
 * guarantee.
 */
@Slf4j
public class MilvusVectorIndex implements VectorIndex {

    private final MilvusClientV2          milvusClient;
    private final MilvusCollectionManager collectionManager;
    private final MetricMode              metricMode;

    public MilvusVectorIndex(MilvusClientV2 milvusClient,
                             MilvusCollectionManager collectionManager,
                             MetricMode metricMode) {
        this.milvusClient      = milvusClient;
        this.collectionManager = collectionManager;
        this.metricMode        = metricMode;
    }

    @Override
    public MetricMode metricMode() {
        return metricMode;
    }

    @Override
    public void insert(String collection, MemoryRecord record) {
        try {
            collectionManager.ensureCollection(collection, record.embedding().length);
            milvusClient.insert(InsertReq.builder()
                    .collectionName(collection)
                    .data(List.of(toRow(record)))
                    .build());
            log.debug("[Milvus] Indexed {} in {}", record.id(), collection);
        } catch (Exception e) {
            throw new VectorIndexException("Milvus insert into %s failed: %s".formatted(collection, e.getMessage()), e);
        }
    }

    @Override
    public List<VectorHit> search(String collection, float[] vector, int topK, MemoryFilter filter) {
        try {
            if (!collectionManager.exists(collection)) return List.of();

            SearchReq.SearchReqBuilder<?, ?> builder = SearchReq.builder()
                    .collectionName(collection)
                    .data(List.of(new FloatVec(prepare(vector))))
                    .annsField("embedding")
                    .topK(topK)
                    .consistencyLevel(ConsistencyLevel.STRONG)
                    .outputFields(List.of("memory_id"));

            String expression = MilvusFilterExpressions.toExpression(filter);
            if (expression != null) builder.filter(expression);

            SearchResp resp = milvusClient.search(builder.build());
            List<VectorHit> hits = new ArrayList<>();
            if (resp == null || resp.getSearchResults() == null) return hits;

            for (List<SearchResp.SearchResult> row : resp.getSearchResults()) {
                for (SearchResp.SearchResult hit : row) {
                    Object id = hit.getId();
                    if (id == null && hit.getEntity() != null) id = hit.getEntity().get("memory_id");
                    if (id == null) continue;
                    Float score = hit.getScore();
                    hits.add(new VectorHit(id.toString(), score == null ? 0.0 : score.doubleValue()));
                }
            }
            return hits;
        } catch (Exception e) {
            throw new VectorIndexException("Milvus search in %s failed: %s".formatted(collection, e.getMessage()), e);
        }
    }

    @Override
    public void delete(String collection, Collection<String> ids) {
        if (ids.isEmpty()) return;
        try {
            if (!collectionManager.exists(collection)) return;
            milvusClient.delete(DeleteReq.builder()
                    .collectionName(collection)
                    .ids(new ArrayList<Object>(ids))
                    .build());
            log.debug("[Milvus] Deleted {} vector(s) from {}", ids.size(), collection);
        } catch (Exception e) {
            throw new VectorIndexException("Milvus delete in %s failed: %s".formatted(collection, e.getMessage()), e);
        }
    }

    // ── Row mapping ──────────────────────────────────────────────────────────

    private JsonObject toRow(MemoryRecord r) {
        JsonObject row = new JsonObject();
        row.addProperty("memory_id",       r.id());
        row.addProperty("user_id",         orEmpty(r.text(MetadataKeys.USER_ID)));
        row.addProperty("session_id",      orEmpty(r.text(MetadataKeys.SESSION_ID)));
        row.addProperty("conversation_id", orEmpty(r.text(MetadataKeys.CONVERSATION_ID)));
        row.addProperty("scope",           orEmpty(r.scope()));
        row.addProperty("kind",            orEmpty(r.kind()));

        JsonArray tags = new JsonArray();
        r.tags().stream().limit(FieldLimits.MAX_TAGS).forEach(tags::add);
        row.add("tags", tags);

        JsonObject metadata = new JsonObject();
        for (Map.Entry<String, MetadataValue> e : r.metadata().entrySet()) {
            if (e.getValue() instanceof MetadataValue.Text t) {
                metadata.addProperty(e.getKey(), t.value());
            } else if (e.getValue() instanceof MetadataValue.Number n) {
                metadata.addProperty(e.getKey(), n.value());
            } else if (e.getValue() instanceof MetadataValue.TextList l) {
                JsonArray arr = new JsonArray();
                l.values().forEach(arr::add);
                metadata.add(e.getKey(), arr);
            }
        }
        row.add("metadata", metadata);

        row.addProperty("created_at_ms", r.createdAt().toEpochMilli());
        row.addProperty("expires_at_ms", r.expiresAt() == null ? 0L : r.expiresAt().toEpochMilli());

        JsonArray embedding = new JsonArray();
        for (float f : prepare(r.embedding())) embedding.add(f);
        row.add("embedding", embedding);
        return row;
    }

    private float[] prepare(float[] vector) {
        if (metricMode != MetricMode.DISTANCE) return vector;
        double norm = 0;
        for (float f : vector) norm += (double) f * f;
        norm = Math.sqrt(norm);
        if (norm == 0) return vector;
        float[] out = new float[vector.length];
        for (int i = 0; i < vector.length; i++) out[i] = (float) (vector[i] / norm);
        return out;
    }

    private static String orEmpty(String s) {
        return s == null ? "" : s;
    }
}
