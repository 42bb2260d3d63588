package com.openforge.memoryengine.vector;

import com.openforge.memoryengine.memory.FieldLimits;
import com.openforge.memoryengine.memory.MetricMode;
import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.common.ConsistencyLevel;
import io.milvus.v2.common.DataType;
import io.milvus.v2.common.IndexParam;
import io.milvus.v2.service.collection.request.AddFieldReq;
import io.milvus.v2.service.collection.request.CreateCollectionReq;
import io.milvus.v2.service.collection.request.HasCollectionReq;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Creates per-tenant Milvus collections on demand and remembers which exist,
 * so insert/search do not pay a hasCollection round-trip every time.
 *
 * Collection schema:
 * ┌──────────────────┬─────────────────────┬──────────────────────────────────┐
 * │ Field            │ Type                │ Notes                            │
 * ├──────────────────┼─────────────────────┼──────────────────────────────────┤
 * │ memory_id        │ VARCHAR(64) PK      │ engine-generated UUID            │
 * │ user_id          │ VARCHAR(64)         │ "" when absent                   │
 * │ session_id       │ VARCHAR(64)         │                                  │
 * │ conversation_id  │ VARCHAR(64)         │                                  │
 * │ scope            │ VARCHAR(128)        │                                  │
 * │ kind             │ VARCHAR(64)         │                                  │
 * │ tags             │ ARRAY<VARCHAR(128)> │ up to 64 tags                    │
 * │ metadata         │ JSON                │ full caller metadata             │
 * │ created_at_ms    │ INT64               │ epoch millis                     │
 * │ expires_at_ms    │ INT64               │ 0 = never expires                │
 * │ embedding        │ FLOAT_VECTOR        │ dim fixed per collection         │
 * └──────────────────┴─────────────────────┴──────────────────────────────────┘
 *
 * Index: HNSW on embedding. COSINE in similarity mode, L2 in distance mode.
 * Collections default to Strong consistency; searches also request it explicitly
 * so collections created before that default still read their own writes.
 *
 * VARCHAR and ARRAY limits mirror {@link FieldLimits}; the engine rejects
 * longer values at store time.
 */
@Slf4j
public class MilvusCollectionManager {

    private final MilvusClientV2 milvusClient;
    private final MetricMode     metricMode;

    private final Set<String> existingCollections = ConcurrentHashMap.newKeySet();

    public MilvusCollectionManager(MilvusClientV2 milvusClient, MetricMode metricMode) {
        this.milvusClient = milvusClient;
        this.metricMode   = metricMode;
    }

    public boolean exists(String collectionName) {
        if (existingCollections.contains(collectionName)) return true;
        boolean exists = milvusClient.hasCollection(
                HasCollectionReq.builder().collectionName(collectionName).build());
        if (exists) existingCollections.add(collectionName);
        return exists;
    }

    /**
     * Ensures the collection exists, creating it for the given dimension if needed.
     */
    public void ensureCollection(String collectionName, int dimension) {
        if (exists(collectionName)) return;
        log.info("[Milvus] Creating collection '{}' (dim={} metric={})…", collectionName, dimension, metricMode);
        createCollection(collectionName, dimension);
        existingCollections.add(collectionName);
    }

    private void createCollection(String name, int dimension) {
        CreateCollectionReq.CollectionSchema schema =
                CreateCollectionReq.CollectionSchema.builder().build();

        schema.addField(AddFieldReq.builder().fieldName("memory_id")
                .dataType(DataType.VarChar).maxLength(64).isPrimaryKey(true).autoID(false).build());
        varchar(schema, "user_id", FieldLimits.MAX_ID_LENGTH);
        varchar(schema, "session_id", FieldLimits.MAX_ID_LENGTH);
        varchar(schema, "conversation_id", FieldLimits.MAX_ID_LENGTH);
        varchar(schema, "scope", FieldLimits.MAX_SCOPE_LENGTH);
        varchar(schema, "kind", FieldLimits.MAX_KIND_LENGTH);
        schema.addField(AddFieldReq.builder().fieldName("tags")
                .dataType(DataType.Array).elementType(DataType.VarChar)
                .maxCapacity(FieldLimits.MAX_TAGS).maxLength(FieldLimits.MAX_TAG_LENGTH).build());
        schema.addField(AddFieldReq.builder().fieldName("metadata")
                .dataType(DataType.JSON).build());
        schema.addField(AddFieldReq.builder().fieldName("created_at_ms")
                .dataType(DataType.Int64).build());
        schema.addField(AddFieldReq.builder().fieldName("expires_at_ms")
                .dataType(DataType.Int64).build());
        schema.addField(AddFieldReq.builder().fieldName("embedding")
                .dataType(DataType.FloatVector).dimension(dimension).build());

        IndexParam vectorIndex = IndexParam.builder()
                .fieldName("embedding")
                .indexType(IndexParam.IndexType.HNSW)
                .metricType(metricMode == MetricMode.DISTANCE
                        ? IndexParam.MetricType.L2
                        : IndexParam.MetricType.COSINE)
                .extraParams(Map.of("M", 16, "efConstruction", 256))
                .build();
        IndexParam scopeIndex = IndexParam.builder()
                .fieldName("scope")
                .indexType(IndexParam.IndexType.TRIE)
                .build();
        IndexParam userIndex = IndexParam.builder()
                .fieldName("user_id")
                .indexType(IndexParam.IndexType.TRIE)
                .build();

        milvusClient.createCollection(CreateCollectionReq.builder()
                .collectionName(name)
                .collectionSchema(schema)
                .indexParams(List.of(vectorIndex, scopeIndex, userIndex))
                .consistencyLevel(ConsistencyLevel.STRONG)
                .build());

        log.info("[Milvus] Collection '{}' created successfully.", name);
    }

    private static void varchar(CreateCollectionReq.CollectionSchema schema, String field, int maxLength) {
        schema.addField(AddFieldReq.builder().fieldName(field)
                .dataType(DataType.VarChar).maxLength(maxLength).build());
    }
}
