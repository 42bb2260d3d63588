package com.openforge.memoryengine.vector;

import com.openforge.memoryengine.memory.MemoryEngineProperties;
import io.milvus.v2.client.ConnectConfig;
import io.milvus.v2.client.MilvusClientV2;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.Nullable;

/**
 * Milvus infrastructure bean configuration.
 *
 * The client connects eagerly at startup. When Milvus is unreachable the
 * client and the {@link VectorIndex} beans are null and the engine runs on
 * its linear-scan fallback; set memory.milvus.enabled=false to skip the
 * connection attempt entirely.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "memory.milvus.enabled", havingValue = "true", matchIfMissing = true)
public class MilvusConfig {

    @Bean(destroyMethod = "close")
    @Nullable
    public MilvusClientV2 milvusClient(MilvusProperties props) {
        log.info("[Milvus] Connecting to {}:{}...", props.host(), props.port());
        try {
            MilvusClientV2 client = new MilvusClientV2(
                    ConnectConfig.builder()
                            .uri("http://%s:%d".formatted(props.host(), props.port()))
                            .connectTimeoutMs(props.connectTimeoutMs())
                            .build()
            );
            log.info("[Milvus] Connected successfully.");
            return client;
        } catch (Exception e) {
            log.warn("[Milvus] Connection failed, vector search will be DISABLED and queries fall back " +
                     "to a linear scan. Cause: {}. " +
                     "To suppress this warning, set memory.milvus.enabled=false.",
                    e.getMessage());
            return null;
        }
    }

    @Bean
    @Nullable
    public VectorIndex vectorIndex(@Nullable MilvusClientV2 milvusClient,
                                   MemoryEngineProperties engineProperties) {
        if (milvusClient == null) return null;
        MilvusCollectionManager collectionManager =
                new MilvusCollectionManager(milvusClient, engineProperties.metricMode());
        return new MilvusVectorIndex(milvusClient, collectionManager, engineProperties.metricMode());
    }
}
