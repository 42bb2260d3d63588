package com.openforge.memoryengine.config;

import com.openforge.memoryengine.embedding.EmbeddingProperties;
import com.openforge.memoryengine.memory.MemoryEngineProperties;
import com.openforge.memoryengine.vector.MilvusProperties;
import com.openforge.memoryengine.vector.VectorIndex;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;

/**
 * Prints a structured startup summary after the application context is fully ready.
 *
 * Checks performed:
 *   - Record store: type, and for JPA a real JDBC connection probe
 *   - Milvus: whether a vector index bean is live, and its address
 *   - Embedding: model + dimensions (API key is masked)
 *   - Engine: metric mode, surprise filter, cache, TTL and pruning settings
 */
@Slf4j
@Component
public class StartupInfoRunner implements ApplicationRunner {

    private final ObjectProvider<DataSource>  dataSource;
    private final ObjectProvider<VectorIndex> vectorIndex;
    private final EmbeddingProperties         embeddingProperties;
    private final MilvusProperties            milvusProperties;
    private final MemoryEngineProperties      engineProperties;
    private final Environment                 env;

    public StartupInfoRunner(ObjectProvider<DataSource> dataSource,
                             ObjectProvider<VectorIndex> vectorIndex,
                             EmbeddingProperties embeddingProperties,
                             MilvusProperties milvusProperties,
                             MemoryEngineProperties engineProperties,
                             Environment env) {
        this.dataSource          = dataSource;
        this.vectorIndex         = vectorIndex;
        this.embeddingProperties = embeddingProperties;
        this.milvusProperties    = milvusProperties;
        this.engineProperties    = engineProperties;
        this.env                 = env;
    }

    @Override
    public void run(ApplicationArguments args) {
        String storeType   = env.getProperty("memory.record-store.type", "jpa");
        String storeStatus = "jpa".equalsIgnoreCase(storeType) ? probeDatabase() : "in-memory (not durable)";
        boolean indexLive  = vectorIndex.getIfAvailable() != null;

        MemoryEngineProperties.Surprise surprise = engineProperties.surprise();
        MemoryEngineProperties.Cache    cache    = engineProperties.cache();

        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║           Memory Engine  —  Startup Summary              ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Record Store                                            ║
                ║    Type           : {}
                ║    {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Vector DB (Milvus)                                      ║
                ║    Enabled        : {}
                ║    Address        : {}:{}
                ║    Index          : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Embedding                                               ║
                ║    Model          : {}  dim={}
                ║    Endpoint       : {}  key={}
                ╠══════════════════════════════════════════════════════════╣
                ║  Engine                                                  ║
                ║    Metric Mode    : {}  recency-alpha={}
                ║    Surprise       : enabled={}  threshold={}  fail-open={}
                ║    Fallback Scan  : {} most recent records
                ║    Query Cache    : enabled={}  ttl={}s
                ║    Default TTL    : {}
                ║    Pruning        : enabled={}  every {} min
                ╚══════════════════════════════════════════════════════════╝
                """,
                storeType,
                storeStatus,

                milvusProperties.enabled(),
                milvusProperties.host(), milvusProperties.port(),
                indexLive ? "✔ live" : "✘ unavailable, linear-scan fallback",

                embeddingProperties.model(), embeddingProperties.dimensions(),
                embeddingProperties.baseUrl(), maskKey(embeddingProperties.apiKey()),

                engineProperties.metricMode(), engineProperties.recencyAlpha(),
                surprise.enabled(), surprise.threshold(), surprise.failOpen(),
                engineProperties.fallbackScanWindow(),
                cache.enabled(), cache.ttlSeconds(),
                engineProperties.defaultTtl() == null ? "never expire" : engineProperties.defaultTtl(),
                engineProperties.prune().enabled(), engineProperties.prune().intervalMinutes()
        );
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    /**
     * Opens a real JDBC connection and reads the DB server version.
     * Returns a one-line summary or error message.
     */
    private String probeDatabase() {
        DataSource ds = dataSource.getIfAvailable();
        if (ds == null) return "✘ no DataSource configured";
        try (Connection conn = ds.getConnection()) {
            String url     = conn.getMetaData().getURL();
            String version = conn.getMetaData().getDatabaseProductVersion();
            // Strip credentials from the JDBC URL for safe logging
            String safeUrl = url.replaceAll("password=[^&;]*", "password=***");
            return "✔ Connected  version=" + version + "  url=" + safeUrl;
        } catch (Exception e) {
            return "✘ FAILED — " + e.getMessage();
        }
    }

    private static String maskKey(String key) {
        if (key == null || key.isBlank() || key.startsWith("sk-placeholder")) {
            return "(not set)";
        }
        if (key.length() <= 10) return "***";
        return key.substring(0, 6) + "..." + key.substring(key.length() - 4);
    }
}
