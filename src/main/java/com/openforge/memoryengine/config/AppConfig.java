package com.openforge.memoryengine.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.openforge.memoryengine.cache.LocalQueryCache;
import com.openforge.memoryengine.cache.QueryCache;
import com.openforge.memoryengine.memory.MemoryEngineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.Nullable;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Core infrastructure beans:
 *  - memoryEngineExecutor    → fixed pool running queryAsync
 *  - collaboratorExecutor    → cached pool running guarded embedding / vector index calls
 *  - Java HttpClient         → the only HTTP engine; used by the embedding client
 *  - Jackson ObjectMapper    → snake_case, Java time as ISO-8601, tolerant deserialization
 *  - QueryCache              → in-process Guava cache, or null when disabled
 */
@Slf4j
@Configuration
public class AppConfig {

    /**
     * Kept separate from collaboratorExecutor so a saturated query pool can
     * never starve the guarded calls those queries wait on.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService memoryEngineExecutor() {
        int threads = Math.max(2, Runtime.getRuntime().availableProcessors());
        return Executors.newFixedThreadPool(threads, namedThreads("memory-engine-"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService collaboratorExecutor() {
        return Executors.newCachedThreadPool(namedThreads("memory-collaborator-"));
    }

    /**
     * Single, shared HttpClient instance.
     * 10 s connect timeout; per-request timeouts are set at call site.
     */
    @Bean
    public HttpClient httpClient(@Qualifier("collaboratorExecutor") ExecutorService collaboratorExecutor) {
        return HttpClient.newBuilder()
                .executor(collaboratorExecutor)
                .connectTimeout(Duration.ofSeconds(10))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    /**
     * Shared ObjectMapper for the embedding API, cached results and the
     * metadata column of the record store:
     *  - snake_case property names (created_at, similarity_score …)
     *  - ISO-8601 dates, NOT timestamps
     *  - Unknown properties silently ignored
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @Nullable
    public QueryCache queryCache(MemoryEngineProperties properties, Clock clock) {
        if (!properties.cache().enabled()) {
            log.info("[Cache] Query cache disabled (memory.engine.cache.enabled=false).");
            return null;
        }
        return new LocalQueryCache(properties.cache().maxEntries(), clock);
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
