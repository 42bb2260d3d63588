package com.openforge.memoryengine.config;

import com.openforge.memoryengine.memory.MemoryEngineProperties;
import com.openforge.memoryengine.resilience.CollaboratorGuard;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ExecutorService;

/**
 * Programmatic Resilience4j wiring.
 *
 * Two guarded collaborators:
 *   • "vectorIndex" → circuit breaker + time limiter. A failing Milvus trips the
 *                     breaker and queries go straight to the linear scan.
 *   • "embedding"   → retry + time limiter. There is no fallback embedder, so
 *                     transient errors are retried instead.
 */
@Configuration
public class Resilience4jConfig {

    public static final String VECTOR_INDEX = "vectorIndex";
    public static final String EMBEDDING    = "embedding";

    // ── Circuit Breaker ──────────────────────────────────────────────────────

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                // trip after 50 % of the last 20 calls fail
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(20)
                .minimumNumberOfCalls(10)
                .failureRateThreshold(50)
                // allow 3 probe calls while HALF-OPEN
                .permittedNumberOfCallsInHalfOpenState(3)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .recordExceptions(IOException.class, RuntimeException.class)
                .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(config);
        registry.circuitBreaker(VECTOR_INDEX);
        return registry;
    }

    // ── Retry ────────────────────────────────────────────────────────────────

    @Bean
    public RetryRegistry retryRegistry() {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofMillis(500))
                // network errors and 429 arrive as EmbeddingException with an IOException cause
                .retryOnException(e -> e instanceof IOException || e.getCause() instanceof IOException)
                .build();

        RetryRegistry registry = RetryRegistry.of(config);
        registry.retry(EMBEDDING);
        return registry;
    }

    // ── Guards ───────────────────────────────────────────────────────────────

    @Bean
    public CollaboratorGuard vectorIndexGuard(CircuitBreakerRegistry circuitBreakers,
                                              MemoryEngineProperties properties,
                                              @Qualifier("collaboratorExecutor") ExecutorService collaboratorExecutor) {
        CircuitBreaker breaker = circuitBreakers.circuitBreaker(VECTOR_INDEX);
        return new CollaboratorGuard(VECTOR_INDEX, breaker, null,
                timeLimiter(VECTOR_INDEX, properties.timeouts().vectorIndexMs()), collaboratorExecutor);
    }

    @Bean
    public CollaboratorGuard embeddingGuard(RetryRegistry retries,
                                            MemoryEngineProperties properties,
                                            @Qualifier("collaboratorExecutor") ExecutorService collaboratorExecutor) {
        Retry retry = retries.retry(EMBEDDING);
        return new CollaboratorGuard(EMBEDDING, null, retry,
                timeLimiter(EMBEDDING, properties.timeouts().embeddingMs()), collaboratorExecutor);
    }

    private static TimeLimiter timeLimiter(String name, long timeoutMs) {
        return TimeLimiter.of(name, TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(timeoutMs))
                .cancelRunningFuture(true)
                .build());
    }
}
