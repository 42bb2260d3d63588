package com.openforge.memoryengine.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Resilience wrapper around one external collaborator.
 *
 * Call graph:
 *
 *   call(supplier)
 *     └─ timeLimiter (whole call, attempts included)
 *           └─ circuitBreaker (optional)
 *                 └─ retry (optional)
 *                       └─ supplier.get()   on the engine executor
 *
 * Runtime exceptions thrown by the supplier come out unchanged, an open
 * circuit surfaces as {@link io.github.resilience4j.circuitbreaker.CallNotPermittedException},
 * and an exceeded budget as {@link CollaboratorTimeoutException}.
 */
@Slf4j
public class CollaboratorGuard {

    private final String          name;
    private final CircuitBreaker  circuitBreaker;
    private final Retry           retry;
    private final TimeLimiter     timeLimiter;
    private final ExecutorService executor;

    public CollaboratorGuard(String name,
                             @Nullable CircuitBreaker circuitBreaker,
                             @Nullable Retry retry,
                             TimeLimiter timeLimiter,
                             ExecutorService executor) {
        this.name           = name;
        this.circuitBreaker = circuitBreaker;
        this.retry          = retry;
        this.timeLimiter    = timeLimiter;
        this.executor       = executor;
    }

    public String name() {
        return name;
    }

    public <T> T call(Supplier<T> call) {
        Supplier<T> decorated = call;
        if (retry != null)          decorated = Retry.decorateSupplier(retry, decorated);
        if (circuitBreaker != null) decorated = CircuitBreaker.decorateSupplier(circuitBreaker, decorated);

        Supplier<T> guarded = decorated;
        try {
            return timeLimiter.executeFutureSupplier(
                    () -> CompletableFuture.supplyAsync(guarded, executor));
        } catch (TimeoutException e) {
            throw new CollaboratorTimeoutException(
                    "%s call exceeded %s".formatted(name, timeLimiter.getTimeLimiterConfig().getTimeoutDuration()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CollaboratorTimeoutException(name + " call interrupted", e);
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        } catch (Exception e) {
            throw unwrap(e);
        }
    }

    public void run(Runnable call) {
        call(() -> {
            call.run();
            return null;
        });
    }

    private RuntimeException unwrap(Throwable t) {
        while ((t instanceof ExecutionException || t instanceof CompletionException)
                && t.getCause() != null) {
            t = t.getCause();
        }
        if (t instanceof RuntimeException re) return re;
        if (t instanceof Error err) throw err;
        log.debug("[Guard] {} failed with checked exception {}", name, t.getClass().getSimpleName());
        return new IllegalStateException(name + " call failed: " + t.getMessage(), t);
    }
}
