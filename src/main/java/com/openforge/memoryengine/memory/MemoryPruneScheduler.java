package com.openforge.memoryengine.memory;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically removes records whose TTL has passed, across all collections.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "memory.engine.prune.enabled", havingValue = "true", matchIfMissing = true)
public class MemoryPruneScheduler {

    private final MemoryEngine memoryEngine;

    @Scheduled(
            initialDelayString = "#{${memory.engine.prune.interval-minutes:60} * 60000}",
            fixedDelayString   = "#{${memory.engine.prune.interval-minutes:60} * 60000}")
    public void pruneExpired() {
        try {
            int removed = memoryEngine.pruneAllExpired();
            if (removed > 0) {
                log.info("[Prune] Removed {} expired memory record(s)", removed);
            } else {
                log.debug("[Prune] Nothing to prune");
            }
        } catch (Exception e) {
            log.warn("[Prune] Pruning run failed, retrying next interval: {}", e.getMessage(), e);
        }
    }
}
