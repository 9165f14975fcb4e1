package com.distributedsystems.archon.service;

import com.distributedsystems.archon.exe.ArchonConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Consecutive-failure circuit breaker shared by every outbox entry.
 */
@Slf4j
@Component
public class DeliveryBreaker {

    private final int threshold;
    private final long cooldownMs;

    private int consecutiveFailures;
    private long openUntilMs;

    public DeliveryBreaker(ArchonConfig config) {
        this.threshold = config.getOutbox().getBreakerThreshold();
        this.cooldownMs = config.getOutbox().getBreakerCooldownMs();
    }

    public synchronized boolean isOpen(long nowMs) {
        return openUntilMs > nowMs;
    }

    public synchronized void recordSuccess() {
        if (consecutiveFailures > 0 || openUntilMs > 0) {
            log.info("Coordinator reachable again after {} consecutive failures", consecutiveFailures);
        }
        consecutiveFailures = 0;
        openUntilMs = 0L;
    }

    /** @return true when this failure opened the breaker */
    public synchronized boolean recordFailure(long nowMs) {
        consecutiveFailures++;
        if (consecutiveFailures >= threshold && openUntilMs <= nowMs) {
            openUntilMs = nowMs + cooldownMs;
            log.warn("Outbox breaker open for {} ms after {} consecutive failures", cooldownMs, consecutiveFailures);
            return true;
        }
        return false;
    }

    public synchronized int consecutiveFailures() {
        return consecutiveFailures;
    }

    public synchronized long openUntilMs() {
        return openUntilMs;
    }
}
