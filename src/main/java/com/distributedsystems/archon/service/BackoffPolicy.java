package com.distributedsystems.archon.service;

import com.distributedsystems.archon.exe.ArchonConfig;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Capped exponential backoff with equal jitter: the nominal delay for attempt {@code n} is
 * {@code min(max, base * 2^(n-1))}, and the returned delay is uniform in
 * {@code [d * (1 - jitter), d]}.
 */
public class BackoffPolicy {

    private final long baseMs;
    private final long maxMs;
    private final double jitter;
    private final DoubleSupplier random;

    public BackoffPolicy(long baseMs, long maxMs, double jitter, DoubleSupplier random) {
        this.baseMs = Math.max(1L, baseMs);
        this.maxMs = Math.max(this.baseMs, maxMs);
        this.jitter = Math.min(1.0, Math.max(0.0, jitter));
        this.random = random;
    }

    public static BackoffPolicy from(ArchonConfig.Outbox outbox) {
        return new BackoffPolicy(outbox.getBaseBackoffMs(), outbox.getMaxBackoffMs(), outbox.getJitter(),
                () -> ThreadLocalRandom.current().nextDouble());
    }

    public long nominalDelayMs(int attempts) {
        int exponent = Math.max(0, attempts - 1);
        if (exponent >= 62 || baseMs > (maxMs >> exponent)) {
            return maxMs;
        }
        return Math.min(maxMs, baseMs << exponent);
    }

    public long delayMs(int attempts) {
        long nominal = nominalDelayMs(attempts);
        double r = Math.min(1.0, Math.max(0.0, random.getAsDouble()));
        long reduction = (long) Math.floor(nominal * jitter * r);
        return nominal - reduction;
    }
}
