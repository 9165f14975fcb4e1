package com.distributedsystems.archon.service;

import org.junit.jupiter.api.Test;

import java.util.concurrent.ThreadLocalRandom;

import static org.assertj.core.api.Assertions.assertThat;

class BackoffPolicyTest {

    @Test
    void nominalDelayDoublesUntilTheCap() {
        BackoffPolicy policy = new BackoffPolicy(30_000, 3_600_000, 0.2, () -> 0.0);

        assertThat(policy.nominalDelayMs(1)).isEqualTo(30_000);
        assertThat(policy.nominalDelayMs(2)).isEqualTo(60_000);
        assertThat(policy.nominalDelayMs(3)).isEqualTo(120_000);
        assertThat(policy.nominalDelayMs(7)).isEqualTo(1_920_000);
        assertThat(policy.nominalDelayMs(8)).isEqualTo(3_600_000);
        assertThat(policy.nominalDelayMs(500)).isEqualTo(3_600_000);
    }

    @Test
    void zeroRandomnessGivesTheFullDelay() {
        BackoffPolicy policy = new BackoffPolicy(1_000, 60_000, 0.2, () -> 0.0);
        assertThat(policy.delayMs(3)).isEqualTo(4_000);
    }

    @Test
    void maximumRandomnessTakesOffTheWholeJitterFraction() {
        BackoffPolicy policy = new BackoffPolicy(1_000, 60_000, 0.2, () -> 1.0);
        assertThat(policy.delayMs(3)).isEqualTo(3_200);
    }

    @Test
    void jitteredDelayStaysWithinItsWindow() {
        BackoffPolicy policy = new BackoffPolicy(30_000, 3_600_000, 0.2,
                () -> ThreadLocalRandom.current().nextDouble());
        for (int attempt = 1; attempt <= 10; attempt++) {
            long nominal = policy.nominalDelayMs(attempt);
            for (int i = 0; i < 50; i++) {
                assertThat(policy.delayMs(attempt)).isBetween((long) (nominal * 0.8), nominal);
            }
        }
    }

    @Test
    void noJitterConfigured() {
        BackoffPolicy policy = new BackoffPolicy(500, 10_000, 0.0, () -> 1.0);
        assertThat(policy.delayMs(1)).isEqualTo(500);
        assertThat(policy.delayMs(0)).isEqualTo(500);
    }
}
