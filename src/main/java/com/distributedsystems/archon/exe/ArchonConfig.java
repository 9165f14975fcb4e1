package com.distributedsystems.archon.exe;

import lombok.Getter;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Immutable node configuration, bound once from {@code archon.*} at startup and handed to
 * every component through its constructor.
 */
@Getter
@ToString(exclude = "gatewayToken")
@ConfigurationProperties(prefix = "archon")
public class ArchonConfig {

    private final String dbPath;
    private final String gatewayUrl;
    private final boolean networkEnabled;
    private final String gatewayToken;
    private final long governanceMinBondSats;
    private final long bondToleranceSats;
    private final String ledgerUrl;
    private final String signerKeyPath;
    private final long requestTimeoutMs;
    private final Outbox outbox;
    private final Retention retention;

    public ArchonConfig(@DefaultValue("") String dbPath,
                        @DefaultValue("https://archon.technology") String gatewayUrl,
                        @DefaultValue("false") boolean networkEnabled,
                        @DefaultValue("") String gatewayToken,
                        @DefaultValue("50000") long governanceMinBondSats,
                        @DefaultValue("1000") long bondToleranceSats,
                        @DefaultValue("") String ledgerUrl,
                        @DefaultValue("") String signerKeyPath,
                        @DefaultValue("10000") long requestTimeoutMs,
                        @DefaultValue Outbox outbox,
                        @DefaultValue Retention retention) {
        this.dbPath = (dbPath == null || dbPath.isBlank())
                ? System.getProperty("user.home") + "/.lightning/cl_hive_archon"
                : dbPath.trim();
        this.gatewayUrl = gatewayUrl == null ? "" : gatewayUrl.trim();
        this.networkEnabled = networkEnabled;
        this.gatewayToken = gatewayToken == null ? "" : gatewayToken.trim();
        this.governanceMinBondSats = Math.max(1L, governanceMinBondSats);
        this.bondToleranceSats = Math.max(0L, bondToleranceSats);
        this.ledgerUrl = ledgerUrl == null ? "" : ledgerUrl.trim();
        this.signerKeyPath = signerKeyPath == null ? "" : signerKeyPath.trim();
        this.requestTimeoutMs = Math.max(250L, requestTimeoutMs);
        this.outbox = outbox;
        this.retention = retention;
    }

    public boolean hasGatewayToken() {
        return !gatewayToken.isEmpty();
    }

    @Getter
    @ToString
    public static class Outbox {
        private final int maxAttempts;
        private final long baseBackoffMs;
        private final long maxBackoffMs;
        private final double jitter;
        private final int breakerThreshold;
        private final long breakerCooldownMs;
        private final int batchSize;
        private final long drainIntervalMs;
        private final boolean schedulerEnabled;

        public Outbox(@DefaultValue("8") int maxAttempts,
                      @DefaultValue("30000") long baseBackoffMs,
                      @DefaultValue("3600000") long maxBackoffMs,
                      @DefaultValue("0.2") double jitter,
                      @DefaultValue("5") int breakerThreshold,
                      @DefaultValue("300000") long breakerCooldownMs,
                      @DefaultValue("50") int batchSize,
                      @DefaultValue("30000") long drainIntervalMs,
                      @DefaultValue("true") boolean schedulerEnabled) {
            this.maxAttempts = Math.max(1, maxAttempts);
            this.baseBackoffMs = Math.max(1L, baseBackoffMs);
            this.maxBackoffMs = Math.max(this.baseBackoffMs, maxBackoffMs);
            this.jitter = Math.min(1.0, Math.max(0.0, jitter));
            this.breakerThreshold = Math.max(1, breakerThreshold);
            this.breakerCooldownMs = Math.max(0L, breakerCooldownMs);
            this.batchSize = Math.max(1, batchSize);
            this.drainIntervalMs = Math.max(1000L, drainIntervalMs);
            this.schedulerEnabled = schedulerEnabled;
        }
    }

    @Getter
    @ToString
    public static class Retention {
        private final int maxPolls;
        private final int maxVotes;
        private final int retentionDays;
        private final long sweepIntervalMs;

        public Retention(@DefaultValue("5000") int maxPolls,
                         @DefaultValue("50000") int maxVotes,
                         @DefaultValue("90") int retentionDays,
                         @DefaultValue("3600000") long sweepIntervalMs) {
            this.maxPolls = Math.max(0, maxPolls);
            this.maxVotes = Math.max(0, maxVotes);
            this.retentionDays = Math.max(0, retentionDays);
            this.sweepIntervalMs = Math.max(1000L, sweepIntervalMs);
        }
    }
}
