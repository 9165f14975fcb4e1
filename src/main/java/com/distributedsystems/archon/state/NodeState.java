package com.distributedsystems.archon.state;

import com.distributedsystems.archon.client.CoordinatorClient;
import com.distributedsystems.archon.exe.ArchonConfig;
import com.distributedsystems.archon.signer.SignerAdapter;
import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Process-wide facts about the local node: its key, the clock, and whether coordinator sync is
 * effectively on after startup validation.
 */
@Slf4j
@Component
public class NodeState {

    private final ArchonConfig config;
    private final SignerAdapter signer;
    private final Clock clock;

    @Getter
    private String selfPubkey;
    @Getter
    private boolean syncEnabled;

    public NodeState(ArchonConfig config, SignerAdapter signer, Clock clock) {
        this.config = config;
        this.signer = signer;
        this.clock = clock;
    }

    @PostConstruct
    void init() {
        selfPubkey = signer.nodePublicKey();
        syncEnabled = config.isNetworkEnabled();
        if (syncEnabled && CoordinatorClient.parseGatewayUrl(config.getGatewayUrl()).isEmpty()) {
            log.warn("[{}] Invalid gateway URL '{}'; disabling coordinator sync",
                    shortSelf(), config.getGatewayUrl());
            syncEnabled = false;
        }
        log.info("[{}] Node state ready: sync={} gateway={} minBond={}sats",
                shortSelf(), syncEnabled, syncEnabled ? config.getGatewayUrl() : "-",
                config.getGovernanceMinBondSats());
    }

    /** Unix seconds. */
    public long now() {
        return clock.millis() / 1000L;
    }

    public long nowMillis() {
        return clock.millis();
    }

    public String shortSelf() {
        return selfPubkey == null ? "?" : selfPubkey.substring(0, Math.min(10, selfPubkey.length()));
    }
}
