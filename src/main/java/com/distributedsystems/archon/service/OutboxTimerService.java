package com.distributedsystems.archon.service;

import com.distributedsystems.archon.exe.ArchonConfig;
import com.distributedsystems.archon.state.NodeState;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

@Slf4j
@Service
@RequiredArgsConstructor
public class OutboxTimerService {

    private final NodeState nodeState;
    private final OutboxDeliveryService deliveryService;
    private final ArchonConfig config;

    private ScheduledExecutorService scheduler;

    @PostConstruct
    void start() {
        if (!nodeState.isSyncEnabled() || !config.getOutbox().isSchedulerEnabled()) {
            log.info("[{}] Outbox timer not started (sync={}, scheduler={})", nodeState.shortSelf(),
                    nodeState.isSyncEnabled(), config.getOutbox().isSchedulerEnabled());
            return;
        }
        long interval = config.getOutbox().getDrainIntervalMs();
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, "archon-outbox");
            t.setDaemon(true);
            return t;
        };
        scheduler = Executors.newSingleThreadScheduledExecutor(tf);
        scheduler.scheduleWithFixedDelay(this::runDrain, interval, interval, TimeUnit.MILLISECONDS);
        log.info("[{}] Outbox timer armed: interval={}ms", nodeState.shortSelf(), interval);
    }

    @PreDestroy
    void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
    }

    public boolean isRunning() {
        return scheduler != null && !scheduler.isShutdown();
    }

    private void runDrain() {
        try {
            deliveryService.drain();
        } catch (Exception e) {
            log.error("[{}] Outbox drain failed: {}", nodeState.shortSelf(), e.getMessage(), e);
        }
    }
}
