package com.distributedsystems.archon.service;

import com.distributedsystems.archon.client.CoordinatorClient;
import com.distributedsystems.archon.client.DeliveryException;
import com.distributedsystems.archon.exe.ArchonConfig;
import com.distributedsystems.archon.model.OutboxEntryEntity;
import com.distributedsystems.archon.model.OutboxStatus;
import com.distributedsystems.archon.repository.IOutboxRepository;
import com.distributedsystems.archon.service.view.DeliveryResult;
import com.distributedsystems.archon.service.view.DrainSummary;
import com.distributedsystems.archon.state.NodeState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Delivers due outbox entries to the coordinator, one at a time and outside any transaction.
 */
@Slf4j
@Service
public class OutboxDeliveryService {

    static final int MAX_ERROR_LEN = 500;

    private final IOutboxRepository outboxRepository;
    private final CoordinatorClient coordinatorClient;
    private final DeliveryBreaker breaker;
    private final NodeState nodeState;
    private final TransactionTemplate tx;
    private final int batchSize;
    private final int maxAttempts;
    private final AtomicBoolean draining = new AtomicBoolean(false);

    private BackoffPolicy backoff;

    public OutboxDeliveryService(IOutboxRepository outboxRepository,
                                 CoordinatorClient coordinatorClient,
                                 DeliveryBreaker breaker,
                                 NodeState nodeState,
                                 TransactionTemplate tx,
                                 ArchonConfig config) {
        this.outboxRepository = outboxRepository;
        this.coordinatorClient = coordinatorClient;
        this.breaker = breaker;
        this.nodeState = nodeState;
        this.tx = tx;
        this.batchSize = config.getOutbox().getBatchSize();
        this.maxAttempts = config.getOutbox().getMaxAttempts();
        this.backoff = BackoffPolicy.from(config.getOutbox());
    }

    void setBackoff(BackoffPolicy backoff) {
        this.backoff = backoff;
    }

    public DrainSummary drain() {
        return drain(false);
    }

    /**
     * @param force attempt pending entries even if their retry time has not come yet; the
     *              breaker is still honoured
     */
    public DrainSummary drain(boolean force) {
        if (!nodeState.isSyncEnabled()) {
            return DrainSummary.skipped("sync_disabled", false);
        }
        if (!draining.compareAndSet(false, true)) {
            return DrainSummary.skipped("drain_in_progress", breaker.isOpen(nodeState.nowMillis()));
        }
        try {
            return drainBatch(force);
        } finally {
            draining.set(false);
        }
    }

    private DrainSummary drainBatch(boolean force) {
        long startMs = nodeState.nowMillis();
        if (breaker.isOpen(startMs)) {
            return DrainSummary.skipped("breaker_open", true);
        }

        List<OutboxEntryEntity> due = force
                ? outboxRepository.findOldest(OutboxStatus.PENDING, PageRequest.of(0, batchSize))
                : outboxRepository.findDue(OutboxStatus.PENDING, startMs, PageRequest.of(0, batchSize));
        List<DeliveryResult> results = new ArrayList<>(due.size());
        int attempted = 0;
        int delivered = 0;
        int failed = 0;
        int abandoned = 0;
        int skipped = 0;

        for (OutboxEntryEntity entry : due) {
            if (breaker.isOpen(nodeState.nowMillis())) {
                skipped++;
                continue;
            }
            attempted++;
            try {
                coordinatorClient.post(entry.getResourcePath(), entry.getPayload());
                tx.executeWithoutResult(status -> outboxRepository.deleteById(entry.getSeq()));
                breaker.recordSuccess();
                delivered++;
                results.add(new DeliveryResult(entry.getEntryId(), entry.getOperation().name(),
                        OutboxStatus.DELIVERED.name(), entry.getAttempts() + 1, null));
                log.info("[{}] Delivered {} {}", nodeState.shortSelf(), entry.getOperation(), entry.getEntityId());
            } catch (DeliveryException e) {
                DeliveryResult result = recordFailure(entry.getSeq(), e.getMessage());
                breaker.recordFailure(nodeState.nowMillis());
                if (result == null) {
                    continue;
                }
                results.add(result);
                failed++;
                if (OutboxStatus.ABANDONED.name().equals(result.status())) {
                    abandoned++;
                }
            }
        }

        if (attempted > 0) {
            log.info("[{}] Outbox drain: attempted={} delivered={} failed={} abandoned={} skipped={}",
                    nodeState.shortSelf(), attempted, delivered, failed, abandoned, skipped);
        }
        return new DrainSummary(null, attempted, delivered, failed, abandoned, skipped,
                breaker.isOpen(nodeState.nowMillis()), List.copyOf(results));
    }

    private DeliveryResult recordFailure(Long seq, String error) {
        return tx.execute(status -> {
            OutboxEntryEntity entry = outboxRepository.findById(seq).orElse(null);
            if (entry == null) {
                return null;
            }
            long nowMs = nodeState.nowMillis();
            int attempts = entry.getAttempts() + 1;
            entry.setAttempts(attempts);
            entry.setLastError(truncate(error));
            entry.setUpdatedAt(nowMs / 1000L);
            if (attempts >= maxAttempts) {
                entry.setStatus(OutboxStatus.ABANDONED);
                log.warn("[{}] Abandoning {} {} after {} attempts: {}", nodeState.shortSelf(),
                        entry.getOperation(), entry.getEntityId(), attempts, entry.getLastError());
            } else {
                long delay = backoff.delayMs(attempts);
                entry.setNextAttemptAtMs(nowMs + delay);
                log.warn("[{}] Delivery of {} {} failed (attempt {}), retry in {} ms: {}", nodeState.shortSelf(),
                        entry.getOperation(), entry.getEntityId(), attempts, delay, entry.getLastError());
            }
            outboxRepository.save(entry);
            return new DeliveryResult(entry.getEntryId(), entry.getOperation().name(),
                    entry.getStatus().name(), attempts, entry.getLastError());
        });
    }

    static String truncate(String error) {
        String value = error == null || error.isBlank() ? "unknown error" : error;
        return value.length() <= MAX_ERROR_LEN ? value : value.substring(0, MAX_ERROR_LEN);
    }
}
