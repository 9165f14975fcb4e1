package com.distributedsystems.archon.service;

import com.distributedsystems.archon.model.OutboxEntryEntity;
import com.distributedsystems.archon.model.OutboxOperation;
import com.distributedsystems.archon.model.OutboxStatus;
import com.distributedsystems.archon.repository.IOutboxRepository;
import com.distributedsystems.archon.service.view.OutboxStatusView;
import com.distributedsystems.archon.state.NodeState;
import com.distributedsystems.archon.util.CanonicalPayloads;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.UUID;

/**
 * Durable queue of coordinator notifications. Entries are written in the same transaction as
 * the local mutation they describe.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutboxService {

    public static final String IDENTITY_PATH = "/api/v1/did/generate";
    public static final String POLLS_PATH = "/api/v1/polls";

    private final IOutboxRepository outboxRepository;
    private final NodeState nodeState;
    private final DeliveryBreaker breaker;

    public static String votesPath(String pollId) {
        return POLLS_PATH + "/" + URLEncoder.encode(pollId, StandardCharsets.UTF_8).replace("+", "%20") + "/votes";
    }

    @Transactional(Transactional.TxType.MANDATORY)
    public void enqueue(OutboxOperation operation, String entityId, String resourcePath, Map<String, ?> body) {
        if (!nodeState.isSyncEnabled()) {
            return;
        }
        String payload;
        try {
            payload = CanonicalPayloads.json(body);
        } catch (IllegalArgumentException e) {
            log.warn("[{}] Skipping {} outbox entry for {}: {}",
                    nodeState.shortSelf(), operation, entityId, e.getMessage());
            return;
        }
        long nowMs = nodeState.nowMillis();
        OutboxEntryEntity entry = OutboxEntryEntity.builder()
                .entryId(UUID.randomUUID().toString())
                .operation(operation)
                .entityId(entityId)
                .resourcePath(resourcePath)
                .payload(payload)
                .attempts(0)
                .nextAttemptAtMs(nowMs)
                .status(OutboxStatus.PENDING)
                .createdAt(nowMs / 1000L)
                .updatedAt(nowMs / 1000L)
                .build();
        outboxRepository.save(entry);
        log.debug("[{}] Queued {} for {}", nodeState.shortSelf(), operation, entityId);
    }

    public OutboxStatusView status() {
        long nowMs = nodeState.nowMillis();
        return new OutboxStatusView(
                nodeState.isSyncEnabled(),
                outboxRepository.countByStatus(OutboxStatus.PENDING),
                outboxRepository.countByStatus(OutboxStatus.ABANDONED),
                breaker.consecutiveFailures(),
                breaker.isOpen(nowMs),
                breaker.openUntilMs());
    }

    @Transactional
    public int retryAbandoned() {
        long nowMs = nodeState.nowMillis();
        int moved = outboxRepository.requeue(OutboxStatus.ABANDONED, OutboxStatus.PENDING, nowMs, nowMs / 1000L);
        if (moved > 0) {
            log.info("[{}] Re-queued {} abandoned outbox entries", nodeState.shortSelf(), moved);
        }
        return moved;
    }

    @Transactional
    public int pruneAbandoned() {
        int removed = outboxRepository.deleteByStatusBulk(OutboxStatus.ABANDONED);
        if (removed > 0) {
            log.info("[{}] Pruned {} abandoned outbox entries", nodeState.shortSelf(), removed);
        }
        return removed;
    }
}
