package com.distributedsystems.archon.service;

import com.distributedsystems.archon.state.NodeState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class RetentionSweepService {

    private final PollService pollService;
    private final NodeState nodeState;

    @Scheduled(initialDelayString = "${archon.retention.sweep-interval-ms:3600000}",
            fixedDelayString = "${archon.retention.sweep-interval-ms:3600000}")
    public void sweep() {
        try {
            pollService.prune(null);
        } catch (Exception e) {
            log.error("[{}] Retention sweep failed: {}", nodeState.shortSelf(), e.getMessage(), e);
        }
    }
}
