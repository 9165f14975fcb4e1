package com.distributedsystems.archon.service;

import com.distributedsystems.archon.support.ArchonIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.TestPropertySource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@TestPropertySource(properties = {
        "archon.network-enabled=true",
        "archon.gateway-url=ftp://coordinator.example"
})
class OutboxSyncDisabledTest extends ArchonIntegrationTest {

    @Autowired
    private OutboxDeliveryService deliveryService;
    @Autowired
    private OutboxService outboxService;
    @Autowired
    private PollService pollService;
    @Autowired
    private OutboxTimerService timerService;

    @Test
    void invalidGatewayUrlTurnsSyncOffAndNothingIsQueued() {
        assertThat(nodeState.isSyncEnabled()).isFalse();
        assertThat(timerService.isRunning()).isFalse();

        governanceMember(self());
        pollService.createPoll(self(), "generic", "t", List.of("a", "b"), now() + 60, null);

        assertThat(outboxRepository.count()).isZero();
        assertThat(deliveryService.drain().skippedReason()).isEqualTo("sync_disabled");
        assertThat(outboxService.status().syncEnabled()).isFalse();
    }
}
