package com.distributedsystems.archon.service;

import com.distributedsystems.archon.model.OutboxEntryEntity;
import com.distributedsystems.archon.model.OutboxStatus;
import com.distributedsystems.archon.service.view.DrainSummary;
import com.distributedsystems.archon.support.ArchonIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.TestPropertySource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * A gateway that resolves to a loopback address is never contacted; entries stay queued.
 */
@TestPropertySource(properties = {
        "archon.network-enabled=true",
        "archon.gateway-url=http://127.0.0.1:9"
})
class OutboxPrivateGatewayTest extends ArchonIntegrationTest {

    @Autowired
    private OutboxDeliveryService deliveryService;
    @Autowired
    private DeliveryBreaker breaker;

    @Test
    void loopbackGatewayIsRefusedAndEntryStaysPending() {
        breaker.recordSuccess();
        identityService.provision(self(), false);

        DrainSummary summary = deliveryService.drain(true);

        assertThat(summary.failed()).isEqualTo(1);
        OutboxEntryEntity entry = outboxRepository.findAll().get(0);
        assertThat(entry.getStatus()).isEqualTo(OutboxStatus.PENDING);
        assertThat(entry.getLastError()).contains("non-routable").contains("127.0.0.1");
        assertThat(identityRepository.existsById(self())).isTrue();
    }
}
