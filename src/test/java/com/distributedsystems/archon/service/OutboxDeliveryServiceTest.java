package com.distributedsystems.archon.service;

import com.distributedsystems.archon.client.CoordinatorClient;
import com.distributedsystems.archon.client.DeliveryException;
import com.distributedsystems.archon.model.OutboxEntryEntity;
import com.distributedsystems.archon.model.OutboxOperation;
import com.distributedsystems.archon.model.OutboxStatus;
import com.distributedsystems.archon.service.view.DrainSummary;
import com.distributedsystems.archon.service.view.PollView;
import com.distributedsystems.archon.support.ArchonIntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.TestPropertySource;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@TestPropertySource(properties = {
        "archon.network-enabled=true",
        "archon.gateway-url=https://coordinator.example",
        "archon.outbox.max-attempts=4",
        "archon.outbox.breaker-threshold=5",
        "archon.outbox.breaker-cooldown-ms=60000"
})
class OutboxDeliveryServiceTest extends ArchonIntegrationTest {

    @Autowired
    private OutboxDeliveryService deliveryService;
    @Autowired
    private OutboxService outboxService;
    @Autowired
    private DeliveryBreaker breaker;
    @Autowired
    private PollService pollService;

    @MockBean
    private CoordinatorClient coordinator;

    @BeforeEach
    void deterministicBackoff() {
        breaker.recordSuccess();
        deliveryService.setBackoff(new BackoffPolicy(1_000L, 60_000L, 0.0, () -> 0.5));
    }

    private void coordinatorDown() throws DeliveryException {
        when(coordinator.post(anyString(), anyString())).thenThrow(new DeliveryException("connection refused"));
    }

    private OutboxEntryEntity onlyEntry() {
        List<OutboxEntryEntity> all = outboxRepository.findAll();
        assertThat(all).hasSize(1);
        return all.get(0);
    }

    @Test
    void localMutationsQueueTheirNotificationInTheSameTransaction() {
        identityService.provision(self(), false);

        OutboxEntryEntity entry = onlyEntry();
        assertThat(entry.getOperation()).isEqualTo(OutboxOperation.IDENTITY_GENERATE);
        assertThat(entry.getResourcePath()).isEqualTo(OutboxService.IDENTITY_PATH);
        assertThat(entry.getStatus()).isEqualTo(OutboxStatus.PENDING);
        assertThat(entry.getPayload()).contains("\"did\":\"" + identityRepository.findById(self()).orElseThrow().getDid());
    }

    @Test
    void pollsAndVotesAreQueuedAgainstTheirResources() {
        governanceMember(self());
        PollView poll = pollService.createPoll(self(), "generic", "t", List.of("a", "b"), now() + 60, null);
        pollService.vote(poll.pollId(), "a", "");

        assertThat(outboxRepository.findAll())
                .extracting(OutboxEntryEntity::getOperation, OutboxEntryEntity::getResourcePath)
                .contains(
                        tuple(OutboxOperation.POLL_CREATE, OutboxService.POLLS_PATH),
                        tuple(OutboxOperation.VOTE_SYNC,
                                OutboxService.votesPath(poll.pollId())));
    }

    @Test
    void entriesQueuedInTheSameSecondAreDeliveredInInsertionOrder() throws Exception {
        governanceMember(self());
        List<String> expected = new ArrayList<>(List.of(OutboxService.IDENTITY_PATH));
        for (int i = 0; i < 5; i++) {
            PollView poll = pollService.createPoll(self(), "generic", "t" + i, List.of("a", "b"), now() + 60, null);
            pollService.vote(poll.pollId(), "a", "");
            expected.add(OutboxService.POLLS_PATH);
            expected.add(OutboxService.votesPath(poll.pollId()));
        }

        DrainSummary summary = deliveryService.drain(true);

        assertThat(summary.delivered()).isEqualTo(expected.size());
        ArgumentCaptor<String> paths = ArgumentCaptor.forClass(String.class);
        verify(coordinator, times(expected.size())).post(paths.capture(), anyString());
        assertThat(paths.getAllValues()).containsExactlyElementsOf(expected);
    }

    @Test
    @DisplayName("coordinator down: the local write stands and the entry backs off")
    void unreachableCoordinatorKeepsEntryPendingWithGrowingBackoff() throws Exception {
        coordinatorDown();
        identityService.provision(self(), false);

        deliveryService.drain(true);
        OutboxEntryEntity first = onlyEntry();
        deliveryService.drain(true);
        OutboxEntryEntity second = onlyEntry();

        assertThat(identityRepository.existsById(self())).isTrue();
        assertThat(first.getAttempts()).isEqualTo(1);
        assertThat(second.getAttempts()).isEqualTo(2);
        assertThat(second.getStatus()).isEqualTo(OutboxStatus.PENDING);
        assertThat(second.getLastError()).isEqualTo("connection refused");
        assertThat(first.getNextAttemptAtMs()).isEqualTo(clock.millis() + 1_000L);
        assertThat(second.getNextAttemptAtMs()).isEqualTo(clock.millis() + 2_000L);
    }

    @Test
    void scheduledDrainWaitsForTheRetryTime() throws Exception {
        coordinatorDown();
        identityService.provision(self(), false);
        deliveryService.drain(false);

        assertThat(deliveryService.drain(false).attempted()).isZero();

        clock.advance(Duration.ofSeconds(1));
        assertThat(deliveryService.drain(false).attempted()).isEqualTo(1);
        assertThat(onlyEntry().getAttempts()).isEqualTo(2);
    }

    @Test
    void successfulDeliveryRemovesTheEntry() throws Exception {
        when(coordinator.post(anyString(), anyString())).thenReturn(201);
        identityService.provision(self(), false);

        DrainSummary summary = deliveryService.drain();

        assertThat(summary.delivered()).isEqualTo(1);
        assertThat(summary.results()).singleElement()
                .satisfies(r -> assertThat(r.status()).isEqualTo("DELIVERED"));
        assertThat(outboxRepository.count()).isZero();
        verify(coordinator).post(eq(OutboxService.IDENTITY_PATH), anyString());
    }

    @Test
    void entryIsAbandonedAfterMaxAttemptsAndCanBeRequeued() throws Exception {
        coordinatorDown();
        identityService.provision(self(), false);

        for (int i = 0; i < 4; i++) {
            deliveryService.drain(true);
        }

        OutboxEntryEntity abandoned = onlyEntry();
        assertThat(abandoned.getStatus()).isEqualTo(OutboxStatus.ABANDONED);
        assertThat(abandoned.getAttempts()).isEqualTo(4);
        assertThat(outboxService.status().abandoned()).isEqualTo(1);
        assertThat(deliveryService.drain(true).attempted()).isZero();

        assertThat(outboxService.retryAbandoned()).isEqualTo(1);
        OutboxEntryEntity requeued = onlyEntry();
        assertThat(requeued.getStatus()).isEqualTo(OutboxStatus.PENDING);
        assertThat(requeued.getAttempts()).isZero();
    }

    @Test
    void abandonedEntriesCanBeDropped() throws Exception {
        coordinatorDown();
        identityService.provision(self(), false);
        for (int i = 0; i < 4; i++) {
            deliveryService.drain(true);
        }

        assertThat(outboxService.pruneAbandoned()).isEqualTo(1);
        assertThat(outboxRepository.count()).isZero();
    }

    @Test
    void breakerOpensAfterConsecutiveFailuresAndClosesAfterCooldown() throws Exception {
        coordinatorDown();
        for (int i = 0; i < 6; i++) {
            identityService.provision(newPeer().pubkey(), false);
        }

        DrainSummary first = deliveryService.drain(true);
        assertThat(first.attempted()).isEqualTo(5);
        assertThat(first.skipped()).isEqualTo(1);
        assertThat(first.breakerOpen()).isTrue();

        DrainSummary blocked = deliveryService.drain(true);
        assertThat(blocked.skippedReason()).isEqualTo("breaker_open");
        assertThat(outboxService.status().breakerOpen()).isTrue();

        clock.advance(Duration.ofSeconds(61));
        when(coordinator.post(anyString(), anyString())).thenReturn(200);
        DrainSummary recovered = deliveryService.drain(true);
        assertThat(recovered.delivered()).isEqualTo(6);
        assertThat(outboxService.status().consecutiveFailures()).isZero();
    }

    @Test
    void failedDeliveryLeavesLocalStateAlone() throws Exception {
        coordinatorDown();
        governanceMember(self());
        PollView poll = pollService.createPoll(self(), "ban", "Ban?", List.of("ban", "keep"), now() + 60, null);

        deliveryService.drain(true);

        assertThat(pollRepository.existsById(poll.pollId())).isTrue();
        assertThat(outboxRepository.findAll()).hasSize(2).allMatch(e -> e.getAttempts() == 1);
    }
}
