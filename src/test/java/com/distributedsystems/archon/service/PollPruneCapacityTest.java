package com.distributedsystems.archon.service;

import com.distributedsystems.archon.model.Choice;
import com.distributedsystems.archon.service.view.PruneResult;
import com.distributedsystems.archon.support.ArchonIntegrationTest;
import com.distributedsystems.archon.util.CanonicalPayloads;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.TestPropertySource;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@TestPropertySource(properties = {
        "archon.retention.max-polls=3",
        "archon.retention.max-votes=4",
        "archon.retention.retention-days=0"
})
class PollPruneCapacityTest extends ArchonIntegrationTest {

    @Autowired
    private PollService pollService;

    @BeforeEach
    void selfIsGovernanceMember() {
        governanceMember(self());
    }

    private String poll(long secondsFromNow) {
        return pollService.createPoll(self(), "generic", "t", List.of("a", "b"), now() + secondsFromNow, null)
                .pollId();
    }

    private void votes(String pollId, int count) throws Exception {
        for (int i = 0; i < count; i++) {
            Peer peer = newPeer();
            governanceMember(peer.pubkey());
            String sig = peer.sign(CanonicalPayloads.ballot(pollId, peer.pubkey(), Choice.option(0), ""));
            pollService.castVote(pollId, peer.pubkey(), Choice.option(0), "", sig);
        }
    }

    @Test
    void removesOldestClosedPollsUntilWithinPollCap() throws Exception {
        String first = poll(100);
        String second = poll(200);
        String third = poll(300);
        String open1 = poll(10_000);
        String open2 = poll(20_000);
        votes(first, 2);
        votes(second, 1);
        clock.advance(Duration.ofSeconds(400));

        PruneResult result = pollService.prune(null);

        assertThat(result.pollsRemoved()).isEqualTo(2);
        assertThat(result.votesRemoved()).isEqualTo(3);
        assertThat(result.pollsRemaining()).isEqualTo(3);
        assertThat(pollRepository.findAllById(List.of(first, second, third, open1, open2)))
                .extracting("pollId")
                .containsExactlyInAnyOrder(third, open1, open2);
    }

    @Test
    void removesClosedPollsWhenVotesExceedTheirCap() throws Exception {
        String closing = poll(100);
        String open = poll(10_000);
        votes(closing, 3);
        votes(open, 3);
        clock.advance(Duration.ofSeconds(200));

        PruneResult result = pollService.prune(null);

        assertThat(result.pollsRemoved()).isEqualTo(1);
        assertThat(result.votesRemaining()).isEqualTo(3);
        assertThat(pollRepository.existsById(open)).isTrue();
    }

    @Test
    void activePollsSurviveEvenOverCapacity() {
        for (int i = 0; i < 5; i++) {
            poll(10_000 + i);
        }

        PruneResult result = pollService.prune(null);

        assertThat(result.pollsRemoved()).isZero();
        assertThat(result.pollsRemaining()).isEqualTo(5);
    }
}
