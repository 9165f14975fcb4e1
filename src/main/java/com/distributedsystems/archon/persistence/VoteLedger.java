package com.distributedsystems.archon.persistence;

import com.distributedsystems.archon.error.ArchonException;
import com.distributedsystems.archon.error.ErrorKind;
import com.distributedsystems.archon.model.OutboxOperation;
import com.distributedsystems.archon.model.PollEntity;
import com.distributedsystems.archon.model.PollStatus;
import com.distributedsystems.archon.model.VoteEntity;
import com.distributedsystems.archon.repository.IPollRepository;
import com.distributedsystems.archon.repository.IVoteRepository;
import com.distributedsystems.archon.service.OutboxService;
import com.distributedsystems.archon.util.CryptoUtil;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Append-only ballot store. The (poll, voter) unique constraint is the final arbiter between
 * concurrent casts; callers translate the resulting integrity violation.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VoteLedger {

    private final IVoteRepository voteRepository;
    private final IPollRepository pollRepository;
    private final OutboxService outboxService;

    /**
     * Inserts {@code vote} and queues its coordinator sync in one transaction.
     *
     * @throws org.springframework.dao.DataIntegrityViolationException when the voter already
     *         has a ballot on the poll and the insert lost the race
     */
    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public VoteEntity append(VoteEntity vote, long nowSeconds) {
        PollEntity poll = pollRepository.findById(vote.getPollId())
                .orElseThrow(() -> ArchonException.of(ErrorKind.POLL_NOT_FOUND, "poll not found"));
        if (poll.statusAt(nowSeconds) != PollStatus.ACTIVE) {
            throw ArchonException.of(ErrorKind.POLL_CLOSED, "poll deadline has passed");
        }
        if (voteRepository.existsByPollIdAndVoterPubkey(vote.getPollId(), vote.getVoterPubkey())) {
            throw ArchonException.of(ErrorKind.DUPLICATE_VOTE, "already voted on this poll");
        }

        VoteEntity saved = voteRepository.saveAndFlush(vote);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("vote_id", saved.getVoteId());
        body.put("poll_id", saved.getPollId());
        body.put("voter", saved.getVoterPubkey());
        body.put("voter_did", saved.getVoterDid());
        body.put("choice", saved.choice().wireValue());
        body.put("reason", saved.getReason());
        body.put("signature", saved.getSignature());
        body.put("voted_at", saved.getVotedAt());
        outboxService.enqueue(OutboxOperation.VOTE_SYNC, saved.getVoteId(),
                OutboxService.votesPath(saved.getPollId()), body);

        log.info("[{}] Recorded vote on poll {} (choice {})",
                CryptoUtil.shortKey(saved.getVoterPubkey()), saved.getPollId(), saved.choice().wireValue());
        return saved;
    }
}
