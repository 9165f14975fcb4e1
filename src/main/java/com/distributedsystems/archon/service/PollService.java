package com.distributedsystems.archon.service;

import com.distributedsystems.archon.error.ArchonException;
import com.distributedsystems.archon.error.ErrorKind;
import com.distributedsystems.archon.exe.ArchonConfig;
import com.distributedsystems.archon.model.Choice;
import com.distributedsystems.archon.model.IdentityEntity;
import com.distributedsystems.archon.model.OutboxOperation;
import com.distributedsystems.archon.model.PollEntity;
import com.distributedsystems.archon.model.PollStatus;
import com.distributedsystems.archon.model.PollType;
import com.distributedsystems.archon.model.VoteEntity;
import com.distributedsystems.archon.persistence.VoteLedger;
import com.distributedsystems.archon.repository.IPollRepository;
import com.distributedsystems.archon.repository.IVoteRepository;
import com.distributedsystems.archon.service.view.PollStatusView;
import com.distributedsystems.archon.service.view.PollView;
import com.distributedsystems.archon.service.view.PruneResult;
import com.distributedsystems.archon.service.view.Tally;
import com.distributedsystems.archon.service.view.VoteView;
import com.distributedsystems.archon.signer.SignerAdapter;
import com.distributedsystems.archon.state.NodeState;
import com.distributedsystems.archon.util.CanonicalPayloads;
import com.distributedsystems.archon.util.CryptoUtil;
import com.distributedsystems.archon.util.IValidator;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Poll lifecycle and ballot casting. Poll status is a function of the deadline and the clock.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PollService {

    private static final int PRUNE_CHUNK = 100;
    private static final long SECONDS_PER_DAY = 86_400L;

    private final IPollRepository pollRepository;
    private final IVoteRepository voteRepository;
    private final VoteLedger voteLedger;
    private final GovernanceService governanceService;
    private final OutboxService outboxService;
    private final SignerAdapter signer;
    private final IValidator validator;
    private final NodeState nodeState;
    private final ArchonConfig config;
    private final TransactionTemplate tx;

    public PollView createPoll(String creatorPubkey, String pollType, String title, List<?> options,
                               long deadline, Map<String, ?> metadata) {
        String creator = validator.nodeKey(creatorPubkey);
        IdentityEntity identity = governanceService.requireGovernance(creator);

        PollType type = validator.pollType(pollType);
        String cleanTitle = validator.title(title);
        List<String> cleanOptions = validator.options(options);
        long now = nodeState.now();
        long cleanDeadline = validator.deadline(deadline, now);
        String metadataJson = validator.metadata(metadata);

        PollEntity poll = tx.execute(status -> {
            PollEntity saved = pollRepository.save(PollEntity.builder()
                    .pollId(UUID.randomUUID().toString())
                    .pollType(type)
                    .title(cleanTitle)
                    .options(cleanOptions)
                    .metadata(metadataJson)
                    .deadline(cleanDeadline)
                    .createdBy(creator)
                    .creatorDid(identity.getDid())
                    .createdAt(now)
                    .build());

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("poll_id", saved.getPollId());
            body.put("poll_type", type.wireName());
            body.put("title", cleanTitle);
            body.put("options", cleanOptions);
            body.put("deadline", cleanDeadline);
            body.put("metadata", metadata == null ? Map.of() : metadata);
            body.put("creator", creator);
            body.put("creator_did", identity.getDid());
            body.put("created_at", now);
            outboxService.enqueue(OutboxOperation.POLL_CREATE, saved.getPollId(), OutboxService.POLLS_PATH, body);
            return saved;
        });

        log.info("[{}] Created {} poll {} '{}' with {} options, deadline {}", CryptoUtil.shortKey(creator),
                type.wireName(), poll.getPollId(), cleanTitle, cleanOptions.size(), cleanDeadline);
        return PollView.of(poll, now);
    }

    /**
     * Records a signed ballot for {@code voterPubkey}. At most one ballot per voter and poll
     * ever commits; losers of a concurrent race get {@code DUPLICATE_VOTE}.
     */
    public VoteView castVote(String pollId, String voterPubkey, Choice choice, String reason, String signature) {
        String cleanReason = validator.reason(reason);
        String voter = validator.nodeKey(voterPubkey);
        IdentityEntity identity = governanceService.requireGovernance(voter);
        PollEntity poll = findPoll(pollId);

        long now = nodeState.now();
        if (poll.statusAt(now) != PollStatus.ACTIVE) {
            throw ArchonException.of(ErrorKind.POLL_CLOSED, "poll deadline has passed");
        }
        if (choice == null || !choice.fits(poll.getOptions().size())) {
            throw ArchonException.of(ErrorKind.INVALID_CHOICE,
                    "choice must be an option index below " + poll.getOptions().size() + " or spoil");
        }
        byte[] ballot = CanonicalPayloads.utf8(CanonicalPayloads.ballot(poll.getPollId(), voter, choice, cleanReason));
        if (signature == null || signature.isBlank() || !signer.verify(ballot, signature, voter)) {
            throw ArchonException.of(ErrorKind.INVALID_SIGNATURE, "ballot signature does not verify for voter key");
        }

        VoteEntity vote = VoteEntity.builder()
                .voteId(UUID.randomUUID().toString())
                .pollId(poll.getPollId())
                .voterPubkey(voter)
                .voterDid(identity.getDid())
                .choiceIndex(choice.index())
                .reason(cleanReason)
                .signature(signature)
                .votedAt(now)
                .build();
        try {
            return VoteView.of(voteLedger.append(vote, now), poll.getOptions());
        } catch (DataIntegrityViolationException e) {
            // vote ids are fresh, so only the (poll, voter) key can collide
            log.debug("[{}] Lost concurrent vote race on {}", CryptoUtil.shortKey(voter), poll.getPollId());
            throw new ArchonException(ErrorKind.DUPLICATE_VOTE, "already voted on this poll", e);
        } catch (ConcurrencyFailureException e) {
            if (voteRepository.existsByPollIdAndVoterPubkey(poll.getPollId(), voter)) {
                throw new ArchonException(ErrorKind.DUPLICATE_VOTE, "already voted on this poll", e);
            }
            throw new ArchonException(ErrorKind.STORE_UNAVAILABLE, "vote could not be stored: " + e.getMessage(), e);
        }
    }

    /**
     * Votes as the local node: resolves {@code choiceText} against the poll's options (or
     * {@code spoil}), signs the ballot and casts it.
     */
    public VoteView vote(String pollId, String choiceText, String reason) {
        String cleanReason = validator.reason(reason);
        String self = nodeState.getSelfPubkey();
        governanceService.requireGovernance(self);
        PollEntity poll = findPoll(pollId);
        Choice choice = Choice.resolve(choiceText, poll.getOptions())
                .orElseThrow(() -> ArchonException.of(ErrorKind.INVALID_CHOICE,
                        "choice must be one of " + poll.getOptions() + " or spoil"));
        if (poll.statusAt(nodeState.now()) != PollStatus.ACTIVE) {
            throw ArchonException.of(ErrorKind.POLL_CLOSED, "poll deadline has passed");
        }
        String signature = signer.sign(CanonicalPayloads.utf8(
                CanonicalPayloads.ballot(poll.getPollId(), self, choice, cleanReason)));
        return castVote(poll.getPollId(), self, choice, cleanReason, signature);
    }

    public Tally tally(String pollId) {
        return tally(findPoll(pollId));
    }

    private Tally tally(PollEntity poll) {
        Map<Integer, Long> byIndex = new HashMap<>();
        for (Object[] row : voteRepository.countByChoice(poll.getPollId())) {
            byIndex.put(((Number) row[0]).intValue(), ((Number) row[1]).longValue());
        }
        Map<String, Long> counts = new LinkedHashMap<>();
        long counted = 0L;
        List<String> options = poll.getOptions();
        for (int i = 0; i < options.size(); i++) {
            long n = byIndex.getOrDefault(i, 0L);
            counts.put(options.get(i), n);
            counted += n;
        }
        long spoiled = byIndex.getOrDefault(Choice.SPOILED_INDEX, 0L);
        return new Tally(counts, spoiled, counted + spoiled);
    }

    @Transactional
    public PollStatusView pollStatus(String pollId) {
        PollEntity poll = findPoll(pollId);
        List<VoteView> votes = voteRepository.findByPollIdOrderByVotedAtAscVoteIdAsc(poll.getPollId()).stream()
                .map(v -> VoteView.of(v, poll.getOptions()))
                .toList();
        return new PollStatusView(PollView.of(poll, nodeState.now()), tally(poll), votes);
    }

    /** Most recent ballots of {@code voterPubkey} (blank = local node), newest first. */
    @Transactional
    public List<VoteView> myVotes(String voterPubkey, Integer limit) {
        int cap = validator.voteLimit(limit);
        String voter = (voterPubkey == null || voterPubkey.isBlank())
                ? nodeState.getSelfPubkey()
                : validator.nodeKey(voterPubkey);
        List<VoteEntity> votes = voteRepository.findByVoterPubkeyOrderByVotedAtDescVoteIdDesc(voter, PageRequest.of(0, cap));
        Map<String, PollEntity> polls = pollRepository.findAllById(
                        votes.stream().map(VoteEntity::getPollId).distinct().toList()).stream()
                .collect(Collectors.toMap(PollEntity::getPollId, Function.identity()));
        return votes.stream()
                .map(v -> {
                    PollEntity p = polls.get(v.getPollId());
                    return VoteView.of(v, p == null ? null : p.getOptions());
                })
                .toList();
    }

    /**
     * Deletes closed polls (with their votes), oldest deadline first: those past the retention
     * window, then as many as needed to bring both tables within their caps. Active polls are
     * never removed.
     */
    @Transactional
    public PruneResult prune(Integer retentionDaysOverride) {
        if (retentionDaysOverride != null && retentionDaysOverride < 0) {
            throw ArchonException.of(ErrorKind.INVALID_REQUEST, "retention_days must be >= 0");
        }
        int retentionDays = retentionDaysOverride != null
                ? retentionDaysOverride
                : config.getRetention().getRetentionDays();
        long now = nodeState.now();
        int pollsRemoved = 0;
        int votesRemoved = 0;

        if (retentionDays > 0) {
            long cutoff = now - retentionDays * SECONDS_PER_DAY;
            List<String> expired = pollRepository.findClosedPollIdsBefore(now, cutoff);
            for (int from = 0; from < expired.size(); from += PRUNE_CHUNK) {
                List<String> chunk = expired.subList(from, Math.min(expired.size(), from + PRUNE_CHUNK));
                votesRemoved += voteRepository.deleteByPollIds(chunk);
                pollsRemoved += pollRepository.deleteByPollIds(chunk);
            }
        }

        long maxPolls = config.getRetention().getMaxPolls();
        long maxVotes = config.getRetention().getMaxVotes();
        long pollCount = pollRepository.count();
        long voteCount = voteRepository.count();
        while (pollCount > maxPolls || voteCount > maxVotes) {
            List<String> oldest = pollRepository.findClosedPollIds(now, PageRequest.of(0, PRUNE_CHUNK));
            if (oldest.isEmpty()) {
                log.warn("[{}] Store over capacity ({} polls, {} votes) but no closed polls left to prune",
                        nodeState.shortSelf(), pollCount, voteCount);
                break;
            }
            List<String> victims = new ArrayList<>();
            long pollExcess = pollCount - maxPolls;
            long voteExcess = voteCount - maxVotes;
            for (String id : oldest) {
                if (pollExcess <= 0 && voteExcess <= 0) break;
                victims.add(id);
                pollExcess--;
                voteExcess -= voteRepository.countByPollId(id);
            }
            int votes = voteRepository.deleteByPollIds(victims);
            int polls = pollRepository.deleteByPollIds(victims);
            votesRemoved += votes;
            pollsRemoved += polls;
            pollCount -= polls;
            voteCount -= votes;
        }

        if (pollsRemoved > 0) {
            log.info("[{}] Pruned {} closed polls and {} votes", nodeState.shortSelf(), pollsRemoved, votesRemoved);
        }
        return new PruneResult(pollsRemoved, votesRemoved, pollRepository.count(), voteRepository.count());
    }

    private PollEntity findPoll(String pollId) {
        if (pollId == null || pollId.isBlank()) {
            throw ArchonException.of(ErrorKind.POLL_NOT_FOUND, "poll_id is required");
        }
        return pollRepository.findById(pollId.trim())
                .orElseThrow(() -> ArchonException.of(ErrorKind.POLL_NOT_FOUND, "poll not found"));
    }
}
