package com.distributedsystems.archon.controller;

import com.distributedsystems.archon.controller.dto.BindRequestDTO;
import com.distributedsystems.archon.controller.dto.DidRequestDTO;
import com.distributedsystems.archon.controller.dto.MyVotesRequestDTO;
import com.distributedsystems.archon.controller.dto.PollCreateRequestDTO;
import com.distributedsystems.archon.controller.dto.PollIdRequestDTO;
import com.distributedsystems.archon.controller.dto.ProcessOutboxRequestDTO;
import com.distributedsystems.archon.controller.dto.ProvisionRequestDTO;
import com.distributedsystems.archon.controller.dto.PruneRequestDTO;
import com.distributedsystems.archon.controller.dto.SignMessageRequestDTO;
import com.distributedsystems.archon.controller.dto.UpgradeRequestDTO;
import com.distributedsystems.archon.controller.dto.VoteRequestDTO;
import com.distributedsystems.archon.error.ArchonException;
import com.distributedsystems.archon.error.ErrorKind;
import com.distributedsystems.archon.service.GovernanceService;
import com.distributedsystems.archon.service.IdentityService;
import com.distributedsystems.archon.service.OutboxDeliveryService;
import com.distributedsystems.archon.service.OutboxService;
import com.distributedsystems.archon.service.PollService;
import com.distributedsystems.archon.service.view.BindingView;
import com.distributedsystems.archon.service.view.DidHistoryView;
import com.distributedsystems.archon.service.view.DrainSummary;
import com.distributedsystems.archon.service.view.IdentityStatus;
import com.distributedsystems.archon.service.view.IdentityView;
import com.distributedsystems.archon.service.view.OutboxStatusView;
import com.distributedsystems.archon.service.view.PollStatusView;
import com.distributedsystems.archon.service.view.PollView;
import com.distributedsystems.archon.service.view.PruneResult;
import com.distributedsystems.archon.service.view.TierResult;
import com.distributedsystems.archon.service.view.VoteView;
import com.distributedsystems.archon.signer.SignerAdapter;
import com.distributedsystems.archon.state.NodeState;
import com.distributedsystems.archon.util.CanonicalPayloads;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * JSON-over-HTTP dispatch for the node operator. Every method acts for the local node.
 */
@Slf4j
@RestController
@RequestMapping("/rpc")
@RequiredArgsConstructor
public class ArchonRpcController {

    private final IdentityService identityService;
    private final GovernanceService governanceService;
    private final PollService pollService;
    private final OutboxService outboxService;
    private final OutboxDeliveryService deliveryService;
    private final SignerAdapter signer;
    private final NodeState nodeState;

    @PostMapping("/provision-identity")
    public IdentityView provision(@RequestBody(required = false) ProvisionRequestDTO dto) {
        boolean reprovision = dto != null && dto.wantsReprovision();
        return identityService.provision(nodeState.getSelfPubkey(), reprovision);
    }

    @PostMapping("/status")
    public IdentityStatus status(@RequestBody(required = false) DidRequestDTO dto) {
        return identityService.status(dto == null ? null : dto.getDid());
    }

    @PostMapping("/identity-history")
    public HistoryResponse history() {
        String self = nodeState.getSelfPubkey();
        return new HistoryResponse(self, identityService.history(self));
    }

    @PostMapping("/bind-nostr")
    public BindingView bindNostr(@RequestBody BindRequestDTO dto) {
        return identityService.bindNostr(dto.getDid(), dto.getPubkey());
    }

    @PostMapping("/bind-cln")
    public BindingView bindCln(@RequestBody(required = false) BindRequestDTO dto) {
        return dto == null
                ? identityService.bindCln(null, null)
                : identityService.bindCln(dto.getDid(), dto.getPubkey());
    }

    @PostMapping("/upgrade")
    public TierResult upgrade(@RequestBody UpgradeRequestDTO dto) {
        return governanceService.upgrade(nodeState.getSelfPubkey(), dto.getTargetTier(), dto.getBondSats());
    }

    @PostMapping("/sign-message")
    public SignatureResponse signMessage(@RequestBody SignMessageRequestDTO dto) {
        if (dto.getMessage() == null) {
            throw ArchonException.of(ErrorKind.INVALID_REQUEST, "message is required");
        }
        String signature = signer.sign(CanonicalPayloads.utf8(dto.getMessage()));
        return new SignatureResponse(signature, signer.nodePublicKey());
    }

    @PostMapping("/poll-create")
    public PollView pollCreate(@RequestBody PollCreateRequestDTO dto) {
        if (dto.getDeadline() == null) {
            throw ArchonException.of(ErrorKind.INVALID_DEADLINE, "deadline is required");
        }
        return pollService.createPoll(nodeState.getSelfPubkey(), dto.getPollType(), dto.getTitle(),
                dto.getOptions(), dto.getDeadline(), dto.getMetadata());
    }

    @PostMapping("/poll-status")
    public PollStatusView pollStatus(@RequestBody PollIdRequestDTO dto) {
        return pollService.pollStatus(dto.getPollId());
    }

    @PostMapping("/vote")
    public VoteView vote(@RequestBody VoteRequestDTO dto) {
        return pollService.vote(dto.getPollId(), dto.getChoice(), dto.getReason());
    }

    @PostMapping("/my-votes")
    public MyVotesResponse myVotes(@RequestBody(required = false) MyVotesRequestDTO dto) {
        Integer limit = dto == null ? null : dto.getLimit();
        List<VoteView> votes = pollService.myVotes(null, limit);
        return new MyVotesResponse(nodeState.getSelfPubkey(), votes.size(), votes);
    }

    @PostMapping("/prune")
    public PruneResult prune(@RequestBody(required = false) PruneRequestDTO dto) {
        return pollService.prune(dto == null ? null : dto.getRetentionDays());
    }

    @PostMapping("/process-outbox")
    public DrainSummary processOutbox(@RequestBody(required = false) ProcessOutboxRequestDTO dto) {
        return deliveryService.drain(dto == null || dto.isForce());
    }

    @PostMapping("/outbox-status")
    public OutboxStatusView outboxStatus() {
        return outboxService.status();
    }

    @PostMapping("/outbox-retry")
    public CountResponse outboxRetry() {
        return new CountResponse(outboxService.retryAbandoned());
    }

    @PostMapping("/outbox-prune")
    public CountResponse outboxPrune() {
        return new CountResponse(outboxService.pruneAbandoned());
    }

    public record HistoryResponse(String nodePubkey, List<DidHistoryView> history) {}

    public record SignatureResponse(String signature, String pubkey) {}

    public record MyVotesResponse(String voter, int count, List<VoteView> votes) {}

    public record CountResponse(int count) {}
}
