package com.distributedsystems.archon.service;

import com.distributedsystems.archon.error.ArchonException;
import com.distributedsystems.archon.error.ErrorKind;
import com.distributedsystems.archon.exe.ArchonConfig;
import com.distributedsystems.archon.model.BindingEntity;
import com.distributedsystems.archon.model.BindingKind;
import com.distributedsystems.archon.model.DidHistoryEntity;
import com.distributedsystems.archon.model.IdentityEntity;
import com.distributedsystems.archon.model.OutboxOperation;
import com.distributedsystems.archon.repository.IBindingRepository;
import com.distributedsystems.archon.repository.IDidHistoryRepository;
import com.distributedsystems.archon.repository.IIdentityRepository;
import com.distributedsystems.archon.repository.IPollRepository;
import com.distributedsystems.archon.repository.IVoteRepository;
import com.distributedsystems.archon.service.view.BindingView;
import com.distributedsystems.archon.service.view.DidHistoryView;
import com.distributedsystems.archon.service.view.IdentityStatus;
import com.distributedsystems.archon.service.view.IdentityView;
import com.distributedsystems.archon.signer.SignerAdapter;
import com.distributedsystems.archon.state.NodeState;
import com.distributedsystems.archon.util.CanonicalPayloads;
import com.distributedsystems.archon.util.CryptoUtil;
import com.distributedsystems.archon.util.DidCodec;
import com.distributedsystems.archon.util.IValidator;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Node identities, their DID history and external-key bindings.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdentityService {

    private final IIdentityRepository identityRepository;
    private final IDidHistoryRepository historyRepository;
    private final IBindingRepository bindingRepository;
    private final IPollRepository pollRepository;
    private final IVoteRepository voteRepository;
    private final IValidator validator;
    private final SignerAdapter signer;
    private final OutboxService outboxService;
    private final NodeState nodeState;
    private final ArchonConfig config;
    private final TransactionTemplate tx;

    /**
     * Creates the identity for {@code nodePublicKey} on first call and returns it unchanged on
     * later calls. With {@code reprovision} an existing identity gets the next-generation DID.
     */
    public IdentityView provision(String nodePublicKey, boolean reprovision) {
        String key = validator.nodeKey(nodePublicKey);
        try {
            return tx.execute(status -> provisionInTx(key, reprovision));
        } catch (DataIntegrityViolationException | ConcurrencyFailureException race) {
            if (reprovision) {
                throw new ArchonException(ErrorKind.STORE_UNAVAILABLE, "reprovision failed", race);
            }
            log.debug("[{}] Concurrent provisioning detected: {}", CryptoUtil.shortKey(key), race.getMessage());
            return identityRepository.findById(key)
                    .map(existing -> IdentityView.of(existing, true))
                    .orElseThrow(() -> new ArchonException(ErrorKind.STORE_UNAVAILABLE,
                            "identity write failed", race));
        }
    }

    private IdentityView provisionInTx(String key, boolean reprovision) {
        long now = nodeState.now();
        Optional<IdentityEntity> existing = identityRepository.findForUpdate(key);
        if (existing.isEmpty()) {
            String did = DidCodec.derive(key, 0);
            IdentityEntity created = identityRepository.saveAndFlush(IdentityEntity.builder()
                    .nodePubkey(key)
                    .did(did)
                    .didGeneration(0)
                    .createdAt(now)
                    .updatedAt(now)
                    .build());
            recordIssued(created, now);
            log.info("[{}] Provisioned identity {}", CryptoUtil.shortKey(key), did);
            return IdentityView.of(created, false);
        }

        IdentityEntity identity = existing.get();
        if (!reprovision) {
            return IdentityView.of(identity, true);
        }

        String previousDid = identity.getDid();
        historyRepository.findById(previousDid).ifPresent(h -> {
            h.setSupersededAt(now);
            historyRepository.save(h);
        });
        int generation = identity.getDidGeneration() + 1;
        identity.setDid(DidCodec.derive(key, generation));
        identity.setDidGeneration(generation);
        identity.setUpdatedAt(now);
        identity = identityRepository.saveAndFlush(identity);
        recordIssued(identity, now);
        log.info("[{}] Reprovisioned identity: {} -> {} (generation {})",
                CryptoUtil.shortKey(key), previousDid, identity.getDid(), generation);
        return IdentityView.of(identity, false);
    }

    private void recordIssued(IdentityEntity identity, long now) {
        historyRepository.save(DidHistoryEntity.builder()
                .did(identity.getDid())
                .nodePubkey(identity.getNodePubkey())
                .generation(identity.getDidGeneration())
                .issuedAt(now)
                .build());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("node_pubkey", identity.getNodePubkey());
        body.put("did", identity.getDid());
        body.put("did_generation", identity.getDidGeneration());
        body.put("issued_at", now);
        outboxService.enqueue(OutboxOperation.IDENTITY_GENERATE, identity.getDid(), OutboxService.IDENTITY_PATH, body);
    }

    /**
     * Binds {@code externalKey} to the local node's current DID. A blank {@code did} means that DID.
     */
    public BindingView bind(String did, String kindName, String externalKey) {
        BindingKind kind = validator.bindingKind(kindName);
        String key = validator.externalKey(kind, externalKey);
        String requestedDid = (did == null || did.isBlank()) ? null : validator.did(did);

        String self = nodeState.getSelfPubkey();
        IdentityEntity identity = identityRepository.findById(self)
                .orElseThrow(() -> ArchonException.of(ErrorKind.IDENTITY_NOT_FOUND,
                        "identity not provisioned; run provision-identity first"));
        String targetDid = requestedDid == null ? identity.getDid() : requestedDid;
        if (!targetDid.equals(identity.getDid())) {
            throw ArchonException.of(ErrorKind.DID_NOT_OWNED, "did is not the local node's current identifier");
        }

        long now = nodeState.now();
        String attestation = CanonicalPayloads.attestation(targetDid, kind, key, self, now);
        byte[] message = CanonicalPayloads.utf8(attestation);
        String signature = signer.sign(message);
        if (!signer.verify(message, signature, identity.getNodePubkey())) {
            throw ArchonException.of(ErrorKind.INVALID_SIGNATURE, "attestation signature does not verify for node key");
        }

        return tx.execute(status -> {
            IdentityEntity current = identityRepository.findForUpdate(self)
                    .orElseThrow(() -> ArchonException.of(ErrorKind.IDENTITY_NOT_FOUND, "identity disappeared"));
            if (!current.getDid().equals(targetDid)) {
                throw ArchonException.of(ErrorKind.DID_NOT_OWNED, "did was reprovisioned while binding");
            }
            for (BindingEntity previous : bindingRepository.findByDidAndKindAndSupersededAtIsNull(targetDid, kind)) {
                previous.setSupersededAt(now);
                bindingRepository.save(previous);
            }
            BindingEntity binding = bindingRepository.save(BindingEntity.builder()
                    .bindingId(UUID.randomUUID().toString())
                    .did(targetDid)
                    .kind(kind)
                    .externalKey(key)
                    .attestation(attestation)
                    .signature(signature)
                    .createdAt(now)
                    .build());
            log.info("[{}] Bound {} key {} to {}", nodeState.shortSelf(), kind.wireName(),
                    CryptoUtil.shortKey(key), targetDid);
            return BindingView.of(binding);
        });
    }

    /** {@code cln} binding; a blank key binds the local node key itself. */
    public BindingView bindCln(String did, String externalKey) {
        String key = (externalKey == null || externalKey.isBlank()) ? nodeState.getSelfPubkey() : externalKey;
        return bind(did, BindingKind.CLN.wireName(), key);
    }

    public BindingView bindNostr(String did, String externalKey) {
        return bind(did, BindingKind.NOSTR.wireName(), externalKey);
    }

    /**
     * Aggregate view for {@code did}, which may be a superseded identifier. Blank means the local node.
     */
    @Transactional
    public IdentityStatus status(String did) {
        IdentityEntity identity;
        String requestedDid;
        if (did == null || did.isBlank()) {
            identity = identityRepository.findById(nodeState.getSelfPubkey())
                    .orElseThrow(() -> ArchonException.of(ErrorKind.IDENTITY_NOT_FOUND, "identity not provisioned"));
            requestedDid = identity.getDid();
        } else {
            requestedDid = validator.did(did);
            identity = identityRepository.findByDid(requestedDid)
                    .or(() -> historyRepository.findById(requestedDid)
                            .flatMap(h -> identityRepository.findById(h.getNodePubkey())))
                    .orElseThrow(() -> ArchonException.of(ErrorKind.IDENTITY_NOT_FOUND, "unknown did " + requestedDid));
        }

        List<BindingView> bindings = bindingRepository.findByDidOrderByCreatedAtDesc(requestedDid).stream()
                .map(BindingView::of)
                .toList();
        Map<String, Long> counts = new LinkedHashMap<>();
        for (BindingKind kind : BindingKind.values()) {
            counts.put(kind.wireName(), bindingRepository.countByDidAndKindAndSupersededAtIsNull(requestedDid, kind));
        }
        long now = nodeState.now();
        return new IdentityStatus(
                IdentityView.of(identity, true),
                requestedDid,
                requestedDid.equals(identity.getDid()),
                bindings,
                counts,
                identity.getGovernanceTier().wireName(),
                pollRepository.countByDeadlineGreaterThan(now),
                pollRepository.countByDeadlineLessThanEqual(now),
                voteRepository.count(),
                nodeState.isSyncEnabled(),
                config.getGovernanceMinBondSats());
    }

    /** Every DID issued for {@code nodePubkey}, oldest first. Blank means the local node. */
    public List<DidHistoryView> history(String nodePubkey) {
        String key = (nodePubkey == null || nodePubkey.isBlank())
                ? nodeState.getSelfPubkey()
                : validator.nodeKey(nodePubkey);
        List<DidHistoryView> history = historyRepository.findByNodePubkeyOrderByGenerationAsc(key).stream()
                .map(DidHistoryView::of)
                .toList();
        if (history.isEmpty()) {
            throw ArchonException.of(ErrorKind.IDENTITY_NOT_FOUND, "no identity for " + CryptoUtil.shortKey(key));
        }
        return history;
    }
}
