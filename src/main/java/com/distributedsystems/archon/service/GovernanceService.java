package com.distributedsystems.archon.service;

import com.distributedsystems.archon.client.ChannelBalanceClient;
import com.distributedsystems.archon.error.ArchonException;
import com.distributedsystems.archon.error.ErrorKind;
import com.distributedsystems.archon.exe.ArchonConfig;
import com.distributedsystems.archon.model.GovernanceTier;
import com.distributedsystems.archon.model.IdentityEntity;
import com.distributedsystems.archon.repository.IIdentityRepository;
import com.distributedsystems.archon.service.view.TierResult;
import com.distributedsystems.archon.state.NodeState;
import com.distributedsystems.archon.util.CryptoUtil;
import com.distributedsystems.archon.util.IValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Tier changes. Promotion to governance is granted only after the ledger confirms the claimed
 * bond; any doubt leaves the tier where it was.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GovernanceService {

    private final IIdentityRepository identityRepository;
    private final ChannelBalanceClient balanceClient;
    private final IValidator validator;
    private final NodeState nodeState;
    private final ArchonConfig config;
    private final TransactionTemplate tx;

    public TierResult upgrade(String nodePubkey, String targetTier, long claimedBondSats) {
        String key = validator.nodeKey(nodePubkey);
        GovernanceTier target = GovernanceTier.parse(targetTier)
                .orElseThrow(() -> ArchonException.of(ErrorKind.INVALID_TIER,
                        "invalid target_tier (valid: basic, governance)"));
        if (claimedBondSats < 0) {
            throw ArchonException.of(ErrorKind.INVALID_REQUEST, "bond_sats must be >= 0");
        }
        identityRepository.findById(key).orElseThrow(() -> ArchonException.of(ErrorKind.IDENTITY_NOT_FOUND,
                "identity not provisioned; run provision-identity first"));

        if (target == GovernanceTier.BASIC) {
            return applyTier(key, GovernanceTier.BASIC, null, null);
        }

        long threshold = config.getGovernanceMinBondSats();
        if (claimedBondSats < threshold) {
            throw ArchonException.of(ErrorKind.INSUFFICIENT_BOND,
                    "insufficient bond for governance tier (required " + threshold + " sats)");
        }

        long actual = queryBond(key);
        if (actual < claimedBondSats - config.getBondToleranceSats()) {
            log.warn("[{}] Bond claim {} sats not backed by ledger ({} sats)",
                    CryptoUtil.shortKey(key), claimedBondSats, actual);
            throw ArchonException.of(ErrorKind.BOND_VERIFICATION_FAILED,
                    "ledger balance " + actual + " sats does not support claimed " + claimedBondSats + " sats");
        }
        if (actual < threshold) {
            throw ArchonException.of(ErrorKind.INSUFFICIENT_BOND,
                    "ledger balance " + actual + " sats below required " + threshold + " sats");
        }
        return applyTier(key, GovernanceTier.GOVERNANCE, claimedBondSats, actual);
    }

    private long queryBond(String key) {
        try {
            return balanceClient.totalBondedSats(key);
        } catch (ChannelBalanceClient.BalanceQueryException | RuntimeException e) {
            log.warn("[{}] Bond verification failed: {}", CryptoUtil.shortKey(key), e.getMessage());
            throw new ArchonException(ErrorKind.BOND_VERIFICATION_FAILED,
                    "could not verify bond: " + e.getMessage(), e);
        }
    }

    private TierResult applyTier(String key, GovernanceTier tier, Long bondSats, Long verifiedSats) {
        return tx.execute(status -> {
            IdentityEntity identity = identityRepository.findForUpdate(key)
                    .orElseThrow(() -> ArchonException.of(ErrorKind.IDENTITY_NOT_FOUND, "identity not provisioned"));
            GovernanceTier previous = identity.getGovernanceTier();
            long now = nodeState.now();
            identity.setGovernanceTier(tier);
            if (bondSats != null) {
                identity.setBondSats(bondSats);
                identity.setBondVerifiedAt(now);
            }
            identity.setUpdatedAt(now);
            identityRepository.save(identity);
            if (previous != tier) {
                log.info("[{}] Governance tier {} -> {}", CryptoUtil.shortKey(key),
                        previous.wireName(), tier.wireName());
            }
            return new TierResult(key, identity.getDid(), previous.wireName(), tier.wireName(),
                    identity.getBondSats(), verifiedSats, identity.getBondVerifiedAt());
        });
    }

    /**
     * @return the identity, which is guaranteed to hold the governance tier
     */
    public IdentityEntity requireGovernance(String nodePubkey) {
        IdentityEntity identity = identityRepository.findById(nodePubkey)
                .orElseThrow(() -> ArchonException.of(ErrorKind.IDENTITY_NOT_FOUND,
                        "identity not provisioned; run provision-identity first"));
        if (identity.getGovernanceTier() != GovernanceTier.GOVERNANCE) {
            throw ArchonException.of(ErrorKind.INSUFFICIENT_TIER,
                    "governance tier required; run upgrade target_tier=governance");
        }
        return identity;
    }
}
