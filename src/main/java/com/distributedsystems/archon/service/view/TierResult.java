package com.distributedsystems.archon.service.view;

public record TierResult(String nodePubkey,
                         String did,
                         String previousTier,
                         String governanceTier,
                         long bondSats,
                         Long verifiedBondSats,
                         Long bondVerifiedAt) {
}
