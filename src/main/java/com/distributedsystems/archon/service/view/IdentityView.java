package com.distributedsystems.archon.service.view;

import com.distributedsystems.archon.model.IdentityEntity;

public record IdentityView(String nodePubkey,
                           String did,
                           int didGeneration,
                           String governanceTier,
                           long bondSats,
                           Long bondVerifiedAt,
                           long createdAt,
                           long updatedAt,
                           boolean alreadyProvisioned) {

    public static IdentityView of(IdentityEntity e, boolean alreadyProvisioned) {
        return new IdentityView(e.getNodePubkey(), e.getDid(), e.getDidGeneration(),
                e.getGovernanceTier().wireName(), e.getBondSats(), e.getBondVerifiedAt(),
                e.getCreatedAt(), e.getUpdatedAt(), alreadyProvisioned);
    }
}
