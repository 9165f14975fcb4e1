package com.distributedsystems.archon.service.view;

import com.distributedsystems.archon.model.BindingEntity;

public record BindingView(String bindingId,
                          String did,
                          String kind,
                          String externalKey,
                          String attestation,
                          String signature,
                          long createdAt,
                          Long supersededAt,
                          boolean active) {

    public static BindingView of(BindingEntity e) {
        return new BindingView(e.getBindingId(), e.getDid(), e.getKind().wireName(), e.getExternalKey(),
                e.getAttestation(), e.getSignature(), e.getCreatedAt(), e.getSupersededAt(), e.isActive());
    }
}
