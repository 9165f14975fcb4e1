package com.distributedsystems.archon.service.view;

import com.distributedsystems.archon.model.DidHistoryEntity;

public record DidHistoryView(String did, int generation, long issuedAt, Long supersededAt, boolean current) {

    public static DidHistoryView of(DidHistoryEntity e) {
        return new DidHistoryView(e.getDid(), e.getGeneration(), e.getIssuedAt(), e.getSupersededAt(), e.isCurrent());
    }
}
