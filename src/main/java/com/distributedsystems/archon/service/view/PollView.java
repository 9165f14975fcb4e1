package com.distributedsystems.archon.service.view;

import com.distributedsystems.archon.model.PollEntity;
import com.fasterxml.jackson.annotation.JsonRawValue;

import java.util.List;

public record PollView(String pollId,
                       String pollType,
                       String title,
                       List<String> options,
                       @JsonRawValue String metadata,
                       long deadline,
                       String status,
                       String createdBy,
                       String creatorDid,
                       long createdAt) {

    public static PollView of(PollEntity p, long nowSeconds) {
        return new PollView(p.getPollId(), p.getPollType().wireName(), p.getTitle(), List.copyOf(p.getOptions()),
                p.getMetadata(), p.getDeadline(), p.statusAt(nowSeconds).wireName(), p.getCreatedBy(),
                p.getCreatorDid(), p.getCreatedAt());
    }
}
