package com.distributedsystems.archon.model;

public enum OutboxOperation {
    IDENTITY_GENERATE,
    POLL_CREATE,
    VOTE_SYNC
}
