package com.distributedsystems.archon.model;

/**
 * PENDING entries are retried by the drain; DELIVERED is reported for an attempt that
 * succeeded (the row itself is deleted); ABANDONED rows wait for an operator.
 */
public enum OutboxStatus {
    PENDING,
    DELIVERED,
    ABANDONED
}
