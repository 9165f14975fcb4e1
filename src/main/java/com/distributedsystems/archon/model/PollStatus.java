package com.distributedsystems.archon.model;

import java.util.Locale;

/**
 * Derived from the deadline on every read; there is no stored status column.
 */
public enum PollStatus {
    ACTIVE,
    CLOSED;

    public static PollStatus at(long deadline, long nowSeconds) {
        return nowSeconds < deadline ? ACTIVE : CLOSED;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
