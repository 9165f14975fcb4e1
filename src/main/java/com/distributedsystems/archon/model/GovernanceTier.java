package com.distributedsystems.archon.model;

import java.util.Locale;
import java.util.Optional;

public enum GovernanceTier {
    BASIC,
    GOVERNANCE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<GovernanceTier> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        for (GovernanceTier tier : values()) {
            if (tier.wireName().equals(raw.trim().toLowerCase(Locale.ROOT))) {
                return Optional.of(tier);
            }
        }
        return Optional.empty();
    }
}
