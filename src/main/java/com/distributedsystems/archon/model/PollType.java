package com.distributedsystems.archon.model;

import java.util.Locale;
import java.util.Optional;

public enum PollType {
    EXPANSION,
    BAN,
    GENERIC;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<PollType> parse(String raw) {
        if (raw == null) return Optional.empty();
        String value = raw.trim().toLowerCase(Locale.ROOT);
        for (PollType type : values()) {
            if (type.wireName().equals(value)) return Optional.of(type);
        }
        return Optional.empty();
    }
}
