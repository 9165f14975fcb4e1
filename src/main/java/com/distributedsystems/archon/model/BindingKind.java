package com.distributedsystems.archon.model;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * External keyspaces a DID can be bound to. Each kind owns the exact format its keys must
 * have; adding a namespace means adding a constant here.
 */
public enum BindingKind {

    /** x-only schnorr key, 32 bytes hex. */
    NOSTR(Pattern.compile("^[0-9a-fA-F]{64}$"), "64 hex chars"),

    /** compressed secp256k1 node key, 33 bytes hex. */
    CLN(Pattern.compile("^0[23][0-9a-fA-F]{64}$"), "66-char compressed secp256k1 pubkey");

    private final Pattern format;
    private final String formatDescription;

    BindingKind(Pattern format, String formatDescription) {
        this.format = format;
        this.formatDescription = formatDescription;
    }

    public boolean accepts(String externalKey) {
        return externalKey != null && format.matcher(externalKey).matches();
    }

    public String formatDescription() {
        return formatDescription;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<BindingKind> parse(String raw) {
        if (raw == null) return Optional.empty();
        String value = raw.trim().toLowerCase(Locale.ROOT);
        for (BindingKind kind : values()) {
            if (kind.wireName().equals(value)) return Optional.of(kind);
        }
        return Optional.empty();
    }
}
