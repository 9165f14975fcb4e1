package com.distributedsystems.archon.model;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * A ballot choice: a zero-based option index or the spoil marker.
 */
public record Choice(int index) {

    public static final String SPOIL_MARKER = "spoil";
    public static final int SPOILED_INDEX = -1;

    public Choice {
        if (index < SPOILED_INDEX) {
            throw new IllegalArgumentException("choice index must be >= 0 or the spoil marker");
        }
    }

    public static Choice spoil() {
        return new Choice(SPOILED_INDEX);
    }

    public static Choice option(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("option index must be >= 0");
        }
        return new Choice(index);
    }

    public boolean isSpoiled() {
        return index == SPOILED_INDEX;
    }

    public boolean fits(int optionCount) {
        return isSpoiled() || index < optionCount;
    }

    /** Value used in canonical ballot payloads: the index, or {@code "spoil"}. */
    public Object wireValue() {
        return isSpoiled() ? SPOIL_MARKER : (Object) index;
    }

    public String label(List<String> options) {
        if (isSpoiled()) return SPOIL_MARKER;
        return index < options.size() ? options.get(index) : String.valueOf(index);
    }

    /** Resolves option text (or the spoil marker, any case) against a poll's options. */
    public static Optional<Choice> resolve(String raw, List<String> options) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        String value = raw.trim();
        if (SPOIL_MARKER.equals(value.toLowerCase(Locale.ROOT))) {
            return Optional.of(spoil());
        }
        int idx = options.indexOf(value);
        return idx >= 0 ? Optional.of(option(idx)) : Optional.empty();
    }
}
