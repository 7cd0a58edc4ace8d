package com.plansmith.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Impact rating of a {@link Plan.Risk}.
 */
public enum Impact {
    LOW,
    MEDIUM,
    HIGH;

    /**
     * Case-insensitive lookup; blank or unknown values yield empty.
     */
    public static Optional<Impact> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        try {
            return Optional.of(valueOf(raw.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
