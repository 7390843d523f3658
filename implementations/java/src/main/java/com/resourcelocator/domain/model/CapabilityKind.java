package com.resourcelocator.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Operation a resource definition grants once its policy is satisfied.
 */
public enum CapabilityKind {
    READ,
    WRITE,
    DELETE,
    SEARCH;

    /**
     * Lenient lookup by action name ({@code "read"}, {@code "WRITE"}, ...).
     */
    public static Optional<CapabilityKind> fromAction(String action) {
        if (action == null) {
            return Optional.empty();
        }
        for (CapabilityKind kind : values()) {
            if (kind.name().equals(action.trim().toUpperCase(Locale.ROOT))) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
