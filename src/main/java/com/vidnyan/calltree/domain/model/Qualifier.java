package com.vidnyan.calltree.domain.model;

import java.util.Optional;

/**
 * Storage and inlining qualifiers that take part in function identity.
 */
public enum Qualifier {
    STATIC,
    INLINE;

    /**
     * Map a C or AUTOSAR qualifier keyword.
     */
    public static Optional<Qualifier> fromKeyword(String keyword) {
        return switch (keyword) {
            case "static", "STATIC" -> Optional.of(STATIC);
            case "inline", "__inline", "__inline__", "INLINE" -> Optional.of(INLINE);
            default -> Optional.empty();
        };
    }
}
