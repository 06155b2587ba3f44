package com.vidnyan.calltree.adapter.out.parser;

import java.util.Objects;

/**
 * Flags callees that go through the Runtime-Environment interface layer,
 * recognized by their name prefix. Metadata only.
 */
public final class RteClassifier {

    public static final String DEFAULT_PREFIX = "Rte_";

    private final String prefix;

    public RteClassifier(String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        if (prefix.isBlank()) {
            throw new IllegalArgumentException("RTE prefix must not be blank");
        }
        this.prefix = prefix;
    }

    public static RteClassifier standard() {
        return new RteClassifier(DEFAULT_PREFIX);
    }

    public boolean isRte(String callee) {
        return callee != null && callee.length() > prefix.length() && callee.startsWith(prefix);
    }

    public String prefix() {
        return prefix;
    }
}
