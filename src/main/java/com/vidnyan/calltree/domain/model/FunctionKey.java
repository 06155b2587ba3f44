package com.vidnyan.calltree.domain.model;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Identity of a function record within one scan: name plus qualifier set.
 */
public record FunctionKey(String name, Set<Qualifier> qualifiers) {

    public FunctionKey {
        Objects.requireNonNull(name, "name");
        qualifiers = qualifiers.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(qualifiers));
    }

    public static FunctionKey of(String name, Set<Qualifier> qualifiers) {
        return new FunctionKey(name, qualifiers);
    }

    public boolean isStatic() {
        return qualifiers.contains(Qualifier.STATIC);
    }
}
