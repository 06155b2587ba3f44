package com.vidnyan.calltree.domain.model;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * A recognized function header, either a definition (followed by a body) or a
 * declaration (terminated by ';').
 * Immutable value object.
 */
public record FunctionSignature(
    String name,
    String returnType,
    Set<Qualifier> qualifiers,
    FunctionKind kind,
    String memoryClass,
    String pointerClass,
    List<Parameter> parameters,
    String rawParameters,
    int startLine,
    int endLine,
    boolean definition
) {

    public FunctionSignature {
        qualifiers = qualifiers.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(qualifiers));
        parameters = List.copyOf(parameters);
    }

    public FunctionKey key() {
        return FunctionKey.of(name, qualifiers);
    }

    public boolean isStatic() {
        return qualifiers.contains(Qualifier.STATIC);
    }

    public boolean isInline() {
        return qualifiers.contains(Qualifier.INLINE);
    }

    /**
     * Build signature string (e.g., "uint8 Com_Read(uint16 id, uint8* data)").
     */
    public String format() {
        String params = parameters.isEmpty()
                ? "void"
                : String.join(", ", parameters.stream().map(Parameter::format).toList());
        return returnType + " " + name + "(" + params + ")";
    }

    /**
     * Builder for FunctionSignature.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String returnType = "void";
        private Set<Qualifier> qualifiers = EnumSet.noneOf(Qualifier.class);
        private FunctionKind kind = FunctionKind.TRADITIONAL_C;
        private String memoryClass;
        private String pointerClass;
        private List<Parameter> parameters = List.of();
        private String rawParameters = "";
        private int startLine;
        private int endLine;
        private boolean definition;

        public Builder name(String name) { this.name = name; return this; }
        public Builder returnType(String type) { this.returnType = type; return this; }
        public Builder qualifiers(Set<Qualifier> qualifiers) { this.qualifiers = qualifiers; return this; }
        public Builder kind(FunctionKind kind) { this.kind = kind; return this; }
        public Builder memoryClass(String memoryClass) { this.memoryClass = memoryClass; return this; }
        public Builder pointerClass(String pointerClass) { this.pointerClass = pointerClass; return this; }
        public Builder parameters(List<Parameter> parameters) { this.parameters = parameters; return this; }
        public Builder rawParameters(String raw) { this.rawParameters = raw; return this; }
        public Builder lines(int start, int end) { this.startLine = start; this.endLine = end; return this; }
        public Builder definition(boolean definition) { this.definition = definition; return this; }

        public FunctionSignature build() {
            return new FunctionSignature(name, returnType, qualifiers, kind, memoryClass, pointerClass,
                    parameters, rawParameters, startLine, endLine, definition);
        }
    }
}
