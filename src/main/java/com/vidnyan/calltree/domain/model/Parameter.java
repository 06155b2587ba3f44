package com.vidnyan.calltree.domain.model;

/**
 * A function parameter as written in the signature.
 * Immutable value object.
 */
public record Parameter(
    String name,
    String type,
    boolean pointer,
    boolean constant,
    Wrapper wrapper,
    String memoryClass
) {

    /**
     * AUTOSAR parameter wrapper macro, if the parameter used one.
     */
    public enum Wrapper {
        NONE,
        VAR,
        P2VAR,
        P2CONST,
        CONST
    }

    /**
     * Plain C parameter without memory class annotation.
     */
    public static Parameter plain(String name, String type, boolean pointer, boolean constant) {
        return new Parameter(name, type, pointer, constant, Wrapper.NONE, null);
    }

    /**
     * Format as C-like declaration (e.g., "const uint8* buffer [APPL_DATA]").
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        if (constant) {
            sb.append("const ");
        }
        sb.append(type);
        if (pointer) {
            sb.append('*');
        }
        if (!name.isEmpty()) {
            sb.append(' ').append(name);
        }
        if (memoryClass != null) {
            sb.append(" [").append(memoryClass).append(']');
        }
        return sb.toString();
    }
}
