package com.vidnyan.calltree.domain.model;

/**
 * Dialect a function definition was written in.
 */
public enum FunctionKind {
    TRADITIONAL_C,
    AUTOSAR_FUNC,
    AUTOSAR_FUNC_P2VAR,
    AUTOSAR_FUNC_P2CONST;

    public boolean isAutosar() {
        return this != TRADITIONAL_C;
    }

    /**
     * Kind for a function wrapper macro name, or null if the name is not one.
     */
    public static FunctionKind forMacro(String macro) {
        return switch (macro) {
            case "FUNC" -> AUTOSAR_FUNC;
            case "FUNC_P2VAR" -> AUTOSAR_FUNC_P2VAR;
            case "FUNC_P2CONST" -> AUTOSAR_FUNC_P2CONST;
            default -> null;
        };
    }
}
