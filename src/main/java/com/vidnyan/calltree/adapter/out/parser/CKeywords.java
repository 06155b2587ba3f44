package com.vidnyan.calltree.adapter.out.parser;

import java.util.Set;

/**
 * Name sets shared by the signature recognizer and the call-site extractor.
 */
final class CKeywords {

    static final Set<String> KEYWORDS = Set.of(
            "if", "else", "while", "for", "do", "switch", "case", "default",
            "return", "break", "continue", "goto", "sizeof", "typedef",
            "struct", "union", "enum", "const", "volatile", "static", "extern",
            "auto", "register", "inline", "__inline", "__inline__", "restrict",
            "__restrict", "__restrict__", "_Bool", "_Complex", "_Imaginary",
            "_Alignas", "_Alignof", "_Atomic", "_Static_assert", "_Noreturn",
            "_Thread_local", "_Generic", "__attribute__", "__asm__", "asm");

    static final Set<String> PRIMITIVE_TYPES = Set.of(
            "void", "char", "short", "int", "long", "float", "double", "signed", "unsigned",
            "bool", "size_t", "ptrdiff_t",
            "int8_t", "int16_t", "int32_t", "int64_t",
            "uint8_t", "uint16_t", "uint32_t", "uint64_t",
            "uint8", "uint16", "uint32", "uint64",
            "sint8", "sint16", "sint32", "sint64",
            "uint8_least", "uint16_least", "uint32_least",
            "sint8_least", "sint16_least", "sint32_least",
            "boolean", "Boolean", "float32", "float64",
            "Std_ReturnType", "StatusType");

    /** AUTOSAR compiler-abstraction macros wrapping functions, variables and pointers. */
    static final Set<String> WRAPPER_MACROS = Set.of(
            "FUNC", "FUNC_P2VAR", "FUNC_P2CONST",
            "VAR", "P2VAR", "P2CONST", "CONST", "CONSTP2VAR", "CONSTP2CONST",
            "P2FUNC", "CONSTP2FUNC");

    /** Function-like value macros that are never calls. */
    static final Set<String> VALUE_MACROS = Set.of(
            "INT8_C", "INT16_C", "INT32_C", "INT64_C",
            "UINT8_C", "UINT16_C", "UINT32_C", "UINT64_C",
            "INTMAX_C", "UINTMAX_C",
            "TS_MAKEREF2CFG", "TS_MAKENULLREF2CFG", "TS_MAKEREFLIST2CFG",
            "STD_ON", "STD_OFF");

    /** Qualifier-like tokens accepted in front of a plain C return type. */
    static final Set<String> LEADING_MODIFIERS = Set.of(
            "static", "STATIC", "inline", "__inline", "__inline__", "INLINE", "LOCAL_INLINE", "extern");

    private CKeywords() {
    }

    /**
     * Integer-literal style macros such as UINT32_C.
     */
    static boolean isValueMacro(String name) {
        if (VALUE_MACROS.contains(name)) {
            return true;
        }
        return name.endsWith("_C") && name.equals(name.toUpperCase());
    }

    /**
     * True if the name can never be a function name or callee.
     */
    static boolean isReserved(String name) {
        return KEYWORDS.contains(name)
                || PRIMITIVE_TYPES.contains(name)
                || WRAPPER_MACROS.contains(name)
                || isValueMacro(name);
    }

    static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
