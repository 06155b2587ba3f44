package com.vidnyan.calltree.domain.model;

/**
 * One physical line after comment removal.
 * <p>
 * {@code text} keeps string and character literal content; {@code code} has the
 * same length with literal content blanked out, so column positions line up and
 * structural scanning never sees characters that live inside a literal.
 */
public record SourceLine(
    int number,
    String text,
    String code,
    boolean commentStripped,
    boolean directive
) {

    public boolean isBlank() {
        return code.isBlank();
    }
}
