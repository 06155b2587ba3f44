package com.vidnyan.calltree.adapter.out.parser;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConditionSanitizerTest {

    @Test
    void sanitize_ShouldTrimBraceSemicolonAndWhitespace() {
        assertEquals("ready()", ConditionSanitizer.sanitize("ready() {"));
        assertEquals("x == 1", ConditionSanitizer.sanitize(" x == 1; "));
        assertEquals("a && b", ConditionSanitizer.sanitize("a  &&\n   b"));
    }

    @Test
    void sanitize_ShouldDropSurplusClosingParens() {
        assertEquals("a > b", ConditionSanitizer.sanitize("a > b)"));
        assertEquals("(a > b)", ConditionSanitizer.sanitize("(a > b))"));
    }

    @Test
    void sanitize_ShouldCutPreprocessorResidue() {
        assertEquals("FLAG_ON", ConditionSanitizer.sanitize("FLAG_ON #if 0"));
    }

    @Test
    void sanitize_TooShortOrMissing_ShouldFallBack() {
        assertEquals(ConditionSanitizer.FALLBACK, ConditionSanitizer.sanitize(null));
        assertEquals(ConditionSanitizer.FALLBACK, ConditionSanitizer.sanitize("x"));
        assertEquals(ConditionSanitizer.FALLBACK, ConditionSanitizer.sanitize("  ;"));
    }
}
