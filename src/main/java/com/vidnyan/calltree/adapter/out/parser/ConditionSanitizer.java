package com.vidnyan.calltree.adapter.out.parser;

/**
 * Cleans condition text taken from an if/while/for header so it can be shown as
 * a label next to a call edge.
 */
final class ConditionSanitizer {

    static final String FALLBACK = "condition";

    private ConditionSanitizer() {
    }

    static String sanitize(String raw) {
        if (raw == null) {
            return FALLBACK;
        }
        String s = raw;

        int hash = s.indexOf('#');
        if (hash >= 0) {
            s = s.substring(0, hash);
        }
        int brace = s.indexOf('{');
        if (brace >= 0) {
            s = s.substring(0, brace);
        }
        s = s.strip();
        while (s.endsWith(";")) {
            s = s.substring(0, s.length() - 1).strip();
        }

        s = dropExtraClosingParens(s);
        s = s.replaceAll("\\s+", " ").strip();

        return s.length() < 3 ? FALLBACK : s;
    }

    /**
     * Remove surplus ')' characters, rightmost first.
     */
    private static String dropExtraClosingParens(String s) {
        int open = 0;
        int close = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '(') {
                open++;
            } else if (c == ')') {
                close++;
            }
        }
        int surplus = close - open;
        if (surplus <= 0) {
            return s;
        }
        StringBuilder sb = new StringBuilder(s);
        for (int i = sb.length() - 1; i >= 0 && surplus > 0; i--) {
            if (sb.charAt(i) == ')') {
                sb.deleteCharAt(i);
                surplus--;
            }
        }
        return sb.toString().strip();
    }
}
