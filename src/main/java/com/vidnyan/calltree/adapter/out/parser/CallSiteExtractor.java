package com.vidnyan.calltree.adapter.out.parser;

import com.vidnyan.calltree.domain.model.SourceLine;

import java.util.Set;

/**
 * Walks the code of a line and turns it into events for the {@link ScopeTracker}.
 * <p>
 * A call is an identifier followed by '(' on the same line that is not a keyword,
 * a known type name (a cast such as {@code uint8(x)}), a wrapper macro or a value
 * macro. Literal content is already blanked, so parentheses inside strings are
 * never seen.
 */
class CallSiteExtractor {

    static final Set<String> HEADER_KEYWORDS = Set.of("if", "else", "for", "while", "do", "switch");

    /**
     * Scan {@code line} from {@code fromColumn} to its end.
     */
    void scan(SourceLine line, int lineIndex, int fromColumn, ScopeTracker scopes) {
        String code = line.code();
        int n = code.length();
        int i = Math.max(0, fromColumn);
        while (i < n) {
            char c = code.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            if (CKeywords.isIdentifierStart(c)) {
                int end = i + 1;
                while (end < n && CKeywords.isIdentifierPart(code.charAt(end))) {
                    end++;
                }
                String word = code.substring(i, end);
                identifier(word, code, lineIndex, i, end, scopes);
                i = end;
                continue;
            }
            if (Character.isDigit(c)) {
                int end = i + 1;
                while (end < n && (CKeywords.isIdentifierPart(code.charAt(end)) || code.charAt(end) == '.')) {
                    end++;
                }
                scopes.token(lineIndex, i);
                i = end;
                continue;
            }
            switch (c) {
                case '(' -> scopes.openParen(lineIndex, i);
                case ')' -> scopes.closeParen(lineIndex, i);
                case '{' -> scopes.openBrace(lineIndex, i);
                case '}' -> scopes.closeBrace(lineIndex, i);
                case ';' -> scopes.semicolon(lineIndex, i);
                default -> scopes.token(lineIndex, i);
            }
            i++;
        }
    }

    private void identifier(String word, String code, int lineIndex, int start, int end, ScopeTracker scopes) {
        if (!scopes.inFunction()) {
            scopes.token(lineIndex, start);
            return;
        }
        if (HEADER_KEYWORDS.contains(word)) {
            scopes.keyword(word, lineIndex, start);
            return;
        }
        scopes.token(lineIndex, start);
        if (followedByParen(code, end) && !CKeywords.isReserved(word)) {
            scopes.call(word, lineIndex);
        }
    }

    private static boolean followedByParen(String code, int from) {
        int i = from;
        while (i < code.length() && Character.isWhitespace(code.charAt(i))) {
            i++;
        }
        return i < code.length() && code.charAt(i) == '(';
    }
}
