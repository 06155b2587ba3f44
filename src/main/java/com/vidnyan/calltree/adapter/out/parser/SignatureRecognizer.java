package com.vidnyan.calltree.adapter.out.parser;

import com.vidnyan.calltree.domain.model.FunctionKind;
import com.vidnyan.calltree.domain.model.FunctionSignature;
import com.vidnyan.calltree.domain.model.Parameter;
import com.vidnyan.calltree.domain.model.Qualifier;
import com.vidnyan.calltree.domain.model.SourceLine;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Recognizes function headers in plain C and AUTOSAR macro form.
 * <p>
 * A header is read with a small cursor parser over the logically joined code of
 * the candidate line and the lines after it. If the name or return type is not on
 * the candidate line, up to {@value #MAX_BACKTRACK} preceding lines are pulled in
 * while each looks like a bare type expression.
 */
@Slf4j
public class SignatureRecognizer {

    static final int MAX_HEADER_LINES = 32;
    static final int MAX_BACKTRACK = 3;

    private static final Pattern BARE_TYPE_LINE = Pattern.compile("^[\\w\\s*]+$");

    private static final Set<String> NOT_IN_RETURN_TYPE = Set.of(
            "if", "else", "while", "for", "do", "switch", "case", "default", "return",
            "break", "continue", "goto", "sizeof", "typedef");

    private enum Outcome {
        MATCHED,
        INCOMPLETE,
        MISSING_RETURN_TYPE,
        REJECTED
    }

    private record Header(Outcome outcome, FunctionSignature.Builder builder, int terminatorOffset, boolean definition) {

        static Header of(Outcome outcome) {
            return new Header(outcome, null, -1, false);
        }
    }

    private final SourceNormalizer normalizer;

    public SignatureRecognizer(SourceNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    /**
     * Try to recognize a header starting on line {@code index}.
     *
     * @return the match, or empty if the candidate is not a function header
     */
    public Optional<SignatureMatch> recognize(List<SourceLine> lines, int index) {
        int last = Math.min(lines.size() - 1, index + MAX_HEADER_LINES - 1);
        LogicalLine joined = normalizer.join(lines, index, last);
        Header header = parseHeader(joined.text());

        int from = index;
        int backtracked = 0;
        while (header.outcome() == Outcome.MISSING_RETURN_TYPE && backtracked < MAX_BACKTRACK) {
            int previous = previousCodeLine(lines, from);
            if (previous < 0 || !BARE_TYPE_LINE.matcher(lines.get(previous).code()).matches()) {
                break;
            }
            from = previous;
            backtracked++;
            joined = normalizer.join(lines, from, last);
            header = parseHeader(joined.text());
        }

        // qualifiers written on their own line above the header
        while (header.outcome() == Outcome.MATCHED && backtracked < MAX_BACKTRACK) {
            int previous = previousCodeLine(lines, from);
            if (previous < 0 || !isModifierLine(lines.get(previous).code())) {
                break;
            }
            LogicalLine widened = normalizer.join(lines, previous, last);
            Header reparsed = parseHeader(widened.text());
            if (reparsed.outcome() != Outcome.MATCHED) {
                break;
            }
            from = previous;
            backtracked++;
            joined = widened;
            header = reparsed;
        }

        if (header.outcome() != Outcome.MATCHED) {
            if (header.outcome() != Outcome.REJECTED) {
                log.debug("Unresolved header candidate at line {}: {}", lines.get(index).number(), header.outcome());
            }
            return Optional.empty();
        }

        LogicalLine.Segment end = joined.segmentAt(header.terminatorOffset());
        FunctionSignature signature = header.builder()
                .lines(joined.firstLineNumber(), end.lineNumber())
                .definition(header.definition())
                .build();
        log.debug("Recognized {} {} at line {}",
                signature.definition() ? "definition" : "declaration", signature.name(), signature.startLine());
        return Optional.of(new SignatureMatch(signature, end.lineIndex(), header.terminatorOffset() - end.offset()));
    }

    private static int previousCodeLine(List<SourceLine> lines, int index) {
        for (int i = index - 1; i >= 0; i--) {
            SourceLine line = lines.get(i);
            if (line.directive() || line.isBlank()) {
                continue;
            }
            return i;
        }
        return -1;
    }

    private static boolean isModifierLine(String code) {
        String trimmed = code.strip();
        if (trimmed.isEmpty()) {
            return false;
        }
        for (String token : trimmed.split("\\s+")) {
            if (!CKeywords.LEADING_MODIFIERS.contains(token)) {
                return false;
            }
        }
        return true;
    }

    private Header parseHeader(String s) {
        Cursor cur = new Cursor(s);
        Set<Qualifier> qualifiers = EnumSet.noneOf(Qualifier.class);

        String word = cur.peekIdentifier();
        while (word != null && CKeywords.LEADING_MODIFIERS.contains(word)) {
            if (word.equals("LOCAL_INLINE")) {
                qualifiers.add(Qualifier.STATIC);
                qualifiers.add(Qualifier.INLINE);
            } else {
                Qualifier.fromKeyword(word).ifPresent(qualifiers::add);
            }
            cur.advance(word.length());
            word = cur.peekIdentifier();
        }

        FunctionSignature.Builder builder = FunctionSignature.builder().qualifiers(qualifiers);
        FunctionKind kind = word != null ? FunctionKind.forMacro(word) : null;
        Outcome prefix = kind != null
                ? parseMacroPrefix(cur, word, kind, builder)
                : parsePlainPrefix(cur, builder);
        if (prefix != Outcome.MATCHED) {
            return Header.of(prefix);
        }

        // cursor sits on '(' of the parameter list
        int open = cur.pos;
        int close = ParameterParser.matchingParen(s, open);
        if (close < 0) {
            return Header.of(Outcome.INCOMPLETE);
        }
        String rawParameters = s.substring(open + 1, close).strip().replaceAll("\\s+", " ");
        List<Parameter> parameters = ParameterParser.parse(rawParameters);
        builder.rawParameters(rawParameters).parameters(parameters);

        cur.pos = close + 1;
        cur.skipWhitespace();
        if (cur.atEnd()) {
            return Header.of(Outcome.INCOMPLETE);
        }
        char terminator = cur.peek();
        if (terminator == '{') {
            return new Header(Outcome.MATCHED, builder, cur.pos, true);
        }
        if (terminator == ';') {
            return new Header(Outcome.MATCHED, builder, cur.pos, false);
        }
        return Header.of(Outcome.REJECTED);
    }

    /**
     * FUNC(rettype, memclass) name( or FUNC_P2VAR/FUNC_P2CONST(rettype, ptrclass, memclass) name(
     */
    private Outcome parseMacroPrefix(Cursor cur, String macro, FunctionKind kind, FunctionSignature.Builder builder) {
        cur.advance(macro.length());
        cur.skipWhitespace();
        if (cur.atEnd()) {
            return Outcome.INCOMPLETE;
        }
        if (cur.peek() != '(') {
            return Outcome.REJECTED;
        }
        int close = ParameterParser.matchingParen(cur.text, cur.pos);
        if (close < 0) {
            return Outcome.INCOMPLETE;
        }
        List<String> args = ParameterParser.splitTopLevel(cur.text.substring(cur.pos + 1, close)).stream()
                .map(arg -> arg.strip().replaceAll("\\s+", " "))
                .toList();
        int expected = kind == FunctionKind.AUTOSAR_FUNC ? 2 : 3;
        if (args.size() != expected || args.stream().anyMatch(String::isEmpty)) {
            return Outcome.REJECTED;
        }
        String type = args.get(0);
        switch (kind) {
            case AUTOSAR_FUNC_P2VAR -> builder.returnType(type + "*").pointerClass(args.get(1));
            case AUTOSAR_FUNC_P2CONST -> builder.returnType("const " + type + "*").pointerClass(args.get(1));
            default -> builder.returnType(type);
        }
        builder.kind(kind).memoryClass(args.get(args.size() - 1));

        cur.pos = close + 1;
        String name = cur.peekIdentifier();
        if (name == null) {
            return cur.atEnd() ? Outcome.INCOMPLETE : Outcome.REJECTED;
        }
        if (CKeywords.isReserved(name)) {
            return Outcome.REJECTED;
        }
        cur.advance(name.length());
        cur.skipWhitespace();
        if (cur.atEnd()) {
            return Outcome.INCOMPLETE;
        }
        if (cur.peek() != '(') {
            return Outcome.REJECTED;
        }
        builder.name(name);
        return Outcome.MATCHED;
    }

    /**
     * Identifiers and '*' up to the parameter list; the last identifier is the name.
     */
    private Outcome parsePlainPrefix(Cursor cur, FunctionSignature.Builder builder) {
        List<String> tokens = new ArrayList<>();
        while (true) {
            cur.skipWhitespace();
            if (cur.atEnd()) {
                return Outcome.INCOMPLETE;
            }
            char c = cur.peek();
            if (c == '(') {
                break;
            }
            if (c == '*') {
                tokens.add("*");
                cur.advance(1);
                continue;
            }
            String word = cur.peekIdentifier();
            if (word == null) {
                return Outcome.REJECTED;
            }
            tokens.add(word);
            cur.advance(word.length());
        }

        if (tokens.isEmpty()) {
            return Outcome.MISSING_RETURN_TYPE;
        }
        String name = tokens.get(tokens.size() - 1);
        if (name.equals("*") || CKeywords.isReserved(name)) {
            return Outcome.REJECTED;
        }
        List<String> returnTokens = tokens.subList(0, tokens.size() - 1);
        if (returnTokens.stream().anyMatch(NOT_IN_RETURN_TYPE::contains)) {
            return Outcome.REJECTED;
        }
        if (returnTokens.stream().noneMatch(t -> !t.equals("*"))) {
            return Outcome.MISSING_RETURN_TYPE;
        }
        builder.name(name)
                .kind(FunctionKind.TRADITIONAL_C)
                .returnType(String.join(" ", returnTokens).replace(" *", "*"));
        return Outcome.MATCHED;
    }

    private static final class Cursor {
        private final String text;
        private int pos;

        Cursor(String text) {
            this.text = text;
        }

        boolean atEnd() {
            return pos >= text.length();
        }

        char peek() {
            return text.charAt(pos);
        }

        void advance(int n) {
            pos += n;
        }

        void skipWhitespace() {
            while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
                pos++;
            }
        }

        /**
         * Identifier after any whitespace, leaving the cursor on its first character.
         */
        String peekIdentifier() {
            skipWhitespace();
            if (atEnd() || !CKeywords.isIdentifierStart(peek())) {
                return null;
            }
            int end = pos + 1;
            while (end < text.length() && CKeywords.isIdentifierPart(text.charAt(end))) {
                end++;
            }
            return text.substring(pos, end);
        }
    }
}
