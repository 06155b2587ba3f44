package com.vidnyan.calltree.adapter.out.parser;

import com.vidnyan.calltree.domain.model.CallSite;
import com.vidnyan.calltree.domain.model.FunctionRecord;
import com.vidnyan.calltree.domain.model.SourceLine;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.BiConsumer;

/**
 * Brace-nesting state for one file.
 * <p>
 * Fed structural events (braces, parentheses, semicolons, control keywords and
 * other tokens) in source order by the {@link CallSiteExtractor}. Keeps a stack
 * of {@link ScopeFrame}s and at most one pending {@link ControlHeader}, and
 * emits each call site with the conditional/loop context in effect.
 * <p>
 * Malformed headers never stop the scan: a missing condition, unbalanced
 * parentheses or a missing brace still produce a best-effort frame, and a header
 * that runs past {@value #MAX_HEADER_LINES} lines is dropped.
 */
@Slf4j
class ScopeTracker {

    static final int MAX_HEADER_LINES = 32;

    private final List<SourceLine> lines;
    private final BiConsumer<FunctionRecord, CallSite> sink;
    private final Deque<ScopeFrame> frames = new ArrayDeque<>();
    private final List<String> diagnostics = new ArrayList<>();
    private ControlHeader header;

    ScopeTracker(List<SourceLine> lines, BiConsumer<FunctionRecord, CallSite> sink) {
        this.lines = lines;
        this.sink = sink;
    }

    // ---- state

    boolean inFunction() {
        ScopeFrame top = frames.peek();
        return top != null && top.function() != null;
    }

    List<String> diagnostics() {
        return diagnostics;
    }

    /**
     * Frames still open, innermost first. Only braced frames count as unclosed.
     */
    List<ScopeFrame> openFrames() {
        return frames.stream().filter(ScopeFrame::braced).toList();
    }

    // ---- events

    /**
     * A confirmed definition's body brace.
     */
    void enterFunction(FunctionRecord record, int lineIndex) {
        header = null;
        frames.push(ScopeFrame.function(record, number(lineIndex)));
    }

    void keyword(String keyword, int lineIndex, int column) {
        expireHeader(lineIndex);
        ControlHeader.Kind kind = ControlHeader.Kind.forKeyword(keyword);
        if (header != null && header.phase == ControlHeader.Phase.AWAIT_BODY) {
            if (header.kind == ControlHeader.Kind.ELSE && kind == ControlHeader.Kind.IF) {
                header.kind = ControlHeader.Kind.ELSE_IF;
                header.phase = ControlHeader.Phase.AWAIT_PAREN;
                header.conditionText = null;
                return;
            }
            pushHeaderFrame(false, lineIndex);
        } else if (header != null) {
            // a control keyword inside a condition is malformed; keep the newer statement
            dropHeader("control keyword '" + keyword + "' inside condition");
        }
        header = new ControlHeader(kind, lineIndex);
        header.startLine = lineIndex;
        header.startColumn = column + keyword.length();
    }

    void openParen(int lineIndex, int column) {
        expireHeader(lineIndex);
        if (header == null) {
            return;
        }
        switch (header.phase) {
            case AWAIT_PAREN -> {
                header.phase = ControlHeader.Phase.CONDITION;
                header.parenDepth = 1;
                header.startLine = lineIndex;
                header.startColumn = column + 1;
            }
            case CONDITION -> header.parenDepth++;
            case AWAIT_BODY -> pushHeaderFrame(false, lineIndex);
        }
    }

    void closeParen(int lineIndex, int column) {
        expireHeader(lineIndex);
        if (header == null || header.phase != ControlHeader.Phase.CONDITION || header.bare) {
            return;
        }
        header.parenDepth--;
        if (header.parenDepth == 0) {
            closeCondition(lineIndex, column);
        }
    }

    void semicolon(int lineIndex, int column) {
        expireHeader(lineIndex);
        if (header != null) {
            switch (header.phase) {
                case CONDITION -> {
                    if (header.kind == ControlHeader.Kind.FOR && !header.bare) {
                        if (header.parenDepth == 1) {
                            header.separators.add(new int[]{lineIndex, column});
                        }
                        return;
                    }
                    dropHeader("condition ended by ';'");
                }
                case AWAIT_PAREN -> dropHeader("missing condition");
                case AWAIT_BODY -> {
                    // empty body, e.g. "while (poll());" or the tail of do-while
                    flushPending(header, true);
                    header = null;
                }
            }
        }
        statementEnd();
    }

    void openBrace(int lineIndex, int column) {
        expireHeader(lineIndex);
        if (header != null) {
            if (header.phase != ControlHeader.Phase.AWAIT_BODY) {
                if (header.phase == ControlHeader.Phase.CONDITION) {
                    closeCondition(lineIndex, column);
                }
                log.debug("Best-effort frame for malformed {} header at line {}", header.kind, number(lineIndex));
            }
            pushHeaderFrame(true, lineIndex);
            return;
        }
        frames.push(ScopeFrame.nested(frames.peek(), ScopeFrame.Kind.BLOCK, true, null, number(lineIndex)));
    }

    void closeBrace(int lineIndex, int column) {
        expireHeader(lineIndex);
        if (header != null) {
            dropHeader("header without body before '}'");
        }
        while (!frames.isEmpty() && !frames.peek().braced()) {
            frames.pop();
        }
        if (frames.isEmpty()) {
            diagnostics.add("Unmatched '}' at line " + number(lineIndex));
            return;
        }
        ScopeFrame closed = frames.pop();
        if (closed.kind() == ScopeFrame.Kind.FUNCTION) {
            closed.function().closeBody(number(lineIndex));
        } else if (closed.isControl()) {
            // a braced body also ends the brace-less statements it belonged to
            statementEnd();
        }
    }

    /**
     * Any other token: an identifier, literal or operator.
     */
    void token(int lineIndex, int column) {
        expireHeader(lineIndex);
        if (header == null) {
            return;
        }
        switch (header.phase) {
            case AWAIT_PAREN -> {
                header.phase = ControlHeader.Phase.CONDITION;
                header.bare = true;
                header.startLine = lineIndex;
                header.startColumn = column;
            }
            case AWAIT_BODY -> pushHeaderFrame(false, lineIndex);
            case CONDITION -> {
                // part of the condition
            }
        }
    }

    /**
     * A call to {@code callee} at this position. Ignored outside function bodies.
     */
    void call(String callee, int lineIndex) {
        if (!inFunction()) {
            return;
        }
        int line = number(lineIndex);
        if (header != null && header.phase != ControlHeader.Phase.AWAIT_BODY && header.kind.defersConditionCalls()) {
            header.pending.add(new ControlHeader.PendingCall(callee, line));
            return;
        }
        ScopeFrame frame = frames.peek();
        sink.accept(frame.function(), new CallSite(callee, line,
                frame.conditional(), frame.loop(), frame.condition(), frame.loopCondition()));
    }

    /**
     * Discard a pending header at end of input.
     */
    void finish(int lineIndex) {
        if (header != null) {
            dropHeader("header at end of input");
        }
    }

    // ---- internals

    private void closeCondition(int lineIndex, int column) {
        String raw;
        if (header.kind == ControlHeader.Kind.FOR && header.separators.size() >= 2) {
            int[] first = header.separators.get(0);
            int[] second = header.separators.get(1);
            raw = slice(first[0], first[1] + 1, second[0], second[1]);
        } else if (header.startLine >= 0) {
            raw = slice(header.startLine, header.startColumn, lineIndex, column);
        } else {
            raw = null;
        }
        header.conditionText = ConditionSanitizer.sanitize(raw);
        header.phase = ControlHeader.Phase.AWAIT_BODY;
        flushPending(header, true);
    }

    private void pushHeaderFrame(boolean braced, int lineIndex) {
        ControlHeader opened = header;
        header = null;
        String text = conditionOf(opened);
        flushPending(opened, true);
        ScopeFrame frame = ScopeFrame.nested(frames.peek(), opened.kind.frameKind(), braced, text, number(lineIndex));
        frames.push(frame);
    }

    private static String conditionOf(ControlHeader h) {
        return h.conditionText != null ? h.conditionText : ConditionSanitizer.FALLBACK;
    }

    /**
     * Emit calls held back while the condition was open. Without {@code underHeader}
     * they keep the enclosing context.
     */
    private void flushPending(ControlHeader source, boolean underHeader) {
        List<ControlHeader.PendingCall> calls = source.pending;
        if (calls.isEmpty()) {
            return;
        }
        ScopeFrame frame = frames.peek();
        if (frame == null || frame.function() == null) {
            calls.clear();
            return;
        }
        String text = conditionOf(source);
        for (ControlHeader.PendingCall call : calls) {
            CallSite site;
            if (underHeader && source.kind == ControlHeader.Kind.ELSE_IF) {
                site = new CallSite(call.callee(), call.lineNumber(),
                        true, frame.loop(), text, frame.loopCondition());
            } else if (underHeader && source.kind.frameKind() == ScopeFrame.Kind.LOOP) {
                site = new CallSite(call.callee(), call.lineNumber(),
                        frame.conditional(), true, frame.condition(), text);
            } else {
                site = new CallSite(call.callee(), call.lineNumber(),
                        frame.conditional(), frame.loop(), frame.condition(), frame.loopCondition());
            }
            sink.accept(frame.function(), site);
        }
        calls.clear();
    }

    private void dropHeader(String reason) {
        log.debug("Dropping {} header from line {}: {}", header.kind, number(header.openedLine), reason);
        flushPending(header, false);
        header = null;
    }

    private void expireHeader(int lineIndex) {
        if (header != null && header.phase != ControlHeader.Phase.AWAIT_BODY
                && lineIndex - header.openedLine >= MAX_HEADER_LINES) {
            diagnostics.add(header.kind + " header at line " + number(header.openedLine)
                    + " spans more than " + MAX_HEADER_LINES + " lines");
            dropHeader("too long");
        }
    }

    /**
     * Brace-less bodies end with their statement.
     */
    private void statementEnd() {
        while (!frames.isEmpty() && !frames.peek().braced()) {
            frames.pop();
        }
    }

    /**
     * Literal text from (startLine, startColumn) up to, not including, (endLine, endColumn).
     */
    private String slice(int startLine, int startColumn, int endLine, int endColumn) {
        StringBuilder sb = new StringBuilder();
        for (int i = startLine; i <= endLine && i < lines.size(); i++) {
            String text = lines.get(i).text();
            int from = i == startLine ? Math.min(startColumn, text.length()) : 0;
            int to = i == endLine ? Math.min(endColumn, text.length()) : text.length();
            if (lines.get(i).directive() || from >= to) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(text, from, to);
        }
        return sb.toString();
    }

    private int number(int lineIndex) {
        return lines.get(Math.min(lineIndex, lines.size() - 1)).number();
    }
}
