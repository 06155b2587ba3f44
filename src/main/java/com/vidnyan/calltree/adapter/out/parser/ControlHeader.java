package com.vidnyan.calltree.adapter.out.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * A control statement whose body has not started yet: the keyword has been seen,
 * the condition may still be open.
 */
final class ControlHeader {

    enum Kind {
        IF,
        ELSE_IF,
        ELSE,
        FOR,
        WHILE,
        DO,
        SWITCH;

        static Kind forKeyword(String keyword) {
            return switch (keyword) {
                case "if" -> IF;
                case "else" -> ELSE;
                case "for" -> FOR;
                case "while" -> WHILE;
                case "do" -> DO;
                case "switch" -> SWITCH;
                default -> throw new IllegalArgumentException("Not a control keyword: " + keyword);
            };
        }

        ScopeFrame.Kind frameKind() {
            return switch (this) {
                case FOR, WHILE, DO -> ScopeFrame.Kind.LOOP;
                default -> ScopeFrame.Kind.BRANCH;
            };
        }

        /**
         * Calls inside this header's condition only run when the condition itself
         * is reached under the header's own control.
         */
        boolean defersConditionCalls() {
            return this == ELSE_IF || this == FOR || this == WHILE;
        }
    }

    enum Phase {
        AWAIT_PAREN,
        CONDITION,
        AWAIT_BODY
    }

    /** A call seen inside the condition, emitted once the condition text is known. */
    record PendingCall(String callee, int lineNumber) {
    }

    Kind kind;
    Phase phase;
    final int openedLine;
    int parenDepth;
    boolean bare;

    // condition start, exclusive end, and the for-clause separators (line index, column)
    int startLine = -1;
    int startColumn = -1;
    final List<int[]> separators = new ArrayList<>();
    String conditionText;

    final List<PendingCall> pending = new ArrayList<>();

    ControlHeader(Kind kind, int openedLine) {
        this.kind = kind;
        this.openedLine = openedLine;
        this.phase = kind == Kind.ELSE || kind == Kind.DO ? Phase.AWAIT_BODY : Phase.AWAIT_PAREN;
        if (kind == Kind.ELSE) {
            conditionText = "else";
        }
    }
}
