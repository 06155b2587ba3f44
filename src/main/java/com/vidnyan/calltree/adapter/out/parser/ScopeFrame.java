package com.vidnyan.calltree.adapter.out.parser;

import com.vidnyan.calltree.domain.model.FunctionRecord;

/**
 * One level of nesting. Conditional and loop flags are cumulative: a frame
 * carries them if it or any enclosing frame up to the function boundary does.
 *
 * @param braced false for the statement-scoped body of a brace-less if/else/loop
 */
record ScopeFrame(
    Kind kind,
    boolean braced,
    FunctionRecord function,
    boolean conditional,
    boolean loop,
    String condition,
    String loopCondition,
    int openedLine
) {

    enum Kind {
        FUNCTION,
        BLOCK,
        BRANCH,
        LOOP
    }

    static ScopeFrame function(FunctionRecord record, int line) {
        return new ScopeFrame(Kind.FUNCTION, true, record, false, false, null, null, line);
    }

    /**
     * Frame nested in {@code parent} (null at file scope).
     *
     * @param text condition text of the header that opened it, if any
     */
    static ScopeFrame nested(ScopeFrame parent, Kind kind, boolean braced, String text, int line) {
        FunctionRecord function = parent != null ? parent.function() : null;
        boolean conditional = parent != null && parent.conditional();
        boolean loop = parent != null && parent.loop();
        String condition = parent != null ? parent.condition() : null;
        String loopCondition = parent != null ? parent.loopCondition() : null;
        if (kind == Kind.BRANCH) {
            conditional = true;
            condition = text;
        } else if (kind == Kind.LOOP) {
            loop = true;
            loopCondition = text;
        }
        return new ScopeFrame(kind, braced, function, conditional, loop, condition, loopCondition, line);
    }

    boolean isControl() {
        return kind == Kind.BRANCH || kind == Kind.LOOP;
    }
}
