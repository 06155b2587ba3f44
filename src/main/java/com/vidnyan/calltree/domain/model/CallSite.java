package com.vidnyan.calltree.domain.model;

/**
 * One occurrence of a call expression inside a function body, with the
 * control-flow context in effect at that position.
 */
public record CallSite(
    String callee,
    int line,
    boolean conditional,
    boolean loop,
    String condition,
    String loopCondition
) {
}
