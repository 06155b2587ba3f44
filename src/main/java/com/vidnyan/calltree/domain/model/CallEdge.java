package com.vidnyan.calltree.domain.model;

/**
 * Aggregated caller-to-callee relationship. Unique per (caller, callee).
 * Immutable value object; merging returns a new edge.
 * <p>
 * {@code conditional} holds only while every occurrence was conditional, since a
 * single unconditional occurrence guarantees the call happens. {@code loop} holds
 * as soon as any occurrence sits inside a loop.
 */
public record CallEdge(
    String callee,
    boolean conditional,
    boolean loop,
    boolean rte,
    int occurrences,
    int firstLine,
    String condition,
    String loopCondition
) {

    /**
     * Edge for the first sighting of a callee.
     */
    public static CallEdge firstSighting(CallSite site, boolean rte) {
        return new CallEdge(
                site.callee(),
                site.conditional(),
                site.loop(),
                rte,
                1,
                site.line(),
                site.conditional() ? site.condition() : null,
                site.loop() ? site.loopCondition() : null);
    }

    /**
     * Fold a repeat sighting of the same callee into this edge.
     */
    public CallEdge withOccurrence(CallSite site) {
        if (!callee.equals(site.callee())) {
            throw new IllegalArgumentException("Cannot merge call to " + site.callee() + " into edge to " + callee);
        }
        boolean mergedConditional = conditional && site.conditional();
        boolean mergedLoop = loop || site.loop();
        return new CallEdge(
                callee,
                mergedConditional,
                mergedLoop,
                rte,
                occurrences + 1,
                Math.min(firstLine, site.line()),
                mergedConditional ? firstNonNull(condition, site.condition()) : null,
                mergedLoop ? firstNonNull(loopCondition, site.loop() ? site.loopCondition() : null) : null);
    }

    /**
     * Combine two edges to the same callee coming from different definitions
     * of one function name.
     */
    public CallEdge combine(CallEdge other) {
        if (!callee.equals(other.callee())) {
            throw new IllegalArgumentException("Cannot combine edges to " + callee + " and " + other.callee());
        }
        boolean mergedConditional = conditional && other.conditional();
        boolean mergedLoop = loop || other.loop();
        return new CallEdge(
                callee,
                mergedConditional,
                mergedLoop,
                rte || other.rte(),
                occurrences + other.occurrences(),
                Math.min(firstLine, other.firstLine()),
                mergedConditional ? firstNonNull(condition, other.condition()) : null,
                mergedLoop ? firstNonNull(loopCondition, other.loopCondition()) : null);
    }

    private static String firstNonNull(String a, String b) {
        return a != null ? a : b;
    }
}
