package com.vidnyan.calltree.domain.model;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CallEdgeTest {

    @Test
    void withOccurrence_ShouldStayConditionalOnlyWhileEveryCallIs() {
        CallEdge edge = CallEdge.firstSighting(site("f", 10, true, false, "x > 0", null), false);
        assertTrue(edge.conditional());
        assertEquals("x > 0", edge.condition());

        CallEdge merged = edge.withOccurrence(site("f", 4, false, false, null, null));

        assertFalse(merged.conditional());
        assertNull(merged.condition());
        assertEquals(2, merged.occurrences());
        assertEquals(4, merged.firstLine());
    }

    @Test
    void withOccurrence_ShouldBecomeLoopOnceAnyCallIs() {
        CallEdge edge = CallEdge.firstSighting(site("f", 1, false, false, null, null), false)
                .withOccurrence(site("f", 2, false, true, null, "i < n"));

        assertTrue(edge.loop());
        assertEquals("i < n", edge.loopCondition());
    }

    @Test
    void withOccurrence_OtherCallee_ShouldThrow() {
        CallEdge edge = CallEdge.firstSighting(site("f", 1, false, false, null, null), false);

        assertThrows(IllegalArgumentException.class,
                () -> edge.withOccurrence(site("g", 2, false, false, null, null)));
    }

    @Test
    void combine_ShouldSumOccurrencesAndKeepRteFlag() {
        CallEdge a = CallEdge.firstSighting(site("Rte_Read", 7, true, false, "on", null), true);
        CallEdge b = CallEdge.firstSighting(site("Rte_Read", 3, true, true, "ready", "poll"), false);

        CallEdge combined = a.combine(b);

        assertEquals(2, combined.occurrences());
        assertTrue(combined.rte());
        assertTrue(combined.conditional());
        assertEquals("on", combined.condition());
        assertTrue(combined.loop());
        assertEquals("poll", combined.loopCondition());
        assertEquals(3, combined.firstLine());
    }

    @Test
    void functionRecord_Redefine_ShouldClearEdgesAndCountDefinitions() {
        FunctionSignature first = FunctionSignature.builder().name("Init").lines(1, 1).definition(true).build();
        FunctionRecord record = new FunctionRecord(first, Path.of("a.c"));
        record.addCall(site("Old", 2, false, false, null, null), false);
        record.closeBody(3);

        record.redefine(FunctionSignature.builder().name("Init").lines(10, 10).definition(true).build());

        assertTrue(record.edges().isEmpty());
        assertEquals(2, record.definitionCount());
        assertEquals(new Location("a.c", 10, 10), record.location());
    }

    @Test
    void functionRecord_RedefineWithOtherKey_ShouldThrow() {
        FunctionRecord record = new FunctionRecord(
                FunctionSignature.builder().name("Init").definition(true).build(), Path.of("a.c"));

        assertThrows(IllegalArgumentException.class, () -> record.redefine(
                FunctionSignature.builder().name("Init").qualifiers(Set.of(Qualifier.STATIC)).build()));
    }

    private static CallSite site(String callee, int line, boolean conditional, boolean loop,
                                 String condition, String loopCondition) {
        return new CallSite(callee, line, conditional, loop, condition, loopCondition);
    }
}
