package com.vidnyan.calltree.domain.graph;

import com.vidnyan.calltree.domain.model.FunctionRecord;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.vidnyan.calltree.domain.graph.GraphFixtures.function;
import static org.junit.jupiter.api.Assertions.*;

class CycleDetectorTest {

    @Test
    void detect_SelfCall_ShouldReportSingleMemberCycle() {
        CallGraph graph = CallGraph.build(List.of(function("Recurse", "Recurse", "Leaf")));

        List<Cycle> cycles = CycleDetector.detect(graph);

        assertEquals(1, cycles.size());
        assertTrue(cycles.get(0).isSelfCall());
        assertEquals("Recurse -> Recurse", cycles.get(0).format());
    }

    @Test
    void detect_MutualRecursion_ShouldReportOnce() {
        CallGraph graph = CallGraph.build(List.of(
                function("Ping", "Pong"),
                function("Pong", "Ping")));

        List<Cycle> cycles = CycleDetector.detect(graph);

        assertEquals(List.of(new Cycle(List.of("Ping", "Pong"))), cycles);
    }

    @Test
    void detect_ThreeNodeLoop_ShouldRotateToSmallestMember() {
        CallGraph graph = CallGraph.build(List.of(
                function("Z_Step", "X_Step"),
                function("X_Step", "Y_Step"),
                function("Y_Step", "Z_Step")));

        List<Cycle> cycles = CycleDetector.detect(graph);

        assertEquals(1, cycles.size());
        assertEquals(List.of("X_Step", "Y_Step", "Z_Step"), cycles.get(0).members());
        assertEquals("X_Step -> Y_Step -> Z_Step -> X_Step", cycles.get(0).format());
    }

    @Test
    void detect_SharedDependency_ShouldNotBeACycle() {
        CallGraph graph = CallGraph.build(List.of(
                function("Top", "Left", "Right"),
                function("Left", "Leaf"),
                function("Right", "Leaf"),
                function("Leaf")));

        assertTrue(CycleDetector.detect(graph).isEmpty());
    }

    @Test
    void detect_SeveralCycles_ShouldFollowNameOrder() {
        CallGraph graph = CallGraph.build(List.of(
                function("B", "C"),
                function("C", "B"),
                function("A", "A", "B")));

        List<Cycle> cycles = CycleDetector.detect(graph);

        assertEquals(List.of(new Cycle(List.of("A")), new Cycle(List.of("B", "C"))), cycles);
    }

    @Test
    void detect_CyclesSharingNodes_ShouldReportEachElementaryCycle() {
        // Arrange: both loops run through A and B, the longer one detours via D
        CallGraph graph = CallGraph.build(List.of(
                function("A", "B"),
                function("B", "C", "D"),
                function("C", "A"),
                function("D", "C")));

        // Act
        List<Cycle> cycles = CycleDetector.detect(graph);

        // Assert
        assertEquals(List.of(
                new Cycle(List.of("A", "B", "C")),
                new Cycle(List.of("A", "B", "D", "C"))), cycles);
    }

    @Test
    void detect_CycleReachedOnlyThroughFinishedNode_ShouldStillBeReported() {
        CallGraph graph = CallGraph.build(List.of(
                function("A", "B", "C"),
                function("B", "A"),
                function("C", "B")));

        List<Cycle> cycles = CycleDetector.detect(graph);

        assertEquals(List.of(
                new Cycle(List.of("A", "B")),
                new Cycle(List.of("A", "C", "B"))), cycles);
    }

    @Test
    void detect_LongChain_ShouldNotOverflowStack() {
        int n = 20_000;
        List<FunctionRecord> records = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            String callee = String.format("F%05d", (i + 1) % n);
            records.add(function(String.format("F%05d", i), callee));
        }

        List<Cycle> cycles = CycleDetector.detect(CallGraph.build(records));

        assertEquals(1, cycles.size());
        assertEquals(n, cycles.get(0).length());
        assertEquals("F00000", cycles.get(0).members().get(0));
    }

    @Test
    void cycleOf_EmptyPath_ShouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> Cycle.of(List.of()));
    }
}
