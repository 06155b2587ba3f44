package com.vidnyan.calltree.adapter.out.export;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Structured, serializable view of an analysis result.
 * Immutable DTO written as JSON by {@link JsonCallGraphExporter}.
 */
@Value
@Builder
public class CallGraphReport {
    Summary summary;
    List<FunctionEntry> functions;
    List<String> unresolved;
    List<CycleEntry> cycles;
    List<FileEntry> files;
    TreeNodeEntry callTree;
    List<String> errors;

    @Value
    @Builder
    public static class Summary {
        int filesScanned;
        int filesComplete;
        int filesPartial;
        int filesFailed;
        int filesSkipped;
        int functionsDefined;
        int declarations;
        int callEdges;
        int rteEdges;
        int unresolvedCallees;
        int staticFunctions;
        int autosarFunctions;
        int cycles;
        long durationMs;
    }

    @Value
    @Builder
    public static class FunctionEntry {
        String name;
        String file;
        int startLine;
        int endLine;
        String signature;
        String kind;
        List<String> qualifiers;
        String memoryClass;
        List<CallEntry> calls;
    }

    @Value
    @Builder
    public static class CallEntry {
        String callee;
        boolean conditional;
        boolean loop;
        boolean rte;
        int occurrences;
        int firstLine;
        String condition;
        String loopCondition;
    }

    @Value
    @Builder
    public static class CycleEntry {
        List<String> members;
        String path;
    }

    @Value
    @Builder
    public static class FileEntry {
        String path;
        String status;
        int functions;
        List<String> diagnostics;
    }

    @Value
    @Builder
    public static class TreeNodeEntry {
        String name;
        int depth;
        boolean defined;
        boolean recursive;
        boolean truncated;
        boolean conditional;
        boolean loop;
        boolean rte;
        List<TreeNodeEntry> children;
    }
}
