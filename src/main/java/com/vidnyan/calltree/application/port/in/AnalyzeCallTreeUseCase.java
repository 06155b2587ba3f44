package com.vidnyan.calltree.application.port.in;

import com.vidnyan.calltree.domain.graph.CallGraph;
import com.vidnyan.calltree.domain.graph.CallTree;
import com.vidnyan.calltree.domain.graph.Cycle;
import com.vidnyan.calltree.domain.model.FileScanResult;
import com.vidnyan.calltree.domain.model.SourceFile;

import java.util.List;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * Primary use case: scan C sources into a call graph, find recursion, and
 * optionally expand a call tree from one root function.
 */
public interface AnalyzeCallTreeUseCase {

    int DEFAULT_MAX_DEPTH = 3;

    /**
     * Analyze the given sources. Each call builds a fresh graph.
     * @param request Analysis request parameters
     * @return Graph, cycles, per-file outcomes and the optional call tree
     */
    AnalysisResult analyze(AnalysisRequest request);

    /**
     * Analysis request parameters.
     *
     * @param rootFunction function to expand into a call tree, or null for graph only
     * @param stopRequested polled before each file is scheduled; once true, remaining files are skipped
     */
    record AnalysisRequest(
        List<SourceFile> sources,
        String rootFunction,
        int maxDepth,
        boolean includeRte,
        BooleanSupplier stopRequested
    ) {
        public AnalysisRequest {
            Objects.requireNonNull(sources, "sources");
            sources = List.copyOf(sources);
            if (maxDepth < 0) {
                throw new IllegalArgumentException("maxDepth must be >= 0, got " + maxDepth);
            }
            if (rootFunction != null && rootFunction.isBlank()) {
                rootFunction = null;
            }
            stopRequested = stopRequested != null ? stopRequested : () -> false;
        }

        public static AnalysisRequest forSources(List<SourceFile> sources) {
            return new AnalysisRequest(sources, null, DEFAULT_MAX_DEPTH, true, null);
        }

        public AnalysisRequest withRoot(String root, int depth, boolean rte) {
            return new AnalysisRequest(sources, root, depth, rte, stopRequested);
        }

        public AnalysisRequest withStopSignal(BooleanSupplier stop) {
            return new AnalysisRequest(sources, rootFunction, maxDepth, includeRte, stop);
        }
    }

    /**
     * Analysis result.
     *
     * @param callTree null when no root was requested or the root is unknown
     * @param errors problems that prevented part of the result, e.g. an unknown root
     */
    record AnalysisResult(
        CallGraph graph,
        List<Cycle> cycles,
        List<FileScanResult> files,
        CallTree callTree,
        List<String> errors,
        AnalysisStats stats
    ) {
        public AnalysisResult {
            cycles = List.copyOf(cycles);
            files = List.copyOf(files);
            errors = List.copyOf(errors);
        }

        public boolean hasCycles() {
            return !cycles.isEmpty();
        }

        public int fileCount(FileScanResult.Status status) {
            return (int) files.stream()
                    .filter(f -> f.status() == status)
                    .count();
        }
    }

    /**
     * Analysis statistics.
     */
    record AnalysisStats(
        int filesScanned,
        int filesComplete,
        int filesPartial,
        int filesFailed,
        int filesSkipped,
        int functionsDefined,
        int declarations,
        int callEdges,
        int rteEdges,
        int unresolvedCallees,
        int staticFunctions,
        int autosarFunctions,
        int cyclesFound,
        long totalDurationMs
    ) {}
}
