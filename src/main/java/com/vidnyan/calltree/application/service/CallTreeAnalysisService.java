package com.vidnyan.calltree.application.service;

import com.vidnyan.calltree.application.port.in.AnalyzeCallTreeUseCase;
import com.vidnyan.calltree.application.port.out.SourceCodeParser;
import com.vidnyan.calltree.config.CallTreeProperties;
import com.vidnyan.calltree.domain.graph.CallGraph;
import com.vidnyan.calltree.domain.graph.CallTree;
import com.vidnyan.calltree.domain.graph.CallTreeBuilder;
import com.vidnyan.calltree.domain.graph.Cycle;
import com.vidnyan.calltree.domain.graph.CycleDetector;
import com.vidnyan.calltree.domain.model.FileScanResult;
import com.vidnyan.calltree.domain.model.FunctionRecord;
import com.vidnyan.calltree.domain.model.SourceFile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Main application service that orchestrates the analysis workflow.
 * Implements the primary use case.
 * <p>
 * Files are scanned by a fixed pool of workers that share nothing; the graph is
 * assembled by this thread once every worker is done, then cycle detection and
 * the optional call tree run over the finished graph.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CallTreeAnalysisService implements AnalyzeCallTreeUseCase {

    private final SourceCodeParser sourceCodeParser;
    private final CallTreeProperties properties;

    @Override
    public AnalysisResult analyze(AnalysisRequest request) {
        Instant startTime = Instant.now();
        List<SourceFile> sources = request.sources();
        log.info("Starting analysis of {} source file(s)", sources.size());

        // Step 1: Scan files in parallel
        log.info("Step 1: Scanning source files...");
        List<FileScanResult> files = scanAll(sources, request);

        // Step 2: Merge into one graph
        log.info("Step 2: Building call graph...");
        List<FunctionRecord> records = new ArrayList<>();
        int declarations = 0;
        for (FileScanResult file : files) {
            records.addAll(file.functions());
            declarations += file.declarations().size();
        }
        CallGraph graph = CallGraph.build(records);
        CallGraph.Stats graphStats = graph.stats();
        log.info("Built: {} functions, {} call edges ({} RTE), {} unresolved callees",
                graphStats.definedCount(), graphStats.edgeCount(), graphStats.rteEdgeCount(),
                graphStats.unresolvedCount());

        // Step 3: Detect cycles
        log.info("Step 3: Detecting cycles...");
        List<Cycle> cycles = CycleDetector.detect(graph);
        cycles.forEach(c -> log.info("  Cycle: {}", c.format()));

        // Step 4: Expand call tree
        List<String> errors = new ArrayList<>();
        CallTree tree = null;
        if (request.rootFunction() != null) {
            log.info("Step 4: Building call tree from {}...", request.rootFunction());
            try {
                tree = CallTreeBuilder.build(graph, request.rootFunction(), request.maxDepth(), request.includeRte());
            } catch (NoSuchElementException e) {
                log.warn(e.getMessage());
                errors.add(e.getMessage());
            }
        }

        Duration totalDuration = Duration.between(startTime, Instant.now());
        AnalysisStats stats = new AnalysisStats(
                files.size(),
                count(files, FileScanResult.Status.COMPLETE),
                count(files, FileScanResult.Status.PARTIAL),
                count(files, FileScanResult.Status.FAILED),
                count(files, FileScanResult.Status.SKIPPED),
                records.size(),
                declarations,
                graphStats.edgeCount(),
                graphStats.rteEdgeCount(),
                graphStats.unresolvedCount(),
                (int) records.stream().filter(r -> r.key().isStatic()).count(),
                (int) records.stream().filter(r -> r.signature().kind().isAutosar()).count(),
                cycles.size(),
                totalDuration.toMillis()
        );

        log.info("Analysis complete: {} functions, {} cycles in {}ms",
                stats.functionsDefined(), stats.cyclesFound(), stats.totalDurationMs());

        return new AnalysisResult(graph, cycles, files, tree, errors, stats);
    }

    /**
     * Scan every file on a fixed pool. Results keep the input order.
     */
    private List<FileScanResult> scanAll(List<SourceFile> sources, AnalysisRequest request) {
        if (sources.isEmpty()) {
            return List.of();
        }
        int threads = Math.max(1, Math.min(properties.getWorkerThreads(), sources.size()));
        log.info("Scanning with {} worker thread(s)", threads);

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<FileScanResult>> futures = new ArrayList<>(sources.size());
            for (SourceFile source : sources) {
                futures.add(executor.submit(() -> scanOne(source, request)));
            }

            List<FileScanResult> results = new ArrayList<>(sources.size());
            for (int i = 0; i < futures.size(); i++) {
                SourceFile source = sources.get(i);
                try {
                    results.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.error("Error scanning {}: {}", source.path(), cause.toString());
                    results.add(FileScanResult.failed(source.path(), "Scan failed: " + cause));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted while scanning, skipping {} remaining file(s)", sources.size() - i);
                    for (int j = i; j < sources.size(); j++) {
                        futures.get(j).cancel(true);
                        results.add(FileScanResult.skipped(sources.get(j).path(), "Interrupted"));
                    }
                    break;
                }
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private FileScanResult scanOne(SourceFile source, AnalysisRequest request) {
        if (request.stopRequested().getAsBoolean()) {
            return FileScanResult.skipped(source.path(), "Stop requested");
        }
        return sourceCodeParser.parse(source);
    }

    private static int count(List<FileScanResult> files, FileScanResult.Status status) {
        return (int) files.stream().filter(f -> f.status() == status).count();
    }
}
