package com.vidnyan.calltree.adapter.in.cli;

import com.vidnyan.calltree.application.port.in.AnalyzeCallTreeUseCase;
import com.vidnyan.calltree.application.port.in.AnalyzeCallTreeUseCase.AnalysisRequest;
import com.vidnyan.calltree.application.port.in.AnalyzeCallTreeUseCase.AnalysisResult;
import com.vidnyan.calltree.application.port.out.CallGraphConsumer;
import com.vidnyan.calltree.application.port.out.SourceFileSupplier;
import com.vidnyan.calltree.config.CallTreeProperties;
import com.vidnyan.calltree.domain.graph.CallTreeNode;
import com.vidnyan.calltree.domain.graph.Cycle;
import com.vidnyan.calltree.domain.model.FileScanResult;
import com.vidnyan.calltree.domain.model.SourceFile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * CLI Runner for standalone call-tree analysis.
 * Runs analysis when the calltree.source-path property is set.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CallTreeCliRunner implements CommandLineRunner {

    private final AnalyzeCallTreeUseCase analyzeCallTreeUseCase;
    private final SourceFileSupplier sourceFileSupplier;
    private final CallGraphConsumer callGraphConsumer;
    private final CallTreeProperties properties;
    private final ConfigurableApplicationContext context;

    @Value("${calltree.source-path:}")
    private String sourcePath;

    @Override
    public void run(String... args) throws Exception {
        if (sourcePath == null || sourcePath.isBlank()) {
            log.info("No source path specified. Set calltree.source-path property.");
            return;
        }

        int exitCode = 0;
        try {
            log.info("╔══════════════════════════════════════════════════════════════╗");
            log.info("║              AUTOSAR Call Tree Analyzer                        ║");
            log.info("╠══════════════════════════════════════════════════════════════╣");
            log.info("║ Analyzing: {}", truncatePath(sourcePath, 50));
            log.info("╚══════════════════════════════════════════════════════════════╝");

            List<SourceFile> sources = sourceFileSupplier.supply(Path.of(sourcePath));
            AnalysisRequest request = AnalysisRequest.forSources(sources)
                    .withRoot(properties.getRootFunction(), properties.getMaxDepth(), properties.isIncludeRte())
                    .withStopSignal(() -> Thread.currentThread().isInterrupted());
            AnalysisResult result = analyzeCallTreeUseCase.analyze(request);

            printResults(result);
            callGraphConsumer.consume(result);

            if (!result.errors().isEmpty()) {
                exitCode = 1;
            }
            log.info("");
            log.info("Analysis complete!");
        } catch (Exception e) {
            log.error("Analysis failed: {}", e.getMessage(), e);
            exitCode = 2;
        } finally {
            int code = exitCode;
            SpringApplication.exit(context, () -> code);
        }
    }

    private void printResults(AnalysisResult result) {
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" ANALYSIS RESULTS");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" Files scanned:    {} ({} partial, {} failed, {} skipped)",
                result.stats().filesScanned(), result.stats().filesPartial(),
                result.stats().filesFailed(), result.stats().filesSkipped());
        log.info(" Functions:        {} ({} static, {} AUTOSAR), {} declarations",
                result.stats().functionsDefined(), result.stats().staticFunctions(),
                result.stats().autosarFunctions(), result.stats().declarations());
        log.info(" Call edges:       {} ({} RTE), {} unresolved callees",
                result.stats().callEdges(), result.stats().rteEdges(), result.stats().unresolvedCallees());
        log.info(" Cycles:           {}", result.stats().cyclesFound());
        log.info(" Duration:         {}ms", result.stats().totalDurationMs());
        log.info("───────────────────────────────────────────────────────────────");

        for (FileScanResult file : result.files()) {
            if (!file.isComplete()) {
                log.info(" {} {}: {}", file.status(), file.path(), String.join("; ", file.diagnostics()));
            }
        }
        for (Cycle cycle : result.cycles()) {
            log.info(" Cycle: {}", cycle.format());
        }
        result.errors().forEach(e -> log.warn(" {}", e));

        if (result.callTree() != null) {
            log.info("");
            log.info(" CALL TREE ({} nodes, depth {})",
                    result.callTree().stats().totalNodes(), result.callTree().stats().maxDepthReached());
            Deque<CallTreeNode> stack = new ArrayDeque<>();
            stack.push(result.callTree().root());
            while (!stack.isEmpty()) {
                CallTreeNode node = stack.pop();
                log.info(" {}{}", "  ".repeat(node.depth()), describe(node));
                List<CallTreeNode> children = node.children();
                for (int i = children.size() - 1; i >= 0; i--) {
                    stack.push(children.get(i));
                }
            }
        }
    }

    private static String describe(CallTreeNode node) {
        StringBuilder sb = new StringBuilder(node.name());
        if (node.via() != null) {
            if (node.via().conditional()) {
                sb.append(" [if ").append(node.via().condition()).append(']');
            }
            if (node.via().loop()) {
                sb.append(" [loop ").append(node.via().loopCondition()).append(']');
            }
            if (node.via().rte()) {
                sb.append(" [RTE]");
            }
        }
        if (node.isRecursive()) {
            sb.append(" [RECURSIVE]");
        }
        if (node.isTruncated()) {
            sb.append(" ...");
        }
        return sb.toString();
    }

    private String truncatePath(String path, int maxLen) {
        if (path.length() <= maxLen)
            return path;
        return "..." + path.substring(path.length() - maxLen + 3);
    }
}
