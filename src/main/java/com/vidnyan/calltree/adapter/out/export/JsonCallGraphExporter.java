package com.vidnyan.calltree.adapter.out.export;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.calltree.application.port.in.AnalyzeCallTreeUseCase.AnalysisResult;
import com.vidnyan.calltree.application.port.in.AnalyzeCallTreeUseCase.AnalysisStats;
import com.vidnyan.calltree.application.port.out.CallGraphConsumer;
import com.vidnyan.calltree.config.CallTreeProperties;
import com.vidnyan.calltree.domain.graph.CallGraph;
import com.vidnyan.calltree.domain.graph.CallTreeNode;
import com.vidnyan.calltree.domain.model.CallEdge;
import com.vidnyan.calltree.domain.model.FileScanResult;
import com.vidnyan.calltree.domain.model.FunctionRecord;
import com.vidnyan.calltree.domain.model.FunctionSignature;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes the analysis result as JSON: functions with their call edges, unresolved
 * callees, cycles, per-file status and the optional call tree. Data only, no layout.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonCallGraphExporter implements CallGraphConsumer {

    private final ObjectMapper objectMapper;
    private final CallTreeProperties properties;

    @Override
    public void consume(AnalysisResult result) throws IOException {
        String outputFile = properties.getOutputFile();
        if (outputFile == null || outputFile.isBlank()) {
            log.debug("No output file configured, skipping JSON export");
            return;
        }
        Path target = Path.of(outputFile);
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        try (Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            write(result, out);
        }
        log.info("Call graph report written to {}", target);
    }

    /**
     * Serialize to the given writer. The writer is left open.
     */
    public void write(AnalysisResult result, Writer out) throws IOException {
        objectMapper.writerWithDefaultPrettyPrinter()
                .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                .writeValue(out, toReport(result));
    }

    public CallGraphReport toReport(AnalysisResult result) {
        CallGraph graph = result.graph();
        List<CallGraphReport.FunctionEntry> functions = new ArrayList<>();
        List<String> unresolved = new ArrayList<>();
        for (CallGraph.Node node : graph.nodes()) {
            if (!node.isDefined()) {
                unresolved.add(node.name());
                continue;
            }
            for (FunctionRecord record : node.definitions()) {
                functions.add(toFunctionEntry(record));
            }
        }

        return CallGraphReport.builder()
                .summary(toSummary(result.stats()))
                .functions(functions)
                .unresolved(unresolved)
                .cycles(result.cycles().stream()
                        .map(c -> CallGraphReport.CycleEntry.builder()
                                .members(c.members())
                                .path(c.format())
                                .build())
                        .toList())
                .files(result.files().stream().map(JsonCallGraphExporter::toFileEntry).toList())
                .callTree(result.callTree() != null ? toTreeEntry(result.callTree().root()) : null)
                .errors(result.errors())
                .build();
    }

    private static CallGraphReport.Summary toSummary(AnalysisStats stats) {
        return CallGraphReport.Summary.builder()
                .filesScanned(stats.filesScanned())
                .filesComplete(stats.filesComplete())
                .filesPartial(stats.filesPartial())
                .filesFailed(stats.filesFailed())
                .filesSkipped(stats.filesSkipped())
                .functionsDefined(stats.functionsDefined())
                .declarations(stats.declarations())
                .callEdges(stats.callEdges())
                .rteEdges(stats.rteEdges())
                .unresolvedCallees(stats.unresolvedCallees())
                .staticFunctions(stats.staticFunctions())
                .autosarFunctions(stats.autosarFunctions())
                .cycles(stats.cyclesFound())
                .durationMs(stats.totalDurationMs())
                .build();
    }

    private static CallGraphReport.FunctionEntry toFunctionEntry(FunctionRecord record) {
        FunctionSignature signature = record.signature();
        return CallGraphReport.FunctionEntry.builder()
                .name(record.name())
                .file(record.sourcePath() != null ? record.sourcePath().toString() : null)
                .startLine(record.location().startLine())
                .endLine(record.location().endLine())
                .signature(signature.format())
                .kind(signature.kind().name())
                .qualifiers(signature.qualifiers().stream().map(Enum::name).sorted().toList())
                .memoryClass(signature.memoryClass())
                .calls(record.calls().stream().map(JsonCallGraphExporter::toCallEntry).toList())
                .build();
    }

    private static CallGraphReport.CallEntry toCallEntry(CallEdge edge) {
        return CallGraphReport.CallEntry.builder()
                .callee(edge.callee())
                .conditional(edge.conditional())
                .loop(edge.loop())
                .rte(edge.rte())
                .occurrences(edge.occurrences())
                .firstLine(edge.firstLine())
                .condition(edge.condition())
                .loopCondition(edge.loopCondition())
                .build();
    }

    private static CallGraphReport.FileEntry toFileEntry(FileScanResult file) {
        return CallGraphReport.FileEntry.builder()
                .path(file.path().toString())
                .status(file.status().name())
                .functions(file.functions().size())
                .diagnostics(file.diagnostics())
                .build();
    }

    // tree depth is bounded by the requested max depth
    private static CallGraphReport.TreeNodeEntry toTreeEntry(CallTreeNode node) {
        CallEdge via = node.via();
        return CallGraphReport.TreeNodeEntry.builder()
                .name(node.name())
                .depth(node.depth())
                .defined(node.isDefined())
                .recursive(node.isRecursive())
                .truncated(node.isTruncated())
                .conditional(via != null && via.conditional())
                .loop(via != null && via.loop())
                .rte(via != null && via.rte())
                .children(node.children().stream().map(JsonCallGraphExporter::toTreeEntry).toList())
                .build();
    }
}
