package com.vidnyan.calltree.adapter.out.parser;

import com.vidnyan.calltree.application.port.out.SourceCodeParser;
import com.vidnyan.calltree.domain.model.FileScanResult;
import com.vidnyan.calltree.domain.model.FunctionRecord;
import com.vidnyan.calltree.domain.model.FunctionSignature;
import com.vidnyan.calltree.domain.model.SourceFile;
import com.vidnyan.calltree.domain.model.SourceLine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Line/token scanner for AUTOSAR-flavored C.
 * <p>
 * One sequential pass per file: normalize, then walk the lines. Outside function
 * bodies every line holding a '(' is offered to the {@link SignatureRecognizer};
 * everything else is fed through the {@link CallSiteExtractor} into a per-file
 * {@link ScopeTracker} and {@link CallAggregator}. No state is shared between
 * calls, so one instance serves all workers.
 */
@Slf4j
@Component
public class CSourceParser implements SourceCodeParser {

    private final RteClassifier rteClassifier;
    private final SourceNormalizer normalizer = new SourceNormalizer();
    private final SignatureRecognizer recognizer = new SignatureRecognizer(normalizer);
    private final CallSiteExtractor extractor = new CallSiteExtractor();

    public CSourceParser(RteClassifier rteClassifier) {
        this.rteClassifier = rteClassifier;
    }

    @Override
    public FileScanResult parse(SourceFile source) {
        long startTime = System.currentTimeMillis();
        Path path = source.path();

        String content;
        try {
            content = source.read();
        } catch (IOException e) {
            log.warn("Failed to read {}: {}", path, e.getMessage());
            return FileScanResult.failed(path, "Failed to read file: " + e.getMessage());
        }

        NormalizedSource normalized = normalizer.normalize(content);
        List<SourceLine> lines = normalized.lines();
        CallAggregator aggregator = new CallAggregator(path, rteClassifier);
        ScopeTracker scopes = new ScopeTracker(lines, aggregator::record);
        List<FunctionSignature> declarations = new ArrayList<>();

        int i = 0;
        while (i < lines.size()) {
            SourceLine line = lines.get(i);
            if (line.directive() || line.isBlank()) {
                i++;
                continue;
            }
            int column = 0;
            if (!scopes.inFunction() && line.code().indexOf('(') >= 0) {
                Optional<SignatureMatch> match = recognizer.recognize(lines, i);
                if (match.isPresent()) {
                    SignatureMatch header = match.get();
                    if (header.isDefinition()) {
                        FunctionRecord record = aggregator.define(header.signature());
                        scopes.enterFunction(record, header.terminatorLine());
                    } else {
                        declarations.add(header.signature());
                    }
                    i = header.terminatorLine();
                    column = header.terminatorColumn() + 1;
                    line = lines.get(i);
                }
            }
            extractor.scan(line, i, column, scopes);
            i++;
        }
        if (!lines.isEmpty()) {
            scopes.finish(lines.size() - 1);
        }

        List<String> diagnostics = new ArrayList<>(scopes.diagnostics());
        FileScanResult.Status status = FileScanResult.Status.COMPLETE;
        if (normalized.hasUnterminatedComment()) {
            status = FileScanResult.Status.PARTIAL;
            diagnostics.add("Unterminated block comment opened at line " + normalized.unterminatedCommentLine());
        }
        List<ScopeFrame> open = scopes.openFrames();
        if (!open.isEmpty()) {
            status = FileScanResult.Status.PARTIAL;
            ScopeFrame outermost = open.get(open.size() - 1);
            diagnostics.add(open.size() + " unclosed '{' at end of file, outermost opened at line "
                    + outermost.openedLine());
        }

        List<FunctionRecord> functions = aggregator.functions();
        long duration = System.currentTimeMillis() - startTime;
        if (status == FileScanResult.Status.PARTIAL) {
            log.warn("Partial scan of {}: {}", path, diagnostics);
        } else {
            log.debug("Scanned {} in {}ms: {} functions, {} declarations",
                    path, duration, functions.size(), declarations.size());
        }
        return new FileScanResult(path, status, functions, declarations, diagnostics, duration);
    }
}
