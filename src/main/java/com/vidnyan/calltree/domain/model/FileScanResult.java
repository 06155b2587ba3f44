package com.vidnyan.calltree.domain.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Everything one worker extracted from one source file.
 * A partial result still carries every function recognized before the scan
 * lost track of the file's structure.
 */
public record FileScanResult(
    Path path,
    Status status,
    List<FunctionRecord> functions,
    List<FunctionSignature> declarations,
    List<String> diagnostics,
    long durationMs
) {

    public enum Status {
        COMPLETE,
        PARTIAL,
        FAILED,
        SKIPPED
    }

    public FileScanResult {
        functions = List.copyOf(functions);
        declarations = List.copyOf(declarations);
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * Create a failed result.
     */
    public static FileScanResult failed(Path path, String message) {
        return new FileScanResult(path, Status.FAILED, List.of(), List.of(), List.of(message), 0);
    }

    /**
     * Create a skipped result.
     */
    public static FileScanResult skipped(Path path, String reason) {
        return new FileScanResult(path, Status.SKIPPED, List.of(), List.of(), List.of(reason), 0);
    }

    public boolean isComplete() {
        return status == Status.COMPLETE;
    }

    public boolean isPartial() {
        return status == Status.PARTIAL;
    }
}
