package com.vidnyan.calltree.application.port.out;

import com.vidnyan.calltree.domain.model.FileScanResult;
import com.vidnyan.calltree.domain.model.SourceFile;

/**
 * Port for scanning one C source file into function records.
 * Implemented by adapters (e.g., the line/token C scanner).
 * <p>
 * Implementations must be safe to call from several worker threads at once,
 * each call owning all the state it creates.
 */
public interface SourceCodeParser {

    /**
     * Scan a single file. Never throws for malformed input; problems are
     * reported through the result's status and diagnostics.
     */
    FileScanResult parse(SourceFile source);
}
