package com.vidnyan.calltree.application.port.out;

import com.vidnyan.calltree.domain.model.SourceFile;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Port for locating the source files to scan.
 */
public interface SourceFileSupplier {

    /**
     * Source files under the given root, in a stable order.
     */
    List<SourceFile> supply(Path root) throws IOException;
}
