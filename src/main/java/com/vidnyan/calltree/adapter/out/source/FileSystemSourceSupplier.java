package com.vidnyan.calltree.adapter.out.source;

import com.vidnyan.calltree.application.port.out.SourceFileSupplier;
import com.vidnyan.calltree.config.CallTreeProperties;
import com.vidnyan.calltree.domain.model.SourceFile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Walks a directory for C source files.
 * Files are returned sorted by path and read only when scanned.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileSystemSourceSupplier implements SourceFileSupplier {

    private final CallTreeProperties properties;

    @Override
    public List<SourceFile> supply(Path root) throws IOException {
        if (Files.isRegularFile(root)) {
            return List.of(SourceFile.onDisk(root));
        }
        if (!Files.isDirectory(root)) {
            throw new IOException("Source path does not exist: " + root);
        }
        List<String> extensions = properties.getExtensions().stream()
                .map(e -> e.toLowerCase(Locale.ROOT))
                .toList();
        try (Stream<Path> paths = Files.walk(root)) {
            List<SourceFile> sources = paths.filter(Files::isRegularFile)
                    .filter(p -> hasExtension(p, extensions))
                    .sorted()
                    .map(SourceFile::onDisk)
                    .toList();
            log.info("Found {} source file(s) under {}", sources.size(), root);
            return sources;
        }
    }

    private static boolean hasExtension(Path path, List<String> extensions) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return extensions.stream().anyMatch(name::endsWith);
    }
}
