package com.vidnyan.calltree.domain.model;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A (path, raw text) pair supplied to the scanner.
 * <p>
 * Content is read on demand so that the file handle lives only for the
 * duration of one file's scan.
 */
public interface SourceFile {

    Path path();

    /**
     * Read the full raw text.
     */
    String read() throws IOException;

    /**
     * Source whose text is already in memory.
     */
    static SourceFile of(Path path, String content) {
        return new InMemory(path, content);
    }

    /**
     * Source read from disk when scanned. Malformed bytes are replaced rather than rejected.
     */
    static SourceFile onDisk(Path path) {
        return new OnDisk(path);
    }

    record InMemory(Path path, String content) implements SourceFile {
        public InMemory {
            Objects.requireNonNull(path, "path");
            Objects.requireNonNull(content, "content");
        }

        @Override
        public String read() {
            return content;
        }
    }

    record OnDisk(Path path) implements SourceFile {
        public OnDisk {
            Objects.requireNonNull(path, "path");
        }

        @Override
        public String read() throws IOException {
            CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPLACE)
                    .onUnmappableCharacter(CodingErrorAction.REPLACE);
            try (Reader reader = new BufferedReader(new InputStreamReader(Files.newInputStream(path), decoder))) {
                StringBuilder sb = new StringBuilder();
                char[] buffer = new char[8192];
                int read;
                while ((read = reader.read(buffer)) != -1) {
                    sb.append(buffer, 0, read);
                }
                return sb.toString();
            }
        }
    }
}
