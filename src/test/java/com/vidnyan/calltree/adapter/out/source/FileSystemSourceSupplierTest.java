package com.vidnyan.calltree.adapter.out.source;

import com.vidnyan.calltree.config.CallTreeProperties;
import com.vidnyan.calltree.domain.model.SourceFile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileSystemSourceSupplierTest {

    @TempDir
    Path tempDir;

    @Test
    void supply_ShouldFindCFilesRecursively() throws IOException {
        // Arrange
        FileSystemSourceSupplier supplier = new FileSystemSourceSupplier(new CallTreeProperties());

        Path moduleDir = tempDir.resolve("bsw/com/src");
        Files.createDirectories(moduleDir);
        Files.writeString(moduleDir.resolve("Com.c"), "void Com_Init(void) { }");
        Files.writeString(moduleDir.resolve("Com.h"), "void Com_Init(void);");
        Files.writeString(tempDir.resolve("Main.C"), "int main(void) { }");
        Files.writeString(tempDir.resolve("readme.txt"), "documentation");

        // Act
        List<SourceFile> results = supplier.supply(tempDir);

        // Assert
        assertEquals(2, results.size());
        assertTrue(results.stream().anyMatch(s -> s.path().endsWith("Com.c")));
        assertTrue(results.stream().anyMatch(s -> s.path().endsWith("Main.C")));
        assertFalse(results.stream().anyMatch(s -> s.path().endsWith("Com.h")));
        assertFalse(results.stream().anyMatch(s -> s.path().endsWith("readme.txt")));
    }

    @Test
    void supply_ConfiguredExtensions_ShouldIncludeHeaders() throws IOException {
        CallTreeProperties properties = new CallTreeProperties();
        properties.setExtensions(List.of(".c", ".h"));
        FileSystemSourceSupplier supplier = new FileSystemSourceSupplier(properties);
        Files.writeString(tempDir.resolve("b.c"), "");
        Files.writeString(tempDir.resolve("a.h"), "");

        List<SourceFile> results = supplier.supply(tempDir);

        assertEquals(List.of(tempDir.resolve("a.h"), tempDir.resolve("b.c")),
                results.stream().map(SourceFile::path).toList());
    }

    @Test
    void supply_SingleFile_ShouldReturnIt() throws IOException {
        Path file = tempDir.resolve("single.c");
        Files.writeString(file, "void F(void) { G(); }");

        List<SourceFile> results = new FileSystemSourceSupplier(new CallTreeProperties()).supply(file);

        assertEquals(1, results.size());
        assertEquals("void F(void) { G(); }", results.get(0).read());
    }

    @Test
    void supply_MissingPath_ShouldThrow() {
        FileSystemSourceSupplier supplier = new FileSystemSourceSupplier(new CallTreeProperties());

        assertThrows(IOException.class, () -> supplier.supply(tempDir.resolve("missing")));
    }

    @Test
    void read_MalformedBytes_ShouldBeReplaced() throws IOException {
        Path file = tempDir.resolve("latin1.c");
        Files.write(file, new byte[]{'a', '(', (byte) 0xE9, ')', ';'});

        String content = SourceFile.onDisk(file).read();

        assertTrue(content.startsWith("a("));
        assertTrue(content.endsWith(");"));
    }
}
