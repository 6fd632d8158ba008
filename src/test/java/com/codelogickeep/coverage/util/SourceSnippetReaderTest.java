package com.codelogickeep.coverage.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SourceSnippetReader Tests")
class SourceSnippetReaderTest {

    @TempDir
    Path root;

    @Test
    @DisplayName("should read trimmed lines through absolute paths and source roots")
    void shouldReadLines() throws IOException {
        Path file = Files.createDirectories(root.resolve("Calc")).resolve("Calculator.cs");
        Files.writeString(file, "namespace Calc;\n    public int Add(int a, int b) => a + b;\n");
        SourceSnippetReader reader = new SourceSnippetReader();

        assertEquals("public int Add(int a, int b) => a + b;", reader.readLine(file.toString(), List.of(), 2));
        assertEquals("namespace Calc;", reader.readLine("Calc/Calculator.cs", List.of(root.toString()), 1));
    }

    @Test
    @DisplayName("should return null for missing files and lines")
    void shouldReturnNullWhenUnavailable() throws IOException {
        Path file = root.resolve("One.cs");
        Files.writeString(file, "class One {}\n");
        SourceSnippetReader reader = new SourceSnippetReader();

        assertNull(reader.readLine(file.toString(), List.of(), 5));
        assertNull(reader.readLine(file.toString(), List.of(), 0));
        assertNull(reader.readLine("Missing.cs", List.of(root.toString()), 1));
        assertNull(reader.readLine(null, List.of(), 1));
    }
}
