package com.questrail.l5x.output;

import com.questrail.l5x.FailureKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

final class MarkdownDiagramWriterTest
{
    @TempDir
    Path dir;

    private final MarkdownDiagramWriter writer = new MarkdownDiagramWriter();

    @Test
    void envelopeWrapsDiagramInMermaidFence()
    {
        assertEquals("# State Logic Diagram\n\n```mermaid\nflowchart TB\n```\n",
                MarkdownDiagramWriter.envelope("flowchart TB"));
    }

    @Test
    void writesEnvelopedDocument() throws IOException
    {
        Path out = dir.resolve("phase_state_diagram.md");

        writer.write("stateDiagram-v2", out);

        assertEquals(MarkdownDiagramWriter.envelope("stateDiagram-v2"),
                Files.readString(out, StandardCharsets.UTF_8));
    }

    @Test
    void replacesExistingFileAndLeavesNoTemporaries() throws IOException
    {
        Path out = dir.resolve("out.md");
        Files.writeString(out, "old content that is longer than the new one");

        writer.write("x", out);

        assertEquals(MarkdownDiagramWriter.envelope("x"), Files.readString(out));
        try (Stream<Path> files = Files.list(dir)) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void createsMissingParentDirectories() throws IOException
    {
        Path out = dir.resolve("nested/deeper/out.md");

        writer.write("x", out);

        assertTrue(Files.isRegularFile(out));
    }

    @Test
    void unwritableDestinationFailsWithOutputKind() throws IOException
    {
        Path blocker = dir.resolve("blocker");
        Files.writeString(blocker, "a file, not a directory");
        Path out = blocker.resolve("out.md");

        DiagramWriteException e = assertThrows(DiagramWriteException.class, () -> writer.write("x", out));

        assertEquals(FailureKind.OUTPUT_FAILED, e.kind());
        assertEquals("a file, not a directory", Files.readString(blocker));
    }
}
