package com.questrail.l5x.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/**
 * MarkdownDiagramWriter
 * -----------------------------------------------------------------------------
 * Wraps Mermaid text in the markdown envelope the diagram viewer expects and
 * writes it to disk.
 *
 * <pre>
 *   # State Logic Diagram
 *
 *   ```mermaid
 *   &lt;diagram text&gt;
 *   ```
 * </pre>
 *
 * <p>The document is written to a temporary sibling first and then moved over
 * the destination, so a failed write never leaves a truncated document.</p>
 */
public final class MarkdownDiagramWriter
{
    private static final Logger log = LoggerFactory.getLogger(MarkdownDiagramWriter.class);

    static final String HEADING = "# State Logic Diagram";
    static final String FENCE_OPEN = "```mermaid";
    static final String FENCE_CLOSE = "```";

    /**
     * Returns the full markdown document for {@code diagramText}.
     */
    public static String envelope(String diagramText) {
        Objects.requireNonNull(diagramText, "diagramText");
        return HEADING + "\n\n" + FENCE_OPEN + "\n" + diagramText + "\n" + FENCE_CLOSE + "\n";
    }

    /**
     * Writes the enveloped document to {@code destination}, replacing any
     * existing file.
     *
     * @throws DiagramWriteException if the document cannot be written
     */
    public void write(String diagramText, Path destination) {
        Objects.requireNonNull(destination, "destination");
        String markdown = envelope(diagramText);

        Path absolute = destination.toAbsolutePath();
        Path directory = absolute.getParent();
        Path temp = null;
        try {
            if (directory != null) {
                Files.createDirectories(directory);
            }
            temp = Files.createTempFile(directory, absolute.getFileName().toString(), ".tmp");
            Files.writeString(temp, markdown, StandardCharsets.UTF_8);
            try {
                Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Wrote {} characters to {}", markdown.length(), absolute);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new DiagramWriteException(destination, e);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temporary file {}", temp, e);
        }
    }
}
