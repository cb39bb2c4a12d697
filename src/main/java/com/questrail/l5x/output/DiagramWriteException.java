package com.questrail.l5x.output;

import com.questrail.l5x.FailureKind;
import com.questrail.l5x.StateDiagramException;

import java.nio.file.Path;

/**
 * Raised when the rendered document cannot be written to its destination.
 */
public final class DiagramWriteException extends StateDiagramException
{
    public DiagramWriteException(Path destination, Throwable cause) {
        super(FailureKind.OUTPUT_FAILED, "Failed to write diagram to " + destination, cause);
    }
}
