package com.questrail.l5x.project;

import com.questrail.l5x.FailureKind;
import com.questrail.l5x.StateDiagramException;

import java.nio.file.Path;

/**
 * Raised when the input export does not exist or cannot be opened.
 */
public final class InputMissingException extends StateDiagramException
{
    public InputMissingException(Path path) {
        super(FailureKind.INPUT_MISSING, "Input file not found: " + path);
    }

    public InputMissingException(Path path, Throwable cause) {
        super(FailureKind.INPUT_MISSING, "Input file cannot be read: " + path, cause);
    }
}
