package com.questrail.l5x.project;

import com.questrail.l5x.FailureKind;
import com.questrail.l5x.StateDiagramException;

/**
 * Indicates that an input document is not a structurally valid L5X export.
 *
 * This typically reflects:
 * <ul>
 *   <li>Content that is not well-formed XML</li>
 *   <li>A root element other than {@code RSLogix5000Content}</li>
 *   <li>A missing {@code Controller} element</li>
 * </ul>
 */
public final class L5xFormatException extends StateDiagramException
{
    public L5xFormatException(String message) {
        super(FailureKind.MALFORMED_DOCUMENT, message);
    }

    public L5xFormatException(String message, Throwable cause) {
        super(FailureKind.MALFORMED_DOCUMENT, message, cause);
    }
}
