package com.questrail.l5x.section;

import com.questrail.l5x.FailureKind;
import com.questrail.l5x.StateDiagramException;

/**
 * Raised when no routine of a project contains a state-logic section under
 * any of the configured conventions.
 */
public final class StateLogicNotFoundException extends StateDiagramException
{
    public StateLogicNotFoundException(String message) {
        super(FailureKind.SECTION_NOT_FOUND, message);
    }
}
