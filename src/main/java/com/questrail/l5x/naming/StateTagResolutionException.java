package com.questrail.l5x.naming;

import com.questrail.l5x.FailureKind;
import com.questrail.l5x.StateDiagramException;

/**
 * Raised when no state-holder tag was supplied and none could be detected.
 */
public final class StateTagResolutionException extends StateDiagramException
{
    public StateTagResolutionException(String message) {
        super(FailureKind.TAG_NOT_RESOLVED, message);
    }
}
