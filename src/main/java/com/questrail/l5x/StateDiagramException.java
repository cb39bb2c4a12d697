package com.questrail.l5x;

import java.util.Objects;

/**
 * Base type of every pipeline-level failure.
 *
 * <p>Stage-local problems (one bad rung, one missing bit description) are
 * absorbed where they occur and never surface as this exception. Anything that
 * does surface halts the pipeline and is converted into a failure result by
 * {@link com.questrail.l5x.pipeline.StateDiagramGenerator}.</p>
 */
public class StateDiagramException extends RuntimeException
{
    private final FailureKind kind;

    public StateDiagramException(FailureKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public StateDiagramException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    /**
     * Returns the failure classification.
     */
    public FailureKind kind() {
        return kind;
    }
}
