package com.questrail.l5x.observability;

/**
 * Receives human-readable stage notifications while the pipeline runs.
 *
 * <p>This is a side channel for logs and status panes. Nothing the pipeline
 * computes depends on what a sink does with the messages.</p>
 */
public interface ProgressSink
{
    /**
     * Called when a stage starts or completes.
     * @param message human-readable progress text
     */
    void onProgress(String message);

    /**
     * Called for conditions that do not stop the pipeline but degrade its
     * result, such as an empty graph or default state names.
     * @param message human-readable warning text
     */
    void onWarning(String message);
}
