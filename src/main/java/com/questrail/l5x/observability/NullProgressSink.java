package com.questrail.l5x.observability;

/**
 * No-op implementation of {@link ProgressSink}.
 */
public final class NullProgressSink implements ProgressSink {
    public static final NullProgressSink INSTANCE = new NullProgressSink();

    private NullProgressSink() {}

    @Override
    public void onProgress(String message) {}

    @Override
    public void onWarning(String message) {}
}
