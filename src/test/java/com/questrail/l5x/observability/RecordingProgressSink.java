package com.questrail.l5x.observability;

import java.util.ArrayList;
import java.util.List;

/**
 * Test sink that records messages for assertions.
 */
public final class RecordingProgressSink implements ProgressSink {
    private final List<String> progress = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    @Override
    public synchronized void onProgress(String message) {
        progress.add(message);
    }

    @Override
    public synchronized void onWarning(String message) {
        warnings.add(message);
    }

    public synchronized List<String> getProgress() {
        return new ArrayList<>(progress);
    }

    public synchronized List<String> getWarnings() {
        return new ArrayList<>(warnings);
    }

    public synchronized boolean hasProgressContaining(String text) {
        return progress.stream().anyMatch(m -> m.contains(text));
    }
}
