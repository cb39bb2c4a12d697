package com.questrail.l5x.section;

import com.questrail.l5x.api.RungRecord;

import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Finds the first rung whose comment contains a marker text, by default
 * {@value #DEFAULT_MARKER}.
 */
public final class CommentMarkerLocator implements SectionLocator
{
    public static final String DEFAULT_MARKER = "STATE LOGIC";

    private final String marker;

    public CommentMarkerLocator() {
        this(DEFAULT_MARKER);
    }

    public CommentMarkerLocator(String marker) {
        this.marker = Objects.requireNonNull(marker, "marker");
        if (marker.isEmpty()) {
            throw new IllegalArgumentException("marker must not be empty");
        }
    }

    @Override
    public OptionalInt locateStart(List<RungRecord> rungs) {
        for (int i = 0; i < rungs.size(); i++) {
            if (rungs.get(i).commentContains(marker)) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }
}
