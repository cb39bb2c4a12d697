package com.questrail.l5x.api;

import java.util.Objects;
import java.util.Optional;

/**
 * RungRecord
 * -----------------------------------------------------------------------------
 * One ladder-logic rung as exposed by a {@link ControllerProject}.
 *
 * <p>A rung carries two independent, optional payloads:</p>
 * <ul>
 *   <li>a free-text <b>comment</b>, which may contain a section marker such as
 *       {@code "STATE LOGIC"} or {@code "FAULT"}</li>
 *   <li>a <b>logic text</b> in instruction-mnemonic form, e.g.
 *       {@code XIC(S.ST[0].0)OTL(S.ST[0].1);}</li>
 * </ul>
 *
 * <p>Either payload may be absent. Comment-only separator rungs are common and
 * are not an error anywhere in the pipeline. Blank payloads are normalized to
 * absent at construction so downstream code only needs one emptiness check.</p>
 *
 * <p>Instances are immutable and owned by the document provider. Pipeline
 * stages only read them.</p>
 */
public final class RungRecord
{
    private final int position;
    private final String comment;
    private final String logicText;

    private RungRecord(int position, String comment, String logicText) {
        this.position = position;
        this.comment = comment;
        this.logicText = logicText;
    }

    /**
     * Creates a rung record.
     *
     * @param position  0-based position of the rung within its routine
     * @param comment   comment payload, or {@code null} if absent
     * @param logicText logic-text payload, or {@code null} if absent
     * @return a new rung record
     * @throws IllegalArgumentException if {@code position} is negative
     */
    public static RungRecord of(int position, String comment, String logicText) {
        if (position < 0) {
            throw new IllegalArgumentException("position must be non-negative (was " + position + ")");
        }
        return new RungRecord(position, normalize(comment), normalize(logicText));
    }

    private static String normalize(String payload) {
        if (payload == null || payload.isBlank()) {
            return null;
        }
        return payload;
    }

    /**
     * Returns the 0-based position of this rung within its routine.
     */
    public int position() {
        return position;
    }

    /**
     * Returns the comment payload, if present.
     */
    public Optional<String> comment() {
        return Optional.ofNullable(comment);
    }

    /**
     * Returns the logic-text payload, if present.
     */
    public Optional<String> logicText() {
        return Optional.ofNullable(logicText);
    }

    /**
     * Returns true if the comment payload contains {@code marker}.
     */
    public boolean commentContains(String marker) {
        Objects.requireNonNull(marker, "marker");
        return comment != null && comment.contains(marker);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RungRecord that)) return false;
        return position == that.position
                && Objects.equals(comment, that.comment)
                && Objects.equals(logicText, that.logicText);
    }

    @Override
    public int hashCode() {
        return Objects.hash(position, comment, logicText);
    }

    @Override
    public String toString() {
        return "RungRecord[" + position + "]";
    }
}
