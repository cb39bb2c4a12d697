package com.questrail.l5x;

/**
 * Classification of pipeline-level failures.
 *
 * <p>The classification exists so callers can tell "fix your input path" apart
 * from "fix your input content" without parsing messages.</p>
 */
public enum FailureKind
{
    /** The input document does not exist or cannot be read. */
    INPUT_MISSING,

    /** The input exists but is not a structurally valid controller export. */
    MALFORMED_DOCUMENT,

    /** No routine contains a recognizable state-logic section. */
    SECTION_NOT_FOUND,

    /** No state tag was given and none could be detected. */
    TAG_NOT_RESOLVED,

    /** The rendered document could not be written. */
    OUTPUT_FAILED,

    /** Anything else; indicates a defect rather than bad input. */
    UNEXPECTED
}
