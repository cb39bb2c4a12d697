package com.questrail.l5x.section;

/**
 * The closed set of section-start conventions found in controller programs.
 */
public enum SectionStrategy
{
    /** A rung comment containing {@code "STATE LOGIC"}. */
    COMMENT_MARKER {
        @Override
        public SectionLocator locator() {
            return new CommentMarkerLocator();
        }
    },

    /** A rung that unlatches an {@code S3_State_Logic} step bit. */
    INSTRUCTION_MARKER {
        @Override
        public SectionLocator locator() {
            return new InstructionMarkerLocator();
        }
    };

    /**
     * Returns a locator implementing this convention with its default marker.
     */
    public abstract SectionLocator locator();
}
