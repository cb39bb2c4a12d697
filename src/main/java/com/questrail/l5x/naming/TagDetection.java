package com.questrail.l5x.naming;

import com.questrail.l5x.section.SectionStrategy;

import java.util.ArrayList;
import java.util.List;

/**
 * Ways of finding the state-holder tag when the caller names none.
 */
public enum TagDetection
{
    /** First tag in the tag table whose data type equals the designated type. */
    DATA_TYPE,

    /**
     * Root of the leading {@code XIC} operand on the rung right after the
     * section start, accepted if that tag exposes the state-bit member.
     */
    LEADING_XIC;

    /**
     * Returns the detection that belongs to the same program convention as
     * {@code strategy}.
     */
    public static TagDetection pairedWith(SectionStrategy strategy) {
        return switch (strategy) {
            case COMMENT_MARKER -> DATA_TYPE;
            case INSTRUCTION_MARKER -> LEADING_XIC;
        };
    }

    /**
     * Returns every detection in the order they are tried for a section found
     * by {@code strategy}: the paired detection first, then the rest.
     */
    public static List<TagDetection> tryOrder(SectionStrategy strategy) {
        TagDetection paired = pairedWith(strategy);
        List<TagDetection> order = new ArrayList<>(List.of(paired));
        for (TagDetection detection : values()) {
            if (detection != paired) {
                order.add(detection);
            }
        }
        return List.copyOf(order);
    }
}
