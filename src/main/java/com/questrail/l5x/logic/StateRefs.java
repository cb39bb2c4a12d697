package com.questrail.l5x.logic;

import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extraction of state identifiers from tag-member references.
 *
 * <p>A state reference has the shape {@code <tag-root>.<qualifier-path>.<digits>},
 * e.g. {@code _A28_PH.ST[0].14}. The trailing digit run after the last dot is
 * the state id. A reference without one is not a state reference.</p>
 */
public final class StateRefs
{
    private static final Pattern TRAILING_BIT = Pattern.compile("\\.(\\d+)$");

    private StateRefs() {}

    /**
     * Returns the state id encoded in {@code operand}.
     *
     * @return the id, or empty if there is no trailing {@code .<digits>} run or
     *         the run does not fit an {@code int}
     */
    public static OptionalInt stateId(String operand) {
        if (operand == null) {
            return OptionalInt.empty();
        }
        Matcher m = TRAILING_BIT.matcher(operand.strip());
        if (!m.find()) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(m.group(1)));
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }

    /**
     * Returns the tag root of a member reference: everything before the first
     * dot, or the whole reference if it has none.
     */
    public static String tagRoot(String operand) {
        String trimmed = operand.strip();
        int dot = trimmed.indexOf('.');
        return dot < 0 ? trimmed : trimmed.substring(0, dot);
    }
}
