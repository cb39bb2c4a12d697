package com.questrail.l5x.api;

import java.util.Optional;
import java.util.Set;

/**
 * ControllerTag
 * -----------------------------------------------------------------------------
 * Read-only view of one tag from a controller's tag table.
 *
 * <h2>What a ControllerTag exposes</h2>
 * <ul>
 *   <li>its name and declared data type (e.g. {@code StateLogic})</li>
 *   <li>the names of its top-level members, for structured types</li>
 *   <li>per-bit description strings for bit-addressable array members</li>
 * </ul>
 *
 * <h2>Bit descriptions</h2>
 * State-machine tags conventionally carry a {@code ST} DINT array whose bit
 * {@code n} of element {@code 0} is the "state n active" flag. The description
 * attached to that bit is the only place a human-readable state name lives.
 * <p>
 * {@link #bitDescription(String, int, int)} distinguishes two outcomes:
 * <ul>
 *   <li>the address is valid but nothing describes it: an empty
 *       {@link Optional}</li>
 *   <li>the address itself cannot be resolved (unknown member, element or bit
 *       out of range, member is not an array): a {@link TagLookupException}</li>
 * </ul>
 * Callers that only need a best-effort name are expected to absorb both.
 */
public interface ControllerTag
{
    /**
     * Returns the tag name as declared in the tag table.
     */
    String name();

    /**
     * Returns the declared data type name, e.g. {@code "StateLogic"} or
     * {@code "DINT"}.
     */
    String dataType();

    /**
     * Returns the names of the top-level members of this tag. Atomic tags
     * return an empty set.
     */
    Set<String> memberNames();

    /**
     * Returns true if this tag exposes a top-level member called {@code member}.
     */
    default boolean hasMember(String member) {
        return memberNames().contains(member);
    }

    /**
     * Looks up the description attached to one bit of an array member.
     *
     * @param member  array member name, e.g. {@code "ST"}
     * @param element array element index
     * @param bit     bit position within the element
     * @return the description, or {@link Optional#empty()} if the bit carries none
     * @throws TagLookupException if the address cannot be resolved on this tag
     */
    Optional<String> bitDescription(String member, int element, int bit) throws TagLookupException;
}
