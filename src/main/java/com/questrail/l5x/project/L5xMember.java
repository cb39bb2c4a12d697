package com.questrail.l5x.project;

import java.util.Objects;

/**
 * Shape of one top-level member of a structured tag.
 *
 * @param name      member name, e.g. {@code ST}
 * @param dataType  member data type, e.g. {@code DINT}
 * @param dimension number of array elements, or {@code 0} for a scalar member
 */
record L5xMember(String name, String dataType, int dimension) {

    L5xMember {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(dataType, "dataType");
        if (dimension < 0) {
            throw new IllegalArgumentException("dimension must be non-negative");
        }
    }

    boolean isArray() {
        return dimension > 0;
    }

    /**
     * Returns the number of addressable bits in one element, or {@code -1}
     * when the element type is not a plain integer and the width is unknown.
     */
    int bitWidth() {
        return switch (dataType.toUpperCase()) {
            case "SINT", "USINT" -> 8;
            case "INT", "UINT" -> 16;
            case "DINT", "UDINT" -> 32;
            case "LINT", "ULINT" -> 64;
            default -> -1;
        };
    }
}
