package com.questrail.l5x.project;

import com.questrail.l5x.api.ControllerTag;
import com.questrail.l5x.api.TagLookupException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * {@link ControllerTag} backed by one {@code Tag} element of an L5X export.
 *
 * <p>Operand comments are keyed by their upper-cased {@code Operand} attribute
 * ({@code .ST[0].3}); Logix exports the operand case-insensitively.</p>
 */
final class L5xTag implements ControllerTag
{
    private final String name;
    private final String dataType;
    private final Map<String, L5xMember> members;
    private final Map<String, String> operandComments;

    L5xTag(String name,
           String dataType,
           Map<String, L5xMember> members,
           Map<String, String> operandComments) {
        this.name = Objects.requireNonNull(name, "name");
        this.dataType = Objects.requireNonNull(dataType, "dataType");
        this.members = Collections.unmodifiableMap(new LinkedHashMap<>(members));
        this.operandComments = Map.copyOf(operandComments);
    }

    static String operandKey(String operand) {
        return operand.toUpperCase();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String dataType() {
        return dataType;
    }

    @Override
    public Set<String> memberNames() {
        return members.keySet();
    }

    @Override
    public Optional<String> bitDescription(String member, int element, int bit) throws TagLookupException {
        Objects.requireNonNull(member, "member");

        L5xMember shape = members.get(member);
        if (shape == null) {
            throw new TagLookupException("Tag " + name + " has no member " + member);
        }
        if (!shape.isArray()) {
            throw new TagLookupException("Member " + name + "." + member + " is not an array");
        }
        if (element < 0 || element >= shape.dimension()) {
            throw new TagLookupException("Element " + element + " out of range for "
                    + name + "." + member + "[" + shape.dimension() + "]");
        }
        int width = shape.bitWidth();
        if (bit < 0 || (width > 0 && bit >= width)) {
            throw new TagLookupException("Bit " + bit + " out of range for "
                    + shape.dataType() + " element of " + name + "." + member);
        }

        String operand = "." + member + "[" + element + "]." + bit;
        return Optional.ofNullable(operandComments.get(operandKey(operand)));
    }

    @Override
    public String toString() {
        return "L5xTag[" + name + ":" + dataType + "]";
    }
}
