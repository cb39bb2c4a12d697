package com.questrail.l5x.api;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Test {@link ControllerTag}: every member is a one-element array whose
 * element is {@code bitWidth} bits wide.
 */
public final class InMemoryTag implements ControllerTag
{
    private final String name;
    private final String dataType;
    private final Map<String, Integer> memberWidths = new LinkedHashMap<>();
    private final Map<String, String> descriptions = new HashMap<>();

    private InMemoryTag(String name, String dataType) {
        this.name = name;
        this.dataType = dataType;
    }

    public static InMemoryTag of(String name, String dataType) {
        return new InMemoryTag(name, dataType);
    }

    /**
     * Returns a {@code StateLogic} tag with a 32-bit {@code ST} member.
     */
    public static InMemoryTag stateTag(String name) {
        return of(name, "StateLogic").withMember("ST", 32);
    }

    public InMemoryTag withMember(String member, int bitWidth) {
        memberWidths.put(member, bitWidth);
        return this;
    }

    public InMemoryTag describe(int bit, String description) {
        descriptions.put("ST[0]." + bit, description);
        return this;
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
        return memberWidths.keySet();
    }

    @Override
    public Optional<String> bitDescription(String member, int element, int bit) throws TagLookupException {
        Integer width = memberWidths.get(member);
        if (width == null) {
            throw new TagLookupException("no member " + member);
        }
        if (element != 0 || bit < 0 || bit >= width) {
            throw new TagLookupException("out of range " + member + "[" + element + "]." + bit);
        }
        return Optional.ofNullable(descriptions.get(member + "[" + element + "]." + bit));
    }
}
