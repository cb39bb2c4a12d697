package com.questrail.l5x.section;

import com.questrail.l5x.api.RungRecord;
import com.questrail.l5x.logic.Instruction;
import com.questrail.l5x.logic.InstructionParser;
import com.questrail.l5x.logic.Mnemonic;

import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Finds the first rung whose logic text unlatches a bit whose operand contains
 * a marker text, by default {@value #DEFAULT_MARKER}.
 *
 * <p>Programs following this convention clear a step flag such as
 * {@code OTU(Seq.S3_State_Logic)} on the rung that opens the section.</p>
 */
public final class InstructionMarkerLocator implements SectionLocator
{
    public static final String DEFAULT_MARKER = "S3_State_Logic";

    private final String marker;
    private final InstructionParser parser;

    public InstructionMarkerLocator() {
        this(DEFAULT_MARKER);
    }

    public InstructionMarkerLocator(String marker) {
        this.marker = Objects.requireNonNull(marker, "marker");
        if (marker.isEmpty()) {
            throw new IllegalArgumentException("marker must not be empty");
        }
        this.parser = new InstructionParser();
    }

    @Override
    public OptionalInt locateStart(List<RungRecord> rungs) {
        for (int i = 0; i < rungs.size(); i++) {
            String logic = rungs.get(i).logicText().orElse(null);
            if (logic != null && unlatchesMarker(logic)) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    private boolean unlatchesMarker(String logic) {
        for (Instruction instruction : parser.instructions(logic)) {
            if (instruction.is(Mnemonic.OTU) && instruction.operand().contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
