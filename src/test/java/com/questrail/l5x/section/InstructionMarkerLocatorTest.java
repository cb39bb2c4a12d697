package com.questrail.l5x.section;

import org.junit.jupiter.api.Test;

import java.util.OptionalInt;

import static com.questrail.l5x.api.InMemoryControllerProject.*;
import static org.junit.jupiter.api.Assertions.*;

final class InstructionMarkerLocatorTest
{
    private final InstructionMarkerLocator locator = new InstructionMarkerLocator();

    @Test
    void firstRungUnlatchingMarkerBitWins()
    {
        OptionalInt start = locator.locateStart(rungs(
                comment("STATE LOGIC"),
                logic("XIC(Seq.Step)OTU(Seq.S3_State_Logic);"),
                logic("OTU(Seq.S3_State_Logic);")));

        assertEquals(OptionalInt.of(1), start);
    }

    @Test
    void markerInAnyUnlatchOfTheRungCounts()
    {
        OptionalInt start = locator.locateStart(rungs(
                logic("XIC(Go)OTU(Other)OTU(Seq.S3_State_Logic);")));

        assertEquals(OptionalInt.of(0), start);
    }

    @Test
    void markerInOtherInstructionsDoesNotCount()
    {
        assertTrue(locator.locateStart(rungs(
                logic("XIC(Seq.S3_State_Logic)OTL(Seq.S3_State_Logic);"),
                comment("S3_State_Logic"))).isEmpty());
    }

    @Test
    void rungsWithoutTextAreSkipped()
    {
        assertTrue(locator.locateStart(rungs(comment("only a comment"))).isEmpty());
    }
}
