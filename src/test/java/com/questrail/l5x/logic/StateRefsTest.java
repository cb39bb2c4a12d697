package com.questrail.l5x.logic;

import org.junit.jupiter.api.Test;

import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

final class StateRefsTest
{
    @Test
    void trailingDigitRunIsTheStateId()
    {
        assertEquals(OptionalInt.of(14), StateRefs.stateId("_A28_PH.ST[0].14"));
        assertEquals(OptionalInt.of(1), StateRefs.stateId("_A28_PH.NST[0].1"));
        assertEquals(OptionalInt.of(0), StateRefs.stateId("S.ST[0].0"));
    }

    @Test
    void leadingZerosAreParsedAsDecimal()
    {
        assertEquals(OptionalInt.of(7), StateRefs.stateId("Tag.ST[0].007"));
    }

    @Test
    void operandWithoutTrailingDigitRunHasNoId()
    {
        assertTrue(StateRefs.stateId("StartPB").isEmpty());
        assertTrue(StateRefs.stateId("Seq.S3_State_Logic").isEmpty());
        assertTrue(StateRefs.stateId("Tag.ST[0]").isEmpty());
        assertTrue(StateRefs.stateId("Tag.Step1").isEmpty());
        assertTrue(StateRefs.stateId("").isEmpty());
        assertTrue(StateRefs.stateId(null).isEmpty());
    }

    @Test
    void digitRunTooLargeForIntHasNoId()
    {
        assertTrue(StateRefs.stateId("Tag.ST[0].99999999999").isEmpty());
    }

    @Test
    void tagRootIsTextBeforeFirstDot()
    {
        assertEquals("MyTag", StateRefs.tagRoot("MyTag.ST[0].0"));
        assertEquals("Plain", StateRefs.tagRoot("Plain"));
    }
}
