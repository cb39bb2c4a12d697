package com.questrail.l5x.logic;

import com.questrail.l5x.api.RungRecord;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link InstructionParser}.
 */
final class InstructionParserTest
{
    private final InstructionParser parser = new InstructionParser();

    @Test
    void leadingExamineAndLatchFormATransition()
    {
        RungTransition t = parser.parse("XIC(S.ST[0].0)OTL(S.ST[0].1);");

        assertEquals(OptionalInt.of(0), t.source());
        assertEquals(List.of(1), t.targets());
        assertTrue(t.isTransition());
    }

    @Test
    void nopRungYieldsNothingWhateverFollows()
    {
        assertEquals(RungTransition.NONE, parser.parse("NOP();"));
        assertEquals(RungTransition.NONE, parser.parse("NOP()XIC(S.ST[0].0)OTL(S.ST[0].1);"));
        assertEquals(RungTransition.NONE, parser.parse("  NOP() OTL(S.ST[0].4);"));
    }

    @Test
    void sourceOnlyFromExamineAtVeryStart()
    {
        RungTransition t = parser.parse("XIO(Fault)XIC(S.ST[0].3)OTL(S.ST[0].4);");

        assertTrue(t.source().isEmpty());
        assertEquals(List.of(4), t.targets());
        assertFalse(t.isTransition());
    }

    @Test
    void leadingExamineWithoutStateBitGivesNoSource()
    {
        RungTransition t = parser.parse("XIC(StartPB)OTL(S.ST[0].2);");

        assertTrue(t.source().isEmpty());
        assertEquals(List.of(2), t.targets());
    }

    @Test
    void latchesAnywhereAreCollectedInScanOrderWithDuplicates()
    {
        RungTransition t = parser.parse(
                "XIC(S.ST[0].2)[XIC(Done)OTL(S.NST[0].5),XIC(Abort)OTL(S.NST[0].0)]OTL(S.NST[0].5);");

        assertEquals(OptionalInt.of(2), t.source());
        assertEquals(List.of(5, 0, 5), t.targets());
    }

    @Test
    void unlatchAndOtherInstructionsAreIgnored()
    {
        RungTransition t = parser.parse("XIC(S.ST[0].1)OTU(S.ST[0].1)MOV(5,Timer.PRE)TON(Timer,?,?)OTL(Flag);");

        assertEquals(OptionalInt.of(1), t.source());
        assertTrue(t.targets().isEmpty());
        assertFalse(t.isTransition());
    }

    @Test
    void mnemonicsAreCaseSensitive()
    {
        RungTransition t = parser.parse("xic(S.ST[0].1)otl(S.ST[0].2);");

        assertEquals(RungTransition.NONE, t);
    }

    @Test
    void absentOrBlankTextYieldsNothing()
    {
        assertEquals(RungTransition.NONE, parser.parse((String) null));
        assertEquals(RungTransition.NONE, parser.parse("   "));
        assertEquals(RungTransition.NONE, parser.parse(RungRecord.of(0, "separator", null)));
    }

    @Test
    void surroundingWhitespaceIsIgnored()
    {
        RungTransition t = parser.parse("\n  XIC(S.ST[0].6)OTL(S.ST[0].7);  ");

        assertEquals(OptionalInt.of(6), t.source());
        assertEquals(List.of(7), t.targets());
    }

    @Test
    void instructionsAreClassifiedInScanOrder()
    {
        List<Instruction> instructions = parser.instructions("XIC(A.ST[0].1)NOP()OTU(B)JSR(Sub,0);");

        assertEquals(4, instructions.size());
        assertEquals(Mnemonic.XIC, instructions.get(0).mnemonic());
        assertEquals("A.ST[0].1", instructions.get(0).operand());
        assertEquals(0, instructions.get(0).offset());
        assertEquals(Mnemonic.NOP, instructions.get(1).mnemonic());
        assertEquals("", instructions.get(1).operand());
        assertEquals(Mnemonic.OTU, instructions.get(2).mnemonic());
        assertEquals(Mnemonic.UNRECOGNIZED, instructions.get(3).mnemonic());
        assertEquals("JSR", instructions.get(3).name());
        assertEquals("Sub,0", instructions.get(3).operand());
    }

    @Test
    void leadingExamineOperandIsExposed()
    {
        assertEquals("MyTag.ST[0].0", parser.leadingExamineOperand("XIC(MyTag.ST[0].0)OTL(X);").orElseThrow());
        assertTrue(parser.leadingExamineOperand("XIO(MyTag.ST[0].0);").isEmpty());
        assertTrue(parser.leadingExamineOperand(null).isEmpty());
    }
}
