package com.questrail.l5x.logic;

import com.questrail.l5x.api.RungRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * InstructionParser
 * -----------------------------------------------------------------------------
 * Reads one rung's logic text as a state transition.
 *
 * <h2>Grammar</h2>
 * <ul>
 *   <li>Text starting with {@code NOP()} is a placeholder rung and yields
 *       nothing, whatever follows.</li>
 *   <li>The <b>source</b> state comes only from an {@code XIC(<operand>)} at the
 *       very start of the text.</li>
 *   <li><b>Target</b> states come from every {@code OTL(<operand>)} anywhere in
 *       the text, left to right, duplicates kept.</li>
 *   <li>Every other instruction, branch bracket and separator is ignored.</li>
 * </ul>
 *
 * <p>This is not a ladder-logic interpreter. Absent, blank or unreadable text
 * yields {@link RungTransition#NONE} rather than an error.</p>
 */
public final class InstructionParser
{
    private static final String NOP_PREFIX = "NOP()";

    /** Mnemonic followed by a parenthesized operand list without nested ')'. */
    private static final Pattern INSTRUCTION = Pattern.compile("([A-Za-z_][A-Za-z0-9_]*)\\(([^)]*)\\)");

    /**
     * Splits logic text into the instructions it contains, in scan order.
     * Offsets are relative to the trimmed text.
     */
    public List<Instruction> instructions(String logicText) {
        List<Instruction> result = new ArrayList<>();
        if (logicText == null) {
            return result;
        }
        Matcher m = INSTRUCTION.matcher(logicText.strip());
        while (m.find()) {
            String name = m.group(1);
            result.add(new Instruction(Mnemonic.of(name), name, m.group(2).strip(), m.start()));
        }
        return result;
    }

    /**
     * Parses a rung; rungs without logic text yield {@link RungTransition#NONE}.
     */
    public RungTransition parse(RungRecord rung) {
        return rung.logicText().map(this::parse).orElse(RungTransition.NONE);
    }

    /**
     * Parses one logic text into its edge contribution.
     */
    public RungTransition parse(String logicText) {
        if (logicText == null) {
            return RungTransition.NONE;
        }
        String logic = logicText.strip();
        if (logic.isEmpty() || logic.startsWith(NOP_PREFIX)) {
            return RungTransition.NONE;
        }

        OptionalInt source = OptionalInt.empty();
        List<Integer> targets = new ArrayList<>();
        for (Instruction instruction : instructions(logic)) {
            if (instruction.offset() == 0 && instruction.is(Mnemonic.XIC)) {
                source = StateRefs.stateId(instruction.operand());
            } else if (instruction.is(Mnemonic.OTL)) {
                StateRefs.stateId(instruction.operand()).ifPresent(targets::add);
            }
        }
        return new RungTransition(source, targets);
    }

    /**
     * Returns the operand of the {@code XIC} that opens {@code logicText}, if any.
     */
    public Optional<String> leadingExamineOperand(String logicText) {
        List<Instruction> parsed = instructions(logicText);
        if (!parsed.isEmpty() && parsed.get(0).offset() == 0 && parsed.get(0).is(Mnemonic.XIC)) {
            return Optional.of(parsed.get(0).operand());
        }
        return Optional.empty();
    }
}
