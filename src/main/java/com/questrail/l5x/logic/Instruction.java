package com.questrail.l5x.logic;

import java.util.Objects;

/**
 * One instruction occurrence within a rung's logic text.
 *
 * @param mnemonic classified mnemonic
 * @param name     mnemonic exactly as written, e.g. {@code "MOV"} for an
 *                 {@link Mnemonic#UNRECOGNIZED} instruction
 * @param operand  raw text between the parentheses, possibly empty
 * @param offset   character offset of the mnemonic within the trimmed text
 */
public record Instruction(Mnemonic mnemonic, String name, String operand, int offset) {

    public Instruction {
        Objects.requireNonNull(mnemonic, "mnemonic");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(operand, "operand");
    }

    public boolean is(Mnemonic expected) {
        return mnemonic == expected;
    }
}
