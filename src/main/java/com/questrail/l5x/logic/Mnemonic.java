package com.questrail.l5x.logic;

/**
 * Instruction mnemonics the parser distinguishes. Matching is exact and
 * case-sensitive; anything else is {@link #UNRECOGNIZED}.
 */
public enum Mnemonic
{
    /** Examine if closed: a condition on a bit. */
    XIC,

    /** Output latch: sets a bit. */
    OTL,

    /** Output unlatch: clears a bit. */
    OTU,

    /** No-op placeholder. */
    NOP,

    /** Any instruction outside the set above. */
    UNRECOGNIZED;

    /**
     * Maps a raw mnemonic name to its constant.
     */
    public static Mnemonic of(String name) {
        return switch (name) {
            case "XIC" -> XIC;
            case "OTL" -> OTL;
            case "OTU" -> OTU;
            case "NOP" -> NOP;
            default -> UNRECOGNIZED;
        };
    }
}
