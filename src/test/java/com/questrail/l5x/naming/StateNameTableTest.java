package com.questrail.l5x.naming;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class StateNameTableTest
{
    @Test
    void missingEntriesReadAsDefaultName()
    {
        StateNameTable table = StateNameTable.of(Map.of(1, "Run"));

        assertEquals("Run", table.nameOf(1));
        assertEquals("State 2", table.nameOf(2));
        assertEquals("State 7", StateNameTable.defaults().nameOf(7));
    }

    @Test
    void emptyTableIsTheDefaultsTable()
    {
        assertSame(StateNameTable.defaults(), StateNameTable.of(Map.of()));
        assertEquals(StateNameTable.of(Map.of(1, "Run")), StateNameTable.of(Map.of(1, "Run")));
    }
}
