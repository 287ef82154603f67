package com.ethnicthv.qcircuit.core.layout;

import com.ethnicthv.qcircuit.core.UnsupportedLayoutModeException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class LayoutModeTest {

    @Test
    void serialAliases() {
        assertEquals(LayoutMode.SERIAL, LayoutMode.fromName("serial"));
        assertEquals(LayoutMode.SERIAL, LayoutMode.fromName("horizontal"));
        assertEquals(LayoutMode.SERIAL, LayoutMode.fromName(" Serial "));
    }

    @Test
    void packedAliases() {
        assertEquals(LayoutMode.PACKED, LayoutMode.fromName("packed"));
        assertEquals(LayoutMode.PACKED, LayoutMode.fromName("parallel"));
        assertEquals(LayoutMode.PACKED, LayoutMode.fromName("vertical"));
        assertEquals(LayoutMode.PACKED, LayoutMode.fromName("VERTICAL"));
    }

    @Test
    void unknownNameIsRejected() {
        UnsupportedLayoutModeException ex = assertThrows(UnsupportedLayoutModeException.class,
                () -> LayoutMode.fromName("diagonal"));
        assertEquals("diagonal", ex.getSelector());
        assertTrue(ex.getMessage().contains("diagonal"));

        assertThrows(UnsupportedLayoutModeException.class, () -> LayoutMode.fromName(""));
        assertThrows(UnsupportedLayoutModeException.class, () -> LayoutMode.fromName(null));
    }
}
