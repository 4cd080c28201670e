package com.spreadsheet.calc.models;

import com.spreadsheet.calc.exceptions.InvalidAddressException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CellAddressTest {

    /**
     * Plain, absolute and sheet-qualified addresses.
     */
    @Test
    void testParseForms() {
        CellAddress plain = CellAddress.parse("B7");
        assertNull(plain.getSheetName());
        assertEquals(2, plain.getColumn());
        assertEquals(7, plain.getRow());

        CellAddress absolute = CellAddress.parse("$AA$10");
        assertEquals(27, absolute.getColumn());
        assertTrue(absolute.isAbsoluteColumn());
        assertTrue(absolute.isAbsoluteRow());

        CellAddress quoted = CellAddress.parse("'My Sheet'!C3");
        assertEquals("My Sheet", quoted.getSheetName());
        assertEquals("'My Sheet'!C3", quoted.toString());
        assertEquals("C3", quoted.toA1());
    }

    @Test
    void testColumnLetters() {
        assertEquals(1, CellAddress.lettersToColumn("A"));
        assertEquals(26, CellAddress.lettersToColumn("z"));
        assertEquals(16384, CellAddress.lettersToColumn("XFD"));
        assertEquals("AA", CellAddress.columnToLetters(27));
        assertEquals("XFD", CellAddress.columnToLetters(16384));
    }

    /**
     * Malformed and out-of-grid addresses are rejected.
     */
    @Test
    void testInvalidAddresses() {
        assertThrows(InvalidAddressException.class, () -> CellAddress.parse(""));
        assertThrows(InvalidAddressException.class, () -> CellAddress.parse("A0"));
        assertThrows(InvalidAddressException.class, () -> CellAddress.parse("1A"));
        assertThrows(InvalidAddressException.class, () -> CellAddress.parse("XFE1"));
        assertThrows(InvalidAddressException.class, () -> CellAddress.parse("A1048577"));
        assertThrows(InvalidAddressException.class, () -> CellAddress.parse("!A1"));
    }

    /**
     * Range ends inherit the start's sheet; two different sheets fail.
     */
    @Test
    void testParseRange() {
        CellAddress[] range = CellAddress.parseRange("Data!$A$1:B5");
        assertEquals("Data", range[0].getSheetName());
        assertEquals("Data", range[1].getSheetName());
        assertEquals(5, range[1].getRow());

        CellAddress[] single = CellAddress.parseRange("C2");
        assertEquals(single[0], single[1]);

        assertThrows(InvalidAddressException.class, () -> CellAddress.parseRange("A!A1:B!B2"));
    }

    @Test
    void testKeyIgnoresCaseAndMarkers() {
        assertEquals(CellAddress.parse("sheet1!$a$1").key(), CellAddress.parse("Sheet1!A1").key());
        assertEquals("SHEET1!A1", CellAddress.parse("Sheet1!A1").key());
    }
}
