package com.spreadsheet.calc.models;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class CellValueTest {

    @Test
    void testFromObject() {
        assertEquals(CellValue.of(2.5), CellValue.fromObject(2.5));
        assertEquals(CellValue.of(3), CellValue.fromObject(3));
        assertEquals(CellValue.TRUE, CellValue.fromObject(Boolean.TRUE));
        assertEquals(CellValue.EMPTY, CellValue.fromObject(null));
        assertEquals(CellValue.error(ErrorCode.NA), CellValue.fromObject("#N/A"));
        assertEquals(CellValue.text("hello"), CellValue.fromObject("hello"));
    }

    /**
     * NaN and infinities are not representable in a cell.
     */
    @Test
    void testNonFiniteBecomesNumError() {
        assertEquals(ErrorCode.NUM, CellValue.of(Double.NaN).getError());
        assertEquals(ErrorCode.NUM, CellValue.of(Double.POSITIVE_INFINITY).getError());
    }

    /**
     * General format: integers without decimals, at most 15 significant digits.
     */
    @Test
    void testFormat() {
        assertEquals("42", CellValue.of(42).format());
        assertEquals("0.3", CellValue.of(0.1 + 0.2).format());
        assertEquals("TRUE", CellValue.TRUE.format());
        assertEquals("#DIV/0!", CellValue.error(ErrorCode.DIV0).format());
        assertEquals("", CellValue.EMPTY.format());
    }

    @Test
    void testToObject() {
        assertEquals(1.5, CellValue.of(1.5).toObject());
        assertEquals("#REF!", CellValue.error(ErrorCode.REF).toObject());
        assertNull(CellValue.EMPTY.toObject());
    }

    @Test
    void testRangeVector() {
        RangeValue range = RangeValue.of(Arrays.asList(
                Arrays.asList(CellValue.of(1), CellValue.of(2)),
                Arrays.asList(CellValue.of(3), CellValue.of(4))));
        assertEquals(2, range.getRows());
        assertEquals(2, range.getColumns());
        assertEquals(CellValue.of(4), range.get(1, 1));
        assertEquals(Arrays.asList(CellValue.of(2), CellValue.of(4)), range.column(1));
    }
}
