package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LookupFunctionsTest {

    private FormulaHarness sheet;

    @BeforeEach
    void setUp() {
        sheet = new FormulaHarness()
                .column("A1", "Pen", "Brush", "Paint")
                .column("B1", 1.5, 8.5, 12)
                // sorted keys for approximate matching
                .column("D1", 0, 10, 20, 30)
                .column("E1", "F", "C", "B", "A")
                // descending keys
                .column("F1", 30, 20, 10, 0)
                .set("G1", "x").set("H1", "y")
                .set("G2", 1).set("H2", 2)
                .name("Table", "Sheet1!A1:B3");
    }

    @Test
    void testExactVlookup() {
        assertEquals(8.5, sheet.number("=VLOOKUP(\"Brush\",A1:B3,2,FALSE)"));
        assertEquals(8.5, sheet.number("=VLOOKUP(\"brush\",Table,2,FALSE)"));
        assertEquals(8.5, sheet.number("=VLOOKUP(\"Br*\",A1:B3,2,FALSE)"));
        assertEquals("Paint", sheet.text("=VLOOKUP(\"Paint\",A1:B3,1,FALSE)"));
        assertEquals(ErrorCode.NA, sheet.error("=VLOOKUP(\"Missing\",A1:B3,2,FALSE)"));
    }

    /**
     * Column index below 1 is #VALUE!, past the table #REF!.
     */
    @Test
    void testVlookupColumnIndex() {
        assertEquals(ErrorCode.REF, sheet.error("=VLOOKUP(\"Brush\",A1:B3,3,FALSE)"));
        assertEquals(ErrorCode.VALUE, sheet.error("=VLOOKUP(\"Brush\",A1:B3,0,FALSE)"));
    }

    /**
     * Approximate mode (the default) takes the largest key not above the lookup value.
     */
    @Test
    void testApproximateLookup() {
        assertEquals("B", sheet.text("=VLOOKUP(25,D1:E4,2)"));
        assertEquals("A", sheet.text("=VLOOKUP(99,D1:E4,2,TRUE)"));
        assertEquals("F", sheet.text("=VLOOKUP(0,D1:E4,2,TRUE)"));
        assertEquals(ErrorCode.NA, sheet.error("=VLOOKUP(-1,D1:E4,2,TRUE)"));
        assertEquals("B", sheet.text("=LOOKUP(25,D1:D4,E1:E4)"));
    }

    @Test
    void testHlookup() {
        assertEquals(2, sheet.number("=HLOOKUP(\"y\",G1:H2,2,FALSE)"));
        assertEquals(ErrorCode.NA, sheet.error("=HLOOKUP(\"z\",G1:H2,2,FALSE)"));
    }

    @Test
    void testMatch() {
        assertEquals(3, sheet.number("=MATCH(\"Paint\",A1:A3,0)"));
        assertEquals(3, sheet.number("=MATCH(25,D1:D4,1)"));
        assertEquals(3, sheet.number("=MATCH(25,D1:D4)"));
        assertEquals(2, sheet.number("=MATCH(15,F1:F4,-1)"));
        assertEquals(ErrorCode.NA, sheet.error("=MATCH(\"Glue\",A1:A3,0)"));
    }

    @Test
    void testIndex() {
        assertEquals(8.5, sheet.number("=INDEX(A1:B3,2,2)"));
        assertEquals("Paint", sheet.text("=INDEX(A1:A3,3)"));
        assertEquals(22, sheet.number("=SUM(INDEX(A1:B3,0,2))"));
        assertEquals(ErrorCode.REF, sheet.error("=INDEX(A1:B3,4,1)"));
        assertEquals("Brush", sheet.text("=INDEX(A1:A3,MATCH(8.5,B1:B3,0))"));
    }

    @Test
    void testChooseAndDimensions() {
        assertEquals("b", sheet.text("=CHOOSE(2,\"a\",\"b\",\"c\")"));
        assertEquals(ErrorCode.VALUE, sheet.error("=CHOOSE(5,\"a\")"));
        assertEquals(3, sheet.number("=ROWS(A1:B3)"));
        assertEquals(2, sheet.number("=COLUMNS(A1:B3)"));
    }

    /**
     * INDIRECT resolves text to a reference at evaluation time.
     */
    @Test
    void testIndirect() {
        assertEquals(8.5, sheet.number("=INDIRECT(\"B2\")"));
        assertEquals("Pen", sheet.text("=INDIRECT(\"Sheet1!A\"&1)"));
        assertEquals(22, sheet.number("=SUM(INDIRECT(\"B1:B3\"))"));
        assertEquals(8.5, sheet.number("=VLOOKUP(\"Brush\",INDIRECT(\"Table\"),2,FALSE)"));
        assertEquals(ErrorCode.REF, sheet.error("=INDIRECT(\"Nope!A1\")"));
        assertEquals(ErrorCode.REF, sheet.error("=INDIRECT(\"not a ref\")"));
    }

    @Test
    void testIndexHelpers() {
        List<CellValue> keys = Arrays.asList(CellValue.of(1), CellValue.text("b"), CellValue.of(3), CellValue.of(5));
        assertEquals(2, LookupFunctions.approximateIndex(keys, CellValue.of(4)));
        assertEquals(1, LookupFunctions.exactIndex(keys, CellValue.text("B")));
        assertEquals(-1, LookupFunctions.exactIndex(keys, CellValue.of(4)));
    }
}
