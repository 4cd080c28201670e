package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.ErrorCode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CriteriaTest {

    private static Criteria criteria(String text) {
        return Criteria.parse(CellValue.text(text));
    }

    @Test
    void testNumericOperators() {
        assertTrue(criteria(">=10").test(CellValue.of(10)));
        assertFalse(criteria(">10").test(CellValue.of(10)));
        assertTrue(criteria("<>5").test(CellValue.of(4)));
        assertTrue(criteria("<>5").test(CellValue.text("five")));
        assertFalse(criteria("<5").test(CellValue.text("1")));
    }

    /**
     * A plain number matches numeric text as well.
     */
    @Test
    void testEquality() {
        assertTrue(criteria("5").test(CellValue.of(5)));
        assertTrue(criteria("=5").test(CellValue.text("5")));
        assertTrue(Criteria.parse(CellValue.of(5)).test(CellValue.of(5)));
        assertTrue(criteria("true").test(CellValue.TRUE));
        assertTrue(criteria("apple").test(CellValue.text("APPLE")));
        assertFalse(criteria("apple").test(CellValue.error(ErrorCode.NA)));
    }

    @Test
    void testBlanks() {
        assertTrue(criteria("=").test(CellValue.EMPTY));
        assertFalse(criteria("=").test(CellValue.of(0)));
        assertTrue(criteria("<>").test(CellValue.of(0)));
        assertFalse(criteria("<>").test(CellValue.EMPTY));
        assertTrue(criteria("").test(CellValue.EMPTY_TEXT));
    }

    /**
     * * and ? are wildcards unless escaped with ~.
     */
    @Test
    void testWildcards() {
        assertTrue(criteria("a*e").test(CellValue.text("Apple")));
        assertTrue(criteria("?at").test(CellValue.text("cat")));
        assertFalse(criteria("?at").test(CellValue.text("chat")));
        assertTrue(criteria("<>a*").test(CellValue.text("banana")));
        assertTrue(criteria("what~?").test(CellValue.text("what?")));
        assertFalse(criteria("what~?").test(CellValue.text("whats")));
        assertFalse(criteria("a*").test(CellValue.of(1)));
        assertTrue(Criteria.compileWildcard("x.y*").matcher("X.Y+z").matches());
    }
}
