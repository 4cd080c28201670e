package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.models.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TextFunctionsTest {

    private FormulaHarness sheet;

    @BeforeEach
    void setUp() {
        sheet = new FormulaHarness()
                .column("A1", "Hello", "World", null, 42);
    }

    @Test
    void testJoining() {
        assertEquals("Hello World", sheet.text("=CONCATENATE(A1,\" \",A2)"));
        assertEquals("HelloWorld42", sheet.text("=CONCAT(A1:A4)"));
        assertEquals("Hello-World-42", sheet.text("=TEXTJOIN(\"-\",TRUE,A1:A4)"));
        assertEquals("Hello-World--42", sheet.text("=TEXTJOIN(\"-\",FALSE,A1:A4)"));
        assertEquals("Total: 1.5", sheet.text("=\"Total: \"&1.5"));
        assertEquals("TRUE!", sheet.text("=TRUE&\"!\""));
    }

    @Test
    void testSubstrings() {
        assertEquals("He", sheet.text("=LEFT(A1,2)"));
        assertEquals("H", sheet.text("=LEFT(A1)"));
        assertEquals("ld", sheet.text("=RIGHT(A2,2)"));
        assertEquals("ell", sheet.text("=MID(A1,2,3)"));
        assertEquals("Hello", sheet.text("=LEFT(A1,99)"));
        assertEquals(5, sheet.number("=LEN(A1)"));
        assertEquals(2, sheet.number("=LEN(A4)"));
        assertEquals(ErrorCode.VALUE, sheet.error("=MID(A1,0,1)"));
    }

    @Test
    void testCaseAndSpacing() {
        assertEquals("HELLO", sheet.text("=UPPER(A1)"));
        assertEquals("world", sheet.text("=LOWER(A2)"));
        assertEquals("Hello Big World", sheet.text("=PROPER(\"hello big wORLD\")"));
        assertEquals("a b c", sheet.text("=TRIM(\"  a   b c \")"));
        assertFalse(sheet.bool("=EXACT(\"abc\",\"ABC\")"));
        assertTrue(sheet.bool("=EXACT(A1,\"Hello\")"));
        assertEquals("ababab", sheet.text("=REPT(\"ab\",3)"));
    }

    @Test
    void testReplacing() {
        assertEquals("a-b-c", sheet.text("=SUBSTITUTE(\"a b c\",\" \",\"-\")"));
        assertEquals("a b-c", sheet.text("=SUBSTITUTE(\"a b c\",\" \",\"-\",2)"));
        assertEquals("Jello", sheet.text("=REPLACE(A1,1,1,\"J\")"));
    }

    /**
     * Counts up to the largest int run to the end of the text.
     */
    @Test
    void testHugeCounts() {
        assertEquals("bc", sheet.text("=MID(\"abc\",2,2147483647)"));
        assertEquals("", sheet.text("=MID(\"abc\",4,2147483647)"));
        assertEquals("ax", sheet.text("=REPLACE(\"abc\",2,2147483647,\"x\")"));
        assertEquals("abc", sheet.text("=LEFT(\"abc\",2147483647)"));
        assertEquals("abc", sheet.text("=RIGHT(\"abc\",2147483647)"));
    }

    /**
     * FIND is case-sensitive; SEARCH is not and accepts wildcards.
     */
    @Test
    void testFindAndSearch() {
        assertEquals(3, sheet.number("=FIND(\"l\",A1)"));
        assertEquals(4, sheet.number("=FIND(\"l\",A1,4)"));
        assertEquals(ErrorCode.VALUE, sheet.error("=FIND(\"h\",A1)"));
        assertEquals(1, sheet.number("=SEARCH(\"h\",A1)"));
        assertEquals(2, sheet.number("=SEARCH(\"e?l\",A1)"));
        assertEquals(ErrorCode.VALUE, sheet.error("=SEARCH(\"z\",A1)"));
    }

    @Test
    void testConversions() {
        assertEquals(12.5, sheet.number("=VALUE(\"12.5\")"));
        assertEquals(0.25, sheet.number("=VALUE(\"25%\")"));
        assertEquals(ErrorCode.VALUE, sheet.error("=VALUE(\"abc\")"));
        assertEquals("720.00", sheet.text("=TEXT(720,\"0.00\")"));
        assertEquals("1,234.57", sheet.text("=TEXT(1234.567,\"#,##0.00\")"));
        assertEquals("3", sheet.text("=TEXT(2.5,\"0\")"));
        assertEquals("15%", sheet.text("=TEXT(0.15,\"0%\")"));
    }
}
