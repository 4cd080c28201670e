package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.models.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class MathFunctionsTest {

    private FormulaHarness sheet;

    @BeforeEach
    void setUp() {
        sheet = new FormulaHarness()
                .column("A1", 10, 20, "abc")
                .column("B1", 2, 3);
    }

    /**
     * Text inside ranges is ignored, text given directly is coerced.
     */
    @Test
    void testSum() {
        assertEquals(30, sheet.number("=SUM(A1:A2)"));
        assertEquals(30, sheet.number("=SUM(A1:A3)"));
        assertEquals(30, sheet.number("=SUM(A3,A1:A2)"));
        assertEquals(6, sheet.number("=SUM(\"5\",1)"));
        assertEquals(ErrorCode.VALUE, sheet.error("=SUM(\"abc\")"));
        assertEquals(0, sheet.number("=SUM(C1:C5)"));
    }

    @Test
    void testSumPropagatesErrors() {
        sheet.set("A4", "#DIV/0!");
        assertEquals(ErrorCode.DIV0, sheet.error("=SUM(A1:A4)"));
        assertEquals(ErrorCode.NA, sheet.error("=SUM(1,NA())"));
    }

    /**
     * Decimal arithmetic: 0.1 + 0.2 is exactly 0.3.
     */
    @Test
    void testDecimalArithmetic() {
        assertEquals(0.3, sheet.number("=0.1+0.2"));
        assertEquals(0.3, sheet.number("=SUM(0.1,0.2)"));
        assertEquals(ErrorCode.DIV0, sheet.error("=1/0"));
        assertEquals(4, sheet.number("=-2^2"));
        assertEquals(512, sheet.number("=2^3^2"));
        assertEquals(0.5, sheet.number("=50%"));
        assertEquals(4, sheet.number("=\"3\"+1"));
        assertEquals(2, sheet.number("=TRUE+1"));
        assertEquals(ErrorCode.VALUE, sheet.error("=\"a\"+1"));
    }

    @Test
    void testPowerDomain() {
        assertEquals(ErrorCode.NUM, sheet.error("=0^0"));
        assertEquals(ErrorCode.DIV0, sheet.error("=0^-1"));
        assertEquals(ErrorCode.NUM, sheet.error("=(-8)^0.5"));
        assertEquals(1024, sheet.number("=POWER(2,10)"));
    }

    /**
     * Rounding ties go away from zero.
     */
    @Test
    void testRounding() {
        assertEquals(3.14, sheet.number("=ROUND(3.14159,2)"));
        assertEquals(3, sheet.number("=ROUND(2.5,0)"));
        assertEquals(-3, sheet.number("=ROUND(-2.5,0)"));
        assertEquals(1200, sheet.number("=ROUND(1234.5,-2)"));
        assertEquals(3.15, sheet.number("=ROUNDUP(3.141,2)"));
        assertEquals(-3.14, sheet.number("=ROUNDDOWN(-3.149,2)"));
        assertEquals(-3, sheet.number("=INT(-2.5)"));
        assertEquals(-2, sheet.number("=TRUNC(-2.5)"));
        assertEquals(3, sheet.number("=CEILING(2.3,1)"));
        assertEquals(2, sheet.number("=FLOOR(2.7,1)"));
        assertEquals(7.5, sheet.number("=CEILING(7.1,2.5)"));
    }

    @Test
    void testRoundingWithExtremeDigits() {
        assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
            assertEquals(1.5, sheet.number("=ROUND(1.5,100000000)"));
            assertEquals(1.25, sheet.number("=ROUNDUP(1.25,2147483647)"));
            assertEquals(0, sheet.number("=ROUND(1.5,-100000000)"));
            assertEquals(0, sheet.number("=ROUNDDOWN(1234.5,-2147483647)"));
            assertEquals(0, sheet.number("=TRUNC(-2.5,-100000000)"));
        });
    }

    @Test
    void testElementaryFunctions() {
        assertEquals(1, sheet.number("=MOD(-3,2)"));
        assertEquals(-1, sheet.number("=MOD(3,-2)"));
        assertEquals(ErrorCode.DIV0, sheet.error("=MOD(5,0)"));
        assertEquals(ErrorCode.NUM, sheet.error("=SQRT(-1)"));
        assertEquals(ErrorCode.NUM, sheet.error("=LN(0)"));
        assertEquals(3, sheet.number("=LOG(8,2)"), 1e-12);
        assertEquals(2, sheet.number("=LOG10(100)"), 1e-12);
        assertEquals(4, sheet.number("=ABS(-4)"));
        assertEquals(-1, sheet.number("=SIGN(-7)"));
        assertEquals(Math.PI, sheet.number("=PI()"));
    }

    @Test
    void testConditionalSums() {
        sheet.column("C1", "apple", "banana", "apricot");
        sheet.column("D1", 1, 2, 4);
        assertEquals(5, sheet.number("=SUMIF(C1:C3,\"ap*\",D1:D3)"));
        assertEquals(20, sheet.number("=SUMIF(A1:A3,\">15\")"));
        assertEquals(4, sheet.number("=SUMIFS(D1:D3,C1:C3,\"a*\",D1:D3,\">1\")"));
        assertEquals(ErrorCode.VALUE, sheet.error("=SUMIFS(D1:D3,C1:C2,\"a*\")"));
    }

    @Test
    void testProducts() {
        assertEquals(24, sheet.number("=PRODUCT(2,3,4)"));
        assertEquals(80, sheet.number("=SUMPRODUCT(A1:A2,B1:B2)"));
        assertEquals(ErrorCode.VALUE, sheet.error("=SUMPRODUCT(A1:A3,B1:B2)"));
    }

    /**
     * Unknown functions are #NAME?, a wrong argument count #VALUE!.
     */
    @Test
    void testFunctionResolution() {
        assertEquals(ErrorCode.NAME, sheet.error("=FOO(1)"));
        assertEquals(ErrorCode.VALUE, sheet.error("=SUM()"));
        assertEquals(ErrorCode.VALUE, sheet.error("=ABS(1,2)"));
        assertEquals(2, sheet.number("=abs(-2)"));
    }
}
