package com.spreadsheet.calc.services;

import com.spreadsheet.calc.config.EngineProperties;
import com.spreadsheet.calc.exceptions.DuplicateSheetException;
import com.spreadsheet.calc.exceptions.InvalidAddressException;
import com.spreadsheet.calc.exceptions.SheetNotFoundException;
import com.spreadsheet.calc.functions.FunctionRegistry;
import com.spreadsheet.calc.models.CalcMode;
import com.spreadsheet.calc.models.Cell;
import com.spreadsheet.calc.models.ErrorCode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Calculation engine behaviour on small in-memory workbooks.
 */
class CalculationEngineTest {

    private CalculationEngine engine;

    @BeforeEach
    void setUp() {
        engine = new CalculationEngine();
        engine.createSheet("Sheet1");
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private double number(String address) {
        Object value = engine.getCell("Sheet1", address).getValue();
        assertTrue(value instanceof Double, address + " holds " + value);
        return (Double) value;
    }

    private ErrorCode error(String address) {
        return engine.getCell("Sheet1", address).getError();
    }

    private CalculationEngine engineWith(EngineProperties properties) {
        engine.close();
        engine = new CalculationEngine(properties);
        engine.createSheet("Sheet1");
        return engine;
    }

    @Test
    void testSumOfRange() {
        engine.setCell("Sheet1", "A1", "10");
        engine.setCell("Sheet1", "A2", "20");
        CalculationResult result = engine.setCell("Sheet1", "A3", "=SUM(A1:A2)");

        assertEquals(30.0, result.getValue());
        assertEquals("30", result.getFormattedValue());
    }

    @Test
    void testBasicFunctions() {
        engine.setCell("Sheet1", "A1", "=AVERAGE(10,20,30)");
        engine.setCell("Sheet1", "A2", "=IF(TRUE,\"Yes\",\"No\")");
        engine.setCell("Sheet1", "A3", "=ROUND(3.14159,2)");

        assertEquals(20.0, number("A1"));
        assertEquals("Yes", engine.getCell("Sheet1", "A2").getValue());
        assertEquals(3.14, number("A3"));
    }

    /**
     * Changing an input recalculates everything downstream of it.
     */
    @Test
    void testChangePropagatesToDependents() {
        engine.setCell("Sheet1", "A1", "10");
        engine.setCell("Sheet1", "A2", "=A1*2");
        engine.setCell("Sheet1", "A3", "=A2+A1");
        assertEquals(30.0, number("A3"));

        engine.setCell("Sheet1", "A1", "15");

        assertEquals(30.0, number("A2"));
        assertEquals(45.0, number("A3"));
        assertEquals(0, engine.getDirtyCount());
    }

    @Test
    void testVlookupExactMatch() {
        engine.setCell("Sheet1", "A1", "Pen");
        engine.setCell("Sheet1", "B1", "1.5");
        engine.setCell("Sheet1", "A2", "Brush");
        engine.setCell("Sheet1", "B2", "8.5");
        engine.setCell("Sheet1", "D1", "=VLOOKUP(\"Brush\",A1:B2,2,FALSE)");
        engine.setCell("Sheet1", "D2", "=VLOOKUP(\"Missing\",A1:B2,2,FALSE)");

        assertEquals(8.5, number("D1"));
        assertEquals(ErrorCode.NA, error("D2"));
    }

    @Test
    void testDivergentCycleIsCircular() {
        engine.setCell("Sheet1", "A1", "=B1+1");
        engine.setCell("Sheet1", "B1", "=A1+1");

        assertEquals(ErrorCode.CIRCULAR, error("A1"));
        assertEquals(ErrorCode.CIRCULAR, error("B1"));
    }

    @Test
    void testSelfReferenceIsCircular() {
        engine.setCell("Sheet1", "A1", "=A1+1");

        assertEquals(ErrorCode.CIRCULAR, error("A1"));
    }

    @Test
    void testConvergentCycleIsSolved() {
        engine.setCell("Sheet1", "A1", "=B1*0.5+10");
        engine.setCell("Sheet1", "B1", "=A1*0.5");

        assertEquals(40.0 / 3, number("A1"), 0.01);
        assertEquals(20.0 / 3, number("B1"), 0.01);
    }

    @Test
    void testCycleWithoutIterationIsCircular() {
        EngineProperties properties = new EngineProperties();
        properties.setIterativeCalculation(false);
        engineWith(properties);

        engine.setCell("Sheet1", "A1", "=B1*0.5+10");
        engine.setCell("Sheet1", "B1", "=A1*0.5");
        RecalculationReport report = engine.recalculateAll();

        assertEquals(ErrorCode.CIRCULAR, error("A1"));
        assertEquals(ErrorCode.CIRCULAR, error("B1"));
        assertEquals(1, report.getFailedCycles());
    }

    /**
     * A loop only visible at evaluation time, through INDIRECT.
     */
    @Test
    void testRuntimeCycleThroughIndirect() {
        engine.setCell("Sheet1", "A1", "=INDIRECT(\"B1\")");
        engine.setCell("Sheet1", "B1", "=A1+1");

        assertEquals(ErrorCode.CIRCULAR, error("A1"));
        assertEquals(ErrorCode.CIRCULAR, error("B1"));
    }

    @Test
    void testRecalculateAllIsIdempotent() {
        engine.setCell("Sheet1", "A1", "4");
        engine.setCell("Sheet1", "A2", "=A1^2");
        engine.setCell("Sheet1", "A3", "=A2/A1");

        RecalculationReport first = engine.recalculateAll();
        Map<String, Object> before = engine.getSheetData("Sheet1");
        RecalculationReport second = engine.recalculateAll();

        assertEquals(before, engine.getSheetData("Sheet1"));
        assertEquals(2, first.getCellsCalculated());
        assertEquals(2, second.getCellsCalculated());
        assertEquals(0, second.getErrorCells());
    }

    @Test
    void testManualModeDefersCalculation() {
        engine.setCalcMode(CalcMode.MANUAL);
        engine.setCell("Sheet1", "A1", "5");
        engine.setCell("Sheet1", "A2", "=A1*2");

        assertEquals(1, engine.getDirtyCount());
        assertNotEquals(10.0, engine.getCell("Sheet1", "A2").getValue());

        RecalculationReport report = engine.recalculate();

        assertEquals(1, report.getCellsCalculated());
        assertEquals(10.0, number("A2"));
        assertEquals(0, engine.getDirtyCount());
    }

    @Test
    void testSwitchingToAutomaticCalculatesDirtyCells() {
        engine.setCalcMode(CalcMode.MANUAL);
        engine.setCell("Sheet1", "A1", "=2+3");
        assertEquals(1, engine.getDirtyCount());

        engine.setCalcMode(CalcMode.AUTOMATIC);

        assertEquals(0, engine.getDirtyCount());
        assertEquals(5.0, number("A1"));
    }

    @Test
    void testCalculateCellOnlyTouchesWhatItNeeds() {
        engine.setCalcMode(CalcMode.MANUAL);
        engine.setCell("Sheet1", "A1", "5");
        engine.setCell("Sheet1", "B1", "=A1*2");
        engine.setCell("Sheet1", "C1", "=B1+1");
        engine.setCell("Sheet1", "D1", "=100");

        CalculationResult result = engine.calculateCell("Sheet1", "C1");

        assertEquals(11.0, result.getValue());
        assertEquals(10.0, number("B1"));
        assertEquals(1, engine.getDirtyCount());
    }

    @Test
    void testCalculateCellOnEmptyAddress() {
        assertNull(engine.calculateCell("Sheet1", "Z99").getValue());
    }

    @Test
    void testCancelledRecalculationLeavesCellsDirty() {
        engine.setCalcMode(CalcMode.MANUAL);
        engine.setCell("Sheet1", "A1", "=1+1");
        engine.setCell("Sheet1", "A2", "=A1+1");

        CancellationToken token = new CancellationToken();
        token.cancel();
        RecalculationReport report = engine.recalculate(token);

        assertTrue(report.isCancelled());
        assertEquals(0, report.getCellsCalculated());
        assertEquals(2, report.getRemainingDirty());
        assertEquals(2, engine.getDirtyCount());
    }

    @Test
    void testParseErrorStoresNameError() {
        engine.setCell("Sheet1", "A1", "=(1+2");

        assertEquals(ErrorCode.NAME, error("A1"));
        Cell cell = engine.findCell("Sheet1", "A1");
        assertNotNull(cell.getErrorMessage());
        assertEquals("=(1+2", cell.getRawContent());
    }

    @Test
    void testUnknownFunctionIsNameError() {
        engine.setCell("Sheet1", "A1", "=NOSUCHFUNCTION(1)");

        assertEquals(ErrorCode.NAME, error("A1"));
    }

    @Test
    void testDivisionByZero() {
        engine.setCell("Sheet1", "A1", "=1/0");
        engine.setCell("Sheet1", "A2", "=A1+1");

        assertEquals(ErrorCode.DIV0, error("A1"));
        assertEquals(ErrorCode.DIV0, error("A2"));
    }

    /**
     * A reference to a sheet that doesn't exist yet is #REF! until the sheet is created.
     */
    @Test
    void testMissingSheetIsLinkedOnCreate() {
        engine.setCell("Sheet1", "A1", "=Other!A1+1");
        assertEquals(ErrorCode.REF, error("A1"));

        engine.createSheet("Other");
        assertEquals(1.0, number("A1"));

        engine.setCell("Other", "A1", "41");
        assertEquals(42.0, number("A1"));
    }

    @Test
    void testCrossSheetReference() {
        engine.createSheet("Data Sheet");
        engine.setCell("Data Sheet", "B2", "7");
        engine.setCell("Sheet1", "A1", "='Data Sheet'!B2*3");

        assertEquals(21.0, number("A1"));
    }

    @Test
    void testNamedRangeAddedLater() {
        engine.setCell("Sheet1", "A1", "10");
        engine.setCell("Sheet1", "A2", "20");
        engine.setCell("Sheet1", "B1", "=SUM(Prices)");
        assertEquals(ErrorCode.NAME, error("B1"));

        engine.addNamedRange("Prices", null, "Sheet1!$A$1:$A$2");

        assertEquals(30.0, number("B1"));
        engine.setCell("Sheet1", "A2", "25");
        assertEquals(35.0, number("B1"));
    }

    @Test
    void testIndirectFollowsChangedTarget() {
        engine.setCell("Sheet1", "A1", "10");
        engine.setCell("Sheet1", "C1", "=INDIRECT(\"A1\")*2");
        assertEquals(20.0, number("C1"));

        engine.setCell("Sheet1", "A1", "99");

        assertEquals(198.0, number("C1"));
    }

    @Test
    void testParallelLayers() {
        EngineProperties properties = new EngineProperties();
        properties.setParallelism(2);
        engineWith(properties);

        engine.setCalcMode(CalcMode.MANUAL);
        for (int row = 1; row <= 20; row++) {
            engine.setCell("Sheet1", "A" + row, String.valueOf(row));
            engine.setCell("Sheet1", "B" + row, "=A" + row + "*2");
        }
        engine.setCell("Sheet1", "C1", "=SUM(B1:B20)");
        engine.setCell("Sheet1", "C2", "=INDIRECT(\"B20\")");

        RecalculationReport report = engine.recalculateAll();

        assertEquals(420.0, number("C1"));
        assertEquals(40.0, number("C2"));
        assertEquals(22, report.getCellsCalculated());
        assertFalse(report.isCancelled());
    }

    @Test
    void testConcurrentReadsDuringWrites() throws Exception {
        engine.setCell("Sheet1", "A1", "1");
        engine.setCell("Sheet1", "B1", "=A1*10");

        ExecutorService readers = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                futures.add(readers.submit(() -> {
                    for (int n = 0; n < 200; n++) {
                        Object a = engine.getCell("Sheet1", "A1").getValue();
                        Object b = engine.getCell("Sheet1", "B1").getValue();
                        assertNotNull(a);
                        assertNotNull(b);
                    }
                }));
            }
            for (int n = 2; n <= 50; n++) {
                engine.setCell("Sheet1", "A1", String.valueOf(n));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            readers.shutdown();
        }

        assertEquals(500.0, number("B1"));
    }

    @Test
    void testGetSheetData() {
        engine.setCell("Sheet1", "A1", "hello");
        engine.setCell("Sheet1", "A2", "=LEN(A1)");
        engine.setCell("Sheet1", "A3", "TRUE");

        Map<String, Object> data = engine.getSheetData("Sheet1");

        assertEquals("hello", data.get("A1"));
        assertEquals(5.0, data.get("A2"));
        assertEquals(Boolean.TRUE, data.get("A3"));
        assertEquals(1, engine.getFormulaCells().size());
    }

    @Test
    void testEmptyFormulaResultReadsAsZero() {
        engine.setCell("Sheet1", "A1", "=B1");

        assertEquals(0.0, number("A1"));
    }

    /**
     * A function failing unexpectedly only affects its own cell, on the calling thread and on the pool.
     */
    @Test
    void testFailingFunctionDoesNotStopThePass() {
        FunctionRegistry registry = new FunctionRegistry();
        registry.register("BROKEN", "Test", 0, 0, (ctx, args) -> {
            throw new IllegalStateException("handler bug");
        });
        for (int parallelism : new int[] {1, 2}) {
            EngineProperties properties = new EngineProperties();
            properties.setCalcMode(CalcMode.MANUAL);
            properties.setParallelism(parallelism);
            try (CalculationEngine isolated = new CalculationEngine(properties, registry)) {
                isolated.createSheet("Sheet1");
                isolated.setCell("Sheet1", "A1", "=BROKEN()");
                isolated.setCell("Sheet1", "A2", "=7");
                isolated.setCell("Sheet1", "A3", "=A1");

                RecalculationReport report = isolated.recalculateAll();

                assertEquals(ErrorCode.VALUE, isolated.getCell("Sheet1", "A1").getError());
                assertEquals(7.0, isolated.getCell("Sheet1", "A2").getValue());
                assertEquals(ErrorCode.VALUE, isolated.getCell("Sheet1", "A3").getError());
                assertEquals(3, report.getCellsCalculated());
                assertEquals(0, isolated.getDirtyCount());
            }
        }
    }

    @Test
    void testOversizedArgumentsStayInTheirCell() {
        engine.setCalcMode(CalcMode.MANUAL);
        engine.setCell("Sheet1", "A1", "=MID(\"abc\",2,2147483647)");
        engine.setCell("Sheet1", "A2", "=1+1");

        engine.recalculateAll();

        assertEquals("bc", engine.getCell("Sheet1", "A1").getValue());
        assertEquals(2.0, number("A2"));
    }

    @Test
    void testInvalidInput() {
        assertThrows(SheetNotFoundException.class, () -> engine.setCell("Nowhere", "A1", "1"));
        assertThrows(InvalidAddressException.class, () -> engine.setCell("Sheet1", "1A", "1"));
        assertThrows(DuplicateSheetException.class, () -> engine.createSheet("sheet1"));
    }

    @Test
    void testReplacingFormulaWithConstantDropsEdges() {
        engine.setCell("Sheet1", "A1", "1");
        engine.setCell("Sheet1", "B1", "=A1+1");
        engine.setCell("Sheet1", "B1", "7");
        engine.setCell("Sheet1", "A1", "100");

        assertEquals(7.0, number("B1"));
        assertTrue(engine.getFormulaCells().isEmpty());
    }
}
