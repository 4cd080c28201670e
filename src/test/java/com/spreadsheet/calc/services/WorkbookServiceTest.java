package com.spreadsheet.calc.services;

import com.spreadsheet.calc.config.EngineProperties;
import com.spreadsheet.calc.exceptions.WorkbookNotFoundException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WorkbookServiceTest {

    private WorkbookService workbookService;

    @BeforeEach
    void setUp() {
        workbookService = new WorkbookService(new EngineProperties());
    }

    @AfterEach
    void tearDown() {
        workbookService.shutdown();
    }

    @Test
    void testWorkbooksAreIndependent() {
        long first = workbookService.createWorkbook();
        long second = workbookService.createWorkbook();
        workbookService.getWorkbook(first).createSheet("Sheet1");
        workbookService.getWorkbook(second).createSheet("Sheet1");

        workbookService.setCell(first, "Sheet1", "A1", "=2*21");
        workbookService.setCell(second, "Sheet1", "A1", "=1+1");

        assertNotEquals(first, second);
        assertEquals(42.0, workbookService.calculateCell(first, "Sheet1", "A1").getValue());
        assertEquals(2.0, workbookService.calculateCell(second, "Sheet1", "A1").getValue());
        assertEquals(2, workbookService.openWorkbooks());
    }

    @Test
    void testSheetDataAndRecalculation() {
        long id = workbookService.createWorkbook();
        workbookService.getWorkbook(id).createSheet("Sheet1");
        workbookService.setCell(id, "Sheet1", "A1", "3");
        workbookService.setCell(id, "Sheet1", "A2", "=A1*A1");

        RecalculationReport report = workbookService.recalculateAll(id);
        Map<String, Object> data = workbookService.getSheetData(id, "Sheet1");

        assertEquals(1, report.getCellsCalculated());
        assertEquals(9.0, data.get("A2"));
    }

    @Test
    void testClosedWorkbookIsGone() {
        long id = workbookService.createWorkbook();
        workbookService.closeWorkbook(id);

        assertEquals(0, workbookService.openWorkbooks());
        assertThrows(WorkbookNotFoundException.class, () -> workbookService.getWorkbook(id));
        assertThrows(WorkbookNotFoundException.class, () -> workbookService.closeWorkbook(id));
    }
}
