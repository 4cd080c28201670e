package com.spreadsheet.calc.services;

import com.spreadsheet.calc.analysis.WorkbookAnalysis;
import com.spreadsheet.calc.config.EngineProperties;
import com.spreadsheet.calc.exceptions.WorkbookNotFoundException;
import com.spreadsheet.calc.functions.FunctionRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps the open workbooks, each with its own calculation engine.
 */
@Service
public class WorkbookService {

    private static final Logger logger = LoggerFactory.getLogger(WorkbookService.class);

    // All workbooks live here in memory
    private final Map<Long, CalculationEngine> workbooks = new ConcurrentHashMap<>();
    private final AtomicLong nextId = new AtomicLong(1);

    private final EngineProperties properties;

    public WorkbookService(EngineProperties properties) {
        this.properties = properties;
    }

    /**
     * Opens an empty workbook and returns its ID.
     */
    public long createWorkbook() {
        long id = nextId.getAndIncrement();
        workbooks.put(id, new CalculationEngine(properties, FunctionRegistry.standard()));
        return id;
    }

    /**
     * Opens a workbook populated from an analysis document; nothing is calculated yet.
     */
    public long loadWorkbook(WorkbookAnalysis analysis) {
        long id = createWorkbook();
        getWorkbook(id).loadAnalysis(analysis);
        logger.info("Opened workbook {} with {} formulas", id, analysis.getFormulaCount());
        return id;
    }

    /**
     * Retrieves a workbook's engine by ID. Throws if not found.
     */
    public CalculationEngine getWorkbook(long workbookId) {
        CalculationEngine engine = workbooks.get(workbookId);
        if (engine == null) {
            throw new WorkbookNotFoundException("Workbook not found: " + workbookId);
        }
        return engine;
    }

    public CalculationResult setCell(long workbookId, String sheet, String address, String content) {
        return getWorkbook(workbookId).setCell(sheet, address, content);
    }

    public CalculationResult calculateCell(long workbookId, String sheet, String address) {
        return getWorkbook(workbookId).calculateCell(sheet, address);
    }

    public RecalculationReport recalculateAll(long workbookId) {
        return getWorkbook(workbookId).recalculateAll();
    }

    public Map<String, Object> getSheetData(long workbookId, String sheet) {
        return getWorkbook(workbookId).getSheetData(sheet);
    }

    public void closeWorkbook(long workbookId) {
        CalculationEngine engine = workbooks.remove(workbookId);
        if (engine == null) {
            throw new WorkbookNotFoundException("Workbook not found: " + workbookId);
        }
        engine.close();
    }

    public int openWorkbooks() {
        return workbooks.size();
    }

    @PreDestroy
    public void shutdown() {
        for (CalculationEngine engine : workbooks.values()) {
            engine.close();
        }
        workbooks.clear();
    }
}
