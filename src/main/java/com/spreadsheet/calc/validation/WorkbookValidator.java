package com.spreadsheet.calc.validation;

import com.spreadsheet.calc.analysis.FormulaEntry;
import com.spreadsheet.calc.analysis.WorkbookAnalysis;
import com.spreadsheet.calc.config.EngineProperties;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.ErrorCode;
import com.spreadsheet.calc.services.CalculationEngine;
import com.spreadsheet.calc.services.RecalculationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks every formula of an analysis document against the engine's result.
 * Entries carrying an expected value are compared with it; the rest only
 * have to resolve to a value or one of the accepted error codes.
 */
@Component
public class WorkbookValidator {

    private static final Logger logger = LoggerFactory.getLogger(WorkbookValidator.class);

    static final String UNCATEGORIZED = "uncategorized";

    private final EngineProperties properties;
    private final ResultValidator resultValidator;
    private final Set<ErrorCode> acceptedErrors;

    public WorkbookValidator(EngineProperties properties) {
        EngineProperties.Validation validation = properties.getValidation();
        this.properties = properties;
        this.resultValidator = new ResultValidator(
                new Tolerance(validation.getAbsoluteTolerance(), validation.getRelativeTolerance()));
        this.acceptedErrors = parseCodes(validation.getAcceptedErrorCodes());
    }

    /**
     * Loads the analysis into a fresh engine, calculates everything and validates.
     */
    public ValidationReport run(WorkbookAnalysis analysis) {
        try (CalculationEngine engine = new CalculationEngine(properties)) {
            engine.loadAnalysis(analysis);
            RecalculationReport recalculation = engine.recalculateAll();
            return validate(engine, analysis, recalculation);
        }
    }

    /**
     * Validates an engine that already holds the analysis' formulas.
     */
    public ValidationReport validate(CalculationEngine engine, WorkbookAnalysis analysis,
                                     RecalculationReport recalculation) {
        ValidationReport report = new ValidationReport(properties.getValidation().getAcceptanceThreshold());
        for (Map.Entry<String, List<FormulaEntry>> sheet : analysis.getFormulasBySheet().entrySet()) {
            for (FormulaEntry entry : sheet.getValue()) {
                validateEntry(engine, sheet.getKey(), entry, report);
            }
        }
        report.setPerformance(recalculation);
        recommend(report);

        logger.info("Validated {} formulas: {} passed ({}%), accepted={}",
                report.getTotalFormulas(), report.getSuccessful(),
                String.format("%.2f", report.getSuccessRate()), report.isAccepted());
        return report;
    }

    public Set<ErrorCode> getAcceptedErrors() {
        return acceptedErrors;
    }

    // ---- Internal Helpers ----

    private void validateEntry(CalculationEngine engine, String sheet, FormulaEntry entry, ValidationReport report) {
        String cellId = sheet + "!" + entry.getCell();
        CellValue actual = engine.getCell(sheet, entry.getCell()).getCellValue();
        if (actual.isError()) {
            report.countError(actual.getError().getText());
        }

        ValidationResult result;
        Object expected = null;
        if (entry.hasExpectedValue()) {
            expected = entry.getExpectedValue();
            result = resultValidator.validateResult(actual, cellId, CellValue.fromObject(expected));
        } else {
            result = resultValidator.validateResolved(actual, cellId, acceptedErrors);
        }

        String category = entry.getCategory() == null || entry.getCategory().isBlank()
                ? UNCATEGORIZED : entry.getCategory();
        FailureRecord failure = null;
        if (!result.isValid()) {
            logger.debug("Validation failed for {}: {}", cellId, result.getReason());
            failure = new FailureRecord(cellId, entry.normalizedFormula(), category,
                    expected, actual.toObject(), result.getReason());
        }
        report.record(category, result, failure);
    }

    private void recommend(ValidationReport report) {
        for (Map.Entry<String, CategoryStats> category : report.getCategoryBreakdown().entrySet()) {
            CategoryStats stats = category.getValue();
            if (stats.getPassRate() < report.getAcceptanceThreshold()) {
                report.addRecommendation(String.format("Category '%s' passes %d of %d formulas (%.1f%%)",
                        category.getKey(), stats.getPassed(), stats.getTotal(), stats.getPassRate()));
            }
        }
        Map<String, Integer> errors = report.getErrorBreakdown();
        addErrorHint(report, errors, ErrorCode.NAME, "check for unsupported functions or undefined names");
        addErrorHint(report, errors, ErrorCode.CIRCULAR,
                "cycles did not converge; review them or raise calc.engine.max-iterations");
        addErrorHint(report, errors, ErrorCode.REF, "check references to missing sheets or cells outside a range");
        addErrorHint(report, errors, ErrorCode.VALUE, "check argument types passed to functions and operators");
    }

    private static void addErrorHint(ValidationReport report, Map<String, Integer> errors, ErrorCode code,
                                     String hint) {
        Integer count = errors.get(code.getText());
        if (count != null && count > 0) {
            report.addRecommendation(count + " formulas evaluate to " + code.getText() + ": " + hint);
        }
    }

    private static Set<ErrorCode> parseCodes(List<String> codes) {
        Set<ErrorCode> parsed = EnumSet.noneOf(ErrorCode.class);
        for (String text : codes) {
            ErrorCode code = ErrorCode.fromText(text);
            if (code == null) {
                logger.warn("Ignoring unknown accepted error code '{}'", text);
            } else {
                parsed.add(code);
            }
        }
        return parsed;
    }
}
