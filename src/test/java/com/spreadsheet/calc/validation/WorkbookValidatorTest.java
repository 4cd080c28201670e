package com.spreadsheet.calc.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.spreadsheet.calc.analysis.AnalysisLoader;
import com.spreadsheet.calc.analysis.WorkbookAnalysis;
import com.spreadsheet.calc.config.EngineProperties;
import com.spreadsheet.calc.models.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end validation of analysis documents against the values they declare.
 */
class WorkbookValidatorTest {

    private ObjectMapper objectMapper;
    private AnalysisLoader loader;
    private EngineProperties properties;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        loader = new AnalysisLoader(objectMapper);
        properties = new EngineProperties();
    }

    private WorkbookAnalysis sample() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/analysis/sample-workbook.json")) {
            return loader.load(in);
        }
    }

    @Test
    void testSampleWorkbookPasses() throws IOException {
        ValidationReport report = new WorkbookValidator(properties).run(sample());

        assertEquals(23, report.getTotalFormulas());
        assertEquals(23, report.getSuccessful(), () -> "failures: " + describe(report.getTopFailures()));
        assertEquals(100.0, report.getSuccessRate(), 1e-9);
        assertTrue(report.isAccepted());
        assertTrue(report.getTopFailures().isEmpty());
        assertTrue(report.getRecommendations().isEmpty());
        assertEquals(1, report.getErrorBreakdown().get("#N/A"));
        assertEquals(1, report.getErrorBreakdown().get("#DIV/0!"));
        assertEquals(2, report.getCategoryBreakdown().get("iterative").getTotal());
        assertEquals(23, report.getPerformance().getCellsCalculated());
    }

    @Test
    void testFailuresAreReported() {
        WorkbookAnalysis analysis = loader.parse("{\"formulas_by_sheet\": {\"Sheet1\": ["
                + "{\"cell\": \"A1\", \"formula\": \"=1+1\", \"category\": \"math\", \"expected_value\": 2},"
                + "{\"cell\": \"A2\", \"formula\": \"=1+1\", \"category\": \"math\", \"expected_value\": 3},"
                + "{\"cell\": \"A3\", \"formula\": \"=NOSUCH(1)\"}"
                + "]}}");

        ValidationReport report = new WorkbookValidator(properties).run(analysis);

        assertEquals(3, report.getTotalFormulas());
        assertEquals(1, report.getSuccessful());
        assertEquals(2, report.getFailed());
        assertFalse(report.isAccepted());
        assertEquals(50.0, report.getCategoryBreakdown().get("math").getPassRate(), 1e-9);
        assertEquals(1, report.getCategoryBreakdown().get(WorkbookValidator.UNCATEGORIZED).getFailed());

        FailureRecord failure = report.getTopFailures().get(0);
        assertEquals("Sheet1!A2", failure.getCell());
        assertEquals("=1+1", failure.getFormula());
        assertEquals(2.0, failure.getActual());
        assertTrue(report.getRecommendations().stream().anyMatch(r -> r.contains("#NAME?")));
        assertTrue(report.getRecommendations().stream().anyMatch(r -> r.contains("'math'")));
    }

    @Test
    void testAcceptedErrorCodesAreConfigurable() {
        properties.getValidation().setAcceptedErrorCodes(List.of("#N/A", "#BOGUS"));
        WorkbookValidator validator = new WorkbookValidator(properties);

        assertEquals(1, validator.getAcceptedErrors().size());
        assertTrue(validator.getAcceptedErrors().contains(ErrorCode.NA));

        WorkbookAnalysis analysis = loader.parse(
                "{\"formulas_by_sheet\": {\"Sheet1\": [{\"cell\": \"A1\", \"formula\": \"=1/0\"}]}}");
        assertEquals(0, validator.run(analysis).getSuccessful());
    }

    @Test
    void testReportSerialization() throws IOException {
        ValidationReport report = new WorkbookValidator(properties).run(sample());

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(report));

        assertEquals(23, json.get("total_formulas").asInt());
        assertEquals(100.0, json.get("success_rate").asDouble(), 1e-9);
        assertTrue(json.get("accepted").asBoolean());
        assertEquals(100.0, json.get("category_breakdown").get("lookup").get("pass_rate").asDouble(), 1e-9);
        assertTrue(json.get("top_failures").isArray());
        assertTrue(json.has("performance"));
    }

    private static String describe(List<FailureRecord> failures) {
        StringBuilder text = new StringBuilder();
        for (FailureRecord failure : failures) {
            text.append(failure.getCell()).append(' ').append(failure.getReason()).append("; ");
        }
        return text.toString();
    }
}
