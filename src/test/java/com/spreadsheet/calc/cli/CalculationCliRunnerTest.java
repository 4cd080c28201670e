package com.spreadsheet.calc.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.spreadsheet.calc.analysis.AnalysisLoader;
import com.spreadsheet.calc.config.EngineProperties;
import com.spreadsheet.calc.validation.WorkbookValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class CalculationCliRunnerTest {

    @TempDir
    Path tempDir;

    private ObjectMapper objectMapper;
    private AnalysisLoader loader;
    private WorkbookValidator validator;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        loader = new AnalysisLoader(objectMapper);
        validator = new WorkbookValidator(new EngineProperties());
    }

    private Path copySample() throws IOException {
        Path target = tempDir.resolve("workbook.json");
        try (InputStream in = getClass().getResourceAsStream("/analysis/sample-workbook.json")) {
            Files.copy(in, target);
        }
        return target;
    }

    private CalculationCliRunner runner(String analysis, String report) {
        return new CalculationCliRunner(loader, validator, objectMapper, analysis, report);
    }

    @Test
    void testReportIsWritten() throws IOException {
        Path analysis = copySample();
        Path report = tempDir.resolve("out/report.json");

        CalculationCliRunner runner = runner(analysis.toString(), report.toString());
        runner.run();

        assertEquals(CalculationCliRunner.EXIT_ACCEPTED, runner.getExitCode());
        assertTrue(Files.exists(report));
        JsonNode json = objectMapper.readTree(report.toFile());
        assertEquals(23, json.get("total_formulas").asInt());
        assertTrue(json.get("accepted").asBoolean());
    }

    @Test
    void testPathFromArguments() throws IOException {
        Path analysis = copySample();

        CalculationCliRunner runner = runner("", "");
        runner.run(analysis.toString());

        assertEquals(CalculationCliRunner.EXIT_ACCEPTED, runner.getExitCode());
    }

    @Test
    void testRejectedRun() throws IOException {
        Path analysis = tempDir.resolve("failing.json");
        Files.writeString(analysis, "{\"formulas_by_sheet\": {\"Sheet1\": ["
                + "{\"cell\": \"A1\", \"formula\": \"=1+1\", \"expected_value\": 5}]}}");

        CalculationCliRunner runner = runner(analysis.toString(), "");
        runner.run();

        assertEquals(CalculationCliRunner.EXIT_REJECTED, runner.getExitCode());
    }

    @Test
    void testMissingFileFails() {
        CalculationCliRunner runner = runner(tempDir.resolve("absent.json").toString(), "");
        runner.run();

        assertEquals(CalculationCliRunner.EXIT_FAILED, runner.getExitCode());
    }

    @Test
    void testNothingToDo() {
        CalculationCliRunner runner = runner("", "");
        runner.run();

        assertEquals(CalculationCliRunner.EXIT_ACCEPTED, runner.getExitCode());
    }
}
