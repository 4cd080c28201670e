package com.spreadsheet.calc.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.spreadsheet.calc.analysis.AnalysisLoader;
import com.spreadsheet.calc.analysis.WorkbookAnalysis;
import com.spreadsheet.calc.exceptions.ErrorResponse;
import com.spreadsheet.calc.validation.FailureRecord;
import com.spreadsheet.calc.validation.ValidationReport;
import com.spreadsheet.calc.validation.WorkbookValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Calculates and validates an analysis document when calc.cli.analysis is set.
 * The report goes to calc.cli.report when given, otherwise to the log.
 * Exit code: 0 when accepted, 1 below the acceptance threshold, 2 when the run failed.
 */
@Component
public class CalculationCliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger logger = LoggerFactory.getLogger(CalculationCliRunner.class);

    static final int EXIT_ACCEPTED = 0;
    static final int EXIT_REJECTED = 1;
    static final int EXIT_FAILED = 2;

    private final AnalysisLoader analysisLoader;
    private final WorkbookValidator validator;
    private final ObjectMapper objectMapper;
    private final String analysisPath;
    private final String reportPath;

    private int exitCode = EXIT_ACCEPTED;

    public CalculationCliRunner(AnalysisLoader analysisLoader,
                                WorkbookValidator validator,
                                ObjectMapper objectMapper,
                                @Value("${calc.cli.analysis:}") String analysisPath,
                                @Value("${calc.cli.report:}") String reportPath) {
        this.analysisLoader = analysisLoader;
        this.validator = validator;
        this.objectMapper = objectMapper;
        this.analysisPath = analysisPath;
        this.reportPath = reportPath;
    }

    @Override
    public void run(String... args) {
        String source = analysisPath;
        if ((source == null || source.isBlank()) && args.length > 0) {
            source = args[0];
        }
        if (source == null || source.isBlank()) {
            logger.info("No analysis document given. Set calc.cli.analysis or pass a path argument.");
            return;
        }

        logger.info("Calculating {}", source);
        ValidationReport report;
        try {
            WorkbookAnalysis analysis = analysisLoader.load(Path.of(source));
            report = validator.run(analysis);
        } catch (RuntimeException e) {
            logger.error("Calculation failed: {}", toJson(ErrorResponse.from(e)));
            exitCode = EXIT_FAILED;
            return;
        }

        printSummary(report);
        try {
            writeReport(report);
        } catch (IOException e) {
            logger.error("Cannot write report to {}: {}", reportPath, e.getMessage());
            exitCode = EXIT_FAILED;
            return;
        }
        exitCode = report.isAccepted() ? EXIT_ACCEPTED : EXIT_REJECTED;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    // ---- Internal Helpers ----

    private void printSummary(ValidationReport report) {
        logger.info("Formulas:   {}", report.getTotalFormulas());
        logger.info("Successful: {}", report.getSuccessful());
        logger.info("Failed:     {}", report.getFailed());
        logger.info("Pass rate:  {}% (threshold {}%)",
                String.format("%.2f", report.getSuccessRate()), report.getAcceptanceThreshold());
        if (report.getPerformance() != null) {
            logger.info("Duration:   {}ms, {} formulas/sec", report.getPerformance().getDurationMs(),
                    String.format("%.0f", report.getPerformance().getFormulasPerSecond()));
        }
        for (FailureRecord failure : report.getTopFailures()) {
            logger.info("  {} {} : {}", failure.getCell(), failure.getFormula(), failure.getReason());
        }
        for (String recommendation : report.getRecommendations()) {
            logger.info("Recommendation: {}", recommendation);
        }
    }

    private void writeReport(ValidationReport report) throws IOException {
        String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report);
        if (reportPath == null || reportPath.isBlank()) {
            logger.info("Validation report:\n{}", json);
            return;
        }
        Path target = Path.of(reportPath);
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        Files.writeString(target, json);
        logger.info("Report written to {}", target);
    }

    private String toJson(ErrorResponse error) {
        try {
            return objectMapper.writeValueAsString(error);
        } catch (JsonProcessingException e) {
            return error.getCode() + ": " + error.getMessage();
        }
    }
}
