package com.spreadsheet.calc.analysis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.spreadsheet.calc.exceptions.AnalysisFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Reads a workbook analysis document and checks its structure.
 * This is the only I/O step before calculation.
 */
@Component
public class AnalysisLoader {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisLoader.class);

    private final ObjectMapper objectMapper;

    public AnalysisLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public WorkbookAnalysis load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new AnalysisFormatException("Analysis file not found: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            WorkbookAnalysis analysis = load(in);
            logger.info("Read analysis {}: {} sheets, {} formulas", path.getFileName(),
                    analysis.getSheetNames().size(), analysis.getFormulaCount());
            return analysis;
        } catch (IOException e) {
            throw new AnalysisFormatException("Cannot read " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * @throws AnalysisFormatException if the stream is not a well-formed analysis document
     */
    public WorkbookAnalysis load(InputStream in) throws IOException {
        JsonNode root;
        try {
            root = objectMapper.readTree(in);
        } catch (JsonProcessingException e) {
            throw new AnalysisFormatException("Malformed JSON: " + e.getOriginalMessage(), e);
        }
        return parse(root);
    }

    public WorkbookAnalysis parse(String json) {
        try {
            return parse(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new AnalysisFormatException("Malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    private WorkbookAnalysis parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new AnalysisFormatException("Analysis document must be a JSON object");
        }
        JsonNode formulas = root.get("formulas_by_sheet");
        if (formulas == null || !formulas.isObject()) {
            throw new AnalysisFormatException("formulas_by_sheet must be an object");
        }
        requireObjectIfPresent(root, "metadata");
        requireObjectIfPresent(root, "named_ranges");
        requireObjectIfPresent(root, "dependencies");
        requireObjectIfPresent(root, "values_by_sheet");

        WorkbookAnalysis analysis;
        try {
            analysis = objectMapper.treeToValue(root, WorkbookAnalysis.class);
        } catch (JsonProcessingException e) {
            throw new AnalysisFormatException("Invalid analysis document: " + e.getOriginalMessage(), e);
        }
        checkEntries(analysis);
        checkMetadata(analysis);
        return analysis;
    }

    private static void requireObjectIfPresent(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node != null && !node.isNull() && !node.isObject()) {
            throw new AnalysisFormatException(field + " must be an object");
        }
    }

    private static void checkEntries(WorkbookAnalysis analysis) {
        for (Map.Entry<String, List<FormulaEntry>> sheet : analysis.getFormulasBySheet().entrySet()) {
            if (sheet.getValue() == null) {
                throw new AnalysisFormatException("No formula list for sheet " + sheet.getKey());
            }
            for (FormulaEntry entry : sheet.getValue()) {
                if (entry.getCell() == null || entry.getCell().isBlank()) {
                    throw new AnalysisFormatException("Formula entry without a cell on sheet " + sheet.getKey());
                }
            }
        }
    }

    // totals that disagree with the content are tolerated
    private static void checkMetadata(WorkbookAnalysis analysis) {
        AnalysisMetadata metadata = analysis.getMetadata();
        if (metadata == null) {
            analysis.setMetadata(new AnalysisMetadata());
            return;
        }
        int formulas = analysis.getFormulaCount();
        if (metadata.getTotalFormulas() > 0 && metadata.getTotalFormulas() != formulas) {
            logger.warn("Metadata announces {} formulas, document contains {}", metadata.getTotalFormulas(), formulas);
        }
        if (metadata.getTotalSheets() > 0 && metadata.getTotalSheets() != analysis.getSheetNames().size()) {
            logger.warn("Metadata announces {} sheets, document mentions {}",
                    metadata.getTotalSheets(), analysis.getSheetNames().size());
        }
    }
}
