package com.spreadsheet.calc.validation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.spreadsheet.calc.services.RecalculationReport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summary of validating a calculated workbook against its analysis document.
 */
@JsonPropertyOrder({"total_formulas", "successful", "failed", "success_rate", "acceptance_threshold",
        "accepted", "category_breakdown", "error_breakdown", "top_failures", "performance", "recommendations"})
public class ValidationReport {

    static final int TOP_FAILURES = 10;

    private int totalFormulas;
    private int successful;
    private double acceptanceThreshold;
    private final Map<String, CategoryStats> categoryBreakdown = new LinkedHashMap<>();
    private final Map<String, Integer> errorBreakdown = new LinkedHashMap<>();
    private final List<FailureRecord> failures = new ArrayList<>();
    private int failureCount;
    private RecalculationReport performance;
    private final List<String> recommendations = new ArrayList<>();

    ValidationReport(double acceptanceThreshold) {
        this.acceptanceThreshold = acceptanceThreshold;
    }

    void record(String category, ValidationResult result, FailureRecord failure) {
        totalFormulas++;
        categoryBreakdown.computeIfAbsent(category, k -> new CategoryStats()).record(result.isValid());
        if (result.isValid()) {
            successful++;
            return;
        }
        failureCount++;
        if (failures.size() < TOP_FAILURES) {
            failures.add(failure);
        }
    }

    void countError(String code) {
        errorBreakdown.merge(code, 1, Integer::sum);
    }

    void setPerformance(RecalculationReport performance) {
        this.performance = performance;
    }

    void addRecommendation(String recommendation) {
        recommendations.add(recommendation);
    }

    @JsonProperty("total_formulas")
    public int getTotalFormulas() {
        return totalFormulas;
    }

    public int getSuccessful() {
        return successful;
    }

    public int getFailed() {
        return failureCount;
    }

    @JsonProperty("success_rate")
    public double getSuccessRate() {
        return totalFormulas == 0 ? 100.0 : successful * 100.0 / totalFormulas;
    }

    @JsonProperty("acceptance_threshold")
    public double getAcceptanceThreshold() {
        return acceptanceThreshold;
    }

    /**
     * True when the success rate reaches the acceptance threshold.
     */
    public boolean isAccepted() {
        return getSuccessRate() >= acceptanceThreshold;
    }

    @JsonProperty("category_breakdown")
    public Map<String, CategoryStats> getCategoryBreakdown() {
        return Collections.unmodifiableMap(categoryBreakdown);
    }

    @JsonProperty("error_breakdown")
    public Map<String, Integer> getErrorBreakdown() {
        return Collections.unmodifiableMap(errorBreakdown);
    }

    @JsonProperty("top_failures")
    public List<FailureRecord> getTopFailures() {
        return Collections.unmodifiableList(failures);
    }

    public RecalculationReport getPerformance() {
        return performance;
    }

    public List<String> getRecommendations() {
        return Collections.unmodifiableList(recommendations);
    }
}
