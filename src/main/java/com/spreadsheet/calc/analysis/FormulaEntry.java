package com.spreadsheet.calc.analysis;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * One formula cell of the analysis document.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class FormulaEntry {

    private String cell;
    private String formula;
    private String category;
    private List<String> dependencies = new ArrayList<>();
    private Integer row;
    private Integer column;

    /**
     * Value Excel computed for the cell, if known: number, text, boolean or an error code string.
     */
    @JsonProperty("expected_value")
    private Object expectedValue;

    public FormulaEntry() {
    }

    public FormulaEntry(String cell, String formula, String category) {
        this.cell = cell;
        this.formula = formula;
        this.category = category;
    }

    public String getCell() {
        return cell;
    }

    public void setCell(String cell) {
        this.cell = cell;
    }

    public String getFormula() {
        return formula;
    }

    public void setFormula(String formula) {
        this.formula = formula;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    public List<String> getDependencies() {
        return dependencies;
    }

    public void setDependencies(List<String> dependencies) {
        this.dependencies = dependencies == null ? new ArrayList<>() : dependencies;
    }

    public Integer getRow() {
        return row;
    }

    public void setRow(Integer row) {
        this.row = row;
    }

    public Integer getColumn() {
        return column;
    }

    public void setColumn(Integer column) {
        this.column = column;
    }

    public Object getExpectedValue() {
        return expectedValue;
    }

    public void setExpectedValue(Object expectedValue) {
        this.expectedValue = expectedValue;
    }

    public boolean hasExpectedValue() {
        return expectedValue != null;
    }

    /**
     * Formula text with the leading "=" the document sometimes leaves out.
     */
    public String normalizedFormula() {
        if (formula == null) {
            return null;
        }
        String trimmed = formula.trim();
        return trimmed.startsWith("=") ? trimmed : "=" + trimmed;
    }
}
