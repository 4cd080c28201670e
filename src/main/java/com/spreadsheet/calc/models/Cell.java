package com.spreadsheet.calc.models;

import com.spreadsheet.calc.parser.FormulaNode;

/**
 * Represents a single cell of the workbook.
 * Stores:
 * - its arena id and address (sheet-qualified)
 * - rawContent as it was set ("=A1+1", "42", "Brush") or null for a placeholder
 * - the parsed formula, if rawContent is a formula
 * - value, the last computed (or literal) result
 * - state, CLEAN once value is up to date
 *
 * Dependency edges are kept by the DependencyGraph, keyed by id.
 */
public class Cell {

    private final int id;
    private final CellAddress address;
    private String rawContent;
    private FormulaNode formula;
    private String formulaCacheKey;
    private CellValue value = CellValue.EMPTY;
    private CellState state = CellState.CLEAN;
    private String category;
    private String errorMessage;

    public Cell(int id, CellAddress address) {
        this.id = id;
        this.address = address;
    }

    public int getId() {
        return id;
    }

    public CellAddress getAddress() {
        return address;
    }

    public String getSheetName() {
        return address.getSheetName();
    }

    public String getRawContent() {
        return rawContent;
    }

    public void setRawContent(String rawContent) {
        this.rawContent = rawContent;
    }

    public boolean isFormula() {
        return rawContent != null && rawContent.startsWith("=");
    }

    /**
     * True when nothing was ever set on this cell; it exists only because something references it.
     */
    public boolean isPlaceholder() {
        return rawContent == null;
    }

    public FormulaNode getFormula() {
        return formula;
    }

    public String getFormulaCacheKey() {
        return formulaCacheKey;
    }

    public void setFormula(FormulaNode formula, String formulaCacheKey) {
        this.formula = formula;
        this.formulaCacheKey = formulaCacheKey;
    }

    public CellValue getValue() {
        return value;
    }

    /**
     * Stores a computed result and marks the cell up to date.
     */
    public void setValue(CellValue value) {
        this.value = value;
        this.state = value.isError() ? CellState.ERROR : CellState.CLEAN;
    }

    public CellState getState() {
        return state;
    }

    public void setState(CellState state) {
        this.state = state;
    }

    public boolean isDirty() {
        return state == CellState.DIRTY;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    @Override
    public String toString() {
        return address + "=" + value + " [" + state + "]";
    }
}
