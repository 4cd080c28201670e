package com.spreadsheet.calc.graph;

import java.util.Collections;
import java.util.List;

/**
 * One unit of a calculation plan: a single cell, or the members of a cycle
 * that have to be solved together.
 */
public final class CalculationGroup {

    private final List<Integer> cells;
    private final boolean cyclic;

    public CalculationGroup(List<Integer> cells, boolean cyclic) {
        this.cells = Collections.unmodifiableList(cells);
        this.cyclic = cyclic;
    }

    public List<Integer> getCells() {
        return cells;
    }

    public boolean isCyclic() {
        return cyclic;
    }

    public int size() {
        return cells.size();
    }

    @Override
    public String toString() {
        return (cyclic ? "cycle" : "cell") + cells;
    }
}
