package com.spreadsheet.calc.services;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Summary of one recalculation pass.
 */
public final class RecalculationReport {

    private final int cellsCalculated;
    private final int errorCells;
    private final int layers;
    private final int cycles;
    private final int failedCycles;
    private final int iterations;
    private final long durationMs;
    private final double formulasPerSecond;
    private final boolean cancelled;
    private final int remainingDirty;

    public RecalculationReport(int cellsCalculated, int errorCells, int layers, int cycles, int failedCycles,
                               int iterations, long durationMs, double formulasPerSecond, boolean cancelled,
                               int remainingDirty) {
        this.cellsCalculated = cellsCalculated;
        this.errorCells = errorCells;
        this.layers = layers;
        this.cycles = cycles;
        this.failedCycles = failedCycles;
        this.iterations = iterations;
        this.durationMs = durationMs;
        this.formulasPerSecond = formulasPerSecond;
        this.cancelled = cancelled;
        this.remainingDirty = remainingDirty;
    }

    @JsonProperty("cells_calculated")
    public int getCellsCalculated() {
        return cellsCalculated;
    }

    @JsonProperty("error_cells")
    public int getErrorCells() {
        return errorCells;
    }

    public int getLayers() {
        return layers;
    }

    public int getCycles() {
        return cycles;
    }

    @JsonProperty("failed_cycles")
    public int getFailedCycles() {
        return failedCycles;
    }

    public int getIterations() {
        return iterations;
    }

    @JsonProperty("duration_ms")
    public long getDurationMs() {
        return durationMs;
    }

    @JsonProperty("formulas_per_second")
    public double getFormulasPerSecond() {
        return formulasPerSecond;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    @JsonProperty("remaining_dirty")
    public int getRemainingDirty() {
        return remainingDirty;
    }

    @Override
    public String toString() {
        return "RecalculationReport{cells=" + cellsCalculated + ", errors=" + errorCells + ", layers=" + layers
                + ", cycles=" + cycles + ", failedCycles=" + failedCycles + ", durationMs=" + durationMs
                + ", cancelled=" + cancelled + "}";
    }
}
