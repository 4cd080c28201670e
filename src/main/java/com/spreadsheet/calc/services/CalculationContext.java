package com.spreadsheet.calc.services;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * State of one top-level calculation request: iteration settings,
 * cancellation and counters. Created fresh for every request.
 */
public class CalculationContext {

    private final boolean iterative;
    private final int maxIterations;
    private final double epsilon;
    private final CancellationToken cancellationToken;
    private final long startNanos = System.nanoTime();

    // cycle groups may be solved on worker threads
    private final AtomicInteger iterations = new AtomicInteger();
    private final AtomicInteger convergedCycles = new AtomicInteger();
    private final AtomicInteger failedCycles = new AtomicInteger();
    private int cellsCalculated;

    public CalculationContext(boolean iterative, int maxIterations, double epsilon,
                              CancellationToken cancellationToken) {
        this.iterative = iterative;
        this.maxIterations = maxIterations;
        this.epsilon = epsilon;
        this.cancellationToken = cancellationToken == null ? new CancellationToken() : cancellationToken;
    }

    public boolean isIterative() {
        return iterative;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public double getEpsilon() {
        return epsilon;
    }

    public boolean isCancelled() {
        return cancellationToken.isCancelled();
    }

    public void countIteration() {
        iterations.incrementAndGet();
    }

    public int getIterations() {
        return iterations.get();
    }

    public void cycleConverged() {
        convergedCycles.incrementAndGet();
    }

    public void cycleFailed() {
        failedCycles.incrementAndGet();
    }

    public int getConvergedCycles() {
        return convergedCycles.get();
    }

    public int getFailedCycles() {
        return failedCycles.get();
    }

    // only the coordinating thread commits
    public void cellCalculated() {
        cellsCalculated++;
    }

    public int getCellsCalculated() {
        return cellsCalculated;
    }

    public long elapsedMillis() {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    public double elapsedSeconds() {
        return (System.nanoTime() - startNanos) / 1e9;
    }
}
