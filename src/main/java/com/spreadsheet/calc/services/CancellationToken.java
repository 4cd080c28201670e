package com.spreadsheet.calc.services;

/**
 * Cooperative cancellation of a recalculation pass, checked between layers.
 */
public class CancellationToken {

    private volatile boolean cancelled;

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
