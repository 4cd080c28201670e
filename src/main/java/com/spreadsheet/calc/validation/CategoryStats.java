package com.spreadsheet.calc.validation;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Pass/fail counters for one formula category.
 */
public class CategoryStats {

    private int total;
    private int passed;

    void record(boolean valid) {
        total++;
        if (valid) {
            passed++;
        }
    }

    public int getTotal() {
        return total;
    }

    public int getPassed() {
        return passed;
    }

    public int getFailed() {
        return total - passed;
    }

    @JsonProperty("pass_rate")
    public double getPassRate() {
        return total == 0 ? 100.0 : passed * 100.0 / total;
    }
}
