package com.spreadsheet.calc.validation;

/**
 * Allowed numeric deviation: a difference passes when it is within the
 * absolute bound or within the relative bound of the larger magnitude.
 */
public final class Tolerance {

    public static final Tolerance DEFAULT = new Tolerance(1e-6, 1e-9);
    public static final Tolerance EXACT = new Tolerance(0, 0);

    private final double absolute;
    private final double relative;

    public Tolerance(double absolute, double relative) {
        if (absolute < 0 || relative < 0) {
            throw new IllegalArgumentException("Tolerances must not be negative");
        }
        this.absolute = absolute;
        this.relative = relative;
    }

    public double getAbsolute() {
        return absolute;
    }

    public double getRelative() {
        return relative;
    }

    public boolean accepts(double actual, double expected) {
        double delta = Math.abs(actual - expected);
        return delta <= absolute || delta <= relative * Math.max(Math.abs(actual), Math.abs(expected));
    }

    @Override
    public String toString() {
        return "Tolerance{absolute=" + absolute + ", relative=" + relative + "}";
    }
}
