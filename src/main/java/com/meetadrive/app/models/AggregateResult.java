package com.meetadrive.app.models;

/**
 * Result of aggregating a set of cells: the value, how many cells
 * contributed a number, and how many had text that did not parse as one.
 */
public class AggregateResult {
    private final double value;
    private final int counted;
    private final int skipped;

    public AggregateResult(double value, int counted, int skipped) {
        this.value = value;
        this.counted = counted;
        this.skipped = skipped;
    }

    public double getValue() {
        return value;
    }

    public int getCounted() {
        return counted;
    }

    public int getSkipped() {
        return skipped;
    }

    @Override
    public String toString() {
        return "AggregateResult{value=" + value + ", counted=" + counted + ", skipped=" + skipped + "}";
    }
}
