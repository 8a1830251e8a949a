package com.meetadrive.app.models;

import java.util.List;

/**
 * Aggregate functions a formula may call.
 * AVERAGE only accepts a range argument ("A1:B3"), not a comma list.
 */
public enum AggregateFunction {
    SUM(true) {
        @Override
        public double apply(List<Double> numbers) {
            double sum = 0;
            for (double n : numbers) {
                sum += n;
            }
            return sum;
        }
    },
    AVERAGE(false) {
        @Override
        public double apply(List<Double> numbers) {
            if (numbers.isEmpty()) {
                // A blank range averages to 0
                return 0;
            }
            return SUM.apply(numbers) / numbers.size();
        }
    };

    private final boolean acceptsList;

    AggregateFunction(boolean acceptsList) {
        this.acceptsList = acceptsList;
    }

    public boolean acceptsList() {
        return acceptsList;
    }

    /**
     * The "NAME(" text a formula body starts with when calling this function.
     */
    public String callPrefix() {
        return name() + "(";
    }

    public abstract double apply(List<Double> numbers);
}
