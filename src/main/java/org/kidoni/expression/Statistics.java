package org.kidoni.expression;

final class Statistics {
    private Statistics() {
    }

    static double mean(final double[] values) {
        double sum = 0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    /**
     * Population variance: mean of the squares minus the square of the mean.
     */
    static double variance(final double[] values) {
        double sumOfSquares = 0;
        for (double value : values) {
            sumOfSquares += value * value;
        }
        double mean = mean(values);
        return sumOfSquares / values.length - mean * mean;
    }
}
