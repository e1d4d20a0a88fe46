package com.medica.factory.optimizer;

import lombok.Value;

import java.util.List;

/**
 * Spread of a score over repeated runs. Standard deviation is the population form.
 */
@Value
public class RunStatistics {
    double mean;
    double stdDev;
    double min;
    double max;
    List<Double> values;

    public static RunStatistics of(List<Double> values) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("No values to summarize");
        }
        double sum = 0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            sum += v;
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        double mean = sum / values.size();
        double squares = 0;
        for (double v : values) {
            squares += (v - mean) * (v - mean);
        }
        return new RunStatistics(mean, Math.sqrt(squares / values.size()), min, max, List.copyOf(values));
    }

    /** Best run above the mean, in percent of the mean; 0 unless the mean is positive. */
    public double improvementPercent() {
        return mean > 0 ? (max - mean) / Math.abs(mean) * 100 : 0;
    }
}
