package com.mlpromote.validation;

import java.util.Arrays;
import java.util.List;

/**
 * Percentiles with linear interpolation between the two closest ranks.
 */
final class LatencyPercentiles {

    private LatencyPercentiles() {
    }

    static double percentile(List<Double> samples, double percentile) {
        if (percentile < 0 || percentile > 100) {
            throw new IllegalArgumentException("percentile must be within [0, 100]: " + percentile);
        }
        if (samples.isEmpty()) {
            return 0.0;
        }
        double[] sorted = samples.stream().mapToDouble(Double::doubleValue).toArray();
        Arrays.sort(sorted);
        double rank = percentile / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        if (lower == upper) {
            return sorted[lower];
        }
        return sorted[lower] + (rank - lower) * (sorted[upper] - sorted[lower]);
    }

    static double mean(List<Double> samples) {
        return samples.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }
}
