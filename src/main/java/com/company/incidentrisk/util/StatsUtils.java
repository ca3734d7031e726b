package com.company.incidentrisk.util;

import java.util.Arrays;

/**
 * Small numeric helpers shared by aggregation, training and scoring.
 */
public final class StatsUtils {

    private static final double LOG_EPSILON = 1e-15;

    private StatsUtils() {
    }

    /**
     * Nearest-rank percentile: index = ceil(quantile * n) - 1, clamped to [0, n-1].
     *
     * @param sortedAscending values sorted ascending
     * @param quantile value in (0, 1]
     * @return the selected sample, or 0 for an empty array
     */
    public static double percentile(double[] sortedAscending, double quantile) {
        int n = sortedAscending.length;
        if (n == 0) {
            return 0.0;
        }
        int index = (int) Math.ceil(quantile * n) - 1;
        index = Math.max(0, Math.min(index, n - 1));
        return sortedAscending[index];
    }

    public static double percentileOfUnsorted(double[] values, double quantile) {
        double[] copy = values.clone();
        Arrays.sort(copy);
        return percentile(copy, quantile);
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    public static double ratio(long numerator, long denominator) {
        if (denominator == 0) {
            return 0.0;
        }
        return (double) numerator / denominator;
    }

    public static double sigmoid(double z) {
        if (z >= 0) {
            return 1.0 / (1.0 + Math.exp(-z));
        }
        double e = Math.exp(z);
        return e / (1.0 + e);
    }

    public static double logLoss(double probability, int label) {
        double p = Math.min(Math.max(probability, LOG_EPSILON), 1.0 - LOG_EPSILON);
        return label == 1 ? -Math.log(p) : -Math.log(1.0 - p);
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
