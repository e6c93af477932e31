package com.patternscope.analysis.detectors;

import java.util.Arrays;

final class Percentiles {

    private Percentiles() {
    }

    /**
     * Percentile with linear interpolation between closest ranks.
     *
     * @param sortedValues ascending, non-empty
     * @param percentile   in [0, 100]
     */
    static double percentile(double[] sortedValues, double percentile) {
        double index = percentile / 100.0 * (sortedValues.length - 1);
        int lower = (int) Math.floor(index);
        int upper = (int) Math.ceil(index);
        if (lower == upper) {
            return sortedValues[lower];
        }
        double weight = index - lower;
        return sortedValues[lower] * (1 - weight) + sortedValues[upper] * weight;
    }

    /**
     * Flags the rows whose outlier score (higher = more anomalous) lies strictly above the
     * {@code 1 - contamination} percentile of all scores.
     */
    static boolean[] outliers(double[] outlierScores, double contamination) {
        double[] sorted = outlierScores.clone();
        Arrays.sort(sorted);
        double cutoff = percentile(sorted, 100.0 * (1.0 - contamination));
        boolean[] flags = new boolean[outlierScores.length];
        for (int i = 0; i < outlierScores.length; i++) {
            flags[i] = outlierScores[i] > cutoff;
        }
        return flags;
    }
}
