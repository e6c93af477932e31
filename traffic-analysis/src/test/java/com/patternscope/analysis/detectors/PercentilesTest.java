package com.patternscope.analysis.detectors;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PercentilesTest {

    @Test
    void interpolatesBetweenClosestRanks() {
        double[] sorted = {1, 2, 3, 4};

        assertThat(Percentiles.percentile(sorted, 25)).isCloseTo(1.75, within(1e-12));
        assertThat(Percentiles.percentile(sorted, 50)).isCloseTo(2.5, within(1e-12));
        assertThat(Percentiles.percentile(sorted, 100)).isEqualTo(4.0);
    }

    @Test
    void flagsScoresStrictlyAboveContaminationCutoff() {
        double[] scores = new double[20];
        for (int i = 0; i < 20; i++) {
            scores[i] = i;
        }

        boolean[] outliers = Percentiles.outliers(scores, 0.1);

        int flagged = 0;
        for (boolean outlier : outliers) {
            if (outlier) {
                flagged++;
            }
        }
        assertThat(flagged).isEqualTo(2);
        assertThat(outliers[19]).isTrue();
        assertThat(outliers[18]).isTrue();
    }

    @Test
    void identicalScoresAreNeverOutliers() {
        boolean[] outliers = Percentiles.outliers(new double[]{0.4, 0.4, 0.4}, 0.1);

        assertThat(outliers).containsOnly(false);
    }
}
