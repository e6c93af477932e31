package com.patternscope.analysis.detectors;

import com.patternscope.analysis.dto.AnomalyCandidateDto;
import com.patternscope.analysis.dto.ObservationDto;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.patternscope.analysis.detectors.TestObservations.context;
import static com.patternscope.analysis.detectors.TestObservations.reading;
import static com.patternscope.analysis.detectors.TestObservations.vehicles;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ZScoreDetectorTest {

    private final ZScoreDetector detector = new ZScoreDetector(3.0);

    @Test
    void flagsVehicleCountSpikeWithClampedConfidence() {
        List<AnomalyCandidateDto> candidates = detector.detect(context(TestObservations.vehicleSpike()));

        assertThat(candidates)
                .hasSize(1)
                .first()
                .satisfies(candidate -> {
                    assertThat(candidate.getTrafficEventId()).isEqualTo(12L);
                    assertThat(candidate.getAnomalyType()).isEqualTo("zscore");
                    assertThat(candidate.getConfidenceScore()).isEqualTo(1.0);
                    assertThat(candidate.getAffectedMetrics()).containsExactly("vehicle_count");
                    assertThat(candidate.getDescription())
                            .isEqualTo("vehicle_count value 90 is 3.17 standard deviations from mean");
                });
    }

    @Test
    void skipsMetricWithZeroDeviation() {
        List<ObservationDto> observations = new ArrayList<>();
        for (int i = 1; i <= 12; i++) {
            observations.add(vehicles(i, 50));
        }

        assertThat(detector.detect(context(observations))).isEmpty();
    }

    @Test
    void skipsMetricMissingAcrossTheBatch() {
        List<ObservationDto> observations = new ArrayList<>();
        for (int i = 1; i <= 12; i++) {
            observations.add(vehicles(i, null));
        }

        assertThat(detector.detect(context(observations))).isEmpty();
    }

    @Test
    void flagsEachMetricOfTheSameReadingSeparately() {
        double[] speeds = {39, 40, 41, 40, 39, 41, 40, 40, 39, 41, 40, 120};
        List<ObservationDto> spike = TestObservations.vehicleSpike();
        List<ObservationDto> observations = new ArrayList<>();
        for (int i = 0; i < spike.size(); i++) {
            observations.add(reading(i + 1, spike.get(i).getVehicleCount(), speeds[i], null));
        }

        List<AnomalyCandidateDto> candidates = detector.detect(context(observations));

        assertThat(candidates).hasSize(2);
        assertThat(candidates).extracting(AnomalyCandidateDto::getTrafficEventId).containsOnly(12L);
        assertThat(candidates).flatExtracting(AnomalyCandidateDto::getAffectedMetrics)
                .containsExactly("vehicle_count", "avg_speed");
        assertThat(candidates).extracting(AnomalyCandidateDto::getDescription)
                .satisfiesExactly(
                        description -> assertThat(description).startsWith("vehicle_count value 90 is "),
                        description -> assertThat(description).startsWith("avg_speed value 120.0 is "));
    }

    @Test
    void formatsValuesByMetricKind() {
        assertThat(TrafficMetric.VEHICLE_COUNT.format(90.0)).isEqualTo("90");
        assertThat(TrafficMetric.AVG_SPEED.format(40.0)).isEqualTo("40.0");
        assertThat(TrafficMetric.AVG_SPEED.format(38.25)).isEqualTo("38.25");
        assertThat(TrafficMetric.TRAFFIC_DENSITY_SCORE.format(1.0)).isEqualTo("1.0");
    }

    @Test
    void ignoresMissingValuesWhenScoring() {
        List<ObservationDto> observations = new ArrayList<>(TestObservations.vehicleSpike());
        observations.add(vehicles(13, null));

        List<AnomalyCandidateDto> candidates = detector.detect(context(observations));

        assertThat(candidates).extracting(AnomalyCandidateDto::getTrafficEventId).containsExactly(12L);
    }

    @Test
    void confidenceScalesWithThreshold() {
        ZScoreDetector lenient = new ZScoreDetector(1.0);

        List<AnomalyCandidateDto> candidates = lenient.detect(context(TestObservations.vehicleSpike()));

        assertThat(candidates).isNotEmpty();
        assertThat(candidates).allSatisfy(candidate ->
                assertThat(candidate.getConfidenceScore()).isBetween(0.0, 1.0));
    }

    @Test
    void rejectsNonPositiveThreshold() {
        assertThatThrownBy(() -> new ZScoreDetector(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
