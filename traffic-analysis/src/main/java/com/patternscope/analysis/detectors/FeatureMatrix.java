package com.patternscope.analysis.detectors;

import com.patternscope.analysis.dto.ObservationDto;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Row-per-observation matrix over the tracked metrics that have at least one present value.
 * Missing cells are filled with the column mean.
 */
final class FeatureMatrix {

    private final List<ObservationDto> observations;
    private final List<String> featureNames;
    private final double[][] rows;

    private FeatureMatrix(List<ObservationDto> observations, List<String> featureNames, double[][] rows) {
        this.observations = observations;
        this.featureNames = featureNames;
        this.rows = rows;
    }

    /**
     * @return the imputed matrix, or empty when no metric has a present value or the batch
     * holds fewer than {@code minSamples} observations
     */
    static Optional<FeatureMatrix> build(List<ObservationDto> observations, int minSamples) {
        List<TrafficMetric> columns = new ArrayList<>();
        List<Double> columnMeans = new ArrayList<>();
        for (TrafficMetric metric : TrafficMetric.values()) {
            double sum = 0;
            int present = 0;
            for (ObservationDto observation : observations) {
                Double value = metric.valueOf(observation);
                if (value != null) {
                    sum += value;
                    present++;
                }
            }
            if (present > 0) {
                columns.add(metric);
                columnMeans.add(sum / present);
            }
        }
        if (columns.isEmpty() || observations.size() < minSamples) {
            return Optional.empty();
        }

        double[][] rows = new double[observations.size()][columns.size()];
        for (int i = 0; i < observations.size(); i++) {
            for (int j = 0; j < columns.size(); j++) {
                Double value = columns.get(j).valueOf(observations.get(i));
                rows[i][j] = value != null ? value : columnMeans.get(j);
            }
        }
        List<String> names = columns.stream().map(TrafficMetric::metricName).toList();
        return Optional.of(new FeatureMatrix(observations, names, rows));
    }

    int size() {
        return rows.length;
    }

    double[][] rows() {
        return rows;
    }

    List<String> featureNames() {
        return featureNames;
    }

    long trafficEventId(int row) {
        return observations.get(row).getId();
    }
}
