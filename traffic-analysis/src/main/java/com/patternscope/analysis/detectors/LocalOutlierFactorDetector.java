package com.patternscope.analysis.detectors;

import com.patternscope.analysis.dto.AnomalyCandidateDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import smile.neighbor.KDTree;
import smile.neighbor.Neighbor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Local Outlier Factor over the imputed feature matrix. The neighbourhood of a point never
 * includes the point itself.
 */
@Slf4j
@Component
public class LocalOutlierFactorDetector implements AnomalyDetector {

    private static final double DENSITY_EPS = 1e-10;

    private final int minSamples;
    private final double contamination;
    private final int neighbors;

    public LocalOutlierFactorDetector(@Value("${analysis.ensemble.min-samples:10}") int minSamples,
                                      @Value("${analysis.ensemble.contamination:0.1}") double contamination,
                                      @Value("${analysis.lof.neighbors:20}") int neighbors) {
        this.minSamples = minSamples;
        this.contamination = contamination;
        this.neighbors = neighbors;
    }

    @Override
    public DetectionMethod method() {
        return DetectionMethod.LOF;
    }

    @Override
    public List<AnomalyCandidateDto> detect(DetectionContext context) {
        Optional<FeatureMatrix> optionalMatrix = FeatureMatrix.build(context.getObservations(), minSamples);
        if (optionalMatrix.isEmpty() || optionalMatrix.get().size() < 2) {
            log.debug("lof: abstaining on batch of {}", context.getObservations().size());
            return List.of();
        }
        FeatureMatrix matrix = optionalMatrix.get();
        double[] lof = localOutlierFactors(matrix.rows(), Math.min(neighbors, matrix.size() - 1));
        boolean[] outliers = Percentiles.outliers(lof, contamination);

        String features = String.join(", ", matrix.featureNames());
        List<AnomalyCandidateDto> candidates = new ArrayList<>();
        for (int i = 0; i < lof.length; i++) {
            if (!outliers[i]) {
                continue;
            }
            double negativeOutlierFactor = -lof[i];
            candidates.add(AnomalyCandidateDto.builder()
                    .trafficEventId(matrix.trafficEventId(i))
                    .anomalyType(method().wireName())
                    .confidenceScore(Math.min(Math.abs(negativeOutlierFactor), 1.0))
                    .affectedMetrics(matrix.featureNames())
                    .description("Local outlier detected on features: " + features)
                    .build());
        }
        return candidates;
    }

    /**
     * k-NN queries go through a KD-tree, so memory stays at {@code n * k} neighbour entries.
     */
    static double[] localOutlierFactors(double[][] data, int k) {
        int n = data.length;
        KDTree<double[]> tree = KDTree.of(data);

        int[][] knn = new int[n][k];
        double[][] knnDistance = new double[n][k];
        double[] kDistance = new double[n];
        for (int i = 0; i < n; i++) {
            // a copy of the row, so the tree does not skip the query point by identity
            Neighbor<double[], double[]>[] found = tree.search(data[i].clone(), k + 1);
            Arrays.sort(found, Comparator.comparingDouble((Neighbor<double[], double[]> neighbor) -> neighbor.distance));
            int taken = 0;
            for (Neighbor<double[], double[]> neighbor : found) {
                if (neighbor.index == i || taken == k) {
                    continue;
                }
                knn[i][taken] = neighbor.index;
                knnDistance[i][taken] = neighbor.distance;
                taken++;
            }
            kDistance[i] = knnDistance[i][k - 1];
        }

        double[] lrd = new double[n];
        for (int i = 0; i < n; i++) {
            double reach = 0;
            for (int m = 0; m < k; m++) {
                reach += Math.max(kDistance[knn[i][m]], knnDistance[i][m]);
            }
            lrd[i] = 1.0 / (reach / k + DENSITY_EPS);
        }

        double[] lof = new double[n];
        for (int i = 0; i < n; i++) {
            double sum = 0;
            for (int j : knn[i]) {
                sum += lrd[j] / lrd[i];
            }
            lof[i] = sum / k;
        }
        return lof;
    }
}
