package com.patternscope.analysis.detectors;

import com.patternscope.analysis.dto.AnomalyCandidateDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
@Component
public class IsolationForestDetector implements AnomalyDetector {

    private final int minSamples;
    private final double contamination;
    private final int trees;
    private final int maxSamples;

    public IsolationForestDetector(@Value("${analysis.ensemble.min-samples:10}") int minSamples,
                                   @Value("${analysis.ensemble.contamination:0.1}") double contamination,
                                   @Value("${analysis.isolation-forest.trees:100}") int trees,
                                   @Value("${analysis.isolation-forest.max-samples:256}") int maxSamples) {
        this.minSamples = minSamples;
        this.contamination = contamination;
        this.trees = trees;
        this.maxSamples = maxSamples;
    }

    @Override
    public DetectionMethod method() {
        return DetectionMethod.ISOLATION_FOREST;
    }

    @Override
    public List<AnomalyCandidateDto> detect(DetectionContext context) {
        Optional<FeatureMatrix> optionalMatrix = FeatureMatrix.build(context.getObservations(), minSamples);
        if (optionalMatrix.isEmpty()) {
            log.debug("isolation forest: abstaining on batch of {}", context.getObservations().size());
            return List.of();
        }
        FeatureMatrix matrix = optionalMatrix.get();
        double[][] data = matrix.rows();

        SeededIsolationForest forest = SeededIsolationForest.fit(data, trees, maxSamples, context.getSeed());

        double[] anomalyScores = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            anomalyScores[i] = forest.score(data[i]);
        }
        boolean[] outliers = Percentiles.outliers(anomalyScores, contamination);

        String features = String.join(", ", matrix.featureNames());
        List<AnomalyCandidateDto> candidates = new ArrayList<>();
        for (int i = 0; i < data.length; i++) {
            if (!outliers[i]) {
                continue;
            }
            candidates.add(AnomalyCandidateDto.builder()
                    .trafficEventId(matrix.trafficEventId(i))
                    .anomalyType(method().wireName())
                    .confidenceScore(confidence(anomalyScores[i]))
                    .affectedMetrics(matrix.featureNames())
                    .description("Anomaly detected using Isolation Forest on features: " + features)
                    .build());
        }
        return candidates;
    }

    /** The raw score is the negated anomaly score, so confidence is {@code 1 - (raw + 0.5)}. */
    static double confidence(double anomalyScore) {
        double rawScore = -anomalyScore;
        return clamp(1.0 - (rawScore + 0.5));
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
