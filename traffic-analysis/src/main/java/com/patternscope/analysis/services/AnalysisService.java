package com.patternscope.analysis.services;

import com.patternscope.analysis.detectors.AnomalyConsolidator;
import com.patternscope.analysis.detectors.AnomalyDetector;
import com.patternscope.analysis.detectors.DetectionContext;
import com.patternscope.analysis.detectors.DetectionMethod;
import com.patternscope.analysis.dto.AnalysisRequestDto;
import com.patternscope.analysis.dto.AnalysisResultDto;
import com.patternscope.analysis.dto.AnomalyCandidateDto;
import com.patternscope.analysis.dto.AnomalyDto;
import com.patternscope.analysis.dto.ObservationDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Runs one analysis: fetch the batch, run the requested detectors, consolidate, persist, report.
 */
@Slf4j
@Service
public class AnalysisService {

    static final String NO_EVENTS_MESSAGE = "No traffic events found in the specified period";

    private final TrafficDataStore trafficDataStore;
    private final Map<DetectionMethod, AnomalyDetector> detectors = new EnumMap<>(DetectionMethod.class);
    private final AnomalyConsolidator consolidator;
    private final Executor detectorExecutor;
    private final List<String> defaultMethods;
    private final long defaultSeed;

    public AnalysisService(TrafficDataStore trafficDataStore,
                           List<AnomalyDetector> detectors,
                           AnomalyConsolidator consolidator,
                           @Qualifier("detectorExecutor") Executor detectorExecutor,
                           @Value("${analysis.default-methods:zscore,iqr,isolation_forest}") List<String> defaultMethods,
                           @Value("${analysis.seed:42}") long defaultSeed) {
        this.trafficDataStore = trafficDataStore;
        detectors.forEach(detector -> this.detectors.put(detector.method(), detector));
        this.consolidator = consolidator;
        this.detectorExecutor = detectorExecutor;
        this.defaultMethods = List.copyOf(defaultMethods);
        this.defaultSeed = defaultSeed;
    }

    /**
     * Validates the request's period bounds before any I/O, then runs the pipeline.
     *
     * @throws InvalidPeriodException when a bound cannot be parsed or start is after end
     */
    public AnalysisResultDto runAnalysis(AnalysisRequestDto request) {
        AnalysisPeriod period = AnalysisPeriod.parse(request.getStart(), request.getEnd());
        long seed = request.getSeed() != null ? request.getSeed() : defaultSeed;
        return runAnalysis(period, request.getMethods(), seed);
    }

    public AnalysisResultDto runAnalysis(AnalysisPeriod period, Collection<String> methods, long seed) {
        log.info("---Start Analysis for period [{} , {}] methods: {}", period.getStart(), period.getEnd(), methods);
        List<ObservationDto> observations = trafficDataStore.fetchObservations(period.getStart(), period.getEnd());
        if (observations.isEmpty()) {
            log.info("No traffic events in period, skipping detection");
            return AnalysisResultDto.builder()
                    .success(true)
                    .anomaliesDetected(0)
                    .message(NO_EVENTS_MESSAGE)
                    .build();
        }

        EnumSet<DetectionMethod> requested = resolveMethods(methods);
        DetectionContext context = DetectionContext.builder()
                .observations(List.copyOf(observations))
                .seed(seed)
                .build();
        List<AnomalyCandidateDto> candidates = detect(requested, context);

        List<AnomalyDto> anomalies = consolidator.consolidate(candidates);
        log.info("Consolidated {} candidates into {} anomalies", candidates.size(), anomalies.size());
        if (!anomalies.isEmpty()) {
            trafficDataStore.persistAnomalies(anomalies);
        }

        log.info("--- Analysis Completed ....");
        return AnalysisResultDto.builder()
                .success(true)
                .anomaliesDetected(anomalies.size())
                .anomalyDetails(anomalies)
                .period(period.toDto())
                .methodsUsed(requested.stream().map(DetectionMethod::wireName).toList())
                .build();
    }

    /** Unknown names are ignored; the result is in canonical method order. */
    EnumSet<DetectionMethod> resolveMethods(Collection<String> methods) {
        Collection<String> names = methods == null || methods.isEmpty() ? defaultMethods : methods;
        EnumSet<DetectionMethod> resolved = EnumSet.noneOf(DetectionMethod.class);
        for (String name : names) {
            DetectionMethod.fromWireName(name).ifPresentOrElse(resolved::add,
                    () -> log.warn("Ignoring unknown detection method '{}'", name));
        }
        return resolved;
    }

    private List<AnomalyCandidateDto> detect(EnumSet<DetectionMethod> requested, DetectionContext context) {
        Map<DetectionMethod, CompletableFuture<List<AnomalyCandidateDto>>> futures = new LinkedHashMap<>();
        for (DetectionMethod method : requested) {
            AnomalyDetector detector = detectors.get(method);
            if (detector == null) {
                log.warn("No detector registered for method {}", method.wireName());
                continue;
            }
            futures.put(method, CompletableFuture.supplyAsync(() -> detector.detect(context), detectorExecutor));
        }

        List<AnomalyCandidateDto> candidates = new ArrayList<>();
        for (Map.Entry<DetectionMethod, CompletableFuture<List<AnomalyCandidateDto>>> entry : futures.entrySet()) {
            List<AnomalyCandidateDto> found = join(entry.getValue());
            log.info("{} produced {} candidates", entry.getKey().wireName(), found.size());
            candidates.addAll(found);
        }
        return candidates;
    }

    private static List<AnomalyCandidateDto> join(CompletableFuture<List<AnomalyCandidateDto>> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw e;
        }
    }
}
