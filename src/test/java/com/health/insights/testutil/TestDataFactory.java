package com.health.insights.testutil;

import com.health.insights.config.DetectionConfig;
import com.health.insights.model.*;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.IntToDoubleFunction;

/**
 * Shared test data builders to avoid repeating construction boilerplate across test classes.
 */
public final class TestDataFactory {

    public static final LocalDate START = LocalDate.of(2025, 1, 1);

    private TestDataFactory() {}

    public static DetectionConfig defaultConfig() {
        return new DetectionConfig();
    }

    /** Daily series starting at {@link #START}, one value per day. */
    public static MetricSeries series(String metric, double... values) {
        return series(metric, values.length, i -> values[i]);
    }

    public static MetricSeries series(String metric, int days, IntToDoubleFunction valueForDay) {
        List<DailyObservation> observations = new ArrayList<>();
        for (int i = 0; i < days; i++) {
            observations.add(observation(START.plusDays(i), valueForDay.applyAsDouble(i)));
        }
        return MetricSeries.of(metric, observations);
    }

    public static MetricSeries constantThenSpike(String metric, double level, int days, double spike) {
        return series(metric, days + 1, i -> i < days ? level : spike);
    }

    public static MetricSeries gaussian(String metric, int days, double mean, double std, long seed) {
        Random random = new Random(seed);
        return series(metric, days, i -> mean + std * random.nextGaussian());
    }

    public static double[] gaussianValues(int n, long seed) {
        Random random = new Random(seed);
        double[] values = new double[n];
        for (int i = 0; i < n; i++) values[i] = random.nextGaussian();
        return values;
    }

    public static DailyObservation observation(LocalDate date, double value) {
        return DailyObservation.builder()
                .date(date)
                .value(value)
                .sourceTable("daily_entries")
                .sourceId("SRC-" + date)
                .build();
    }

    public static UserSeriesSnapshot snapshot(String userId, MetricSeries... series) {
        Map<String, MetricSeries> byName = new HashMap<>();
        for (MetricSeries s : series) byName.put(s.getMetricName(), s);
        return UserSeriesSnapshot.of(userId, START, START.plusDays(90), byName);
    }

    public static DetectionRequest request() {
        return DetectionRequest.builder()
                .days(90)
                .endDate(START.plusDays(89))
                .build();
    }

    public static AnomalyResult anomaly(String metric, LocalDate date, DetectorType detector, double score) {
        return AnomalyResult.scored(score)
                .occurredOn(date)
                .metricName(metric)
                .metricValue(100.0)
                .baselineValue(10.0)
                .detectorType(detector)
                .sourceTable("daily_entries")
                .sourceId("SRC-" + date)
                .details(Map.of("z_score", 4.2))
                .build();
    }

    public static CorrelationResult correlation(String a, String b, CorrelationType type, double strength,
                                                StatisticalConfidence confidence, boolean significant, int n) {
        return CorrelationResult.builder()
                .metricA(a)
                .metricB(b)
                .correlationType(type)
                .strength(strength)
                .lagDays(0)
                .confidence(confidence)
                .sampleSize(n)
                .significant(significant)
                .causalDirection(type == CorrelationType.GRANGER
                        ? (significant ? CausalDirection.A_CAUSES_B : CausalDirection.NONE) : null)
                .build();
    }

    public static MergedCorrelation merged(String a, String b, boolean actionable, int agreement, double composite) {
        return MergedCorrelation.builder()
                .metricA(a)
                .metricB(b)
                .leadType(CorrelationType.PEARSON)
                .strength(0.6)
                .strengthLabel(CorrelationStrength.MODERATE_POSITIVE)
                .lagDays(0)
                .causalDirection(CausalDirection.NONE)
                .confidence(StatisticalConfidence.tested(0.001))
                .significant(true)
                .compositeConfidence(composite)
                .agreement(agreement)
                .signConflict(false)
                .actionable(actionable)
                .sampleSize(60)
                .contributions(List.of())
                .build();
    }

    public static DetectionResult detectionResult(String userId, RunStatus status, int total, int fresh) {
        return DetectionResult.builder()
                .runId("RUN-1")
                .userId(userId)
                .status(status)
                .totalAnomalies(total)
                .newAnomalies(fresh)
                .anomalies(List.of(anomaly("resting_hr", START.plusDays(10), DetectorType.ZSCORE, 0.9)))
                .correlations(List.of())
                .failures(List.of())
                .skipped(List.of())
                .build();
    }
}
