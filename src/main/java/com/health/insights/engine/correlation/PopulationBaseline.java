package com.health.insights.engine.correlation;

import com.health.insights.config.DetectionConfig;
import com.health.insights.model.MergedCorrelation;
import com.health.insights.model.PopulationComparison;
import com.health.insights.repository.CorrelationResultRepository;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Compares a user's correlation verdicts with the same relationship across other users.
 *
 * Population statistics come from other users' stored verdicts with the same pair, lead
 * method and granularity. With fewer than {@code minUsers} of them a published default
 * is used instead, and a neutral one (mean 0, std 0.25) for pairs without a default.
 * The percentile is that of the absolute distance from the mean under a normal model,
 * so it ranks how atypical the strength is, not its direction.
 */
@Component
public class PopulationBaseline {

    private static final Logger log = LoggerFactory.getLogger(PopulationBaseline.class);

    static final Map<String, double[]> DEFAULT_BASELINES = Map.of(
            "exercise_minutes|sleep_quality", new double[]{0.35, 0.15},
            "exercise_minutes|resting_hr", new double[]{-0.25, 0.12},
            "total_calories|weight_kg", new double[]{0.20, 0.18},
            "sleep_hours|hrv", new double[]{0.30, 0.14},
            "total_sugar_g|sleep_quality", new double[]{-0.18, 0.10},
            "sleep_quality|resting_hr", new double[]{-0.22, 0.11},
            "exercise_minutes|hrv", new double[]{0.28, 0.13},
            "total_carbs_g|blood_glucose_fasting", new double[]{0.25, 0.15});

    static final double NEUTRAL_MEAN = 0.0;
    static final double NEUTRAL_STD = 0.25;

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0.0, 1.0);

    private final CorrelationResultRepository correlationRepository;

    public PopulationBaseline(CorrelationResultRepository correlationRepository) {
        this.correlationRepository = correlationRepository;
    }

    /** Copies of {@code verdicts} with their population comparison attached, in the same order. */
    public List<MergedCorrelation> compare(String userId, List<MergedCorrelation> verdicts, DetectionConfig config) {
        if (verdicts.isEmpty()) {
            return verdicts;
        }
        Map<String, List<Double>> peers = correlationRepository.findPeerStrengths(userId);
        DetectionConfig.Population settings = config.getPopulation();

        List<MergedCorrelation> compared = new ArrayList<>(verdicts.size());
        for (MergedCorrelation verdict : verdicts) {
            List<Double> strengths = peers.getOrDefault(CorrelationResultRepository.peerKey(
                    verdict.getMetricA(), verdict.getMetricB(), verdict.getLeadType(), verdict.getGranularity()),
                    List.of());
            PopulationStats stats = statsFor(verdict.getMetricA(), verdict.getMetricB(), strengths, settings);
            compared.add(verdict.toBuilder()
                    .population(comparison(verdict.getStrength(), stats, settings))
                    .build());
        }
        log.debug("Compared {} verdicts for user {} with the population", compared.size(), userId);
        return compared;
    }

    static PopulationStats statsFor(String metricA, String metricB, List<Double> strengths,
                                    DetectionConfig.Population settings) {
        if (strengths.size() < settings.getMinUsers()) {
            return defaultStats(metricA, metricB);
        }
        double[] values = strengths.stream().mapToDouble(Double::doubleValue).toArray();
        double std = new StandardDeviation().evaluate(values);
        return new PopulationStats(new Mean().evaluate(values), std > 0 ? std : settings.getStdFloor(),
                values.length, false);
    }

    static PopulationStats defaultStats(String metricA, String metricB) {
        double[] baseline = DEFAULT_BASELINES.get(metricA + "|" + metricB);
        if (baseline == null) {
            baseline = DEFAULT_BASELINES.get(metricB + "|" + metricA);
        }
        if (baseline == null) {
            return new PopulationStats(NEUTRAL_MEAN, NEUTRAL_STD, 0, true);
        }
        return new PopulationStats(baseline[0], baseline[1], 0, true);
    }

    static PopulationComparison comparison(double strength, PopulationStats stats, DetectionConfig.Population settings) {
        double scale = Math.max(stats.std(), settings.getStdFloor());
        double distance = Math.abs(strength - stats.mean()) / scale;
        double percentile = STANDARD_NORMAL.cumulativeProbability(distance) * 100.0;
        return PopulationComparison.builder()
                .mean(stats.mean())
                .std(stats.std())
                .count(stats.count())
                .defaultBaseline(stats.isDefault())
                .percentileRank(Math.round(percentile * 10.0) / 10.0)
                .distanceInStd(Math.round(distance * 100.0) / 100.0)
                .unusual(distance > settings.getUnusualDistance())
                .build();
    }

    record PopulationStats(double mean, double std, int count, boolean isDefault) {}
}
