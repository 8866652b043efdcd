package com.health.insights.engine.correlation;

import com.health.insights.config.DetectionConfig;
import com.health.insights.engine.CorrelationDetector;
import com.health.insights.engine.NumericDegeneracyException;
import com.health.insights.model.CorrelationResult;
import com.health.insights.model.CorrelationType;
import com.health.insights.model.Granularity;
import com.health.insights.model.MetricSeries;
import com.health.insights.model.StatisticalConfidence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Same-day linear (Pearson) and rank (Spearman) correlation.
 */
@Component
public class PearsonSpearmanDetector implements CorrelationDetector {

    private static final Logger log = LoggerFactory.getLogger(PearsonSpearmanDetector.class);

    @Override
    public String getName() {
        return "PEARSON_SPEARMAN";
    }

    @Override
    public Set<CorrelationType> getCorrelationTypes() {
        return EnumSet.of(CorrelationType.PEARSON, CorrelationType.SPEARMAN);
    }

    @Override
    public List<CorrelationResult> detect(MetricSeries seriesA, MetricSeries seriesB, DetectionConfig config) {
        return correlate(seriesA, seriesB, config.getPearson().getMinSamples(),
                config.getCorrelation().getSignificanceLevel(), Granularity.DAILY);
    }

    static List<CorrelationResult> correlate(MetricSeries seriesA, MetricSeries seriesB, int minSamples,
                                             double alpha, Granularity granularity) {
        AlignedPair pair = PairAligner.align(seriesA, seriesB);
        if (pair.size() < minSamples) {
            log.debug("Declining {} vs {} ({}): {} aligned samples",
                    seriesA.getMetricName(), seriesB.getMetricName(), granularity, pair.size());
            return List.of();
        }

        try {
            double pearson = CorrelationStatistics.pearson(pair.a(), pair.b());
            double spearman = CorrelationStatistics.spearman(pair.a(), pair.b());
            return List.of(
                    result(seriesA, seriesB, CorrelationType.PEARSON, pearson, pair.size(), alpha, granularity),
                    result(seriesA, seriesB, CorrelationType.SPEARMAN, spearman, pair.size(), alpha, granularity));
        } catch (NumericDegeneracyException e) {
            log.debug("Declining {} vs {}: {}", seriesA.getMetricName(), seriesB.getMetricName(), e.getMessage());
            return List.of();
        }
    }

    private static CorrelationResult result(MetricSeries a, MetricSeries b, CorrelationType type,
                                            double r, int n, double alpha, Granularity granularity) {
        StatisticalConfidence confidence = StatisticalConfidence.tested(CorrelationStatistics.pValue(r, n));
        return CorrelationResult.builder()
                .metricA(a.getMetricName())
                .metricB(b.getMetricName())
                .correlationType(type)
                .strength(r)
                .lagDays(0)
                .confidence(confidence)
                .sampleSize(n)
                .significant(confidence.isSignificantAt(alpha))
                .granularity(granularity)
                .details(Map.of("coefficient", r))
                .build();
    }
}
