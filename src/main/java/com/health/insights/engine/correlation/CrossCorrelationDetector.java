package com.health.insights.engine.correlation;

import com.health.insights.config.DetectionConfig;
import com.health.insights.engine.CorrelationDetector;
import com.health.insights.engine.NumericDegeneracyException;
import com.health.insights.model.CorrelationResult;
import com.health.insights.model.CorrelationType;
import com.health.insights.model.MetricSeries;
import com.health.insights.model.StatisticalConfidence;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scans lags from -maxLag to +maxLag and reports the lag with the largest |r|.
 * Lag convention: A on day d is paired with B on day d + lag, so a positive lag
 * means B follows A.
 *
 * Picking the best of many lags inflates significance, so the p-value is only
 * reported when Bonferroni correction is enabled.
 */
@Component
public class CrossCorrelationDetector implements CorrelationDetector {

    @Override
    public String getName() {
        return "CROSS_CORRELATION";
    }

    @Override
    public Set<CorrelationType> getCorrelationTypes() {
        return EnumSet.of(CorrelationType.CROSS_CORRELATION);
    }

    @Override
    public List<CorrelationResult> detect(MetricSeries seriesA, MetricSeries seriesB, DetectionConfig config) {
        DetectionConfig.CrossCorrelation settings = config.getCrossCorrelation();
        Map<LocalDate, Double> a = seriesA.valuesByDate();
        Map<LocalDate, Double> b = seriesB.valuesByDate();

        int lagsTested = 0;
        int bestLag = 0;
        double bestR = Double.NaN;
        int bestN = 0;
        for (int lag = -settings.getMaxLag(); lag <= settings.getMaxLag(); lag++) {
            AlignedPair pair = PairAligner.align(a, b, lag);
            if (pair.size() < settings.getMinSamples()) {
                continue;
            }
            double r;
            try {
                r = CorrelationStatistics.pearson(pair.a(), pair.b());
            } catch (NumericDegeneracyException e) {
                continue;
            }
            lagsTested++;
            if (Double.isNaN(bestR) || Math.abs(r) > Math.abs(bestR)
                    || (Math.abs(r) == Math.abs(bestR) && Math.abs(lag) < Math.abs(bestLag))) {
                bestR = r;
                bestLag = lag;
                bestN = pair.size();
            }
        }

        if (lagsTested == 0 || Math.abs(bestR) < settings.getMinCorrelation()) {
            return List.of();
        }

        double rawP = CorrelationStatistics.pValue(bestR, bestN);
        StatisticalConfidence confidence = settings.isBonferroniCorrection()
                ? StatisticalConfidence.tested(Math.min(1.0, rawP * lagsTested))
                : StatisticalConfidence.unsupported();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("optimal_lag", bestLag);
        details.put("lags_tested", lagsTested);
        details.put("multiple_comparison_corrected", settings.isBonferroniCorrection());

        return List.of(CorrelationResult.builder()
                .metricA(seriesA.getMetricName())
                .metricB(seriesB.getMetricName())
                .correlationType(CorrelationType.CROSS_CORRELATION)
                .strength(bestR)
                .lagDays(bestLag)
                .confidence(confidence)
                .sampleSize(bestN)
                .significant(confidence.isSignificantAt(config.getCorrelation().getSignificanceLevel()))
                .details(details)
                .build());
    }
}
