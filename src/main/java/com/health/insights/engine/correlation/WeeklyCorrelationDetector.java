package com.health.insights.engine.correlation;

import com.health.insights.config.DetectionConfig;
import com.health.insights.engine.CorrelationDetector;
import com.health.insights.engine.features.WeeklyResampler;
import com.health.insights.model.CorrelationResult;
import com.health.insights.model.CorrelationType;
import com.health.insights.model.Granularity;
import com.health.insights.model.MetricSeries;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Pearson and Spearman correlation of weekly means. Picks up relationships that
 * day-to-day noise hides, at the cost of far fewer samples.
 */
@Component
public class WeeklyCorrelationDetector implements CorrelationDetector {

    @Override
    public String getName() {
        return "WEEKLY_PEARSON_SPEARMAN";
    }

    @Override
    public Set<CorrelationType> getCorrelationTypes() {
        return EnumSet.of(CorrelationType.PEARSON, CorrelationType.SPEARMAN);
    }

    @Override
    public List<CorrelationResult> detect(MetricSeries seriesA, MetricSeries seriesB, DetectionConfig config) {
        DetectionConfig.Weekly settings = config.getWeekly();
        if (!settings.isEnabled()) {
            return List.of();
        }
        return PearsonSpearmanDetector.correlate(
                WeeklyResampler.resample(seriesA, settings.getMinDaysPerWeek()),
                WeeklyResampler.resample(seriesB, settings.getMinDaysPerWeek()),
                settings.getMinWeeks(),
                config.getCorrelation().getSignificanceLevel(),
                Granularity.WEEKLY);
    }
}
