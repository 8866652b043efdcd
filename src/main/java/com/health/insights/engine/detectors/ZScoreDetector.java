package com.health.insights.engine.detectors;

import com.health.insights.config.DetectionConfig;
import com.health.insights.engine.AnomalyDetector;
import com.health.insights.engine.baseline.Baseline;
import com.health.insights.engine.baseline.BaselineEstimator;
import com.health.insights.model.AnomalyResult;
import com.health.insights.model.BaselineStrategy;
import com.health.insights.model.DailyObservation;
import com.health.insights.model.DetectorType;
import com.health.insights.model.MetricSeries;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flags days whose value lies too many baseline spreads away from the personal center,
 * or outside the metric's absolute bounds.
 *
 * Score: z / (z + k), so z = k maps to 0.5 and the score saturates towards 1.
 * A bounds violation lifts the score to at least the configured minimum.
 */
@Component
public class ZScoreDetector implements AnomalyDetector {

    private final BaselineEstimator baselineEstimator;

    public ZScoreDetector(BaselineEstimator baselineEstimator) {
        this.baselineEstimator = baselineEstimator;
    }

    @Override
    public DetectorType getDetectorType() {
        return DetectorType.ZSCORE;
    }

    @Override
    public List<AnomalyResult> detect(MetricSeries series, DetectionConfig config, BaselineStrategy strategy) {
        DetectionConfig.ZScore settings = config.getZScore();
        Baseline baseline = baselineEstimator.estimate(series, strategy, config);

        String metric = series.getMetricName();
        double threshold = settings.thresholdFor(metric);
        DetectionConfig.Bounds bounds = settings.getBounds().get(metric);
        double floor = Math.max(settings.getMinSpread(),
                settings.getRelativeSpreadFloor() * Math.abs(baseline.getCenter()));
        double spread = Math.max(baseline.getSpread(), floor);

        List<AnomalyResult> results = new ArrayList<>();
        for (DailyObservation observation : series.finiteObservations()) {
            double value = observation.getValue();
            double z = Math.abs(value - baseline.getCenter()) / spread;
            boolean boundsViolation = bounds != null && bounds.violatedBy(value);
            if (z <= threshold && !boundsViolation) {
                continue;
            }

            double score = z / (z + settings.getSaturationK());
            if (boundsViolation) {
                score = Math.max(score, settings.getBoundsViolationMinScore());
            }

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("z_score", z);
            details.put("threshold", threshold);
            details.put("spread", spread);
            details.put("bounds_violation", boundsViolation);
            details.put("baseline_strategy", baseline.getStrategy().name());

            results.add(AnomalyResult.scored(score)
                    .occurredOn(observation.getDate())
                    .sourceTable(observation.getSourceTable())
                    .sourceId(observation.getSourceId())
                    .metricName(metric)
                    .metricValue(value)
                    .baselineValue(baseline.getCenter())
                    .detectorType(DetectorType.ZSCORE)
                    .details(details)
                    .build());
        }
        return results;
    }
}
