package com.health.insights.engine.detectors;

import com.health.insights.config.DetectionConfig;
import com.health.insights.engine.AnomalyDetector;
import com.health.insights.engine.InsufficientDataException;
import com.health.insights.engine.baseline.Baseline;
import com.health.insights.engine.baseline.BaselineEstimator;
import com.health.insights.engine.isolationforest.FeatureExtractor;
import com.health.insights.engine.isolationforest.IsolationForest;
import com.health.insights.model.AnomalyResult;
import com.health.insights.model.BaselineStrategy;
import com.health.insights.model.DailyObservation;
import com.health.insights.model.DetectorType;
import com.health.insights.model.MetricSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Unsupervised detector: fits an isolation forest on the metric's own history and
 * flags days that are isolated unusually early.
 */
@Component
public class IsolationForestDetector implements AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(IsolationForestDetector.class);

    private final BaselineEstimator baselineEstimator;

    public IsolationForestDetector(BaselineEstimator baselineEstimator) {
        this.baselineEstimator = baselineEstimator;
    }

    @Override
    public DetectorType getDetectorType() {
        return DetectorType.ISOLATION_FOREST;
    }

    @Override
    public List<AnomalyResult> detect(MetricSeries series, DetectionConfig config, BaselineStrategy strategy) {
        DetectionConfig.IsolationForest settings = config.getIsolationForest();
        List<DailyObservation> observations = series.finiteObservations();
        if (observations.size() < settings.getMinSamples()) {
            throw new InsufficientDataException(
                    "Isolation forest for " + series.getMetricName() + " needs " + settings.getMinSamples()
                            + " observations, found " + observations.size(),
                    settings.getMinSamples(), observations.size());
        }

        Baseline baseline = baselineEstimator.estimate(series, strategy, config);
        double[][] raw = FeatureExtractor.extract(observations, settings.getRollingWindowDays());
        double[][] features = FeatureExtractor.standardize(copy(raw));

        // Per-metric seed keeps metrics independent while staying reproducible
        long seed = settings.getSeed() * 31 + series.getMetricName().hashCode();
        IsolationForest forest = IsolationForest.fit(features, settings.getNumTrees(), settings.getSampleSize(), seed);
        log.debug("Fitted isolation forest for {}: {} trees, sample size {}",
                series.getMetricName(), forest.getTreeCount(), forest.getSampleSize());

        List<AnomalyResult> results = new ArrayList<>();
        for (int i = 0; i < observations.size(); i++) {
            double score = forest.score(features[i]);
            if (score <= settings.getScoreThreshold()) {
                continue;
            }
            DailyObservation observation = observations.get(i);

            Map<String, Object> featureValues = new LinkedHashMap<>();
            for (int f = 0; f < FeatureExtractor.FEATURE_COUNT; f++) {
                featureValues.put(FeatureExtractor.FEATURE_NAMES[f], raw[i][f]);
            }
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("mean_path_length", forest.meanPathLength(features[i]));
            details.put("isolation_score", score);
            details.put("threshold", settings.getScoreThreshold());
            details.put("features", featureValues);
            details.put("baseline_strategy", baseline.getStrategy().name());

            results.add(AnomalyResult.scored(score)
                    .occurredOn(observation.getDate())
                    .sourceTable(observation.getSourceTable())
                    .sourceId(observation.getSourceId())
                    .metricName(series.getMetricName())
                    .metricValue(observation.getValue())
                    .baselineValue(baseline.getCenter())
                    .detectorType(DetectorType.ISOLATION_FOREST)
                    .details(details)
                    .build());
        }
        return results;
    }

    private static double[][] copy(double[][] rows) {
        double[][] copy = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            copy[i] = rows[i].clone();
        }
        return copy;
    }
}
