package com.health.insights.engine;

import com.health.insights.config.DetectionConfig;
import com.health.insights.model.AnomalyResult;
import com.health.insights.model.BaselineStrategy;
import com.health.insights.model.DetectorType;
import com.health.insights.model.MetricSeries;

import java.util.List;

/**
 * Point-anomaly detector over a single metric's series.
 * Each implementation handles one {@link DetectorType}.
 */
public interface AnomalyDetector {

    DetectorType getDetectorType();

    /**
     * Flags anomalous days of the series. Non-finite values are skipped.
     *
     * @param series   one metric's daily values, gaps allowed
     * @param config   detection settings for this run
     * @param strategy baseline strategy selected for the run
     * @return flagged days in date order, empty when nothing is anomalous
     * @throws InsufficientDataException when the series is too short to judge
     */
    List<AnomalyResult> detect(MetricSeries series, DetectionConfig config, BaselineStrategy strategy);
}
