package com.health.insights.engine;

import com.health.insights.config.DetectionConfig;
import com.health.insights.model.CorrelationResult;
import com.health.insights.model.CorrelationType;
import com.health.insights.model.MetricSeries;

import java.util.List;
import java.util.Set;

/**
 * Association test between two metric series.
 */
public interface CorrelationDetector {

    /** Name used in logs, spans and failure records. */
    String getName();

    /** Result types this detector can emit. */
    Set<CorrelationType> getCorrelationTypes();

    /**
     * Tests the pair. {@code seriesA} is treated as the candidate cause by
     * directional methods.
     *
     * @return zero or more results; an empty list means the detector declined
     *         (too few aligned samples or an undefined statistic)
     */
    List<CorrelationResult> detect(MetricSeries seriesA, MetricSeries seriesB, DetectionConfig config);
}
