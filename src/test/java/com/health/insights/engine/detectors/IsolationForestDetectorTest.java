package com.health.insights.engine.detectors;

import com.health.insights.config.DetectionConfig;
import com.health.insights.engine.InsufficientDataException;
import com.health.insights.engine.baseline.BaselineEstimator;
import com.health.insights.model.AnomalyResult;
import com.health.insights.model.BaselineStrategy;
import com.health.insights.model.DetectorType;
import com.health.insights.model.MetricSeries;
import com.health.insights.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IsolationForestDetectorTest {

    private final IsolationForestDetector detector = new IsolationForestDetector(new BaselineEstimator());
    private final DetectionConfig config = TestDataFactory.defaultConfig();

    private static MetricSeries hrvWithSpike(int spikeDay) {
        Random random = new Random(11);
        return TestDataFactory.series("hrv", 60, i -> i == spikeDay ? 160.0 : 55.0 + 3.0 * random.nextGaussian());
    }

    @Test
    void spikeDay_isFlaggedWithTheHighestScore() {
        List<AnomalyResult> results = detector.detect(hrvWithSpike(40), config, BaselineStrategy.ROBUST);

        LocalDate spikeDate = TestDataFactory.START.plusDays(40);
        assertThat(results).isNotEmpty();
        AnomalyResult top = results.stream().max(Comparator.comparingDouble(AnomalyResult::getAnomalyScore)).orElseThrow();
        assertThat(top.getOccurredOn()).isEqualTo(spikeDate);
        assertThat(top.getMetricValue()).isEqualTo(160.0);
        assertThat(top.getDetectorType()).isEqualTo(DetectorType.ISOLATION_FOREST);
        assertThat(top.getAnomalyScore()).isGreaterThan(0.6);
        assertThat(top.getDetails()).containsKeys("mean_path_length", "isolation_score", "features");
    }

    @Test
    void fixedSeed_isDeterministic() {
        MetricSeries series = hrvWithSpike(25);

        List<AnomalyResult> first = detector.detect(series, config, BaselineStrategy.ROBUST);
        List<AnomalyResult> second = detector.detect(series, config, BaselineStrategy.ROBUST);

        assertThat(first).isEqualTo(second);
    }

    @Test
    void belowMinimumSamples_throwsInsufficientData() {
        MetricSeries series = TestDataFactory.series("hrv", 9, i -> 50.0 + i);

        assertThatThrownBy(() -> detector.detect(series, config, BaselineStrategy.ROBUST))
                .isInstanceOf(InsufficientDataException.class);
    }
}
