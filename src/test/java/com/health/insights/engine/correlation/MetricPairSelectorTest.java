package com.health.insights.engine.correlation;

import com.health.insights.config.DetectionConfig;
import com.health.insights.model.MetricPair;
import com.health.insights.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class MetricPairSelectorTest {

    private final MetricPairSelector selector = new MetricPairSelector();

    @Test
    void crossProduct_onlyIncludesAvailableMetrics() {
        DetectionConfig config = TestDataFactory.defaultConfig();

        List<MetricPair> pairs = selector.select(Set.of("exercise_minutes", "hrv", "resting_hr", "steps"), config);

        assertThat(pairs).containsExactly(
                new MetricPair("exercise_minutes", "hrv"),
                new MetricPair("exercise_minutes", "resting_hr"));
    }

    @Test
    void metricThatIsBothInfluencerAndOutcome_isPairedOnce() {
        DetectionConfig config = TestDataFactory.defaultConfig();

        List<MetricPair> pairs = selector.select(Set.of("sleep_hours", "sleep_quality"), config);

        assertThat(pairs).containsExactly(new MetricPair("sleep_hours", "sleep_quality"));
    }

    @Test
    void explicitPairs_replaceCrossProduct() {
        DetectionConfig config = TestDataFactory.defaultConfig();
        config.getCorrelation().setPairs(List.of(
                new DetectionConfig.PairSetting("total_sugar_g", "blood_glucose_fasting"),
                new DetectionConfig.PairSetting("blood_glucose_fasting", "total_sugar_g"),
                new DetectionConfig.PairSetting("weight_kg", "weight_kg")));

        List<MetricPair> pairs = selector.select(
                Set.of("total_sugar_g", "blood_glucose_fasting", "exercise_minutes", "hrv", "weight_kg"), config);

        assertThat(pairs).containsExactly(new MetricPair("blood_glucose_fasting", "total_sugar_g"));
    }

    @Test
    void noAvailableMetrics_yieldsNoPairs() {
        assertThat(selector.select(Set.of(), TestDataFactory.defaultConfig())).isEmpty();
    }
}
