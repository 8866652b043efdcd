package com.health.insights.engine.isolationforest;

import com.health.insights.model.DailyObservation;
import com.health.insights.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FeatureExtractorTest {

    @Test
    void extract_computesRollingStatsFromPriorDaysOnly() {
        List<DailyObservation> observations = TestDataFactory.series("hrv", 10, 20, 30, 40).finiteObservations();

        double[][] rows = FeatureExtractor.extract(observations, 7);

        assertThat(rows[0]).containsExactly(10.0, 10.0, 0.0, 0.0);
        assertThat(rows[3][0]).isEqualTo(40.0);
        assertThat(rows[3][1]).isCloseTo(20.0, within(1e-9));
        assertThat(rows[3][2]).isCloseTo(10.0, within(1e-9));
        assertThat(rows[3][3]).isEqualTo(10.0);
    }

    @Test
    void extract_gapResetsDayOverDayChange() {
        List<DailyObservation> observations = List.of(
                TestDataFactory.observation(TestDataFactory.START, 10.0),
                TestDataFactory.observation(TestDataFactory.START.plusDays(3), 50.0));

        double[][] rows = FeatureExtractor.extract(observations, 7);

        assertThat(rows[1][3]).isEqualTo(0.0);
        assertThat(rows[1][1]).isEqualTo(10.0);
    }

    @Test
    void standardize_constantColumnBecomesZero() {
        double[][] rows = {{1.0, 5.0}, {3.0, 5.0}};

        FeatureExtractor.standardize(rows);

        assertThat(rows[0][1]).isEqualTo(0.0);
        assertThat(rows[0][0]).isCloseTo(-rows[1][0], within(1e-12));
    }

    @Test
    void standardize_usesSampleStandardDeviation() {
        double[][] rows = {{1.0}, {3.0}, {5.0}};

        FeatureExtractor.standardize(rows);

        // mean 3, sample std 2
        assertThat(rows[0][0]).isCloseTo(-1.0, within(1e-12));
        assertThat(rows[1][0]).isCloseTo(0.0, within(1e-12));
        assertThat(rows[2][0]).isCloseTo(1.0, within(1e-12));
    }
}
