package com.health.insights.model;

import com.health.insights.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResultDetailsTest {

    @Test
    void anomalyDetails_areDetachedFromTheBuilderMap() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("z_score", 4.2);
        AnomalyResult result = AnomalyResult.scored(0.9)
                .occurredOn(TestDataFactory.START)
                .metricName("resting_hr")
                .detectorType(DetectorType.ZSCORE)
                .details(details)
                .build();

        details.put("z_score", -1.0);

        assertThat(result.getDetails()).containsEntry("z_score", 4.2);
        assertThatThrownBy(() -> result.getDetails().put("z_score", -1.0))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void correlationDetails_nestedCollectionsAreReadOnly() {
        Map<Integer, Double> pValuesByLag = new LinkedHashMap<>();
        pValuesByLag.put(1, 0.2);
        List<Integer> lags = new ArrayList<>(List.of(1, 2));
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("p_values_by_lag", pValuesByLag);
        details.put("lags", lags);
        CorrelationResult result = TestDataFactory.correlation("a", "b", CorrelationType.GRANGER, 0.4,
                StatisticalConfidence.tested(0.2), false, 40).toBuilder().details(details).build();

        pValuesByLag.put(2, 0.01);
        lags.add(3);

        @SuppressWarnings("unchecked")
        Map<Integer, Double> stored = (Map<Integer, Double>) result.getDetails().get("p_values_by_lag");
        assertThat(stored).containsOnlyKeys(1);
        assertThat((List<Object>) result.getDetails().get("lags")).containsExactly(1, 2);
        assertThatThrownBy(() -> stored.put(2, 0.01)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void missingDetails_defaultToEmpty() {
        AnomalyResult result = AnomalyResult.scored(0.3).metricName("steps").build();

        assertThat(result.getDetails()).isEmpty();
    }
}
