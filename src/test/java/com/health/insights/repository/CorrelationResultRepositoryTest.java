package com.health.insights.repository;

import com.health.insights.model.Granularity;
import com.health.insights.model.MergedCorrelation;
import com.health.insights.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CorrelationResultRepositoryTest {

    @Test
    void dailyAndWeeklyVerdicts_getDistinctRecordKeys() {
        MergedCorrelation daily = TestDataFactory.merged("exercise_minutes", "sleep_quality", true, 3, 0.7);
        MergedCorrelation weekly = daily.toBuilder().granularity(Granularity.WEEKLY).build();

        assertThat(CorrelationResultRepository.recordKey("user-1", daily))
                .isEqualTo("user-1|exercise_minutes|sleep_quality");
        assertThat(CorrelationResultRepository.recordKey("user-1", weekly))
                .isEqualTo("user-1|exercise_minutes|sleep_quality|WEEKLY");
    }
}
