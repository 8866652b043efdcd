package com.health.insights.engine.correlation;

import com.health.insights.config.DetectionConfig;
import com.health.insights.model.CausalDirection;
import com.health.insights.model.CorrelationResult;
import com.health.insights.model.CorrelationStrength;
import com.health.insights.model.CorrelationSummary;
import com.health.insights.model.CorrelationType;
import com.health.insights.model.Granularity;
import com.health.insights.model.MergedCorrelation;
import com.health.insights.model.MetricPair;
import com.health.insights.model.StatisticalConfidence;
import com.health.insights.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.health.insights.model.StatisticalConfidence.tested;
import static com.health.insights.model.StatisticalConfidence.unsupported;
import static com.health.insights.testutil.TestDataFactory.correlation;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CorrelationAggregatorTest {

    private static final String A = "exercise_minutes";
    private static final String B = "sleep_quality";
    private static final MetricPair PAIR = new MetricPair(A, B);

    private final CorrelationAggregator aggregator = new CorrelationAggregator();
    private final DetectionConfig config = TestDataFactory.defaultConfig();

    @Test
    void corroboratedPositiveAssociation_isActionable() {
        List<CorrelationResult> results = List.of(
                correlation(A, B, CorrelationType.PEARSON, 0.60, tested(0.0001), true, 60),
                correlation(A, B, CorrelationType.SPEARMAN, 0.55, tested(0.0005), true, 60),
                correlation(A, B, CorrelationType.GRANGER, 0.25, tested(0.001), true, 57),
                correlation(A, B, CorrelationType.MUTUAL_INFORMATION, 0.70, unsupported(), true, 60));

        MergedCorrelation merged = aggregator.aggregate(PAIR, results, config).orElseThrow();

        assertThat(merged.getLeadType()).isEqualTo(CorrelationType.PEARSON);
        assertThat(merged.getStrength()).isEqualTo(0.60);
        assertThat(merged.getStrengthLabel()).isEqualTo(CorrelationStrength.MODERATE_POSITIVE);
        assertThat(merged.getAgreement()).isEqualTo(3);
        assertThat(merged.isSignConflict()).isFalse();
        assertThat(merged.getCausalDirection()).isEqualTo(CausalDirection.A_CAUSES_B);
        assertThat(merged.isActionable()).isTrue();
        assertThat(merged.getSampleSize()).isEqualTo(60);
        assertThat(merged.getContributions()).hasSize(4);
    }

    @Test
    void compositeConfidence_isWeightedMeanOfConfidenceScores() {
        List<CorrelationResult> results = List.of(
                correlation(A, B, CorrelationType.PEARSON, 0.5, tested(0.0), true, 60),
                correlation(A, B, CorrelationType.MUTUAL_INFORMATION, 0.8, unsupported(), true, 60));

        MergedCorrelation merged = aggregator.aggregate(PAIR, results, config).orElseThrow();

        double expected = (0.30 * 0.5 + 0.05 * 0.8) / (0.30 + 0.05);
        assertThat(merged.getCompositeConfidence()).isCloseTo(expected, within(1e-9));
    }

    @Test
    void testedResult_leadsOverStrongerUntestedResult() {
        List<CorrelationResult> results = List.of(
                correlation(A, B, CorrelationType.MUTUAL_INFORMATION, 0.95, unsupported(), true, 60),
                correlation(A, B, CorrelationType.SPEARMAN, 0.35, tested(0.02), true, 60));

        MergedCorrelation merged = aggregator.aggregate(PAIR, results, config).orElseThrow();

        assertThat(merged.getLeadType()).isEqualTo(CorrelationType.SPEARMAN);
        assertThat(merged.getConfidence().pValue()).isEqualTo(0.02);
    }

    @Test
    void lowerPValue_leadsAmongTestedResults() {
        List<CorrelationResult> results = List.of(
                correlation(A, B, CorrelationType.PEARSON, 0.7, tested(0.01), true, 60),
                correlation(A, B, CorrelationType.SPEARMAN, 0.5, tested(0.001), true, 60));

        assertThat(aggregator.aggregate(PAIR, results, config).orElseThrow().getLeadType())
                .isEqualTo(CorrelationType.SPEARMAN);
    }

    @Test
    void opposingSignificantSigns_flagConflictAndBlockActionability() {
        CorrelationResult lagged = correlation(A, B, CorrelationType.CROSS_CORRELATION, -0.6, tested(0.002), true, 55)
                .toBuilder().lagDays(2).build();
        List<CorrelationResult> results = List.of(
                correlation(A, B, CorrelationType.PEARSON, 0.5, tested(0.0001), true, 60),
                lagged,
                correlation(A, B, CorrelationType.GRANGER, 0.3, tested(0.001), true, 57));

        MergedCorrelation merged = aggregator.aggregate(PAIR, results, config).orElseThrow();

        assertThat(merged.isSignConflict()).isTrue();
        assertThat(merged.getAgreement()).isEqualTo(2);
        assertThat(merged.isActionable()).isFalse();
    }

    @Test
    void singleFamily_isNotActionable() {
        List<CorrelationResult> results = List.of(
                correlation(A, B, CorrelationType.PEARSON, 0.8, tested(0.0001), true, 60),
                correlation(A, B, CorrelationType.SPEARMAN, 0.8, tested(0.0001), true, 60));

        MergedCorrelation merged = aggregator.aggregate(PAIR, results, config).orElseThrow();

        assertThat(merged.getAgreement()).isEqualTo(1);
        assertThat(merged.isActionable()).isFalse();
    }

    @Test
    void grangerResultsInBothOrientations_giveBidirectional() {
        List<CorrelationResult> results = List.of(
                correlation(A, B, CorrelationType.GRANGER, 0.3, tested(0.001), true, 57),
                correlation(B, A, CorrelationType.GRANGER, 0.2, tested(0.01), true, 57));

        assertThat(aggregator.aggregate(PAIR, results, config).orElseThrow().getCausalDirection())
                .isEqualTo(CausalDirection.BIDIRECTIONAL);
    }

    @Test
    void reverseGrangerOnly_givesBCausesA() {
        List<CorrelationResult> results = List.of(
                correlation(A, B, CorrelationType.GRANGER, 0.05, tested(0.4), false, 57),
                correlation(B, A, CorrelationType.GRANGER, 0.3, tested(0.001), true, 57));

        assertThat(aggregator.aggregate(PAIR, results, config).orElseThrow().getCausalDirection())
                .isEqualTo(CausalDirection.B_CAUSES_A);
    }

    @Test
    void resultsBelowTheirSampleFloor_areDropped() {
        List<CorrelationResult> results = List.of(
                correlation(A, B, CorrelationType.PEARSON, 0.9, tested(0.0001), true, 10),
                correlation(A, B, CorrelationType.GRANGER, 0.4, tested(0.001), true, 15));

        Optional<MergedCorrelation> merged = aggregator.aggregate(PAIR, results, config);

        assertThat(merged).isEmpty();
    }

    @Test
    void rank_putsActionableThenStrongerAgreementFirst() {
        MergedCorrelation weak = TestDataFactory.merged("a", "b", false, 1, 0.9);
        MergedCorrelation agreed = TestDataFactory.merged("c", "d", false, 3, 0.5);
        MergedCorrelation actionable = TestDataFactory.merged("e", "f", true, 2, 0.6);

        List<MergedCorrelation> ranked = aggregator.rank(List.of(weak, agreed, actionable));

        assertThat(ranked).containsExactly(actionable, agreed, weak);
    }

    @Test
    void summarize_countsAndDescribesTopFindings() {
        MergedCorrelation actionable = TestDataFactory.merged("exercise_minutes", "sleep_quality", true, 3, 0.7)
                .toBuilder().causalDirection(CausalDirection.A_CAUSES_B).lagDays(1).build();
        MergedCorrelation other = TestDataFactory.merged("total_sugar_g", "hrv", false, 1, 0.3);

        CorrelationSummary summary = aggregator.summarize(List.of(other, actionable), 1);

        assertThat(summary.getTotal()).isEqualTo(2);
        assertThat(summary.getSignificant()).isEqualTo(2);
        assertThat(summary.getActionable()).isEqualTo(1);
        assertThat(summary.getByType()).containsEntry(CorrelationType.PEARSON, 2);
        assertThat(summary.getByStrength()).containsEntry(CorrelationStrength.MODERATE_POSITIVE, 2);
        assertThat(summary.getTopFindings())
                .containsExactly("exercise_minutes -> sleep_quality (MODERATE_POSITIVE, lag 1d)");
    }

    @Test
    void dailyAndWeeklyResults_areMergedSeparately() {
        CorrelationResult weeklyPearson = correlation(A, B, CorrelationType.PEARSON, 0.85, tested(0.004), true, 8)
                .toBuilder().granularity(Granularity.WEEKLY).build();
        CorrelationResult weeklySpearman = correlation(A, B, CorrelationType.SPEARMAN, 0.80, tested(0.01), true, 8)
                .toBuilder().granularity(Granularity.WEEKLY).build();
        List<CorrelationResult> results = List.of(
                correlation(A, B, CorrelationType.PEARSON, 0.40, tested(0.002), true, 60),
                weeklyPearson,
                weeklySpearman);

        List<MergedCorrelation> merged = aggregator.aggregateByGranularity(PAIR, results, config);

        assertThat(merged).extracting(MergedCorrelation::getGranularity)
                .containsExactly(Granularity.DAILY, Granularity.WEEKLY);
        assertThat(merged.get(0).getContributions()).hasSize(1);
        assertThat(merged.get(1).getStrength()).isEqualTo(0.85);
        assertThat(merged.get(1).getContributions()).containsExactly(weeklyPearson, weeklySpearman);
    }

    @Test
    void weeklyResults_useTheWeeklySampleFloor() {
        CorrelationResult threeWeeks = correlation(A, B, CorrelationType.PEARSON, 0.99, tested(0.09), false, 3)
                .toBuilder().granularity(Granularity.WEEKLY).build();
        CorrelationResult fourWeeks = threeWeeks.toBuilder().sampleSize(4).build();

        assertThat(aggregator.aggregate(PAIR, List.of(threeWeeks), config)).isEmpty();
        assertThat(aggregator.aggregate(PAIR, List.of(fourWeeks), config)).isPresent();
    }

    @Test
    void summarize_countsWeeklyVerdictsAndLabelsThem() {
        MergedCorrelation weekly = TestDataFactory.merged("exercise_minutes", "sleep_quality", true, 1, 0.8)
                .toBuilder().granularity(Granularity.WEEKLY).build();
        MergedCorrelation daily = TestDataFactory.merged("total_sugar_g", "hrv", false, 1, 0.3);

        CorrelationSummary summary = aggregator.summarize(List.of(daily, weekly), 1);

        assertThat(summary.getByGranularity())
                .containsEntry(Granularity.DAILY, 1)
                .containsEntry(Granularity.WEEKLY, 1);
        assertThat(summary.getTopFindings())
                .containsExactly("exercise_minutes <-> sleep_quality (MODERATE_POSITIVE, weekly)");
    }
}
