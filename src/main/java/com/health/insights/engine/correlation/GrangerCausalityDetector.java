package com.health.insights.engine.correlation;

import com.health.insights.config.DetectionConfig;
import com.health.insights.engine.CorrelationDetector;
import com.health.insights.engine.NumericDegeneracyException;
import com.health.insights.model.CausalDirection;
import com.health.insights.model.CorrelationResult;
import com.health.insights.model.CorrelationType;
import com.health.insights.model.MetricSeries;
import com.health.insights.model.StatisticalConfidence;
import org.apache.commons.math3.distribution.FDistribution;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Granger causality via nested OLS regressions.
 *
 * For each lag order p the effect series is regressed on its own p lags (restricted)
 * and on its own lags plus p lags of the cause (unrestricted). The F statistic
 * ((RSS_r - RSS_u) / p) / (RSS_u / (n - 2p - 1)) is tested against F(p, n - 2p - 1).
 * The order with the lowest p-value is reported, and its p-value is Bonferroni-corrected
 * by the number of orders tested. Strength is the share of restricted residual variance
 * explained by the cause's lags.
 *
 * Lags are calendar days: a row is used only when every lagged day is present in both series.
 */
@Component
public class GrangerCausalityDetector implements CorrelationDetector {

    private static final Logger log = LoggerFactory.getLogger(GrangerCausalityDetector.class);

    @Override
    public String getName() {
        return "GRANGER";
    }

    @Override
    public Set<CorrelationType> getCorrelationTypes() {
        return EnumSet.of(CorrelationType.GRANGER);
    }

    @Override
    public List<CorrelationResult> detect(MetricSeries seriesA, MetricSeries seriesB, DetectionConfig config) {
        DetectionConfig.Granger settings = config.getGranger();
        Map<LocalDate, Double> a = seriesA.valuesByDate();
        Map<LocalDate, Double> b = seriesB.valuesByDate();
        if (settings.isDifference()) {
            a = difference(a);
            b = difference(b);
        }

        List<CorrelationResult> results = new ArrayList<>();
        test(a, b, seriesA.getMetricName(), seriesB.getMetricName(), config).ifPresent(results::add);
        if (settings.isBothDirections()) {
            test(b, a, seriesB.getMetricName(), seriesA.getMetricName(), config).ifPresent(results::add);
        }
        return results;
    }

    private Optional<CorrelationResult> test(Map<LocalDate, Double> cause, Map<LocalDate, Double> effect,
                                             String causeName, String effectName, DetectionConfig config) {
        DetectionConfig.Granger settings = config.getGranger();
        LagTest best = null;
        Map<Integer, Double> pValuesByLag = new LinkedHashMap<>();

        for (int p = 1; p <= settings.getMaxLag(); p++) {
            try {
                LagTest candidate = testOrder(cause, effect, p, settings.getMinSamples());
                if (candidate == null) continue;
                pValuesByLag.put(p, candidate.pValue);
                if (best == null || candidate.pValue < best.pValue) {
                    best = candidate;
                }
            } catch (NumericDegeneracyException e) {
                log.debug("Granger {} -> {} lag {} skipped: {}", causeName, effectName, p, e.getMessage());
            }
        }
        if (best == null) {
            return Optional.empty();
        }

        double corrected = Math.min(1.0, best.pValue * pValuesByLag.size());
        boolean significant = corrected < config.getCorrelation().getSignificanceLevel();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("optimal_lag_order", best.order);
        details.put("f_statistic", best.fStatistic);
        details.put("p_values_by_lag", pValuesByLag);
        details.put("lag_orders_tested", pValuesByLag.size());
        details.put("multiple_comparison_corrected", true);
        details.put("differenced", settings.isDifference());

        return Optional.of(CorrelationResult.builder()
                .metricA(causeName)
                .metricB(effectName)
                .correlationType(CorrelationType.GRANGER)
                .strength(best.strength)
                .lagDays(best.order)
                .confidence(StatisticalConfidence.tested(corrected))
                .sampleSize(best.sampleSize)
                .significant(significant)
                .causalDirection(significant ? CausalDirection.A_CAUSES_B : CausalDirection.NONE)
                .details(details)
                .build());
    }

    private LagTest testOrder(Map<LocalDate, Double> cause, Map<LocalDate, Double> effect, int p, int minSamples) {
        List<double[]> restrictedRows = new ArrayList<>();
        List<double[]> unrestrictedRows = new ArrayList<>();
        List<Double> targets = new ArrayList<>();

        for (Map.Entry<LocalDate, Double> entry : effect.entrySet()) {
            LocalDate day = entry.getKey();
            double[] restricted = new double[p];
            double[] unrestricted = new double[2 * p];
            boolean complete = true;
            for (int k = 1; k <= p && complete; k++) {
                Double ownLag = effect.get(day.minusDays(k));
                Double causeLag = cause.get(day.minusDays(k));
                if (ownLag == null || causeLag == null) {
                    complete = false;
                } else {
                    restricted[k - 1] = ownLag;
                    unrestricted[k - 1] = ownLag;
                    unrestricted[p + k - 1] = causeLag;
                }
            }
            if (complete && cause.containsKey(day)) {
                restrictedRows.add(restricted);
                unrestrictedRows.add(unrestricted);
                targets.add(entry.getValue());
            }
        }

        int n = targets.size();
        int dfDenominator = n - 2 * p - 1;
        if (n < minSamples || dfDenominator <= 0) {
            return null;
        }

        double[] y = targets.stream().mapToDouble(Double::doubleValue).toArray();
        double rssRestricted = residualSumOfSquares(y, restrictedRows.toArray(new double[0][]));
        double rssUnrestricted = residualSumOfSquares(y, unrestrictedRows.toArray(new double[0][]));
        if (rssRestricted <= 0 || rssUnrestricted <= 0) {
            throw new NumericDegeneracyException("Perfect fit, residual variance is zero");
        }

        double reduction = Math.max(0.0, rssRestricted - rssUnrestricted);
        double f = (reduction / p) / (rssUnrestricted / dfDenominator);
        double pValue = 1.0 - new FDistribution(p, dfDenominator).cumulativeProbability(f);
        return new LagTest(p, f, Math.max(0.0, Math.min(1.0, pValue)), reduction / rssRestricted, n);
    }

    private static double residualSumOfSquares(double[] y, double[][] x) {
        try {
            OLSMultipleLinearRegression regression = new OLSMultipleLinearRegression();
            regression.newSampleData(y, x);
            return regression.calculateResidualSumOfSquares();
        } catch (MathIllegalArgumentException e) {
            throw new NumericDegeneracyException("Regression is singular: " + e.getMessage());
        }
    }

    /** Day-over-day differences; a day is kept only when the previous calendar day exists. */
    static Map<LocalDate, Double> difference(Map<LocalDate, Double> values) {
        Map<LocalDate, Double> differenced = new LinkedHashMap<>();
        for (Map.Entry<LocalDate, Double> entry : values.entrySet()) {
            Double previous = values.get(entry.getKey().minusDays(1));
            if (previous != null) {
                differenced.put(entry.getKey(), entry.getValue() - previous);
            }
        }
        return differenced;
    }

    private record LagTest(int order, double fStatistic, double pValue, double strength, int sampleSize) {}
}
