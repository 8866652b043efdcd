package com.health.insights.engine.baseline;

import com.health.insights.config.DetectionConfig;
import com.health.insights.engine.InsufficientDataException;
import com.health.insights.model.BaselineStrategy;
import com.health.insights.model.DailyObservation;
import com.health.insights.model.MetricSeries;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.List;

/**
 * Estimates a personal baseline from a metric's history.
 *
 * <ul>
 *   <li>ROBUST: median and IQR / 1.349, which equals sigma for normal data. When half or
 *       more of the values coincide the IQR is zero (and so is the MAD); the spread then
 *       falls back to the standard deviation of the values between the 5th and 95th
 *       percentiles. A lone spike stays outside that range.</li>
 *   <li>ADAPTIVE: the robust baseline with the spread scaled by the series' coefficient
 *       of variation relative to a reference CV, within configured bounds.</li>
 *   <li>EWMA: exponentially weighted mean and bias-corrected weighted standard deviation;
 *       weights decay by calendar distance from the latest observation so gaps age data.</li>
 * </ul>
 */
@Component
public class BaselineEstimator {

    static final double IQR_TO_SIGMA = 1.349;

    public Baseline estimate(MetricSeries series, BaselineStrategy strategy, DetectionConfig config) {
        List<DailyObservation> observations = series.finiteObservations();
        int minSamples = config.getBaseline().getMinSamples();
        if (observations.size() < minSamples) {
            throw new InsufficientDataException(
                    "Baseline for " + series.getMetricName() + " needs " + minSamples
                            + " observations, found " + observations.size(),
                    minSamples, observations.size());
        }

        return switch (strategy) {
            case ROBUST -> robust(observations);
            case ADAPTIVE -> adaptive(observations, config.getBaseline());
            case EWMA -> ewma(observations, config.getBaseline());
        };
    }

    private Baseline robust(List<DailyObservation> observations) {
        double[] values = values(observations);
        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        percentile.setData(values);
        double median = percentile.evaluate(50.0);
        double spread = (percentile.evaluate(75.0) - percentile.evaluate(25.0)) / IQR_TO_SIGMA;
        if (spread == 0.0) {
            spread = trimmedStandardDeviation(values, percentile.evaluate(5.0), percentile.evaluate(95.0));
        }
        return new Baseline(median, spread, BaselineStrategy.ROBUST, values.length);
    }

    static double trimmedStandardDeviation(double[] values, double low, double high) {
        double[] kept = Arrays.stream(values).filter(v -> v >= low && v <= high).toArray();
        return kept.length > 1 ? new StandardDeviation().evaluate(kept) : 0.0;
    }

    private Baseline adaptive(List<DailyObservation> observations, DetectionConfig.Baseline settings) {
        Baseline robust = robust(observations);
        double[] values = values(observations);
        double mean = new Mean().evaluate(values);
        double factor = 1.0;
        if (Math.abs(mean) > 0) {
            double cv = new StandardDeviation().evaluate(values) / Math.abs(mean);
            factor = clamp(cv / settings.getAdaptiveReferenceCv(),
                    settings.getAdaptiveMinFactor(), settings.getAdaptiveMaxFactor());
        }
        return new Baseline(robust.getCenter(), robust.getSpread() * factor,
                BaselineStrategy.ADAPTIVE, values.length);
    }

    private Baseline ewma(List<DailyObservation> observations, DetectionConfig.Baseline settings) {
        LocalDate latest = observations.get(observations.size() - 1).getDate();
        double halfLife = settings.getEwmaHalfLifeDays();

        double sumW = 0, sumW2 = 0, sumWx = 0;
        double[] weights = new double[observations.size()];
        for (int i = 0; i < observations.size(); i++) {
            DailyObservation o = observations.get(i);
            long age = ChronoUnit.DAYS.between(o.getDate(), latest);
            weights[i] = Math.pow(0.5, age / halfLife);
            sumW += weights[i];
            sumW2 += weights[i] * weights[i];
            sumWx += weights[i] * o.getValue();
        }
        double center = sumWx / sumW;

        double weightedSq = 0;
        for (int i = 0; i < observations.size(); i++) {
            double d = observations.get(i).getValue() - center;
            weightedSq += weights[i] * d * d;
        }
        // Reliability-weight correction: V1 / (V1^2 - V2)
        double denominator = sumW * sumW - sumW2;
        double variance = denominator > 0 ? weightedSq * sumW / denominator : 0.0;
        return new Baseline(center, Math.sqrt(variance), BaselineStrategy.EWMA, observations.size());
    }

    private static double[] values(List<DailyObservation> observations) {
        return observations.stream().mapToDouble(DailyObservation::getValue).toArray();
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
