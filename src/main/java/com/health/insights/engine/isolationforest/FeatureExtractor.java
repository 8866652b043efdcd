package com.health.insights.engine.isolationforest;

import com.health.insights.model.DailyObservation;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Builds a 4-dimensional feature vector for each day of a metric's series.
 *
 * Features:
 *   [0] value
 *   [1] rolling mean of the prior window (value itself when there is no history)
 *   [2] rolling standard deviation of the prior window (0 with fewer than two prior days)
 *   [3] change from the previous calendar day (0 when that day is missing)
 *
 * The window is measured in calendar days, so gaps shrink it rather than reaching further back.
 */
public final class FeatureExtractor {

    public static final int FEATURE_COUNT = 4;

    public static final String[] FEATURE_NAMES = {
            "value",
            "rolling_mean",
            "rolling_std",
            "day_over_day_change"
    };

    private FeatureExtractor() {}

    /** Raw features, one row per observation. Observations must be finite and date-ordered. */
    public static double[][] extract(List<DailyObservation> observations, int windowDays) {
        double[][] rows = new double[observations.size()][FEATURE_COUNT];
        for (int i = 0; i < observations.size(); i++) {
            DailyObservation current = observations.get(i);
            LocalDate windowStart = current.getDate().minusDays(windowDays);

            double sum = 0, sumSq = 0;
            int count = 0;
            for (int j = i - 1; j >= 0; j--) {
                DailyObservation prior = observations.get(j);
                if (prior.getDate().isBefore(windowStart)) break;
                sum += prior.getValue();
                sumSq += prior.getValue() * prior.getValue();
                count++;
            }

            double value = current.getValue();
            double mean = count > 0 ? sum / count : value;
            double std = 0.0;
            if (count > 1) {
                double variance = (sumSq - count * mean * mean) / (count - 1);
                std = Math.sqrt(Math.max(0.0, variance));
            }

            double change = 0.0;
            if (i > 0) {
                DailyObservation previous = observations.get(i - 1);
                if (ChronoUnit.DAYS.between(previous.getDate(), current.getDate()) == 1) {
                    change = value - previous.getValue();
                }
            }

            rows[i][0] = value;
            rows[i][1] = mean;
            rows[i][2] = std;
            rows[i][3] = change;
        }
        return rows;
    }

    /** Standardizes every column in place to zero mean and unit variance. Constant columns become 0. */
    public static double[][] standardize(double[][] rows) {
        if (rows.length == 0) return rows;
        int columns = rows[0].length;
        for (int c = 0; c < columns; c++) {
            double[] column = new double[rows.length];
            for (int r = 0; r < rows.length; r++) column[r] = rows[r][c];
            double mean = new Mean().evaluate(column);
            double std = new StandardDeviation().evaluate(column);

            for (double[] row : rows) {
                row[c] = std > 0 ? (row[c] - mean) / std : 0.0;
            }
        }
        return rows;
    }
}
