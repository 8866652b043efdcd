package com.health.insights.engine.correlation;

import com.health.insights.engine.NumericDegeneracyException;
import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.correlation.SpearmansCorrelation;
import org.apache.commons.math3.stat.descriptive.moment.Variance;

/**
 * Correlation coefficients and their two-sided t-test p-values.
 */
final class CorrelationStatistics {

    private CorrelationStatistics() {}

    static double pearson(double[] x, double[] y) {
        requireVariance(x, y);
        return checked(new PearsonsCorrelation().correlation(x, y));
    }

    static double spearman(double[] x, double[] y) {
        requireVariance(x, y);
        return checked(new SpearmansCorrelation().correlation(x, y));
    }

    /** p-value of H0: rho = 0, using t = r * sqrt((n - 2) / (1 - r^2)) with n - 2 degrees of freedom. */
    static double pValue(double r, int n) {
        if (n < 3) return 1.0;
        double rSquared = r * r;
        if (rSquared >= 1.0) return 0.0;
        double t = Math.abs(r) * Math.sqrt((n - 2) / (1.0 - rSquared));
        TDistribution distribution = new TDistribution(n - 2);
        return Math.min(1.0, 2.0 * (1.0 - distribution.cumulativeProbability(t)));
    }

    private static void requireVariance(double[] x, double[] y) {
        Variance variance = new Variance();
        if (variance.evaluate(x) == 0.0 || variance.evaluate(y) == 0.0) {
            throw new NumericDegeneracyException("Correlation undefined for a constant series");
        }
    }

    private static double checked(double r) {
        if (Double.isNaN(r)) {
            throw new NumericDegeneracyException("Correlation coefficient is undefined");
        }
        return Math.max(-1.0, Math.min(1.0, r));
    }
}
