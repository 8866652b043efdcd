package com.health.insights.engine.correlation;

import com.health.insights.config.DetectionConfig;
import com.health.insights.engine.CorrelationDetector;
import com.health.insights.model.CorrelationResult;
import com.health.insights.model.CorrelationType;
import com.health.insights.model.MetricSeries;
import com.health.insights.model.StatisticalConfidence;
import org.apache.commons.math3.special.Gamma;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Non-linear dependence via the Kraskov-Stoegbauer-Grassberger k-nearest-neighbour
 * mutual information estimator (algorithm 1, max-norm):
 * I = psi(k) + psi(N) - mean(psi(n_x + 1) + psi(n_y + 1)).
 *
 * MI in nats is mapped to the information coefficient of correlation sqrt(1 - e^(-2I)),
 * which equals |r| for bivariate normal data. There is no closed-form test, so the
 * confidence is reported as unsupported.
 */
@Component
public class MutualInformationDetector implements CorrelationDetector {

    // Breaks ties between identical values without moving any real distance
    private static final double JITTER = 1e-10;

    @Override
    public String getName() {
        return "MUTUAL_INFORMATION";
    }

    @Override
    public Set<CorrelationType> getCorrelationTypes() {
        return EnumSet.of(CorrelationType.MUTUAL_INFORMATION);
    }

    @Override
    public List<CorrelationResult> detect(MetricSeries seriesA, MetricSeries seriesB, DetectionConfig config) {
        DetectionConfig.MutualInformation settings = config.getMutualInformation();
        AlignedPair pair = PairAligner.align(seriesA, seriesB);
        int k = settings.getNeighbors();
        if (pair.size() < settings.getMinSamples() || pair.size() <= k) {
            return List.of();
        }

        Random random = new Random(settings.getJitterSeed());
        double[] x = standardize(pair.a(), random);
        double[] y = standardize(pair.b(), random);
        if (x == null || y == null) {
            return List.of();
        }

        double mi = estimate(x, y, k);
        double coefficient = Math.sqrt(1.0 - Math.exp(-2.0 * mi));

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("mutual_information_nats", mi);
        details.put("neighbors", k);

        return List.of(CorrelationResult.builder()
                .metricA(seriesA.getMetricName())
                .metricB(seriesB.getMetricName())
                .correlationType(CorrelationType.MUTUAL_INFORMATION)
                .strength(coefficient)
                .lagDays(0)
                .confidence(StatisticalConfidence.unsupported())
                .sampleSize(pair.size())
                .significant(coefficient >= settings.getMinCoefficient())
                .details(details)
                .build());
    }

    /** KSG estimate in nats, floored at 0. */
    static double estimate(double[] x, double[] y, int k) {
        int n = x.length;
        double[] distances = new double[n - 1];
        double sum = 0.0;
        for (int i = 0; i < n; i++) {
            int idx = 0;
            for (int j = 0; j < n; j++) {
                if (j == i) continue;
                distances[idx++] = Math.max(Math.abs(x[i] - x[j]), Math.abs(y[i] - y[j]));
            }
            Arrays.sort(distances);
            double epsilon = distances[k - 1];

            int nx = 0, ny = 0;
            for (int j = 0; j < n; j++) {
                if (j == i) continue;
                if (Math.abs(x[i] - x[j]) < epsilon) nx++;
                if (Math.abs(y[i] - y[j]) < epsilon) ny++;
            }
            sum += Gamma.digamma(nx + 1) + Gamma.digamma(ny + 1);
        }
        double mi = Gamma.digamma(k) + Gamma.digamma(n) - sum / n;
        return Math.max(0.0, mi);
    }

    private static double[] standardize(double[] values, Random random) {
        double mean = new Mean().evaluate(values);
        double std = new StandardDeviation().evaluate(values);
        if (std == 0.0) {
            return null;
        }
        double[] standardized = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            standardized[i] = (values[i] - mean) / std + JITTER * random.nextGaussian();
        }
        return standardized;
    }
}
