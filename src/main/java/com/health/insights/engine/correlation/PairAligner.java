package com.health.insights.engine.correlation;

import com.health.insights.model.MetricSeries;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Pairs two series by calendar date. Days missing or non-finite in either series are dropped.
 */
public final class PairAligner {

    private PairAligner() {}

    public static AlignedPair align(MetricSeries seriesA, MetricSeries seriesB) {
        return align(seriesA, seriesB, 0);
    }

    /**
     * Pairs A on day d with B on day d + lag. A positive lag means B trails A.
     */
    public static AlignedPair align(MetricSeries seriesA, MetricSeries seriesB, int lag) {
        return align(seriesA.valuesByDate(), seriesB.valuesByDate(), lag);
    }

    static AlignedPair align(Map<LocalDate, Double> a, Map<LocalDate, Double> b, int lag) {
        List<double[]> pairs = new ArrayList<>();
        for (Map.Entry<LocalDate, Double> entry : a.entrySet()) {
            Double other = b.get(entry.getKey().plusDays(lag));
            if (other != null) {
                pairs.add(new double[]{entry.getValue(), other});
            }
        }
        double[] x = new double[pairs.size()];
        double[] y = new double[pairs.size()];
        for (int i = 0; i < pairs.size(); i++) {
            x[i] = pairs.get(i)[0];
            y[i] = pairs.get(i)[1];
        }
        return new AlignedPair(x, y);
    }
}
