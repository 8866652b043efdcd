package com.health.insights.engine.features;

import com.health.insights.config.DetectionConfig;
import com.health.insights.model.DailyObservation;
import com.health.insights.model.MetricSeries;
import com.health.insights.model.UserSeriesSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Computes series derived from a user's raw metrics and adds them to the snapshot.
 *
 * <ul>
 *   <li>{@code protein_ratio}: share of calories from protein, protein * 4 / calories, on days with calories above 0</li>
 *   <li>{@code <metric>_7d_avg}: trailing mean over the rolling window of calendar days, ending on the day itself</li>
 *   <li>{@code <metric>_deviation}: the day's value minus its trailing mean</li>
 *   <li>{@code weight_change_7d}: weight minus the latest weight at least seven days earlier</li>
 *   <li>{@code bp_mean}: mean arterial pressure, (systolic + 2 * diastolic) / 3</li>
 * </ul>
 *
 * A derived value exists only on days its inputs were observed. Each one points at the raw
 * record of its primary input. Raw metrics that already carry a derived name are kept as they are.
 */
@Component
public class DerivedMetrics {

    private static final Logger log = LoggerFactory.getLogger(DerivedMetrics.class);

    public static final String PROTEIN_RATIO = "protein_ratio";
    public static final String WEIGHT_CHANGE_7D = "weight_change_7d";
    public static final String BP_MEAN = "bp_mean";

    private static final int WEIGHT_CHANGE_DAYS = 7;

    public UserSeriesSnapshot enrich(UserSeriesSnapshot snapshot, DetectionConfig config) {
        DetectionConfig.Derived settings = config.getDerived();
        if (!settings.isEnabled()) {
            return snapshot;
        }

        Map<String, MetricSeries> derived = new LinkedHashMap<>();
        put(derived, PROTEIN_RATIO, combine(snapshot, "total_protein_g", "total_calories",
                (protein, calories) -> calories > 0 ? protein * 4.0 / calories : Double.NaN));
        put(derived, BP_MEAN, combine(snapshot, "bp_systolic", "bp_diastolic",
                (systolic, diastolic) -> (systolic + 2.0 * diastolic) / 3.0));
        snapshot.get("weight_kg").ifPresent(weight -> put(derived, WEIGHT_CHANGE_7D, weightChange(weight)));

        for (String metric : settings.getRollingMetrics()) {
            snapshot.get(metric).ifPresent(series -> {
                List<DailyObservation> averages = new ArrayList<>();
                List<DailyObservation> deviations = new ArrayList<>();
                rolling(series, settings.getRollingWindowDays(), averages, deviations);
                put(derived, rollingAverageName(metric, settings), averages);
                put(derived, deviationName(metric), deviations);
            });
        }

        Map<String, MetricSeries> all = new LinkedHashMap<>(snapshot.getSeries());
        derived.forEach(all::putIfAbsent);
        log.debug("Derived {} series for user {}", derived.size(), snapshot.getUserId());
        return UserSeriesSnapshot.of(snapshot.getUserId(), snapshot.getFrom(), snapshot.getTo(), all);
    }

    /** Names of every series this component can produce under the given settings. */
    public Set<String> derivedNames(DetectionConfig config) {
        DetectionConfig.Derived settings = config.getDerived();
        Set<String> names = new LinkedHashSet<>(List.of(PROTEIN_RATIO, WEIGHT_CHANGE_7D, BP_MEAN));
        for (String metric : settings.getRollingMetrics()) {
            names.add(rollingAverageName(metric, settings));
            names.add(deviationName(metric));
        }
        return names;
    }

    /** Raw metrics and the derived series listed as anomaly metrics are eligible for anomaly detection. */
    public boolean isAnomalyEligible(String metric, DetectionConfig config) {
        return !config.getDerived().isEnabled()
                || !derivedNames(config).contains(metric)
                || config.getDerived().getAnomalyMetrics().contains(metric);
    }

    static String rollingAverageName(String metric, DetectionConfig.Derived settings) {
        return metric + "_" + settings.getRollingWindowDays() + "d_avg";
    }

    static String deviationName(String metric) {
        return metric + "_deviation";
    }

    // Trailing mean over [day - window + 1, day] of the finite values present in that range.
    static void rolling(MetricSeries series, int windowDays,
                        List<DailyObservation> averages, List<DailyObservation> deviations) {
        List<DailyObservation> observations = series.finiteObservations();
        for (int i = 0; i < observations.size(); i++) {
            DailyObservation current = observations.get(i);
            LocalDate windowStart = current.getDate().minusDays(windowDays - 1L);
            double sum = 0.0;
            int count = 0;
            for (int j = i; j >= 0 && !observations.get(j).getDate().isBefore(windowStart); j--) {
                sum += observations.get(j).getValue();
                count++;
            }
            double average = sum / count;
            averages.add(derivedFrom(current, average));
            deviations.add(derivedFrom(current, current.getValue() - average));
        }
    }

    static List<DailyObservation> weightChange(MetricSeries weight) {
        TreeMap<LocalDate, DailyObservation> byDate = new TreeMap<>();
        for (DailyObservation o : weight.finiteObservations()) {
            byDate.put(o.getDate(), o);
        }
        List<DailyObservation> changes = new ArrayList<>();
        for (DailyObservation current : byDate.values()) {
            Map.Entry<LocalDate, DailyObservation> earlier =
                    byDate.floorEntry(current.getDate().minusDays(WEIGHT_CHANGE_DAYS));
            if (earlier != null) {
                changes.add(derivedFrom(current, current.getValue() - earlier.getValue().getValue()));
            }
        }
        return changes;
    }

    private static List<DailyObservation> combine(UserSeriesSnapshot snapshot, String primary, String secondary, Formula formula) {
        MetricSeries first = snapshot.get(primary).orElse(null);
        MetricSeries second = snapshot.get(secondary).orElse(null);
        if (first == null || second == null) {
            return List.of();
        }
        Map<LocalDate, Double> others = second.valuesByDate();
        List<DailyObservation> values = new ArrayList<>();
        for (DailyObservation o : first.finiteObservations()) {
            Double other = others.get(o.getDate());
            if (other == null) continue;
            double value = formula.apply(o.getValue(), other);
            if (Double.isFinite(value)) {
                values.add(derivedFrom(o, value));
            }
        }
        return values;
    }

    private static void put(Map<String, MetricSeries> derived, String name, List<DailyObservation> values) {
        if (!values.isEmpty()) {
            derived.put(name, MetricSeries.of(name, values));
        }
    }

    private static DailyObservation derivedFrom(DailyObservation source, double value) {
        return DailyObservation.builder()
                .date(source.getDate())
                .value(value)
                .sourceTable(source.getSourceTable())
                .sourceId(source.getSourceId())
                .build();
    }

    @FunctionalInterface
    private interface Formula {
        double apply(double primary, double secondary);
    }
}
