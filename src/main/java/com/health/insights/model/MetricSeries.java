package com.health.insights.model;

import lombok.Value;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Date-ordered daily values of one metric. Missing days are simply absent,
 * never filled with zero. When a date appears twice the first observation wins.
 */
@Value
public class MetricSeries {

    String metricName;
    List<DailyObservation> observations;

    public static MetricSeries of(String metricName, List<DailyObservation> observations) {
        Map<LocalDate, DailyObservation> byDate = new LinkedHashMap<>();
        observations.stream()
                .sorted(Comparator.comparing(DailyObservation::getDate))
                .forEach(o -> byDate.putIfAbsent(o.getDate(), o));
        return new MetricSeries(metricName, Collections.unmodifiableList(new ArrayList<>(byDate.values())));
    }

    public int size() {
        return observations.size();
    }

    public boolean isEmpty() {
        return observations.isEmpty();
    }

    /** Observations whose value is a finite number. */
    public List<DailyObservation> finiteObservations() {
        return observations.stream().filter(DailyObservation::isFinite).toList();
    }

    /** Finite values keyed by date, in date order. */
    public Map<LocalDate, Double> valuesByDate() {
        Map<LocalDate, Double> values = new LinkedHashMap<>();
        for (DailyObservation o : observations) {
            if (o.isFinite()) {
                values.put(o.getDate(), o.getValue());
            }
        }
        return values;
    }
}
