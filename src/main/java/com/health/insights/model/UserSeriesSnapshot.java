package com.health.insights.model;

import lombok.Value;

import java.time.LocalDate;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Read-only view of all of a user's metric series for one detection window.
 * Metrics are kept in name order so that runs iterate deterministically.
 */
@Value
public class UserSeriesSnapshot {

    String userId;
    LocalDate from;
    LocalDate to;
    Map<String, MetricSeries> series;

    public static UserSeriesSnapshot of(String userId, LocalDate from, LocalDate to,
                                        Map<String, MetricSeries> series) {
        return new UserSeriesSnapshot(userId, from, to, Collections.unmodifiableMap(new TreeMap<>(series)));
    }

    public Set<String> metricNames() {
        return series.keySet();
    }

    public Optional<MetricSeries> get(String metricName) {
        return Optional.ofNullable(series.get(metricName));
    }

    public boolean isEmpty() {
        return series.values().stream().allMatch(MetricSeries::isEmpty);
    }
}
