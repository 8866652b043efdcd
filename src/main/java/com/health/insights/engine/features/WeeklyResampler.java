package com.health.insights.engine.features;

import com.health.insights.model.DailyObservation;
import com.health.insights.model.MetricSeries;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Collapses a daily series into weekly means. Weeks start on Monday and each weekly
 * value is dated on its Monday. Weeks with fewer than {@code minDaysPerWeek} finite
 * days are dropped rather than averaged over a few days.
 */
public final class WeeklyResampler {

    private WeeklyResampler() {}

    public static MetricSeries resample(MetricSeries daily, int minDaysPerWeek) {
        Map<LocalDate, List<DailyObservation>> byWeek = new TreeMap<>();
        for (DailyObservation o : daily.finiteObservations()) {
            byWeek.computeIfAbsent(weekStart(o.getDate()), w -> new ArrayList<>()).add(o);
        }

        List<DailyObservation> weekly = new ArrayList<>();
        for (Map.Entry<LocalDate, List<DailyObservation>> week : byWeek.entrySet()) {
            List<DailyObservation> days = week.getValue();
            if (days.size() < minDaysPerWeek) continue;
            double mean = days.stream().mapToDouble(DailyObservation::getValue).average().orElse(Double.NaN);
            weekly.add(DailyObservation.builder()
                    .date(week.getKey())
                    .value(mean)
                    .sourceTable(days.get(0).getSourceTable())
                    .build());
        }
        return MetricSeries.of(daily.getMetricName(), weekly);
    }

    public static LocalDate weekStart(LocalDate date) {
        return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }
}
