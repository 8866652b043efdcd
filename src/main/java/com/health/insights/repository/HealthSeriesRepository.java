package com.health.insights.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.health.insights.config.AerospikeConfig;
import com.health.insights.engine.SourceUnavailableException;
import com.health.insights.model.DailyObservation;
import com.health.insights.model.MetricSeries;
import com.health.insights.model.UserSeriesSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only access to the per-user daily metric records maintained by the ingestion side.
 * One record per (user, metric, day) with bins userId, metric, date (ISO), value,
 * sourceTable and sourceId.
 */
@Repository
public class HealthSeriesRepository {

    private static final Logger log = LoggerFactory.getLogger(HealthSeriesRepository.class);

    private final AerospikeClient client;
    private final String namespace;

    public HealthSeriesRepository(AerospikeClient client,
                                  @Qualifier("aerospikeNamespace") String namespace) {
        this.client = client;
        this.namespace = namespace;
    }

    /**
     * Loads every metric series of the user within [from, to]. Missing days stay missing.
     *
     * @throws SourceUnavailableException when the store cannot be read
     */
    public UserSeriesSnapshot findSeries(String userId, LocalDate from, LocalDate to) {
        Map<String, List<DailyObservation>> byMetric = new HashMap<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        try {
            client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_DAILY_METRICS,
                    (key, record) -> {
                        if (!userId.equals(record.getString("userId"))) return;
                        DailyObservation observation = mapRecord(record);
                        if (observation == null
                                || observation.getDate().isBefore(from) || observation.getDate().isAfter(to)) {
                            return;
                        }
                        synchronized (byMetric) {
                            byMetric.computeIfAbsent(record.getString("metric"), m -> new ArrayList<>())
                                    .add(observation);
                        }
                    });
        } catch (AerospikeException e) {
            throw new SourceUnavailableException("Failed to read daily metrics for user " + userId, e);
        }

        Map<String, MetricSeries> series = new HashMap<>();
        byMetric.forEach((metric, observations) -> series.put(metric, MetricSeries.of(metric, observations)));
        log.debug("Loaded {} metric series for user {} between {} and {}", series.size(), userId, from, to);
        return UserSeriesSnapshot.of(userId, from, to, series);
    }

    // Records without a date or a numeric value are gaps, not zeros
    private DailyObservation mapRecord(Record record) {
        String date = record.getString("date");
        Object value = record.getValue("value");
        if (date == null || !(value instanceof Number)) {
            return null;
        }
        try {
            return DailyObservation.builder()
                    .date(LocalDate.parse(date))
                    .value(((Number) value).doubleValue())
                    .sourceTable(record.getString("sourceTable"))
                    .sourceId(record.getString("sourceId"))
                    .build();
        } catch (DateTimeParseException e) {
            log.warn("Skipping daily metric record with malformed date '{}'", date);
            return null;
        }
    }
}
