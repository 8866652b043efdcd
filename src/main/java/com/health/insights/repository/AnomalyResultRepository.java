package com.health.insights.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.health.insights.config.AerospikeConfig;
import com.health.insights.model.AnomalyResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Stores anomalies keyed by (user, date, metric, detector), so re-running detection over
 * the same window never duplicates a stored anomaly.
 */
@Repository
public class AnomalyResultRepository {

    private static final Logger log = LoggerFactory.getLogger(AnomalyResultRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public AnomalyResultRepository(AerospikeClient client,
                                   @Qualifier("aerospikeNamespace") String namespace,
                                   @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                   @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Saves anomalies not stored before.
     *
     * @return the number of anomalies that were new
     */
    public int saveAll(String userId, String runId, List<AnomalyResult> anomalies) {
        int created = 0;
        for (AnomalyResult anomaly : anomalies) {
            Key key = new Key(namespace, AerospikeConfig.SET_ANOMALIES, dedupKey(userId, anomaly));
            if (client.exists(readPolicy, key)) {
                continue;
            }
            client.put(writePolicy, key,
                    new Bin("userId", userId),
                    new Bin("runId", runId),
                    new Bin("occurredOn", anomaly.getOccurredOn().toString()),
                    new Bin("metricName", anomaly.getMetricName()),
                    new Bin("detectorType", anomaly.getDetectorType().name()),
                    new Bin("severity", anomaly.getSeverity().name()),
                    new Bin("anomalyScore", anomaly.getAnomalyScore()),
                    new Bin("detectedAt", System.currentTimeMillis()),
                    new Bin("result", serialize(anomaly)));
            created++;
        }
        log.debug("Stored {} new of {} anomalies for user {}", created, anomalies.size(), userId);
        return created;
    }

    /** Anomalies of the user with occurredOn in [from, to], most recent first. */
    public List<AnomalyResult> findByUser(String userId, LocalDate from, LocalDate to, int limit) {
        List<AnomalyResult> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ANOMALIES,
                (key, record) -> {
                    if (!userId.equals(record.getString("userId"))) return;
                    AnomalyResult anomaly = deserialize(record);
                    if (anomaly == null) return;
                    LocalDate day = anomaly.getOccurredOn();
                    if ((from != null && day.isBefore(from)) || (to != null && day.isAfter(to))) return;
                    synchronized (results) {
                        results.add(anomaly);
                    }
                });

        results.sort(Comparator.comparing(AnomalyResult::getOccurredOn).reversed()
                .thenComparing(AnomalyResult::getMetricName)
                .thenComparing(AnomalyResult::getDetectorType));
        if (results.size() > limit) {
            return results.subList(0, limit);
        }
        return results;
    }

    static String dedupKey(String userId, AnomalyResult anomaly) {
        return userId + "|" + anomaly.getOccurredOn() + "|" + anomaly.getMetricName() + "|" + anomaly.getDetectorType();
    }

    private String serialize(AnomalyResult anomaly) {
        try {
            return objectMapper.writeValueAsString(anomaly);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to serialize anomaly " + anomaly.getMetricName()
                    + " on " + anomaly.getOccurredOn(), e);
        }
    }

    private AnomalyResult deserialize(Record record) {
        String json = record.getString("result");
        if (json == null || json.isEmpty()) return null;
        try {
            return objectMapper.readValue(json, AnomalyResult.class);
        } catch (Exception e) {
            log.error("Failed to deserialize stored anomaly", e);
            return null;
        }
    }
}
