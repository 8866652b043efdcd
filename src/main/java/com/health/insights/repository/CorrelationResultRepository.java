package com.health.insights.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.health.insights.config.AerospikeConfig;
import com.health.insights.model.CorrelationType;
import com.health.insights.model.Granularity;
import com.health.insights.model.MergedCorrelation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Stores the latest correlation verdict per (user, metric pair, granularity). A newer run
 * replaces the previous verdict for the same pair and granularity.
 */
@Repository
public class CorrelationResultRepository {

    private static final Logger log = LoggerFactory.getLogger(CorrelationResultRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final ObjectMapper objectMapper;

    public CorrelationResultRepository(AerospikeClient client,
                                       @Qualifier("aerospikeNamespace") String namespace,
                                       @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.objectMapper = new ObjectMapper();
    }

    public int saveAll(String userId, String runId, List<MergedCorrelation> correlations) {
        for (MergedCorrelation correlation : correlations) {
            Key key = new Key(namespace, AerospikeConfig.SET_CORRELATIONS, recordKey(userId, correlation));
            client.put(writePolicy, key,
                    new Bin("userId", userId),
                    new Bin("runId", runId),
                    new Bin("metricA", correlation.getMetricA()),
                    new Bin("metricB", correlation.getMetricB()),
                    new Bin("leadType", correlation.getLeadType().name()),
                    new Bin("granularity", correlation.getGranularity().name()),
                    new Bin("strength", correlation.getStrength()),
                    new Bin("actionable", correlation.isActionable()),
                    new Bin("compositeConf", correlation.getCompositeConfidence()),
                    new Bin("updatedAt", System.currentTimeMillis()),
                    new Bin("verdict", serialize(correlation)));
        }
        log.debug("Stored {} correlation verdicts for user {}", correlations.size(), userId);
        return correlations.size();
    }

    public List<MergedCorrelation> findByUser(String userId, boolean actionableOnly) {
        List<MergedCorrelation> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_CORRELATIONS,
                (key, record) -> {
                    if (!userId.equals(record.getString("userId"))) return;
                    if (actionableOnly && !record.getBoolean("actionable")) return;
                    MergedCorrelation verdict = deserialize(record);
                    if (verdict == null) return;
                    synchronized (results) {
                        results.add(verdict);
                    }
                });
        return results;
    }

    /**
     * Lead strengths of every other user's stored verdicts, grouped by
     * {@link #peerKey(String, String, CorrelationType, Granularity)}.
     */
    public Map<String, List<Double>> findPeerStrengths(String excludeUserId) {
        Map<String, List<Double>> strengths = new HashMap<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_CORRELATIONS,
                (key, record) -> {
                    if (excludeUserId.equals(record.getString("userId"))) return;
                    Object strength = record.getValue("strength");
                    String leadType = record.getString("leadType");
                    if (!(strength instanceof Number) || leadType == null) return;
                    String granularity = record.getString("granularity");
                    String peerKey = peerKey(record.getString("metricA"), record.getString("metricB"),
                            CorrelationType.valueOf(leadType),
                            granularity != null ? Granularity.valueOf(granularity) : Granularity.DAILY);
                    synchronized (strengths) {
                        strengths.computeIfAbsent(peerKey, k -> new ArrayList<>()).add(((Number) strength).doubleValue());
                    }
                });
        return strengths;
    }

    public static String peerKey(String metricA, String metricB, CorrelationType leadType, Granularity granularity) {
        return metricA + "|" + metricB + "|" + leadType + "|" + granularity;
    }

    static String recordKey(String userId, MergedCorrelation correlation) {
        String key = userId + "|" + correlation.getMetricA() + "|" + correlation.getMetricB();
        return correlation.getGranularity() == Granularity.DAILY ? key : key + "|" + correlation.getGranularity();
    }

    private String serialize(MergedCorrelation correlation) {
        try {
            return objectMapper.writeValueAsString(correlation);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to serialize correlation "
                    + correlation.getMetricA() + "/" + correlation.getMetricB(), e);
        }
    }

    private MergedCorrelation deserialize(Record record) {
        String json = record.getString("verdict");
        if (json == null || json.isEmpty()) return null;
        try {
            return objectMapper.readValue(json, MergedCorrelation.class);
        } catch (Exception e) {
            log.error("Failed to deserialize stored correlation", e);
            return null;
        }
    }
}
