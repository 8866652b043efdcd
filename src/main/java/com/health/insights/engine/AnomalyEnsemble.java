package com.health.insights.engine;

import com.health.insights.model.AnomalyResult;
import com.health.insights.model.DetectorType;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Combines the per-detector anomalies of a run. When the Z-score and isolation forest
 * detectors both flag the same day of the same metric, an additional ENSEMBLE result is
 * emitted with score 0.4 * z + 0.6 * iforest. The per-detector results are kept.
 */
@Component
public class AnomalyEnsemble {

    static final double ZSCORE_WEIGHT = 0.4;
    static final double ISOLATION_FOREST_WEIGHT = 0.6;

    /** Most severe first, then highest score, most recent, metric name and detector. */
    public static final Comparator<AnomalyResult> RANK_ORDER = Comparator
            .comparing(AnomalyResult::getSeverity).reversed()
            .thenComparing(Comparator.comparingDouble(AnomalyResult::getAnomalyScore).reversed())
            .thenComparing(Comparator.comparing(AnomalyResult::getOccurredOn).reversed())
            .thenComparing(AnomalyResult::getMetricName)
            .thenComparing(AnomalyResult::getDetectorType);

    public List<AnomalyResult> combine(List<AnomalyResult> anomalies, int maxAnomalies) {
        Map<String, AnomalyResult> zscore = new LinkedHashMap<>();
        Map<String, AnomalyResult> isolation = new LinkedHashMap<>();
        for (AnomalyResult a : anomalies) {
            if (a.getDetectorType() == DetectorType.ZSCORE) {
                zscore.put(key(a.getMetricName(), a.getOccurredOn()), a);
            } else if (a.getDetectorType() == DetectorType.ISOLATION_FOREST) {
                isolation.put(key(a.getMetricName(), a.getOccurredOn()), a);
            }
        }

        List<AnomalyResult> combined = new ArrayList<>(anomalies);
        for (Map.Entry<String, AnomalyResult> entry : zscore.entrySet()) {
            AnomalyResult forest = isolation.get(entry.getKey());
            if (forest != null) {
                combined.add(merge(entry.getValue(), forest));
            }
        }

        combined.sort(RANK_ORDER);
        return combined.size() > maxAnomalies ? new ArrayList<>(combined.subList(0, maxAnomalies)) : combined;
    }

    private AnomalyResult merge(AnomalyResult z, AnomalyResult forest) {
        double score = ZSCORE_WEIGHT * z.getAnomalyScore() + ISOLATION_FOREST_WEIGHT * forest.getAnomalyScore();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("detection_agreement", List.of(DetectorType.ZSCORE.name(), DetectorType.ISOLATION_FOREST.name()));
        details.put("zscore_score", z.getAnomalyScore());
        details.put("isolation_forest_score", forest.getAnomalyScore());
        details.put("z_score", z.getDetails().get("z_score"));
        details.put("isolation_score", forest.getDetails().get("isolation_score"));

        return AnomalyResult.scored(score)
                .occurredOn(z.getOccurredOn())
                .sourceTable(z.getSourceTable())
                .sourceId(z.getSourceId())
                .metricName(z.getMetricName())
                .metricValue(z.getMetricValue())
                .baselineValue(z.getBaselineValue())
                .detectorType(DetectorType.ENSEMBLE)
                .details(details)
                .build();
    }

    private static String key(String metric, LocalDate date) {
        return metric + "|" + date;
    }
}
