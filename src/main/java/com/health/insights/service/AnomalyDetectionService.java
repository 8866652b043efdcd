package com.health.insights.service;

import com.health.insights.config.DetectionConfig;
import com.health.insights.config.MetricsConfig;
import com.health.insights.engine.CancellationToken;
import com.health.insights.engine.DetectionOrchestrator;
import com.health.insights.engine.correlation.PopulationBaseline;
import com.health.insights.model.AnomalyResult;
import com.health.insights.model.AnomalySummary;
import com.health.insights.model.DetectionRequest;
import com.health.insights.model.DetectionResult;
import com.health.insights.model.DetectionRun;
import com.health.insights.model.MergedCorrelation;
import com.health.insights.model.RunStatus;
import com.health.insights.model.Severity;
import com.health.insights.repository.AnomalyResultRepository;
import com.health.insights.repository.CorrelationResultRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Service
public class AnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

    private final DetectionOrchestrator orchestrator;
    private final AnomalyResultRepository anomalyRepository;
    private final CorrelationResultRepository correlationRepository;
    private final PopulationBaseline populationBaseline;
    private final ApplicationEventPublisher eventPublisher;
    private final DetectionConfig config;
    private final MetricsConfig metricsConfig;

    public AnomalyDetectionService(DetectionOrchestrator orchestrator,
                                   AnomalyResultRepository anomalyRepository,
                                   CorrelationResultRepository correlationRepository,
                                   PopulationBaseline populationBaseline,
                                   ApplicationEventPublisher eventPublisher,
                                   DetectionConfig config,
                                   MetricsConfig metricsConfig) {
        this.orchestrator = orchestrator;
        this.anomalyRepository = anomalyRepository;
        this.correlationRepository = correlationRepository;
        this.populationBaseline = populationBaseline;
        this.eventPublisher = eventPublisher;
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    public DetectionResult detect(String userId, DetectionRequest request) {
        return detect(userId, request, CancellationToken.none());
    }

    /**
     * Runs detection and stores the outcome. Results of failed or cancelled runs are not stored.
     * Correlation verdicts below the request's minimum confidence are dropped before they are
     * compared with the population and stored.
     */
    @Observed(name = "detection.run", contextualName = "detect-anomalies")
    public DetectionResult detect(String userId, DetectionRequest request, CancellationToken token) {
        DetectionRun run = orchestrator.run(userId, request, config, token);
        metricsConfig.recordRun(run.getStatus().name(), run.getAnomalies().size());

        int newAnomalies = 0;
        List<MergedCorrelation> correlations = run.getCorrelations();
        if (run.getStatus() == RunStatus.COMPLETED || run.getStatus() == RunStatus.PARTIAL) {
            correlations = correlations.stream()
                    .filter(c -> c.getCompositeConfidence() >= request.getMinConfidence())
                    .toList();
            if (request.isIncludePopulationComparison()) {
                correlations = populationBaseline.compare(userId, correlations, config);
            }

            newAnomalies = anomalyRepository.saveAll(userId, run.getRunId(), run.getAnomalies());
            correlationRepository.saveAll(userId, run.getRunId(), correlations);

            for (AnomalyResult anomaly : run.getAnomalies()) {
                metricsConfig.recordAnomaly(anomaly.getDetectorType().name(), anomaly.getSeverity().name());
            }
            for (MergedCorrelation correlation : correlations) {
                metricsConfig.recordCorrelation(correlation.getLeadType().name(),
                        correlation.getAgreement(), correlation.isActionable());
            }

            if (request.isIncludeExplanation() && !run.getAnomalies().isEmpty()) {
                eventPublisher.publishEvent(
                        new AnomalyExplanationRequestedEvent(userId, run.getRunId(), run.getAnomalies()));
            }
            log.info("Run {} for user {}: {} anomalies ({} new), {} correlations",
                    run.getRunId(), userId, run.getAnomalies().size(), newAnomalies, correlations.size());
        }

        return DetectionResult.builder()
                .runId(run.getRunId())
                .userId(userId)
                .status(run.getStatus())
                .totalAnomalies(run.getAnomalies().size())
                .newAnomalies(newAnomalies)
                .anomalies(run.getAnomalies())
                .correlations(correlations)
                .failures(run.getFailures())
                .skipped(run.getSkipped())
                .error(run.getError())
                .build();
    }

    public List<AnomalyResult> getAnomalies(String userId, LocalDate from, LocalDate to, int limit) {
        return anomalyRepository.findByUser(userId, from, to, limit);
    }

    public AnomalySummary getSummary(String userId, int days) {
        LocalDate to = LocalDate.now();
        List<AnomalyResult> anomalies = anomalyRepository.findByUser(userId, to.minusDays(days), to, Integer.MAX_VALUE);

        Map<Severity, Integer> bySeverity = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            bySeverity.put(severity, 0);
        }
        Map<String, Integer> byMetric = new TreeMap<>();
        for (AnomalyResult anomaly : anomalies) {
            bySeverity.merge(anomaly.getSeverity(), 1, Integer::sum);
            byMetric.merge(anomaly.getMetricName(), 1, Integer::sum);
        }

        return AnomalySummary.builder()
                .days(days)
                .total(anomalies.size())
                .bySeverity(bySeverity)
                .byMetric(byMetric)
                .build();
    }
}
