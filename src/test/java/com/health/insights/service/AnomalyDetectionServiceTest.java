package com.health.insights.service;

import com.health.insights.config.DetectionConfig;
import com.health.insights.config.MetricsConfig;
import com.health.insights.engine.CancellationToken;
import com.health.insights.engine.DetectionOrchestrator;
import com.health.insights.engine.correlation.PopulationBaseline;
import com.health.insights.model.*;
import com.health.insights.repository.AnomalyResultRepository;
import com.health.insights.repository.CorrelationResultRepository;
import com.health.insights.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static com.health.insights.testutil.TestDataFactory.START;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AnomalyDetectionServiceTest {

    private static final String USER = "user-1";

    @Mock private DetectionOrchestrator orchestrator;
    @Mock private AnomalyResultRepository anomalyRepository;
    @Mock private CorrelationResultRepository correlationRepository;
    @Mock private ApplicationEventPublisher eventPublisher;
    @Mock private MetricsConfig metricsConfig;

    private final DetectionConfig config = TestDataFactory.defaultConfig();
    private AnomalyDetectionService service;

    @BeforeEach
    void setUp() {
        service = new AnomalyDetectionService(orchestrator, anomalyRepository, correlationRepository,
                new PopulationBaseline(correlationRepository), eventPublisher, config, metricsConfig);
    }

    private static DetectionRun run(RunStatus status, List<AnomalyResult> anomalies, List<MergedCorrelation> correlations) {
        return DetectionRun.builder()
                .runId("RUN-1")
                .userId(USER)
                .from(START)
                .to(START.plusDays(89))
                .baselineStrategy(BaselineStrategy.ADAPTIVE)
                .status(status)
                .anomalies(anomalies)
                .correlationResults(List.of())
                .correlations(correlations)
                .failures(List.of())
                .skipped(List.of())
                .startedAt(Instant.now())
                .completedAt(Instant.now())
                .build();
    }

    @Test
    void detect_completedRun_persistsAndReportsNewAnomalies() {
        List<AnomalyResult> anomalies = List.of(
                TestDataFactory.anomaly("resting_hr", START.plusDays(60), DetectorType.ZSCORE, 0.9),
                TestDataFactory.anomaly("hrv", START.plusDays(61), DetectorType.ISOLATION_FOREST, 0.7));
        List<MergedCorrelation> correlations = List.of(
                TestDataFactory.merged("exercise_minutes", "sleep_quality", true, 3, 0.7));
        DetectionRequest request = TestDataFactory.request();
        request.setIncludePopulationComparison(false);
        when(orchestrator.run(eq(USER), eq(request), eq(config), any(CancellationToken.class)))
                .thenReturn(run(RunStatus.COMPLETED, anomalies, correlations));
        when(anomalyRepository.saveAll(USER, "RUN-1", anomalies)).thenReturn(1);

        DetectionResult result = service.detect(USER, request);

        assertThat(result.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(result.getTotalAnomalies()).isEqualTo(2);
        assertThat(result.getNewAnomalies()).isEqualTo(1);
        assertThat(result.getCorrelations()).isEqualTo(correlations);
        verify(correlationRepository).saveAll(USER, "RUN-1", correlations);
        verify(metricsConfig).recordRun("COMPLETED", 2);
        verify(metricsConfig).recordAnomaly("ZSCORE", "HIGH");
        verify(metricsConfig).recordCorrelation("PEARSON", 3, true);
        verifyNoInteractions(eventPublisher);
    }

    @Test
    void detect_withExplanationRequested_publishesEvent() {
        List<AnomalyResult> anomalies = List.of(
                TestDataFactory.anomaly("resting_hr", START.plusDays(60), DetectorType.ZSCORE, 0.9));
        DetectionRequest request = TestDataFactory.request();
        request.setIncludeExplanation(true);
        when(orchestrator.run(eq(USER), eq(request), eq(config), any(CancellationToken.class)))
                .thenReturn(run(RunStatus.PARTIAL, anomalies, List.of()));
        when(anomalyRepository.saveAll(USER, "RUN-1", anomalies)).thenReturn(1);

        service.detect(USER, request);

        ArgumentCaptor<AnomalyExplanationRequestedEvent> captor =
                ArgumentCaptor.forClass(AnomalyExplanationRequestedEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        assertThat(captor.getValue().runId()).isEqualTo("RUN-1");
        assertThat(captor.getValue().anomalies()).isEqualTo(anomalies);
    }

    @Test
    void detect_failedRun_storesNothing() {
        DetectionRequest request = TestDataFactory.request();
        DetectionRun failed = DetectionRun.failed("RUN-2", USER, START, START.plusDays(89), "No data", Instant.now());
        when(orchestrator.run(eq(USER), eq(request), eq(config), any(CancellationToken.class))).thenReturn(failed);

        DetectionResult result = service.detect(USER, request);

        assertThat(result.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(result.getError()).isEqualTo("No data");
        assertThat(result.getNewAnomalies()).isZero();
        verifyNoInteractions(anomalyRepository, correlationRepository, eventPublisher);
    }

    @Test
    void detect_cancelledRun_storesNothing() {
        DetectionRequest request = TestDataFactory.request();
        CancellationToken token = new CancellationToken();
        when(orchestrator.run(USER, request, config, token)).thenReturn(run(RunStatus.CANCELLED, List.of(), List.of()));

        DetectionResult result = service.detect(USER, request, token);

        assertThat(result.getStatus()).isEqualTo(RunStatus.CANCELLED);
        verifyNoInteractions(anomalyRepository, correlationRepository);
    }

    @Test
    void detect_dropsCorrelationsBelowMinimumConfidence() {
        MergedCorrelation confident = TestDataFactory.merged("exercise_minutes", "sleep_quality", true, 3, 0.7);
        MergedCorrelation weak = TestDataFactory.merged("total_sugar_g", "hrv", false, 1, 0.29);
        DetectionRequest request = TestDataFactory.request();
        request.setIncludePopulationComparison(false);
        when(orchestrator.run(eq(USER), eq(request), eq(config), any(CancellationToken.class)))
                .thenReturn(run(RunStatus.COMPLETED, List.of(), List.of(confident, weak)));

        DetectionResult result = service.detect(USER, request);

        assertThat(result.getCorrelations()).containsExactly(confident);
        verify(correlationRepository).saveAll(USER, "RUN-1", List.of(confident));
        verify(metricsConfig, never()).recordCorrelation("PEARSON", 1, false);
    }

    @Test
    void detect_lowerMinimumConfidence_keepsWeakCorrelations() {
        MergedCorrelation weak = TestDataFactory.merged("total_sugar_g", "hrv", false, 1, 0.29);
        DetectionRequest request = TestDataFactory.request();
        request.setIncludePopulationComparison(false);
        request.setMinConfidence(0.0);
        when(orchestrator.run(eq(USER), eq(request), eq(config), any(CancellationToken.class)))
                .thenReturn(run(RunStatus.COMPLETED, List.of(), List.of(weak)));

        assertThat(service.detect(USER, request).getCorrelations()).containsExactly(weak);
    }

    @Test
    void detect_attachesPopulationComparisonBeforeStoring() {
        MergedCorrelation verdict = TestDataFactory.merged("exercise_minutes", "sleep_quality", true, 3, 0.7);
        DetectionRequest request = TestDataFactory.request();
        when(orchestrator.run(eq(USER), eq(request), eq(config), any(CancellationToken.class)))
                .thenReturn(run(RunStatus.COMPLETED, List.of(), List.of(verdict)));
        when(correlationRepository.findPeerStrengths(USER)).thenReturn(Map.of());

        DetectionResult result = service.detect(USER, request);

        assertThat(result.getCorrelations()).singleElement().satisfies(c -> {
            assertThat(c.getPopulation()).isNotNull();
            assertThat(c.getPopulation().isDefaultBaseline()).isTrue();
            assertThat(c.getPopulation().getMean()).isEqualTo(0.35);
        });
        verify(correlationRepository).saveAll(USER, "RUN-1", result.getCorrelations());
    }

    @Test
    void getSummary_countsBySeverityAndMetric() {
        when(anomalyRepository.findByUser(eq(USER), any(LocalDate.class), any(LocalDate.class), eq(Integer.MAX_VALUE)))
                .thenReturn(List.of(
                        TestDataFactory.anomaly("resting_hr", START, DetectorType.ZSCORE, 0.9),
                        TestDataFactory.anomaly("resting_hr", START.plusDays(1), DetectorType.ENSEMBLE, 0.6),
                        TestDataFactory.anomaly("hrv", START.plusDays(2), DetectorType.ZSCORE, 0.3)));

        AnomalySummary summary = service.getSummary(USER, 30);

        assertThat(summary.getDays()).isEqualTo(30);
        assertThat(summary.getTotal()).isEqualTo(3);
        assertThat(summary.getBySeverity())
                .containsEntry(Severity.HIGH, 1)
                .containsEntry(Severity.MEDIUM, 1)
                .containsEntry(Severity.LOW, 1);
        assertThat(summary.getByMetric()).containsEntry("resting_hr", 2).containsEntry("hrv", 1);
    }

    @Test
    void getAnomalies_delegatesToRepository() {
        List<AnomalyResult> stored = List.of(TestDataFactory.anomaly("hrv", START, DetectorType.ZSCORE, 0.9));
        when(anomalyRepository.findByUser(USER, START, START.plusDays(30), 20)).thenReturn(stored);

        assertThat(service.getAnomalies(USER, START, START.plusDays(30), 20)).isEqualTo(stored);
    }
}
