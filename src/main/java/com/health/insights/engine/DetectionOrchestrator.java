package com.health.insights.engine;

import com.health.insights.config.DetectionConfig;
import com.health.insights.config.MetricsConfig;
import com.health.insights.engine.correlation.CorrelationAggregator;
import com.health.insights.engine.correlation.MetricPairSelector;
import com.health.insights.engine.features.DerivedMetrics;
import com.health.insights.model.AnomalyResult;
import com.health.insights.model.BaselineStrategy;
import com.health.insights.model.CorrelationResult;
import com.health.insights.model.DetectionRequest;
import com.health.insights.model.DetectionRun;
import com.health.insights.model.DetectorFailure;
import com.health.insights.model.DetectorType;
import com.health.insights.model.MergedCorrelation;
import com.health.insights.model.MetricPair;
import com.health.insights.model.MetricSeries;
import com.health.insights.model.RunStatus;
import com.health.insights.model.UserSeriesSnapshot;
import com.health.insights.repository.HealthSeriesRepository;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Runs every selected detector over a user's snapshot and combines the outcome.
 *
 * The snapshot is first extended with derived series. Anomaly detectors run once per
 * eligible metric, correlation detectors once per metric pair, all as independent tasks
 * on the shared detector pool. A detector that declines for
 * lack of data is recorded as skipped; one that raises anything else is recorded as a
 * {@link DetectorFailure} and the run ends PARTIAL while the other detectors' results
 * are kept. Only a failed or empty series read fails the whole run.
 */
@Component
public class DetectionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DetectionOrchestrator.class);

    private final HealthSeriesRepository seriesRepository;
    private final DerivedMetrics derivedMetrics;
    private final Map<DetectorType, AnomalyDetector> anomalyDetectors;
    private final List<CorrelationDetector> correlationDetectors;
    private final MetricPairSelector pairSelector;
    private final CorrelationAggregator aggregator;
    private final AnomalyEnsemble ensemble;
    private final Executor detectorExecutor;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    public DetectionOrchestrator(HealthSeriesRepository seriesRepository,
                                 DerivedMetrics derivedMetrics,
                                 List<AnomalyDetector> anomalyDetectors,
                                 List<CorrelationDetector> correlationDetectors,
                                 MetricPairSelector pairSelector,
                                 CorrelationAggregator aggregator,
                                 AnomalyEnsemble ensemble,
                                 @Qualifier("detectorExecutor") Executor detectorExecutor,
                                 Tracer tracer,
                                 MetricsConfig metricsConfig) {
        this.seriesRepository = seriesRepository;
        this.derivedMetrics = derivedMetrics;
        this.anomalyDetectors = new EnumMap<>(DetectorType.class);
        this.pairSelector = pairSelector;
        this.aggregator = aggregator;
        this.ensemble = ensemble;
        this.detectorExecutor = detectorExecutor;
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;

        for (AnomalyDetector detector : anomalyDetectors) {
            this.anomalyDetectors.put(detector.getDetectorType(), detector);
            log.info("Registered anomaly detector: {} -> {}",
                    detector.getDetectorType(), detector.getClass().getSimpleName());
        }
        List<CorrelationDetector> sorted = new ArrayList<>(correlationDetectors);
        sorted.sort(Comparator.comparing(CorrelationDetector::getName));
        this.correlationDetectors = List.copyOf(sorted);
        for (CorrelationDetector detector : this.correlationDetectors) {
            log.info("Registered correlation detector: {} -> {}",
                    detector.getCorrelationTypes(), detector.getClass().getSimpleName());
        }
    }

    public DetectionRun run(String userId, DetectionRequest request, DetectionConfig config, CancellationToken token) {
        String runId = UUID.randomUUID().toString();
        Instant startedAt = Instant.now();
        LocalDate from = request.resolveStartDate(config.getDefaultWindowDays());
        LocalDate to = request.resolveEndDate();
        BaselineStrategy strategy = request.baselineStrategy();
        log.info("Detection run {} for user {} over {}..{} ({} baseline)", runId, userId, from, to, strategy);

        UserSeriesSnapshot snapshot;
        try {
            snapshot = seriesRepository.findSeries(userId, from, to);
        } catch (SourceUnavailableException e) {
            log.error("Detection run {} failed: series source unavailable", runId, e);
            return DetectionRun.failed(runId, userId, from, to, e.getMessage(), startedAt);
        }
        if (snapshot == null || snapshot.isEmpty()) {
            log.warn("Detection run {} failed: no data for user {} between {} and {}", runId, userId, from, to);
            return DetectionRun.failed(runId, userId, from, to, "No data in the requested window", startedAt);
        }
        snapshot = derivedMetrics.enrich(snapshot, config);

        Set<String> metrics = selectMetrics(snapshot, request);
        List<CompletableFuture<TaskOutcome>> anomalyTasks = new ArrayList<>();
        for (String metric : metrics) {
            if (!derivedMetrics.isAnomalyEligible(metric, config)) continue;
            MetricSeries series = snapshot.get(metric).orElseThrow();
            for (AnomalyDetector detector : anomalyDetectors.values()) {
                if (!request.runs(detector.getDetectorType())) continue;
                String name = detector.getDetectorType().name();
                anomalyTasks.add(submit(name, metric, token,
                        () -> TaskOutcome.anomalies(name, metric, detector.detect(series, config, strategy))));
            }
        }

        List<MetricPair> pairs = request.isIncludeCorrelations() ? pairSelector.select(metrics, config) : List.of();
        List<CompletableFuture<TaskOutcome>> correlationTasks = new ArrayList<>();
        for (MetricPair pair : pairs) {
            MetricSeries a = snapshot.get(pair.first()).orElseThrow();
            MetricSeries b = snapshot.get(pair.second()).orElseThrow();
            for (CorrelationDetector detector : correlationDetectors) {
                if (detector.getCorrelationTypes().stream().noneMatch(request::runs)) continue;
                correlationTasks.add(submit(detector.getName(), pair.toString(), token,
                        () -> TaskOutcome.correlations(detector.getName(), pair.toString(),
                                detector.detect(a, b, config).stream().filter(r -> request.runs(r.getCorrelationType())).toList())));
            }
        }

        List<CompletableFuture<TaskOutcome>> all = new ArrayList<>(anomalyTasks);
        all.addAll(correlationTasks);
        CompletableFuture.allOf(all.toArray(new CompletableFuture[0])).join();

        if (token.isCancelled()) {
            log.info("Detection run {} cancelled, discarding detector output", runId);
            return DetectionRun.builder()
                    .runId(runId).userId(userId).from(from).to(to)
                    .baselineStrategy(strategy)
                    .status(RunStatus.CANCELLED)
                    .anomalies(List.of()).correlationResults(List.of()).correlations(List.of())
                    .failures(List.of()).skipped(List.of())
                    .startedAt(startedAt).completedAt(Instant.now())
                    .build();
        }

        List<DetectorFailure> failures = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        List<AnomalyResult> anomalies = new ArrayList<>();
        for (CompletableFuture<TaskOutcome> task : anomalyTasks) {
            TaskOutcome outcome = task.join();
            outcome.collect(failures, skipped);
            anomalies.addAll(outcome.anomalies());
        }

        List<CorrelationResult> correlationResults = new ArrayList<>();
        Map<String, List<CorrelationResult>> byPair = new LinkedHashMap<>();
        for (CompletableFuture<TaskOutcome> task : correlationTasks) {
            TaskOutcome outcome = task.join();
            outcome.collect(failures, skipped);
            correlationResults.addAll(outcome.correlations());
            byPair.computeIfAbsent(outcome.scope(), s -> new ArrayList<>()).addAll(outcome.correlations());
        }

        List<MergedCorrelation> merged = new ArrayList<>();
        for (MetricPair pair : pairs) {
            List<CorrelationResult> results = byPair.getOrDefault(pair.toString(), List.of());
            merged.addAll(aggregator.aggregateByGranularity(pair, results, config));
        }

        RunStatus status = failures.isEmpty() ? RunStatus.COMPLETED : RunStatus.PARTIAL;
        DetectionRun run = DetectionRun.builder()
                .runId(runId)
                .userId(userId)
                .from(from)
                .to(to)
                .baselineStrategy(strategy)
                .status(status)
                .anomalies(List.copyOf(ensemble.combine(anomalies, config.getMaxAnomalies())))
                .correlationResults(List.copyOf(correlationResults))
                .correlations(List.copyOf(aggregator.rank(merged)))
                .failures(List.copyOf(failures))
                .skipped(List.copyOf(skipped))
                .startedAt(startedAt)
                .completedAt(Instant.now())
                .build();

        log.info("Detection run {} {}: {} anomalies, {} correlations, {} failures, {} skipped",
                runId, status, run.getAnomalies().size(), run.getCorrelations().size(),
                failures.size(), skipped.size());
        return run;
    }

    private Set<String> selectMetrics(UserSeriesSnapshot snapshot, DetectionRequest request) {
        Set<String> metrics = new TreeSet<>();
        for (String metric : snapshot.metricNames()) {
            if (snapshot.get(metric).map(MetricSeries::isEmpty).orElse(true)) continue;
            if (request.getMetrics() == null || request.getMetrics().isEmpty() || request.getMetrics().contains(metric)) {
                metrics.add(metric);
            }
        }
        return metrics;
    }

    private CompletableFuture<TaskOutcome> submit(String detector, String scope, CancellationToken token,
                                                  Supplier<TaskOutcome> work) {
        return CompletableFuture.supplyAsync(() -> {
            if (token.isCancelled()) {
                return TaskOutcome.notStarted(detector, scope);
            }

            Span span = tracer.nextSpan()
                    .name("detector." + detector)
                    .tag("detector.name", detector)
                    .tag("detector.scope", scope)
                    .start();
            try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
                TaskOutcome outcome = work.get();
                span.tag("detector.results", String.valueOf(outcome.resultCount()));
                return outcome;
            } catch (InsufficientDataException e) {
                span.tag("detector.declined", "true");
                metricsConfig.recordDetectorDeclined(detector);
                log.debug("Detector {} declined {}: {}", detector, scope, e.getMessage());
                return TaskOutcome.declined(detector, scope);
            } catch (Exception e) {
                span.error(e);
                metricsConfig.recordDetectorFailure(detector);
                log.error("Detector {} failed on {}: {}", detector, scope, e.getMessage(), e);
                return TaskOutcome.failed(detector, scope, e);
            } finally {
                span.end();
            }
        }, detectorExecutor);
    }

    private record TaskOutcome(String detector, String scope,
                               List<AnomalyResult> anomalies, List<CorrelationResult> correlations,
                               DetectorFailure failure, boolean declined) {

        static TaskOutcome anomalies(String detector, String scope, List<AnomalyResult> results) {
            return new TaskOutcome(detector, scope, results, List.of(), null, false);
        }

        static TaskOutcome correlations(String detector, String scope, List<CorrelationResult> results) {
            return new TaskOutcome(detector, scope, List.of(), results, null, results.isEmpty());
        }

        static TaskOutcome declined(String detector, String scope) {
            return new TaskOutcome(detector, scope, List.of(), List.of(), null, true);
        }

        static TaskOutcome notStarted(String detector, String scope) {
            return new TaskOutcome(detector, scope, List.of(), List.of(), null, false);
        }

        static TaskOutcome failed(String detector, String scope, Exception e) {
            DetectorFailure failure = DetectorFailure.builder()
                    .detector(detector)
                    .scope(scope)
                    .errorType(e.getClass().getName())
                    .message(e.getMessage())
                    .build();
            return new TaskOutcome(detector, scope, List.of(), List.of(), failure, false);
        }

        int resultCount() {
            return anomalies.size() + correlations.size();
        }

        void collect(List<DetectorFailure> failures, List<String> skipped) {
            if (failure != null) failures.add(failure);
            if (declined) skipped.add(detector + ":" + scope);
        }
    }
}
