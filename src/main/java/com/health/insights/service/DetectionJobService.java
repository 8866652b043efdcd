package com.health.insights.service;

import com.health.insights.config.DetectionConfig;
import com.health.insights.config.MetricsConfig;
import com.health.insights.engine.CancellationToken;
import com.health.insights.model.DetectionJob;
import com.health.insights.model.DetectionRequest;
import com.health.insights.model.DetectionResult;
import com.health.insights.model.JobStatus;
import com.health.insights.model.RunStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;

/**
 * Background detection jobs. Job records are immutable snapshots replaced atomically per
 * job id; once a job reaches a terminal status no later transition is applied.
 */
@Service
public class DetectionJobService {

    private static final Logger log = LoggerFactory.getLogger(DetectionJobService.class);

    private final AnomalyDetectionService detectionService;
    private final TaskExecutor jobExecutor;
    private final DetectionConfig config;
    private final MetricsConfig metricsConfig;

    private final ConcurrentHashMap<String, DetectionJob> jobs = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CancellationToken> tokens = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, DetectionResult> results = new ConcurrentHashMap<>();

    public DetectionJobService(AnomalyDetectionService detectionService,
                               @Qualifier("detectionJobExecutor") TaskExecutor jobExecutor,
                               DetectionConfig config,
                               MetricsConfig metricsConfig) {
        this.detectionService = detectionService;
        this.jobExecutor = jobExecutor;
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    public DetectionJob submit(String userId, DetectionRequest request) {
        String jobId = UUID.randomUUID().toString();
        DetectionJob job = DetectionJob.builder()
                .jobId(jobId)
                .userId(userId)
                .status(JobStatus.PENDING)
                .message("Job created, waiting to start")
                .createdAt(Instant.now())
                .build();
        jobs.put(jobId, job);
        tokens.put(jobId, new CancellationToken());

        try {
            jobExecutor.execute(() -> execute(jobId, userId, request));
        } catch (TaskRejectedException e) {
            log.error("Detection job {} rejected: job queue is full", jobId);
            return transition(jobId, j -> j.toBuilder()
                    .status(JobStatus.FAILED)
                    .error("Too many detection jobs queued, try again later")
                    .completedAt(Instant.now())
                    .build());
        }
        log.info("Submitted detection job {} for user {}", jobId, userId);
        return job;
    }

    public Optional<DetectionJob> getJob(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    public Optional<DetectionResult> getResult(String jobId) {
        return Optional.ofNullable(results.get(jobId));
    }

    public List<DetectionJob> listJobs(String userId) {
        return jobs.values().stream()
                .filter(j -> j.getUserId().equals(userId))
                .sorted(Comparator.comparing(DetectionJob::getCreatedAt).reversed())
                .toList();
    }

    /**
     * Requests cancellation. Detector tasks not yet started are skipped and the job's
     * output is discarded.
     *
     * @return the job after the request, empty for unknown ids
     */
    public Optional<DetectionJob> cancel(String jobId) {
        CancellationToken token = tokens.get(jobId);
        if (token == null) {
            return Optional.empty();
        }
        token.cancel();
        DetectionJob job = transition(jobId, j -> j.toBuilder()
                .status(JobStatus.CANCELLED)
                .runStatus(RunStatus.CANCELLED)
                .message("Cancelled")
                .completedAt(Instant.now())
                .build());
        if (job == null) {
            return Optional.empty();
        }
        log.info("Detection job {} cancellation requested, status {}", jobId, job.getStatus());
        return Optional.of(job);
    }

    void execute(String jobId, String userId, DetectionRequest request) {
        CancellationToken token = tokens.get(jobId);
        DetectionJob started = transition(jobId, j -> j.toBuilder()
                .status(JobStatus.RUNNING)
                .message("Running detectors")
                .startedAt(Instant.now())
                .build());
        if (started == null || started.getStatus() != JobStatus.RUNNING) {
            return;
        }

        metricsConfig.jobStarted();
        try {
            DetectionResult result = detectionService.detect(userId, request, token);
            if (result.getStatus() == RunStatus.CANCELLED) {
                return;
            }
            results.put(jobId, result);
            JobStatus status = result.getStatus() == RunStatus.FAILED ? JobStatus.FAILED : JobStatus.COMPLETED;
            DetectionJob finished = transition(jobId, j -> j.toBuilder()
                    .status(status)
                    .runStatus(result.getStatus())
                    .runId(result.getRunId())
                    .error(result.getError())
                    .message("Found " + result.getTotalAnomalies() + " anomalies ("
                            + result.getNewAnomalies() + " new)")
                    .completedAt(Instant.now())
                    .build());
            if (finished == null || finished.getStatus() != status) {
                results.remove(jobId);
                return;
            }
            metricsConfig.recordJob(finished.getStatus().name());
        } catch (Exception e) {
            log.error("Detection job {} failed", jobId, e);
            transition(jobId, j -> j.toBuilder()
                    .status(JobStatus.FAILED)
                    .runStatus(RunStatus.FAILED)
                    .error(e.getMessage())
                    .completedAt(Instant.now())
                    .build());
            metricsConfig.recordJob(JobStatus.FAILED.name());
        } finally {
            metricsConfig.jobFinished();
        }
    }

    @Scheduled(fixedRateString = "${detection.jobs.cleanup-interval-minutes:30}",
               timeUnit = TimeUnit.MINUTES,
               initialDelayString = "${detection.jobs.cleanup-interval-minutes:30}")
    public void purgeExpiredJobs() {
        Instant cutoff = Instant.now().minus(Duration.ofHours(config.getJobs().getRetentionHours()));
        int removed = 0;
        for (Map.Entry<String, DetectionJob> entry : jobs.entrySet()) {
            DetectionJob job = entry.getValue();
            if (job.getStatus().isTerminal() && job.getCompletedAt() != null && job.getCompletedAt().isBefore(cutoff)) {
                if (jobs.remove(entry.getKey(), job)) {
                    tokens.remove(entry.getKey());
                    results.remove(entry.getKey());
                    removed++;
                }
            }
        }
        if (removed > 0) {
            log.info("Purged {} detection jobs older than {} hours", removed, config.getJobs().getRetentionHours());
        }
    }

    // Applies the update unless the job is already terminal; returns the current record.
    private DetectionJob transition(String jobId, UnaryOperator<DetectionJob> update) {
        return jobs.computeIfPresent(jobId, (id, current) ->
                current.getStatus().isTerminal() ? current : update.apply(current));
    }
}
