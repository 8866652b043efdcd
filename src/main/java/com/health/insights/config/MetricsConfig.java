package com.health.insights.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger activeJobs;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.activeJobs = registry.gauge("detection.jobs.active", new AtomicInteger(0));
    }

    public void recordRun(String status, int anomalyCount) {
        Counter.builder("detection.run.count")
                .tag("status", status)
                .register(registry)
                .increment();

        DistributionSummary.builder("detection.run.anomalies")
                .tag("status", status)
                .register(registry)
                .record(anomalyCount);
    }

    public void recordAnomaly(String detector, String severity) {
        Counter.builder("detection.anomaly.count")
                .tag("detector", detector)
                .tag("severity", severity)
                .register(registry)
                .increment();
    }

    public void recordDetectorFailure(String detector) {
        Counter.builder("detection.detector.failure.count")
                .tag("detector", detector)
                .register(registry)
                .increment();
    }

    public void recordDetectorDeclined(String detector) {
        Counter.builder("detection.detector.declined.count")
                .tag("detector", detector)
                .register(registry)
                .increment();
    }

    public void recordCorrelation(String leadType, int agreement, boolean actionable) {
        Counter.builder("correlation.verdict.count")
                .tag("lead_type", leadType)
                .tag("agreement", String.valueOf(agreement))
                .tag("actionable", String.valueOf(actionable))
                .register(registry)
                .increment();
    }

    public void recordJob(String status) {
        Counter.builder("detection.job.count")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void jobStarted() {
        activeJobs.incrementAndGet();
    }

    public void jobFinished() {
        activeJobs.decrementAndGet();
    }
}
