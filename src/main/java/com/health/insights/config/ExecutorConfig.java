package com.health.insights.config;

import io.micrometer.observation.ObservationRegistry;
import io.micrometer.observation.aop.ObservedAspect;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Worker pools. Detector tasks of every job share one bounded pool; jobs run on a
 * separate small pool so a job waiting on its detectors never starves them.
 */
@Configuration
public class ExecutorConfig {

    private static final int SHUTDOWN_AWAIT_SECONDS = 30;

    @Bean(name = "detectorExecutor")
    public ThreadPoolTaskExecutor detectorExecutor(DetectionConfig config) {
        DetectionConfig.Workers workers = config.getWorkers();
        ThreadPoolTaskExecutor executor = pool("detector-worker-", workers.getDetectorPoolSize(),
                workers.getQueueCapacity());
        // A full queue runs the detector on the job thread instead of dropping it
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    @Bean(name = "detectionJobExecutor")
    public ThreadPoolTaskExecutor detectionJobExecutor(DetectionConfig config) {
        DetectionConfig.Workers workers = config.getWorkers();
        ThreadPoolTaskExecutor executor = pool("detection-job-", workers.getJobPoolSize(),
                workers.getQueueCapacity());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();
        return executor;
    }

    // Enables @Observed on service entry points
    @Bean
    public ObservedAspect observedAspect(ObservationRegistry observationRegistry) {
        return new ObservedAspect(observationRegistry);
    }

    private static ThreadPoolTaskExecutor pool(String threadPrefix, int size, int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(threadPrefix);
        executor.setDaemon(true);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(SHUTDOWN_AWAIT_SECONDS);
        return executor;
    }
}
