package uk.gegc.bannertracking.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executor used by the tracking endpoints for store calls, so a request thread
 * can give up waiting after the configured store timeout while the call finishes
 * in the background. Tasks are rejected, never run on the caller, once pool and queue are full.
 */
@Configuration
@Slf4j
public class AsyncConfig {

    @Value("${async.tracking.core-pool-size:8}")
    private int trackingCorePoolSize;

    @Value("${async.tracking.max-pool-size:32}")
    private int trackingMaxPoolSize;

    @Value("${async.tracking.queue-capacity:500}")
    private int trackingQueueCapacity;

    @Value("${async.tracking.keep-alive-seconds:60}")
    private int trackingKeepAliveSeconds;

    @Bean(name = "trackingTaskExecutor")
    public Executor trackingTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(trackingCorePoolSize);
        executor.setMaxPoolSize(trackingMaxPoolSize);
        executor.setQueueCapacity(trackingQueueCapacity);
        executor.setKeepAliveSeconds(trackingKeepAliveSeconds);
        executor.setThreadNamePrefix("tracking-");

        // Saturated pool rejects; callers fall back instead of running the store call themselves
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("Tracking Task Executor configured - Core: {}, Max: {}, Queue: {}, KeepAlive: {}s",
                trackingCorePoolSize, trackingMaxPoolSize, trackingQueueCapacity, trackingKeepAliveSeconds);

        return executor;
    }
}
