package uk.gegc.bannertracking.shared.config;

import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AsyncConfigTest {

    @Test
    void trackingTaskExecutor_appliesConfiguredPoolSizes() {
        ThreadPoolTaskExecutor executor = trackingExecutor(2, 4, 10);
        try {
            assertThat(executor.getCorePoolSize()).isEqualTo(2);
            assertThat(executor.getMaxPoolSize()).isEqualTo(4);
            assertThat(executor.getQueueCapacity()).isEqualTo(10);
            assertThat(executor.getThreadNamePrefix()).isEqualTo("tracking-");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void trackingTaskExecutor_saturated_rejectsInsteadOfRunningOnCaller() throws Exception {
        ThreadPoolTaskExecutor executor = trackingExecutor(1, 1, 0);
        CountDownLatch occupied = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicBoolean ranOnCaller = new AtomicBoolean();
        Thread caller = Thread.currentThread();
        try {
            executor.execute(() -> {
                occupied.countDown();
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            assertThat(occupied.await(5, TimeUnit.SECONDS)).isTrue();

            assertThatThrownBy(() -> executor.execute(() -> ranOnCaller.set(Thread.currentThread() == caller)))
                    .isInstanceOf(RejectedExecutionException.class);
            assertThat(ranOnCaller).isFalse();
        } finally {
            release.countDown();
            executor.shutdown();
        }
    }

    private static ThreadPoolTaskExecutor trackingExecutor(int core, int max, int queue) {
        AsyncConfig asyncConfig = new AsyncConfig();
        ReflectionTestUtils.setField(asyncConfig, "trackingCorePoolSize", core);
        ReflectionTestUtils.setField(asyncConfig, "trackingMaxPoolSize", max);
        ReflectionTestUtils.setField(asyncConfig, "trackingQueueCapacity", queue);
        ReflectionTestUtils.setField(asyncConfig, "trackingKeepAliveSeconds", 60);
        return (ThreadPoolTaskExecutor) asyncConfig.trackingTaskExecutor();
    }
}
