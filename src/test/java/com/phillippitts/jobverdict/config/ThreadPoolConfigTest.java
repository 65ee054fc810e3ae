package com.phillippitts.jobverdict.config;

import com.phillippitts.jobverdict.config.properties.ThreadPoolProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ThreadPoolConfigTest {

    private final ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void shouldCreateExecutorsWithDefaultConfiguration() {
        ThreadPoolTaskExecutor evaluation = config.evaluationExecutor();
        ThreadPoolTaskExecutor job = config.jobExecutor();
        try {
            assertThat(evaluation.getCorePoolSize()).isEqualTo(2);
            assertThat(evaluation.getMaxPoolSize()).isEqualTo(2);
            assertThat(evaluation.getThreadNamePrefix()).isEqualTo("eval-pool-");
            assertThat(job.getMaxPoolSize()).isEqualTo(4);
            assertThat(job.getThreadNamePrefix()).isEqualTo("job-pool-");
        } finally {
            evaluation.shutdown();
            job.shutdown();
        }
    }

    @Test
    void shouldHandleConcurrentTasks() throws InterruptedException {
        ThreadPoolTaskExecutor executor = config.evaluationExecutor();
        int taskCount = 10;
        CountDownLatch latch = new CountDownLatch(taskCount);
        AtomicInteger completedTasks = new AtomicInteger(0);

        for (int i = 0; i < taskCount; i++) {
            executor.execute(() -> {
                try {
                    Thread.sleep(10);
                    completedTasks.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    latch.countDown();
                }
            });
        }

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(completedTasks.get()).isEqualTo(taskCount);
        executor.shutdown();
    }

    @Test
    void shouldPropagateMdcToWorkerThreads() throws InterruptedException {
        ThreadPoolTaskExecutor executor = config.jobExecutor();
        ThreadContext.put("requestId", "req-1");
        ThreadContext.put("jobId", "job-7");

        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<String> seenJobId = new AtomicReference<>();
        AtomicReference<String> threadName = new AtomicReference<>();
        executor.execute(() -> {
            seenJobId.set(ThreadContext.get("jobId"));
            threadName.set(Thread.currentThread().getName());
            latch.countDown();
        });

        assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(seenJobId.get()).isEqualTo("job-7");
        assertThat(threadName.get()).startsWith("job-pool-");
        executor.shutdown();
    }

    @Test
    void decoratorRestoresWorkerContext() {
        ThreadContext.put("jobId", "submitter");
        Runnable decorated = ThreadPoolConfig.mdcPropagating().decorate(() ->
                assertThat(ThreadContext.get("jobId")).isEqualTo("submitter"));

        ThreadContext.clearAll();
        ThreadContext.put("jobId", "worker");
        decorated.run();

        assertThat(ThreadContext.get("jobId")).isEqualTo("worker");
    }

    @Test
    void shouldRegisterPoolGauges() {
        ThreadPoolTaskExecutor executor = config.evaluationExecutor();
        SimpleMeterRegistry registry = new SimpleMeterRegistry();

        ThreadPoolMetricsConfig.bind(registry, "evaluation", executor.getThreadPoolExecutor());

        assertThat(registry.get("jobverdict.pool.max.size").tag("pool", "evaluation").gauge().value())
                .isEqualTo(2.0);
        assertThat(registry.get("jobverdict.pool.queued").tag("pool", "evaluation").gauge().value())
                .isZero();
        executor.shutdown();
    }
}
