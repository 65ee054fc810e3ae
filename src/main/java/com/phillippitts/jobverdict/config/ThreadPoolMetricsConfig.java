package com.phillippitts.jobverdict.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for thread pool metrics exposure via Micrometer.
 *
 * <p>Exposes gauges for both executors, tagged with {@code pool=evaluation|job}:
 * <ul>
 *   <li>jobverdict.pool.size - Current number of threads in the pool</li>
 *   <li>jobverdict.pool.active - Number of actively executing tasks</li>
 *   <li>jobverdict.pool.queued - Number of tasks waiting in the queue</li>
 *   <li>jobverdict.pool.completed - Cumulative count of completed tasks</li>
 *   <li>jobverdict.pool.max.size - Configured maximum pool size</li>
 * </ul>
 *
 * <p>Additionally logs a health summary every 5 minutes for operational visibility.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> evaluationExecutorProvider;
    private final ObjectProvider<ThreadPoolTaskExecutor> jobExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("evaluationExecutor") ObjectProvider<ThreadPoolTaskExecutor> evaluationExecutorProvider,
            @Qualifier("jobExecutor") ObjectProvider<ThreadPoolTaskExecutor> jobExecutorProvider) {
        this.evaluationExecutorProvider = evaluationExecutorProvider;
        this.jobExecutorProvider = jobExecutorProvider;
    }

    @Bean
    public MeterBinder executorPoolMetrics() {
        return registry -> {
            bind(registry, "evaluation", evaluationExecutorProvider.getObject().getThreadPoolExecutor());
            bind(registry, "job", jobExecutorProvider.getObject().getThreadPoolExecutor());
            LOG.info("Thread pool metrics registered: jobverdict.pool.* available via /actuator/metrics");
        };
    }

    static void bind(MeterRegistry registry, String pool, ThreadPoolExecutor executor) {
        Gauge.builder("jobverdict.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                .description("Current number of threads in the pool")
                .tag("pool", pool)
                .register(registry);

        Gauge.builder("jobverdict.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                .description("Number of threads actively executing tasks")
                .tag("pool", pool)
                .register(registry);

        Gauge.builder("jobverdict.pool.queued", executor, e -> e.getQueue().size())
                .description("Number of tasks waiting in the queue")
                .tag("pool", pool)
                .register(registry);

        Gauge.builder("jobverdict.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                .description("Cumulative count of completed tasks")
                .tag("pool", pool)
                .register(registry);

        Gauge.builder("jobverdict.pool.max.size", executor, ThreadPoolExecutor::getMaximumPoolSize)
                .description("Configured maximum pool size")
                .tag("pool", pool)
                .register(registry);
    }

    /**
     * Logs thread pool health summary every 5 minutes for operational monitoring.
     */
    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor evaluation = evaluationExecutorProvider.getObject().getThreadPoolExecutor();
        ThreadPoolExecutor job = jobExecutorProvider.getObject().getThreadPoolExecutor();

        LOG.info("Thread pool health: evaluation size={}/{} active={} queued={}; job size={}/{} active={} queued={}",
                evaluation.getPoolSize(), evaluation.getMaximumPoolSize(), evaluation.getActiveCount(),
                evaluation.getQueue().size(),
                job.getPoolSize(), job.getMaximumPoolSize(), job.getActiveCount(), job.getQueue().size());
    }
}
