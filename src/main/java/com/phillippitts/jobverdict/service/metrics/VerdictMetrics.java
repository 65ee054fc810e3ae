package com.phillippitts.jobverdict.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for match evaluation and location validation.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>LLM call latency and failures per client</li>
 *   <li>Extraction retries and failed runs</li>
 *   <li>Final match levels and post-consensus adjustments</li>
 *   <li>Location validation outcomes by method</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class VerdictMetrics {

    private static final String METRIC_PREFIX = "jobverdict";

    private final MeterRegistry registry;

    public VerdictMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records latency of a single LLM call.
     *
     * @param client client name (e.g. "ollama-match", "ollama-adjudication")
     * @param durationNanos duration in nanoseconds
     */
    public void recordLlmLatency(String client, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".llm.latency")
                .description("Time taken by one LLM call")
                .tag("client", client)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * @param reason failure reason (timeout, http_error, malformed, concurrency_limit, ...)
     */
    public void incrementLlmFailure(String client, String reason) {
        Counter.builder(METRIC_PREFIX + ".llm.failure")
                .description("Number of failed LLM calls")
                .tag("client", client)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementExtractionRetry() {
        Counter.builder(METRIC_PREFIX + ".match.retry")
                .description("Number of attempts retried because no match level was extracted")
                .register(registry)
                .increment();
    }

    public void incrementFailedRun() {
        Counter.builder(METRIC_PREFIX + ".match.run.failed")
                .description("Number of logical runs that exhausted all attempts")
                .register(registry)
                .increment();
    }

    /**
     * @param level final match level name, or "EXTRACTION_FAILURE"
     * @param adjustment post-consensus adjustment applied
     */
    public void recordMatchVerdict(String level, String adjustment) {
        Counter.builder(METRIC_PREFIX + ".match.verdict")
                .description("Number of match verdicts by level and adjustment")
                .tag("level", level)
                .tag("adjustment", adjustment)
                .register(registry)
                .increment();
    }

    public void recordLocationValidation(String method, boolean conflict) {
        Counter.builder(METRIC_PREFIX + ".location.validation")
                .description("Number of location validations by method and outcome")
                .tag("method", method)
                .tag("conflict", String.valueOf(conflict))
                .register(registry)
                .increment();
    }

    public void incrementLocationOverride(String override) {
        Counter.builder(METRIC_PREFIX + ".location.override")
                .description("Number of conflicts cleared by a safety override")
                .tag("override", override)
                .register(registry)
                .increment();
    }
}
