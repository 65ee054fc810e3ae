package com.phillippitts.jobverdict.service.metrics;

import com.phillippitts.jobverdict.domain.LocationAnalysis;
import com.phillippitts.jobverdict.domain.MatchResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Null-safe facade over {@link VerdictMetrics} used by the orchestrators and the LLM clients.
 *
 * <p>All methods are no-ops when constructed without metrics, so orchestrators can run in unit tests
 * without a registry.
 *
 * @see VerdictMetrics
 */
@Component
public final class VerdictMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(VerdictMetricsPublisher.class);

    /**
     * Shared no-op instance for tests and defaults.
     */
    public static final VerdictMetricsPublisher NOOP = new VerdictMetricsPublisher(null);

    private final VerdictMetrics metrics;

    /**
     * @param metrics metrics service (nullable for test mode)
     */
    public VerdictMetricsPublisher(VerdictMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("VerdictMetricsPublisher created without metrics (test mode)");
        }
    }

    public boolean isEnabled() {
        return metrics != null;
    }

    public void recordLlmCall(String client, long startNanos) {
        if (metrics != null) {
            metrics.recordLlmLatency(client, System.nanoTime() - startNanos);
        }
    }

    public void recordLlmFailure(String client, String reason) {
        if (metrics != null) {
            metrics.incrementLlmFailure(client, reason);
        }
    }

    public void recordExtractionRetry() {
        if (metrics != null) {
            metrics.incrementExtractionRetry();
        }
    }

    public void recordFailedRun() {
        if (metrics != null) {
            metrics.incrementFailedRun();
        }
    }

    public void recordMatchResult(MatchResult result) {
        if (metrics == null || result == null) {
            return;
        }
        if (result.hasError()) {
            metrics.recordMatchVerdict(result.error().name(), result.adjustment().name());
        } else {
            metrics.recordMatchVerdict(result.finalMatchLevel().name(), result.adjustment().name());
        }
    }

    public void recordLocationAnalysis(LocationAnalysis analysis) {
        if (metrics != null && analysis != null) {
            metrics.recordLocationValidation(analysis.method().name(), analysis.conflictDetected());
        }
    }

    public void recordLocationOverride(String override) {
        if (metrics != null) {
            metrics.incrementLocationOverride(override);
        }
    }
}
