package com.phillippitts.jobverdict.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Policy parameters for the match consensus evaluator.
 *
 * <p>The downgrade thresholds are empirical defaults; tune them against known verdicts rather than
 * reading meaning into the literal values.
 *
 * <p>Properties:
 * <ul>
 *   <li>evaluation.consensus.runs - independent evaluation runs per job (default: 5)</li>
 *   <li>evaluation.consensus.retries-per-run - attempts per run before it counts as failed (default: 3)</li>
 *   <li>evaluation.consensus.min-content-length - shorter narratives/rationales are replaced (default: 15)</li>
 *   <li>evaluation.consensus.severity-threshold - critical-gap count that forces Low (default: 1)</li>
 *   <li>evaluation.consensus.density-threshold-pct - requirement density above which Good becomes Low (default: 15)</li>
 *   <li>evaluation.consensus.execution - SEQUENTIAL or PARALLEL (default: PARALLEL)</li>
 *   <li>evaluation.consensus.overall-timeout-ms - deadline for all parallel runs together (default: 300000)</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "evaluation.consensus")
public class ConsensusProperties {

    public enum Execution { SEQUENTIAL, PARALLEL }

    @Min(1)
    @Max(20)
    private final int runs;

    @Min(1)
    @Max(10)
    private final int retriesPerRun;

    @Min(0)
    private final int minContentLength;

    @Min(1)
    private final int severityThreshold;

    @Min(0)
    @Max(100)
    private final double densityThresholdPct;

    @NotNull
    private final Execution execution;

    @Min(1)
    private final long overallTimeoutMs;

    @ConstructorBinding
    public ConsensusProperties(Integer runs, Integer retriesPerRun, Integer minContentLength,
                               Integer severityThreshold, Double densityThresholdPct, Execution execution,
                               Long overallTimeoutMs) {
        this.runs = runs == null ? 5 : runs;
        if (this.runs < 1) {
            throw new IllegalArgumentException("evaluation.consensus.runs must be >= 1");
        }
        this.retriesPerRun = retriesPerRun == null ? 3 : retriesPerRun;
        if (this.retriesPerRun < 1) {
            throw new IllegalArgumentException("evaluation.consensus.retries-per-run must be >= 1");
        }
        this.minContentLength = minContentLength == null ? 15 : minContentLength;
        this.severityThreshold = severityThreshold == null ? 1 : severityThreshold;
        double d = densityThresholdPct == null ? 15.0 : densityThresholdPct;
        if (d < 0.0 || d > 100.0) {
            throw new IllegalArgumentException("evaluation.consensus.density-threshold-pct must be in [0,100]");
        }
        this.densityThresholdPct = d;
        this.execution = execution == null ? Execution.PARALLEL : execution;
        this.overallTimeoutMs = overallTimeoutMs == null ? 300_000L : overallTimeoutMs;
    }

    /**
     * All defaults.
     */
    public static ConsensusProperties defaults() {
        return new ConsensusProperties(null, null, null, null, null, null, null);
    }

    public int getRuns() {
        return runs;
    }

    public int getRetriesPerRun() {
        return retriesPerRun;
    }

    public int getMinContentLength() {
        return minContentLength;
    }

    public int getSeverityThreshold() {
        return severityThreshold;
    }

    public double getDensityThresholdPct() {
        return densityThresholdPct;
    }

    public Execution getExecution() {
        return execution;
    }

    public long getOverallTimeoutMs() {
        return overallTimeoutMs;
    }
}
