package com.phillippitts.jobverdict.domain;

import java.util.Objects;

/**
 * Outcome of one logical evaluation run, i.e. the final attempt made for that run.
 *
 * @param rawText              LLM response text (empty when the call itself failed)
 * @param extractedMatchLevel  level found in the text, or null if none could be extracted
 * @param runIndex             zero-based index of the logical run
 * @param retryIndex           zero-based index of the attempt that produced this record
 * @param durationMs           wall time of the recorded attempt
 * @param failureReason        why no level was extracted (null on success)
 */
public record EvaluationRun(
        String rawText,
        MatchLevel extractedMatchLevel,
        int runIndex,
        int retryIndex,
        long durationMs,
        String failureReason
) {

    public EvaluationRun {
        Objects.requireNonNull(rawText, "rawText must not be null");
        if (runIndex < 0 || retryIndex < 0) {
            throw new IllegalArgumentException("runIndex and retryIndex must be >= 0");
        }
        if (durationMs < 0) {
            throw new IllegalArgumentException("durationMs must be >= 0, got: " + durationMs);
        }
        if (extractedMatchLevel == null && (failureReason == null || failureReason.isBlank())) {
            throw new IllegalArgumentException("failureReason is required when no level was extracted");
        }
    }

    public static EvaluationRun extracted(String rawText, MatchLevel level, int runIndex, int retryIndex,
                                          long durationMs) {
        return new EvaluationRun(rawText, Objects.requireNonNull(level, "level"), runIndex, retryIndex,
                durationMs, null);
    }

    public static EvaluationRun failed(String rawText, int runIndex, int retryIndex, long durationMs,
                                       String reason) {
        return new EvaluationRun(rawText == null ? "" : rawText, null, runIndex, retryIndex, durationMs, reason);
    }

    public boolean hasMatchLevel() {
        return extractedMatchLevel != null;
    }
}
