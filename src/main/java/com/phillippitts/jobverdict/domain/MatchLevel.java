package com.phillippitts.jobverdict.domain;

import java.util.Locale;

/**
 * Categorical candidate-to-role fit.
 *
 * <p>Declaration order is the conservativeness order: {@link #LOW} is the most conservative
 * verdict and compares lowest. Consensus policies rely on {@link #compareTo(Enum)}.
 */
public enum MatchLevel {
    LOW("Low"),
    MODERATE("Moderate"),
    GOOD("Good");

    private final String label;

    MatchLevel(String label) {
        this.label = label;
    }

    /**
     * Human-readable label as it appears in LLM responses ("Low", "Moderate", "Good").
     */
    public String label() {
        return label;
    }

    /**
     * Returns the more conservative of two levels.
     */
    public static MatchLevel lowest(MatchLevel a, MatchLevel b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    /**
     * Resolves a label case-insensitively.
     *
     * @throws IllegalArgumentException if the label is not a known level
     */
    public static MatchLevel fromLabel(String label) {
        if (label == null) {
            throw new IllegalArgumentException("label must not be null");
        }
        return valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}
