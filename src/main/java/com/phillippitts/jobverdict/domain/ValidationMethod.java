package com.phillippitts.jobverdict.domain;

/**
 * How a {@link LocationAnalysis} was decided.
 */
public enum ValidationMethod {
    /** Deterministic gazetteer pass was confident enough. */
    GAZETTEER,
    /** Ambiguous case settled by constrained LLM adjudication. */
    LLM_ADJUDICATED,
    /** Adjudication failed; the declared location is trusted. */
    ERROR_FALLBACK
}
