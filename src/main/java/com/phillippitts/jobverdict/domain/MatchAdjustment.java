package com.phillippitts.jobverdict.domain;

/**
 * Post-consensus correction applied to the final match level, recorded for audit.
 */
public enum MatchAdjustment {
    NONE,
    /** Critical domain gap in the assessment forced {@link MatchLevel#LOW}. */
    DOMAIN_GAP_TO_LOW,
    /** Domain requirement signals in the assessment capped the level at {@link MatchLevel#MODERATE}. */
    DOMAIN_SIGNALS_TO_MODERATE,
    /** A Good verdict came with a rationale instead of a narrative. */
    CONTENT_MISMATCH_TO_MODERATE
}
