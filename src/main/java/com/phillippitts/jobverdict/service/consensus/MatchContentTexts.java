package com.phillippitts.jobverdict.service.consensus;

/**
 * Fixed first-person texts used when a verdict's narrative or rationale has to be synthesized.
 */
final class MatchContentTexts {

    static final String GAP_RATIONALE_PREFIX =
            "I have compared my CV and the role description and decided not to apply due to critical domain "
                    + "knowledge gaps: ";

    static final String SIGNALS_RATIONALE_PREFIX =
            "I have compared my CV and the role description and decided not to apply due to the following "
                    + "domain knowledge gaps: ";

    static final String FALLBACK_RATIONALE =
            "I have compared my CV and the role description and decided not to apply due to the missing skills "
                    + "or experience that would be required for this position.";

    static final String FALLBACK_NARRATIVE =
            "My skills and experience align well with this position based on the match assessment.";

    private MatchContentTexts() {
    }
}
