package com.phillippitts.jobverdict.domain;

/**
 * Heuristic reading of a domain-knowledge assessment passage.
 *
 * @param severity               number of critical-gap phrase occurrences
 * @param hasDomainRequirements  whether any domain-requirement phrase was mentioned
 * @param requirementDensityPct  requirement mentions per 100 words
 * @param mentionsGap            whether the literal word "gap" appears
 * @param hasModerateSignals     whether requirement phrases or experience/skill/knowledge wording appear
 */
public record DomainGapReport(
        int severity,
        boolean hasDomainRequirements,
        double requirementDensityPct,
        boolean mentionsGap,
        boolean hasModerateSignals
) {

    public static final DomainGapReport EMPTY = new DomainGapReport(0, false, 0.0, false, false);

    public DomainGapReport {
        if (severity < 0) {
            throw new IllegalArgumentException("severity must be >= 0, got: " + severity);
        }
        if (requirementDensityPct < 0.0 || Double.isNaN(requirementDensityPct)) {
            throw new IllegalArgumentException("requirementDensityPct must be >= 0, got: " + requirementDensityPct);
        }
    }
}
