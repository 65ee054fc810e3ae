package com.phillippitts.jobverdict.service.location;

import com.phillippitts.jobverdict.domain.ValidationMethod;

/**
 * Working verdict before safety overrides and risk classification.
 *
 * @param evidence text the authoritative location must be grounded in (gazetteer note or adjudicator reasoning)
 * @param notes    override notes appended so far
 */
record LocationCandidate(String authoritativeLocation, boolean conflictDetected, double confidence,
                         ValidationMethod method, String evidence, String notes) {

    LocationCandidate withNoConflict(String metadataLocation, String note) {
        return new LocationCandidate(metadataLocation, false, confidence, method, evidence,
                notes + " (override: " + note + ")");
    }

    String reasoning() {
        return evidence + notes;
    }
}
