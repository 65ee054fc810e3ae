package com.phillippitts.jobverdict.service.location;

import com.phillippitts.jobverdict.domain.RiskLevel;

import java.util.Objects;

/**
 * Grades a location conflict by geographic distance. Another country (and so possibly another continent)
 * is critical and another region of the same country is medium. Anything closer or unresolvable is low.
 */
public final class RiskClassifier {

    private final Gazetteer gazetteer;

    public RiskClassifier(Gazetteer gazetteer) {
        this.gazetteer = Objects.requireNonNull(gazetteer, "gazetteer");
    }

    public RiskLevel classify(boolean conflictDetected, String metadataLocation, String authoritativeLocation) {
        if (!conflictDetected) {
            return RiskLevel.NONE;
        }
        NormalizedLocation declared = gazetteer.normalize(metadataLocation);
        NormalizedLocation actual = gazetteer.normalize(authoritativeLocation);
        if (declared.country() == null || actual.country() == null) {
            return RiskLevel.LOW;
        }
        if (!declared.country().equals(actual.country())) {
            return RiskLevel.CRITICAL;
        }
        if (declared.state() != null && actual.state() != null && !declared.state().equals(actual.state())) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }
}
