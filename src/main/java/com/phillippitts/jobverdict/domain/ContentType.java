package com.phillippitts.jobverdict.domain;

/**
 * Kind of explanatory text attached to a match verdict.
 * A narrative accompanies a {@link MatchLevel#GOOD} verdict; every other level carries a rationale.
 */
public enum ContentType {
    APPLICATION_NARRATIVE,
    NO_GO_RATIONALE;

    public static ContentType forLevel(MatchLevel level) {
        return level == MatchLevel.GOOD ? APPLICATION_NARRATIVE : NO_GO_RATIONALE;
    }
}
