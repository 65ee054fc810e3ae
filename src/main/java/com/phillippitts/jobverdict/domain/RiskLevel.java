package com.phillippitts.jobverdict.domain;

/**
 * Severity of a location conflict, graded by geographic distance.
 */
public enum RiskLevel {
    NONE,
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
