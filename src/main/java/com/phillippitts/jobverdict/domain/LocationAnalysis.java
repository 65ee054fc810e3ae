package com.phillippitts.jobverdict.domain;

import java.util.List;
import java.util.Objects;

/**
 * Result of validating a job's declared location against its description.
 *
 * <p>Invariants:
 * <ul>
 *   <li>{@link ValidationMethod#ERROR_FALLBACK} never reports a conflict</li>
 *   <li>risk is {@link RiskLevel#NONE} exactly when no conflict is reported</li>
 *   <li>confidence lies in [0, 1]</li>
 * </ul>
 *
 * @param metadataLocation      location as declared by the job's metadata
 * @param authoritativeLocation location judged to be the actual work location
 * @param conflictDetected      whether the description contradicts the metadata
 * @param confidence            confidence in the verdict, 0..1
 * @param riskLevel             geographic severity of the conflict
 * @param method                which phase produced the verdict
 * @param reasoning             evidence for the verdict, including any override notes
 * @param extractedLocations    recognised place names found in the description
 */
public record LocationAnalysis(
        String metadataLocation,
        String authoritativeLocation,
        boolean conflictDetected,
        double confidence,
        RiskLevel riskLevel,
        ValidationMethod method,
        String reasoning,
        List<String> extractedLocations
) {

    public LocationAnalysis {
        metadataLocation = metadataLocation == null ? "" : metadataLocation;
        Objects.requireNonNull(authoritativeLocation, "authoritativeLocation must not be null");
        Objects.requireNonNull(riskLevel, "riskLevel must not be null");
        Objects.requireNonNull(method, "method must not be null");
        reasoning = reasoning == null ? "" : reasoning;
        extractedLocations = extractedLocations == null ? List.of() : List.copyOf(extractedLocations);
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
        if (method == ValidationMethod.ERROR_FALLBACK && conflictDetected) {
            throw new IllegalArgumentException("Error fallback must not report a conflict");
        }
        if (conflictDetected == (riskLevel == RiskLevel.NONE)) {
            throw new IllegalArgumentException(
                    "riskLevel " + riskLevel + " inconsistent with conflictDetected=" + conflictDetected);
        }
    }

    /**
     * Verdict that trusts the declared location.
     */
    public static LocationAnalysis noConflict(String metadataLocation, double confidence, ValidationMethod method,
                                              String reasoning, List<String> extractedLocations) {
        return new LocationAnalysis(metadataLocation, metadataLocation == null ? "" : metadataLocation, false,
                confidence, RiskLevel.NONE, method, reasoning, extractedLocations);
    }

    /**
     * Conservative default used when adjudication could not complete.
     */
    public static LocationAnalysis errorFallback(String metadataLocation, String reason,
                                                 List<String> extractedLocations) {
        return noConflict(metadataLocation, 0.0, ValidationMethod.ERROR_FALLBACK,
                "Validation failed, declared location trusted: " + reason, extractedLocations);
    }
}
