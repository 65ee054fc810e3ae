package com.phillippitts.jobverdict.service.location;

import com.phillippitts.jobverdict.service.metrics.VerdictMetricsPublisher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Locale;

/**
 * Post-checks that clear a reported conflict which the evidence does not support.
 *
 * <ul>
 *   <li><b>same-place</b>: the authoritative and declared locations resolve to the same place, or one
 *       lies inside the other (a city inside a declared state or country)</li>
 *   <li><b>ungrounded</b>: the authoritative location does not appear in the evidence text</li>
 *   <li><b>declared-in-description</b>: adjudicated verdicts only; the declared location appears
 *       verbatim in the job description</li>
 * </ul>
 *
 * <p>A cleared verdict reverts to the declared location and keeps a note naming the override.
 */
final class LocationSafetyOverrides {

    private static final Logger LOG = LogManager.getLogger(LocationSafetyOverrides.class);

    static final String SAME_PLACE = "same-place";
    static final String UNGROUNDED = "ungrounded";
    static final String DECLARED_IN_DESCRIPTION = "declared-in-description";

    private final Gazetteer gazetteer;
    private final VerdictMetricsPublisher metrics;

    LocationSafetyOverrides(Gazetteer gazetteer, VerdictMetricsPublisher metrics) {
        this.gazetteer = gazetteer;
        this.metrics = metrics;
    }

    LocationCandidate apply(String metadataLocation, String jobDescription, LocationCandidate candidate,
                            boolean adjudicated) {
        if (!candidate.conflictDetected()) {
            return candidate;
        }
        String authoritative = candidate.authoritativeLocation();

        if (isSameLocation(metadataLocation, authoritative)) {
            return clear(metadataLocation, candidate, SAME_PLACE,
                    "same place as declared location " + metadataLocation);
        }
        if (!isGrounded(authoritative, candidate.evidence())) {
            return clear(metadataLocation, candidate, UNGROUNDED,
                    "'" + authoritative + "' not supported by the reasoning");
        }
        if (adjudicated && containsIgnoreCase(jobDescription, metadataLocation)) {
            return clear(metadataLocation, candidate, DECLARED_IN_DESCRIPTION,
                    "declared location " + metadataLocation + " appears in the job description");
        }
        return candidate;
    }

    boolean isSameLocation(String metadataLocation, String authoritative) {
        if (metadataLocation == null || authoritative == null) {
            return false;
        }
        if (metadataLocation.trim().equalsIgnoreCase(authoritative.trim())) {
            return true;
        }
        NormalizedLocation a = gazetteer.normalize(metadataLocation);
        NormalizedLocation b = gazetteer.normalize(authoritative);
        if (a.isEmpty() || b.isEmpty()) {
            return false;
        }
        if (a.hasCity() && b.hasCity()) {
            return a.city().equals(b.city());
        }
        return encloses(a, b) || encloses(b, a);
    }

    // A city-less location encloses everything in its state, or in its country when no state was resolved
    private static boolean encloses(NormalizedLocation outer, NormalizedLocation inner) {
        if (outer.hasCity()) {
            return false;
        }
        if (outer.state() != null) {
            return outer.state().equals(inner.state());
        }
        return outer.country() != null && outer.country().equals(inner.country());
    }

    boolean isGrounded(String authoritative, String evidence) {
        if (authoritative == null || authoritative.isBlank() || evidence == null || evidence.isBlank()) {
            return false;
        }
        if (containsIgnoreCase(evidence, authoritative.trim())) {
            return true;
        }
        NormalizedLocation resolved = gazetteer.normalize(authoritative);
        if (resolved.hasCity()) {
            return containsIgnoreCase(evidence, resolved.city())
                    || gazetteer.extractMentions(evidence).mentionsCity(resolved.city());
        }
        // Unknown place: its leading component stands in for the city token
        return containsIgnoreCase(evidence, authoritative.split(",")[0]);
    }

    private LocationCandidate clear(String metadataLocation, LocationCandidate candidate, String override,
                                    String note) {
        LOG.info("Location conflict cleared by {} override: {}", override, note);
        metrics.recordLocationOverride(override);
        return candidate.withNoConflict(metadataLocation == null ? "" : metadataLocation, note);
    }

    private static boolean containsIgnoreCase(String haystack, String needle) {
        if (haystack == null || needle == null || needle.isBlank()) {
            return false;
        }
        return haystack.toLowerCase(Locale.ROOT).contains(needle.trim().toLowerCase(Locale.ROOT));
    }
}
