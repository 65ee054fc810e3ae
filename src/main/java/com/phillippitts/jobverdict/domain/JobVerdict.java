package com.phillippitts.jobverdict.domain;

import java.util.Objects;

/**
 * Combined outcome for one job, consumed by downstream reporting.
 */
public record JobVerdict(
        String jobId,
        MatchResult match,
        LocationAnalysis location,
        JobDomainProfile domain
) {

    public JobVerdict {
        Objects.requireNonNull(match, "match must not be null");
        Objects.requireNonNull(location, "location must not be null");
        domain = domain == null ? JobDomainProfile.unclassified() : domain;
    }
}
