package com.phillippitts.jobverdict.domain;

import java.util.List;
import java.util.Objects;

/**
 * Industry domain a job description belongs to, with the domain-specific requirements it states.
 *
 * @param primaryDomain       best-scoring domain, or {@link #UNCLASSIFIED}
 * @param domainRequirements  requirement phrases such as "5+ years experience in asset management"
 */
public record JobDomainProfile(String primaryDomain, List<String> domainRequirements) {

    public static final String UNCLASSIFIED = "unclassified";

    public JobDomainProfile {
        Objects.requireNonNull(primaryDomain, "primaryDomain must not be null");
        domainRequirements = domainRequirements == null ? List.of() : List.copyOf(domainRequirements);
    }

    public static JobDomainProfile unclassified() {
        return new JobDomainProfile(UNCLASSIFIED, List.of());
    }
}
