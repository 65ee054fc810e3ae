package com.phillippitts.jobverdict.domain;

/**
 * Plain-text inputs for evaluating one job against one candidate.
 *
 * @param jobId                optional identifier used only for log correlation
 * @param candidateProfile     candidate CV or profile text
 * @param jobDescription       full job posting text
 * @param metadataLocation     location declared in the job's structured metadata
 */
public record JobEvaluationRequest(
        String jobId,
        String candidateProfile,
        String jobDescription,
        String metadataLocation
) {
}
