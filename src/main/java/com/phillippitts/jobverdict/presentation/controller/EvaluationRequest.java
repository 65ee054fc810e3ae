package com.phillippitts.jobverdict.presentation.controller;

import com.phillippitts.jobverdict.domain.JobEvaluationRequest;
import jakarta.validation.constraints.NotBlank;

/**
 * Request body for a full job evaluation.
 */
public record EvaluationRequest(
        String jobId,
        @NotBlank(message = "candidateProfile must not be blank") String candidateProfile,
        @NotBlank(message = "jobDescription must not be blank") String jobDescription,
        String metadataLocation
) {

    JobEvaluationRequest toDomain() {
        return new JobEvaluationRequest(jobId, candidateProfile, jobDescription,
                metadataLocation == null ? "" : metadataLocation);
    }
}
