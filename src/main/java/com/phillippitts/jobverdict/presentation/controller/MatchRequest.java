package com.phillippitts.jobverdict.presentation.controller;

import jakarta.validation.constraints.NotBlank;

public record MatchRequest(
        @NotBlank(message = "candidateProfile must not be blank") String candidateProfile,
        @NotBlank(message = "jobDescription must not be blank") String jobDescription
) {
}
