package com.phillippitts.jobverdict.presentation.controller;

import jakarta.validation.constraints.NotBlank;

public record LocationRequest(
        String metadataLocation,
        @NotBlank(message = "jobDescription must not be blank") String jobDescription
) {
}
