package com.phillippitts.jobverdict.presentation.controller;

import com.phillippitts.jobverdict.domain.JobVerdict;
import com.phillippitts.jobverdict.domain.LocationAnalysis;
import com.phillippitts.jobverdict.domain.MatchResult;
import com.phillippitts.jobverdict.service.JobEvaluationService;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST surface for job evaluation. Bodies are validated at the boundary; failures map to HTTP 400
 * through the global exception handler.
 */
@RestController
@RequestMapping("/api/v1")
class JobEvaluationController {

    private static final Logger LOG = LogManager.getLogger(JobEvaluationController.class);

    private final JobEvaluationService service;

    JobEvaluationController(JobEvaluationService service) {
        this.service = service;
    }

    @PostMapping("/evaluations")
    JobVerdict evaluate(@Valid @RequestBody EvaluationRequest request) {
        LOG.info("Evaluation requested: jobId={}, profileChars={}, descriptionChars={}",
                request.jobId(), request.candidateProfile().length(), request.jobDescription().length());
        return service.evaluate(request.toDomain());
    }

    @PostMapping("/evaluations/match")
    MatchResult evaluateMatch(@Valid @RequestBody MatchRequest request) {
        LOG.info("Match evaluation requested: profileChars={}, descriptionChars={}",
                request.candidateProfile().length(), request.jobDescription().length());
        return service.evaluateMatch(request.candidateProfile(), request.jobDescription());
    }

    @PostMapping("/locations/validate")
    LocationAnalysis validateLocation(@Valid @RequestBody LocationRequest request) {
        LOG.info("Location validation requested: declared='{}'", request.metadataLocation());
        return service.validateLocation(request.metadataLocation(), request.jobDescription());
    }
}
