package com.phillippitts.jobverdict.service;

import com.phillippitts.jobverdict.domain.JobDomainProfile;
import com.phillippitts.jobverdict.domain.JobEvaluationRequest;
import com.phillippitts.jobverdict.domain.JobVerdict;
import com.phillippitts.jobverdict.domain.LocationAnalysis;
import com.phillippitts.jobverdict.domain.MatchResult;
import com.phillippitts.jobverdict.exception.EvaluationCancelledException;
import com.phillippitts.jobverdict.exception.InvalidJobInputException;
import com.phillippitts.jobverdict.service.consensus.MatchConsensusEvaluator;
import com.phillippitts.jobverdict.service.domaingap.JobDomainClassifier;
import com.phillippitts.jobverdict.service.location.LocationValidator;
import com.phillippitts.jobverdict.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

/**
 * Entry point for evaluating one job against one candidate.
 *
 * <p>Location validation is submitted to the job executor while the consensus evaluation runs on the
 * calling thread; the two are independent and a failure in one never changes the other's result.
 * Domain classification is cheap and runs inline.
 */
@Service
public class JobEvaluationService {

    private static final Logger LOG = LogManager.getLogger(JobEvaluationService.class);

    static final String JOB_ID_KEY = "jobId";

    private final MatchConsensusEvaluator matchEvaluator;
    private final LocationValidator locationValidator;
    private final JobDomainClassifier domainClassifier;
    private final Executor jobExecutor;

    public JobEvaluationService(MatchConsensusEvaluator matchEvaluator,
                                LocationValidator locationValidator,
                                JobDomainClassifier domainClassifier,
                                @Qualifier("jobExecutor") Executor jobExecutor) {
        this.matchEvaluator = matchEvaluator;
        this.locationValidator = locationValidator;
        this.domainClassifier = domainClassifier;
        this.jobExecutor = jobExecutor;
    }

    /**
     * Runs match consensus, location validation and domain classification for one job.
     *
     * @throws InvalidJobInputException if the candidate profile or job description is blank
     * @throws EvaluationCancelledException if the calling thread is interrupted
     */
    public JobVerdict evaluate(JobEvaluationRequest request) {
        if (request == null) {
            throw new InvalidJobInputException("request", "must not be null");
        }
        requireText("candidateProfile", request.candidateProfile());
        requireText("jobDescription", request.jobDescription());

        String previousJobId = ThreadContext.get(JOB_ID_KEY);
        if (request.jobId() != null && !request.jobId().isBlank()) {
            ThreadContext.put(JOB_ID_KEY, request.jobId());
        }
        long t0 = System.nanoTime();
        try {
            CompletableFuture<LocationAnalysis> location = CompletableFuture.supplyAsync(
                    () -> locationValidator.validate(request.metadataLocation(), request.jobDescription()),
                    jobExecutor);

            MatchResult match;
            try {
                match = matchEvaluator.evaluate(request.candidateProfile(), request.jobDescription());
            } catch (RuntimeException e) {
                location.cancel(true);
                throw e;
            }
            LocationAnalysis locationAnalysis = awaitLocation(location, request.metadataLocation());
            JobDomainProfile domain = domainClassifier.classify(request.jobDescription());

            LOG.info("Job evaluated: match={}, locationConflict={}, risk={}, domain={} ({} ms)",
                    match.hasError() ? match.error() : match.finalMatchLevel(),
                    locationAnalysis.conflictDetected(), locationAnalysis.riskLevel(), domain.primaryDomain(),
                    TimeUtils.elapsedMillis(t0));
            return new JobVerdict(request.jobId(), match, locationAnalysis, domain);
        } finally {
            if (previousJobId == null) {
                ThreadContext.remove(JOB_ID_KEY);
            } else {
                ThreadContext.put(JOB_ID_KEY, previousJobId);
            }
        }
    }

    public MatchResult evaluateMatch(String candidateProfile, String jobDescription) {
        requireText("candidateProfile", candidateProfile);
        requireText("jobDescription", jobDescription);
        return matchEvaluator.evaluate(candidateProfile, jobDescription);
    }

    public LocationAnalysis validateLocation(String metadataLocation, String jobDescription) {
        requireText("jobDescription", jobDescription);
        return locationValidator.validate(metadataLocation, jobDescription);
    }

    private static LocationAnalysis awaitLocation(CompletableFuture<LocationAnalysis> future, String metadataLocation) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new EvaluationCancelledException("Interrupted while waiting for location validation", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            LOG.warn("Location validation failed unexpectedly: {}", cause.toString());
            return LocationAnalysis.errorFallback(metadataLocation, cause.toString(), List.of());
        }
    }

    private static void requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidJobInputException(field, "must not be blank");
        }
    }
}
