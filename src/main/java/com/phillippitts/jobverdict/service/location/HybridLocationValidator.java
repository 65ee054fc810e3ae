package com.phillippitts.jobverdict.service.location;

import com.phillippitts.jobverdict.config.properties.LocationValidationProperties;
import com.phillippitts.jobverdict.domain.LocationAnalysis;
import com.phillippitts.jobverdict.domain.RiskLevel;
import com.phillippitts.jobverdict.domain.ValidationMethod;
import com.phillippitts.jobverdict.service.llm.LlmAvailability;
import com.phillippitts.jobverdict.service.llm.LlmEvaluationClient;
import com.phillippitts.jobverdict.service.metrics.VerdictMetricsPublisher;
import com.phillippitts.jobverdict.service.prompt.LocationAdjudicationPrompt;
import com.phillippitts.jobverdict.service.prompt.PromptTemplate;
import com.phillippitts.jobverdict.util.LogSanitizer;
import com.phillippitts.jobverdict.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Two-phase location validator.
 *
 * <p><b>Phase 1</b> runs the deterministic {@link GazetteerLocationCheck}. Verdicts at or above the
 * configured confidence threshold are final.
 *
 * <p><b>Phase 2</b> asks the LLM to adjudicate, sending the declared location, the gazetteer's note and
 * a truncated excerpt of the description. Complete answers get confidence 0.75; incomplete answers
 * keep the declared location at 0.6. Any failure (endpoint unavailable, transport error, unexpected
 * exception) yields an {@link ValidationMethod#ERROR_FALLBACK} verdict that trusts the declared location.
 *
 * <p>Every reported conflict passes through {@link LocationSafetyOverrides} before its risk is graded.
 */
public final class HybridLocationValidator implements LocationValidator {

    private static final Logger LOG = LogManager.getLogger(HybridLocationValidator.class);

    static final double ADJUDICATED_CONFIDENCE = 0.75;
    static final double INCOMPLETE_ANSWER_CONFIDENCE = 0.6;

    private static final int LOG_PREVIEW_CHARS = 120;

    private final LlmEvaluationClient client;
    private final LlmAvailability availability;
    private final PromptTemplate template;
    private final GazetteerLocationCheck gazetteerCheck;
    private final LocationSafetyOverrides overrides;
    private final RiskClassifier riskClassifier;
    private final LocationValidationProperties props;
    private final Duration callTimeout;
    private final VerdictMetricsPublisher metrics;

    public HybridLocationValidator(LlmEvaluationClient client,
                                   LlmAvailability availability,
                                   PromptTemplate template,
                                   Gazetteer gazetteer,
                                   LocationValidationProperties props,
                                   Duration callTimeout,
                                   VerdictMetricsPublisher metrics) {
        this.client = Objects.requireNonNull(client, "client");
        this.availability = Objects.requireNonNull(availability, "availability");
        this.template = Objects.requireNonNull(template, "template").requireSlots(LocationAdjudicationPrompt.SLOTS);
        Objects.requireNonNull(gazetteer, "gazetteer");
        this.props = Objects.requireNonNull(props, "props");
        this.callTimeout = Objects.requireNonNull(callTimeout, "callTimeout");
        this.metrics = metrics == null ? VerdictMetricsPublisher.NOOP : metrics;
        this.gazetteerCheck = new GazetteerLocationCheck(gazetteer);
        this.overrides = new LocationSafetyOverrides(gazetteer, this.metrics);
        this.riskClassifier = new RiskClassifier(gazetteer);
    }

    @Override
    public LocationAnalysis validate(String metadataLocation, String jobDescription) {
        long t0 = System.nanoTime();
        String declared = metadataLocation == null ? "" : metadataLocation.trim();
        String body = jobDescription == null ? "" : jobDescription;

        GazetteerLocationCheck.Verdict phase1 = gazetteerCheck.check(declared, body);
        LocationAnalysis analysis;
        if (phase1.confidence() >= props.getGazetteerConfidenceThreshold()) {
            LocationCandidate candidate = new LocationCandidate(phase1.authoritativeLocation(),
                    phase1.conflictDetected(), phase1.confidence(), ValidationMethod.GAZETTEER,
                    phase1.reasoning(), "");
            analysis = finish(declared, overrides.apply(declared, body, candidate, false),
                    phase1.extractedLocations());
        } else {
            analysis = adjudicate(declared, body, phase1);
        }

        metrics.recordLocationAnalysis(analysis);
        LOG.info("Location validation: declared='{}', authoritative='{}', conflict={}, risk={}, method={}, "
                        + "confidence={} ({} ms)",
                declared, analysis.authoritativeLocation(), analysis.conflictDetected(), analysis.riskLevel(),
                analysis.method(), analysis.confidence(), TimeUtils.elapsedMillis(t0));
        return analysis;
    }

    private LocationAnalysis adjudicate(String declared, String body, GazetteerLocationCheck.Verdict phase1) {
        List<String> extracted = phase1.extractedLocations();
        if (!availability.available()) {
            LOG.warn("Gazetteer confidence {} below threshold but LLM unavailable: {}",
                    phase1.confidence(), availability.reason());
            return LocationAnalysis.errorFallback(declared, "llm unavailable: " + availability.reason(), extracted);
        }
        try {
            String prompt = new LocationAdjudicationPrompt(declared, phase1.reasoning(),
                    LogSanitizer.truncate(body, props.getExcerptLength())).render(template);
            String response = client.evaluate(prompt, callTimeout);
            AdjudicationResponseParser.Answer answer = AdjudicationResponseParser.parse(response);

            if (!answer.isComplete()) {
                LOG.debug("Incomplete adjudication answer: '{}'", LogSanitizer.preview(response, LOG_PREVIEW_CHARS));
                return LocationAnalysis.noConflict(declared, INCOMPLETE_ANSWER_CONFIDENCE,
                        ValidationMethod.LLM_ADJUDICATED,
                        "Adjudication answer incomplete; declared location kept. " + answer.reasoningOrEmpty(),
                        extracted);
            }
            String authoritative = answer.conflict() ? answer.location() : declared;
            LocationCandidate candidate = new LocationCandidate(authoritative, answer.conflict(),
                    ADJUDICATED_CONFIDENCE, ValidationMethod.LLM_ADJUDICATED, answer.reasoningOrEmpty(), "");
            return finish(declared, overrides.apply(declared, body, candidate, true), extracted);
        } catch (RuntimeException e) {
            LOG.warn("Location adjudication failed, declared location trusted: {}", e.getMessage());
            return LocationAnalysis.errorFallback(declared, String.valueOf(e.getMessage()), extracted);
        }
    }

    private LocationAnalysis finish(String declared, LocationCandidate candidate, List<String> extracted) {
        RiskLevel risk = riskClassifier.classify(candidate.conflictDetected(), declared,
                candidate.authoritativeLocation());
        return new LocationAnalysis(declared, candidate.authoritativeLocation(), candidate.conflictDetected(),
                candidate.confidence(), risk, candidate.method(), candidate.reasoning(), extracted);
    }
}
