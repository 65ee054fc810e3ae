package com.phillippitts.jobverdict.service.consensus;

import com.phillippitts.jobverdict.config.properties.ConsensusProperties;
import com.phillippitts.jobverdict.domain.ContentType;
import com.phillippitts.jobverdict.domain.DomainGapReport;
import com.phillippitts.jobverdict.domain.EvaluationRun;
import com.phillippitts.jobverdict.domain.MatchAdjustment;
import com.phillippitts.jobverdict.domain.MatchLevel;
import com.phillippitts.jobverdict.domain.MatchResult;
import com.phillippitts.jobverdict.exception.EvaluationCancelledException;
import com.phillippitts.jobverdict.exception.TransportException;
import com.phillippitts.jobverdict.service.domaingap.DomainGapAnalyzer;
import com.phillippitts.jobverdict.service.extraction.Extraction;
import com.phillippitts.jobverdict.service.extraction.NarrativeExtraction;
import com.phillippitts.jobverdict.service.extraction.ResponseTextExtractor;
import com.phillippitts.jobverdict.service.llm.LlmAvailability;
import com.phillippitts.jobverdict.service.llm.LlmEvaluationClient;
import com.phillippitts.jobverdict.service.metrics.VerdictMetricsPublisher;
import com.phillippitts.jobverdict.service.prompt.MatchPrompt;
import com.phillippitts.jobverdict.service.prompt.PromptTemplate;
import com.phillippitts.jobverdict.util.LogSanitizer;
import com.phillippitts.jobverdict.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.BooleanSupplier;

/**
 * Default consensus evaluator.
 *
 * <p><b>Workflow:</b>
 * <ol>
 *   <li>Render the match prompt once; every attempt appends a fresh nonce line so the inference
 *       layer cannot serve a cached answer</li>
 *   <li>Execute the configured number of logical runs through the {@link RunExecutionStrategy}; a run
 *       without an extractable level is retried up to the configured attempt count</li>
 *   <li>Combine the extracted levels with the {@link ConsensusPolicy}</li>
 *   <li>Take the first run (by index) at the final level as representative and extract its assessment
 *       and narrative or rationale</li>
 *   <li>Apply domain-gap corrections to a Good verdict, then the content-mismatch correction</li>
 *   <li>Replace missing or near-empty content with a generic text</li>
 * </ol>
 *
 * <p>Corrections only ever lower the level, and whenever the level leaves Good any narrative is
 * replaced by rationale text.
 *
 * @see MatchConsensusEvaluatorBuilder
 */
public final class DefaultMatchConsensusEvaluator implements MatchConsensusEvaluator {

    private static final Logger LOG = LogManager.getLogger(DefaultMatchConsensusEvaluator.class);

    private static final int LOG_PREVIEW_CHARS = 120;

    private final LlmEvaluationClient client;
    private final LlmAvailability availability;
    private final PromptTemplate template;
    private final RunExecutionStrategy strategy;
    private final ConsensusPolicy policy;
    private final DomainGapAnalyzer analyzer;
    private final ConsensusProperties props;
    private final Duration callTimeout;
    private final VerdictMetricsPublisher metrics;

    // Package-private: use MatchConsensusEvaluatorBuilder
    DefaultMatchConsensusEvaluator(LlmEvaluationClient client,
                                   LlmAvailability availability,
                                   PromptTemplate template,
                                   RunExecutionStrategy strategy,
                                   ConsensusPolicy policy,
                                   DomainGapAnalyzer analyzer,
                                   ConsensusProperties props,
                                   Duration callTimeout,
                                   VerdictMetricsPublisher metrics) {
        this.client = client;
        this.availability = availability;
        this.template = template;
        this.strategy = strategy;
        this.policy = policy;
        this.analyzer = analyzer;
        this.props = props;
        this.callTimeout = callTimeout;
        this.metrics = metrics;
    }

    @Override
    public MatchResult evaluate(String candidateProfile, String jobDescription) {
        long t0 = System.nanoTime();
        String prompt = new MatchPrompt(candidateProfile, jobDescription).render(template);

        List<EvaluationRun> runs;
        if (!availability.available()) {
            LOG.warn("LLM unavailable ({}); recording {} failed runs", availability.reason(), props.getRuns());
            runs = strategy.execute(props.getRuns(),
                    (i, abandoned) -> EvaluationRun.failed("", i, 0, 0, "llm unavailable: " + availability.reason()));
        } else {
            runs = strategy.execute(props.getRuns(), (i, abandoned) -> executeRun(prompt, i, abandoned));
        }

        MatchResult result = combine(runs);
        metrics.recordMatchResult(result);
        if (result.hasError()) {
            LOG.warn("Match evaluation failed: no level extracted from {} runs ({} ms)",
                    runs.size(), TimeUtils.elapsedMillis(t0));
        } else {
            LOG.info("Match evaluation: level={}, adjustment={}, extractedRuns={}/{}, strategy={}, policy={} ({} ms)",
                    result.finalMatchLevel(), result.adjustment(), result.extractedRunCount(), runs.size(),
                    strategy.name(), policy.name(), TimeUtils.elapsedMillis(t0));
        }
        return result;
    }

    /**
     * Executes one logical run, retrying with a fresh nonce until a level is extracted or attempts run out.
     * No attempt starts once {@code abandoned} reports true.
     */
    EvaluationRun executeRun(String prompt, int runIndex, BooleanSupplier abandoned) {
        EvaluationRun last = null;
        for (int attempt = 0; attempt < props.getRetriesPerRun(); attempt++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new EvaluationCancelledException("Run " + runIndex + " cancelled before attempt " + attempt);
            }
            if (abandoned.getAsBoolean()) {
                LOG.debug("Run {} abandoned before attempt {}", runIndex, attempt);
                return last != null ? last : EvaluationRun.failed("", runIndex, attempt, 0, "abandoned");
            }
            if (attempt > 0) {
                metrics.recordExtractionRetry();
            }
            long t0 = System.nanoTime();
            String response;
            try {
                response = client.evaluate(withNonce(prompt, runIndex, attempt), callTimeout);
            } catch (TransportException e) {
                last = EvaluationRun.failed("", runIndex, attempt, TimeUtils.elapsedMillis(t0), e.getMessage());
                LOG.debug("Run {} attempt {} transport failure: {}", runIndex, attempt, e.getMessage());
                continue;
            }

            long ms = TimeUtils.elapsedMillis(t0);
            Extraction<MatchLevel> level = ResponseTextExtractor.extractMatchLevel(response);
            if (level.isFound()) {
                return EvaluationRun.extracted(response, level.value(), runIndex, attempt, ms);
            }
            LOG.debug("Run {} attempt {} had no match level: '{}'", runIndex, attempt,
                    LogSanitizer.preview(response, LOG_PREVIEW_CHARS));
            last = EvaluationRun.failed(response, runIndex, attempt, ms, "no match level in response");
        }
        metrics.recordFailedRun();
        return last;
    }

    MatchResult combine(List<EvaluationRun> runs) {
        List<MatchLevel> levels = runs.stream()
                .filter(EvaluationRun::hasMatchLevel)
                .map(EvaluationRun::extractedMatchLevel)
                .toList();
        Optional<MatchLevel> consensus = policy.resolve(levels);
        if (consensus.isEmpty()) {
            return MatchResult.extractionFailure(runs);
        }

        MatchLevel level = consensus.get();
        EvaluationRun representative = runs.stream()
                .filter(r -> r.extractedMatchLevel() == level)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No run at consensus level " + level));

        String assessment = ResponseTextExtractor.extractDomainAssessment(representative.rawText()).orElse("");
        Extraction<NarrativeExtraction> content =
                ResponseTextExtractor.extractNarrativeOrRationale(representative.rawText(), level);
        DomainGapReport gap = analyzer.analyze(assessment);

        MatchLevel finalLevel = level;
        String text = content.map(NarrativeExtraction::text).orElse("");
        MatchAdjustment adjustment = MatchAdjustment.NONE;

        if (level == MatchLevel.GOOD) {
            if (isCriticalGap(gap)) {
                finalLevel = MatchLevel.LOW;
                text = MatchContentTexts.GAP_RATIONALE_PREFIX + assessment;
                adjustment = MatchAdjustment.DOMAIN_GAP_TO_LOW;
            } else if (gap.hasModerateSignals()) {
                finalLevel = MatchLevel.MODERATE;
                text = MatchContentTexts.SIGNALS_RATIONALE_PREFIX + assessment;
                adjustment = MatchAdjustment.DOMAIN_SIGNALS_TO_MODERATE;
            } else if (content.isFound() && content.value().mismatch()) {
                // Good verdict explained with a rationale: trust the rationale, not the label
                finalLevel = MatchLevel.MODERATE;
                adjustment = MatchAdjustment.CONTENT_MISMATCH_TO_MODERATE;
            }
            if (adjustment != MatchAdjustment.NONE) {
                LOG.info("Downgraded Good to {} ({}); gap severity={}, density={}%",
                        finalLevel, adjustment, gap.severity(), String.format("%.1f", gap.requirementDensityPct()));
            }
        }

        if (text.trim().length() < props.getMinContentLength()) {
            text = ContentType.forLevel(finalLevel) == ContentType.APPLICATION_NARRATIVE
                    ? MatchContentTexts.FALLBACK_NARRATIVE
                    : MatchContentTexts.FALLBACK_RATIONALE;
        }
        return MatchResult.of(finalLevel, assessment, text, runs, gap, adjustment);
    }

    private boolean isCriticalGap(DomainGapReport gap) {
        return gap.severity() >= props.getSeverityThreshold()
                || gap.requirementDensityPct() > props.getDensityThresholdPct()
                || gap.mentionsGap();
    }

    private static String withNonce(String prompt, int runIndex, int attempt) {
        String nonce = UUID.randomUUID().toString().substring(0, 8);
        return prompt + "\n\n# Internal: Run ID: " + (runIndex + 1) + "-" + attempt + "-" + nonce;
    }
}
