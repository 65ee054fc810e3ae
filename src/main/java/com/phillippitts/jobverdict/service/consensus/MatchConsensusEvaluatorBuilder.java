package com.phillippitts.jobverdict.service.consensus;

import com.phillippitts.jobverdict.config.properties.ConsensusProperties;
import com.phillippitts.jobverdict.service.domaingap.DomainGapAnalyzer;
import com.phillippitts.jobverdict.service.llm.LlmAvailability;
import com.phillippitts.jobverdict.service.llm.LlmEvaluationClient;
import com.phillippitts.jobverdict.service.metrics.VerdictMetricsPublisher;
import com.phillippitts.jobverdict.service.prompt.MatchPrompt;
import com.phillippitts.jobverdict.service.prompt.PromptTemplate;

import java.time.Duration;
import java.util.Objects;

/**
 * Builder for {@link DefaultMatchConsensusEvaluator}.
 *
 * <pre>{@code
 * MatchConsensusEvaluator evaluator = MatchConsensusEvaluatorBuilder.builder()
 *     .client(matchClient)
 *     .template(PromptTemplate.fromClasspath("prompts/cv-match.txt"))
 *     .properties(consensusProperties)
 *     .callTimeout(Duration.ofSeconds(30))
 *     .strategy(new ParallelRunExecutionStrategy(executor, Duration.ofMinutes(5)))
 *     .availability(availability)
 *     .metrics(metricsPublisher)
 *     .build();
 * }</pre>
 *
 * <p>Required: client, template, properties, callTimeout. Defaults: sequential strategy,
 * {@link LowestMatchWinsPolicy}, endpoint available, no-op metrics.
 */
public final class MatchConsensusEvaluatorBuilder {

    private LlmEvaluationClient client;
    private PromptTemplate template;
    private ConsensusProperties properties;
    private Duration callTimeout;

    private LlmAvailability availability = LlmAvailability.ready();
    private RunExecutionStrategy strategy = new SequentialRunExecutionStrategy();
    private ConsensusPolicy policy = new LowestMatchWinsPolicy();
    private DomainGapAnalyzer analyzer = new DomainGapAnalyzer();
    private VerdictMetricsPublisher metrics = VerdictMetricsPublisher.NOOP;

    private MatchConsensusEvaluatorBuilder() {
    }

    public static MatchConsensusEvaluatorBuilder builder() {
        return new MatchConsensusEvaluatorBuilder();
    }

    public MatchConsensusEvaluatorBuilder client(LlmEvaluationClient client) {
        this.client = client;
        return this;
    }

    /**
     * @param template match prompt; must declare exactly the {@link MatchPrompt#SLOTS} slots
     */
    public MatchConsensusEvaluatorBuilder template(PromptTemplate template) {
        this.template = template;
        return this;
    }

    public MatchConsensusEvaluatorBuilder properties(ConsensusProperties properties) {
        this.properties = properties;
        return this;
    }

    public MatchConsensusEvaluatorBuilder callTimeout(Duration callTimeout) {
        this.callTimeout = callTimeout;
        return this;
    }

    public MatchConsensusEvaluatorBuilder availability(LlmAvailability availability) {
        this.availability = availability;
        return this;
    }

    public MatchConsensusEvaluatorBuilder strategy(RunExecutionStrategy strategy) {
        this.strategy = strategy;
        return this;
    }

    public MatchConsensusEvaluatorBuilder policy(ConsensusPolicy policy) {
        this.policy = policy;
        return this;
    }

    public MatchConsensusEvaluatorBuilder analyzer(DomainGapAnalyzer analyzer) {
        this.analyzer = analyzer;
        return this;
    }

    public MatchConsensusEvaluatorBuilder metrics(VerdictMetricsPublisher metrics) {
        this.metrics = metrics;
        return this;
    }

    /**
     * @throws NullPointerException if a required dependency is missing
     * @throws com.phillippitts.jobverdict.exception.PromptTemplateException if the template's slots do not fit
     */
    public MatchConsensusEvaluator build() {
        Objects.requireNonNull(client, "client is required");
        Objects.requireNonNull(template, "template is required");
        Objects.requireNonNull(properties, "properties is required");
        Objects.requireNonNull(callTimeout, "callTimeout is required");
        template.requireSlots(MatchPrompt.SLOTS);
        return new DefaultMatchConsensusEvaluator(
                client,
                Objects.requireNonNull(availability, "availability"),
                template,
                Objects.requireNonNull(strategy, "strategy"),
                Objects.requireNonNull(policy, "policy"),
                Objects.requireNonNull(analyzer, "analyzer"),
                properties,
                callTimeout,
                metrics == null ? VerdictMetricsPublisher.NOOP : metrics);
    }
}
