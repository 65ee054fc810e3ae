package com.phillippitts.jobverdict.config.consensus;

import com.phillippitts.jobverdict.config.properties.ConsensusProperties;
import com.phillippitts.jobverdict.config.properties.LlmClientProperties;
import com.phillippitts.jobverdict.service.consensus.ConsensusPolicy;
import com.phillippitts.jobverdict.service.consensus.LowestMatchWinsPolicy;
import com.phillippitts.jobverdict.service.consensus.MatchConsensusEvaluator;
import com.phillippitts.jobverdict.service.consensus.MatchConsensusEvaluatorBuilder;
import com.phillippitts.jobverdict.service.consensus.ParallelRunExecutionStrategy;
import com.phillippitts.jobverdict.service.consensus.RunExecutionStrategy;
import com.phillippitts.jobverdict.service.consensus.SequentialRunExecutionStrategy;
import com.phillippitts.jobverdict.service.domaingap.DomainGapAnalyzer;
import com.phillippitts.jobverdict.service.llm.LlmAvailability;
import com.phillippitts.jobverdict.service.llm.LlmEvaluationClient;
import com.phillippitts.jobverdict.service.metrics.VerdictMetricsPublisher;
import com.phillippitts.jobverdict.service.prompt.PromptTemplate;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Wires the match consensus evaluator. The run execution strategy is chosen from
 * {@code evaluation.consensus.execution}.
 */
@Configuration
public class ConsensusConfig {

    static final String MATCH_PROMPT = "prompts/cv-match.txt";

    @Bean
    public DomainGapAnalyzer domainGapAnalyzer() {
        return new DomainGapAnalyzer();
    }

    @Bean
    public ConsensusPolicy consensusPolicy() {
        return new LowestMatchWinsPolicy();
    }

    @Bean
    public RunExecutionStrategy runExecutionStrategy(ConsensusProperties props,
                                                     @Qualifier("evaluationExecutor") Executor evaluationExecutor) {
        switch (props.getExecution()) {
            case SEQUENTIAL:
                return new SequentialRunExecutionStrategy();
            case PARALLEL:
                return new ParallelRunExecutionStrategy(evaluationExecutor,
                        Duration.ofMillis(props.getOverallTimeoutMs()));
            default:
                throw new IllegalStateException("Unsupported execution: " + props.getExecution());
        }
    }

    @Bean
    public MatchConsensusEvaluator matchConsensusEvaluator(
            @Qualifier("matchLlmClient") LlmEvaluationClient matchLlmClient,
            LlmAvailability llmAvailability,
            ConsensusProperties props,
            LlmClientProperties llmProps,
            RunExecutionStrategy runExecutionStrategy,
            ConsensusPolicy consensusPolicy,
            DomainGapAnalyzer domainGapAnalyzer,
            VerdictMetricsPublisher metrics) {
        return MatchConsensusEvaluatorBuilder.builder()
                .client(matchLlmClient)
                .availability(llmAvailability)
                .template(PromptTemplate.fromClasspath(MATCH_PROMPT))
                .properties(props)
                .callTimeout(llmProps.callTimeout())
                .strategy(runExecutionStrategy)
                .policy(consensusPolicy)
                .analyzer(domainGapAnalyzer)
                .metrics(metrics)
                .build();
    }
}
