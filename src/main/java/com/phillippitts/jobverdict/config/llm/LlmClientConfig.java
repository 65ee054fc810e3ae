package com.phillippitts.jobverdict.config.llm;

import com.phillippitts.jobverdict.config.properties.LlmClientProperties;
import com.phillippitts.jobverdict.service.llm.ConcurrencyGuard;
import com.phillippitts.jobverdict.service.llm.LlmAvailability;
import com.phillippitts.jobverdict.service.llm.LlmEvaluationClient;
import com.phillippitts.jobverdict.service.llm.OllamaEvaluationClient;
import com.phillippitts.jobverdict.service.metrics.VerdictMetricsPublisher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.Semaphore;

/**
 * Wires the LLM endpoint: one shared concurrency guard and two clients that differ only in sampling
 * temperature (creative match runs, near-deterministic location adjudication).
 *
 * <p>Availability is decided once here. A disabled client, or a failed startup probe when
 * {@code llm.client.probe-on-startup=true}, marks the endpoint unavailable and the orchestrators
 * degrade without calling it.
 */
@Configuration
public class LlmClientConfig {

    private static final Logger LOG = LogManager.getLogger(LlmClientConfig.class);

    static final String MATCH_CLIENT = "matchLlmClient";
    static final String ADJUDICATION_CLIENT = "adjudicationLlmClient";

    @Bean
    public ConcurrencyGuard llmConcurrencyGuard(LlmClientProperties props, ApplicationEventPublisher publisher) {
        return new ConcurrencyGuard(new Semaphore(props.getMaxConcurrency()), props.getAcquireTimeoutMs(),
                "llm", publisher);
    }

    @Bean(name = MATCH_CLIENT)
    public LlmEvaluationClient matchLlmClient(LlmClientProperties props,
                                              RestTemplateBuilder restTemplateBuilder,
                                              ConcurrencyGuard llmConcurrencyGuard,
                                              ApplicationEventPublisher publisher,
                                              VerdictMetricsPublisher metrics) {
        return new OllamaEvaluationClient("match", props.getBaseUrl(), props.getModel(),
                props.getMatchTemperature(), props.getTopP(), Duration.ofMillis(props.getConnectTimeoutMs()),
                restTemplateBuilder, llmConcurrencyGuard, publisher, metrics);
    }

    @Bean(name = ADJUDICATION_CLIENT)
    public LlmEvaluationClient adjudicationLlmClient(LlmClientProperties props,
                                                     RestTemplateBuilder restTemplateBuilder,
                                                     ConcurrencyGuard llmConcurrencyGuard,
                                                     ApplicationEventPublisher publisher,
                                                     VerdictMetricsPublisher metrics) {
        return new OllamaEvaluationClient("adjudication", props.getBaseUrl(), props.getModel(),
                props.getAdjudicationTemperature(), props.getTopP(), Duration.ofMillis(props.getConnectTimeoutMs()),
                restTemplateBuilder, llmConcurrencyGuard, publisher, metrics);
    }

    @Bean
    public LlmAvailability llmAvailability(LlmClientProperties props,
                                           @Qualifier(MATCH_CLIENT) LlmEvaluationClient matchLlmClient) {
        if (!props.isEnabled()) {
            LOG.warn("LLM client disabled by configuration (llm.client.enabled=false); results will degrade");
            return LlmAvailability.unavailable("disabled by configuration");
        }
        if (props.isProbeOnStartup() && !matchLlmClient.ping()) {
            LOG.warn("LLM endpoint {} did not answer the startup probe; results will degrade", props.getBaseUrl());
            return LlmAvailability.unavailable("endpoint " + props.getBaseUrl() + " unreachable at startup");
        }
        LOG.info("LLM endpoint {} (model {}) enabled", props.getBaseUrl(), props.getModel());
        return LlmAvailability.ready();
    }
}
