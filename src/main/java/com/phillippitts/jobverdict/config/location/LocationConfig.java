package com.phillippitts.jobverdict.config.location;

import com.phillippitts.jobverdict.config.properties.LlmClientProperties;
import com.phillippitts.jobverdict.config.properties.LocationValidationProperties;
import com.phillippitts.jobverdict.service.domaingap.JobDomainClassifier;
import com.phillippitts.jobverdict.service.llm.LlmAvailability;
import com.phillippitts.jobverdict.service.llm.LlmEvaluationClient;
import com.phillippitts.jobverdict.service.location.Gazetteer;
import com.phillippitts.jobverdict.service.location.GazetteerLoader;
import com.phillippitts.jobverdict.service.location.HybridLocationValidator;
import com.phillippitts.jobverdict.service.location.LocationValidator;
import com.phillippitts.jobverdict.service.metrics.VerdictMetricsPublisher;
import com.phillippitts.jobverdict.service.prompt.PromptTemplate;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the gazetteer, the hybrid location validator and the job domain classifier.
 * A missing or malformed gazetteer fails startup.
 */
@Configuration
public class LocationConfig {

    static final String ADJUDICATION_PROMPT = "prompts/location-adjudication.txt";

    @Bean
    public Gazetteer gazetteer(LocationValidationProperties props) {
        return GazetteerLoader.fromClasspath(props.getGazetteerResource());
    }

    @Bean
    public LocationValidator locationValidator(
            @Qualifier("adjudicationLlmClient") LlmEvaluationClient adjudicationLlmClient,
            LlmAvailability llmAvailability,
            Gazetteer gazetteer,
            LocationValidationProperties props,
            LlmClientProperties llmProps,
            VerdictMetricsPublisher metrics) {
        return new HybridLocationValidator(adjudicationLlmClient, llmAvailability,
                PromptTemplate.fromClasspath(ADJUDICATION_PROMPT), gazetteer, props, llmProps.callTimeout(), metrics);
    }

    @Bean
    public JobDomainClassifier jobDomainClassifier() {
        return new JobDomainClassifier();
    }
}
