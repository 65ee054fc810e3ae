package com.phillippitts.jobverdict.service.location;

import com.phillippitts.jobverdict.config.properties.LocationValidationProperties;
import com.phillippitts.jobverdict.domain.LocationAnalysis;
import com.phillippitts.jobverdict.domain.RiskLevel;
import com.phillippitts.jobverdict.domain.ValidationMethod;
import com.phillippitts.jobverdict.service.llm.LlmAvailability;
import com.phillippitts.jobverdict.service.metrics.VerdictMetrics;
import com.phillippitts.jobverdict.service.metrics.VerdictMetricsPublisher;
import com.phillippitts.jobverdict.service.prompt.PromptTemplate;
import com.phillippitts.jobverdict.testutil.ScriptedLlmClient;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class HybridLocationValidatorTest {

    private static final Gazetteer GAZETTEER = GazetteerLoader.fromClasspath("gazetteer.json");
    private static final PromptTemplate TEMPLATE = PromptTemplate.fromClasspath("prompts/location-adjudication.txt");

    private static final String PUNE_POSTING = """
            We are hiring a Senior Java Engineer for our Pune delivery centre.
            The Pune team owns the settlement platform, and you will work on site in Pune three days a week.
            """;

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();

    @Test
    void declaredCityContradictedByDescriptionIsCriticalConflict() {
        ScriptedLlmClient client = ScriptedLlmClient.responding("unused");

        LocationAnalysis analysis = validator(client).validate("Frankfurt", PUNE_POSTING);

        assertThat(analysis.conflictDetected()).isTrue();
        assertThat(analysis.authoritativeLocation()).contains("Pune");
        assertThat(analysis.riskLevel()).isEqualTo(RiskLevel.CRITICAL);
        assertThat(analysis.method()).isEqualTo(ValidationMethod.GAZETTEER);
        assertThat(analysis.confidence()).isEqualTo(0.85);
        assertThat(analysis.extractedLocations()).contains("Pune");
        assertThat(client.calls()).isZero();
    }

    @Test
    void variantSpellingOfDeclaredCityConfirmsIt() {
        LocationAnalysis analysis = validator(ScriptedLlmClient.responding("unused"))
                .validate("Berlin, Germany", "Join our team in Berlin-Mitte, close to Alexanderplatz.");

        assertThat(analysis.conflictDetected()).isFalse();
        assertThat(analysis.confidence()).isGreaterThanOrEqualTo(0.9);
        assertThat(analysis.riskLevel()).isEqualTo(RiskLevel.NONE);
        assertThat(analysis.authoritativeLocation()).isEqualTo("Berlin, Germany");

        LocationAnalysis munich = validator(ScriptedLlmClient.responding("unused"))
                .validate("München", "The Munich office is next to the English Garden.");
        assertThat(munich.conflictDetected()).isFalse();
    }

    @Test
    void lowConfidenceIsAdjudicatedByLlm() {
        ScriptedLlmClient client = ScriptedLlmClient.responding("""
                CONFLICT: YES
                LOCATION: Eschweiler, Germany
                REASONING: The excerpt says the role is based in Eschweiler.
                """);

        LocationAnalysis analysis = validator(client)
                .validate("Remote", "The role is based in Eschweiler near Aachen.");

        assertThat(analysis.method()).isEqualTo(ValidationMethod.LLM_ADJUDICATED);
        assertThat(analysis.conflictDetected()).isTrue();
        assertThat(analysis.authoritativeLocation()).isEqualTo("Eschweiler, Germany");
        assertThat(analysis.confidence()).isEqualTo(0.75);
        assertThat(analysis.riskLevel()).isEqualTo(RiskLevel.LOW);
        assertThat(client.calls()).isEqualTo(1);
        assertThat(client.prompts().get(0))
                .contains("Declared location: Remote")
                .contains("based in Eschweiler");
    }

    @Test
    void adjudicatedNoConflictKeepsDeclaredLocation() {
        ScriptedLlmClient client = ScriptedLlmClient.responding(
                "CONFLICT: NO\nLOCATION: Berlin\nREASONING: Eschweiler is only a client site.");

        LocationAnalysis analysis = validator(client)
                .validate("Berlin", "Regular visits to a client site in Eschweiler.");

        assertThat(analysis.conflictDetected()).isFalse();
        assertThat(analysis.authoritativeLocation()).isEqualTo("Berlin");
        assertThat(analysis.confidence()).isEqualTo(0.75);
        assertThat(analysis.riskLevel()).isEqualTo(RiskLevel.NONE);
    }

    @Test
    void ungroundedAdjudicationIsOverridden() {
        ScriptedLlmClient client = ScriptedLlmClient.responding(
                "CONFLICT: YES\nLOCATION: Paris\nREASONING: The company is expanding.");

        LocationAnalysis analysis = validator(client)
                .validate("Remote", "The role is based in Eschweiler.");

        assertThat(analysis.conflictDetected()).isFalse();
        assertThat(analysis.authoritativeLocation()).isEqualTo("Remote");
        assertThat(analysis.riskLevel()).isEqualTo(RiskLevel.NONE);
        assertThat(analysis.reasoning()).contains("(override: ");
    }

    @Test
    void sameCityAdjudicationIsOverridden() {
        ScriptedLlmClient client = ScriptedLlmClient.responding(
                "CONFLICT: YES\nLOCATION: München\nREASONING: Schwabing is a district of München.");

        LocationAnalysis analysis = validator(client).validate("Munich", "Office based in Schwabing.");

        assertThat(analysis.conflictDetected()).isFalse();
        assertThat(analysis.authoritativeLocation()).isEqualTo("Munich");
    }

    @Test
    void declaredCountryContainingTheMentionedCityIsNotAConflict() {
        ScriptedLlmClient client = ScriptedLlmClient.responding(
                "CONFLICT: YES\nLOCATION: Germany\nREASONING: The role is in Germany.");

        LocationAnalysis analysis = validator(client).validate("Deutschland", "Our office in Berlin is hiring.");

        assertThat(analysis.conflictDetected()).isFalse();
        assertThat(analysis.authoritativeLocation()).isEqualTo("Deutschland");
        assertThat(analysis.riskLevel()).isEqualTo(RiskLevel.NONE);
    }

    @Test
    void declaredLocationPresentInDescriptionOverridesAdjudicatedConflict() {
        ScriptedLlmClient client = ScriptedLlmClient.responding(
                "CONFLICT: YES\nLOCATION: Aachen\nREASONING: Travel to Aachen is mentioned.");

        LocationAnalysis analysis = validator(client)
                .validate("Eschweiler", "Office in Eschweiler. Some travel to Aachen.");

        assertThat(analysis.conflictDetected()).isFalse();
        assertThat(analysis.authoritativeLocation()).isEqualTo("Eschweiler");
        assertThat(registry.find("jobverdict.location.override")
                .tag("override", LocationSafetyOverrides.DECLARED_IN_DESCRIPTION).counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void incompleteAnswerKeepsDeclaredLocation() {
        LocationAnalysis analysis = validator(ScriptedLlmClient.responding("I think it's fine."))
                .validate("Remote", "The role is based in Eschweiler.");

        assertThat(analysis.conflictDetected()).isFalse();
        assertThat(analysis.confidence()).isEqualTo(0.6);
        assertThat(analysis.method()).isEqualTo(ValidationMethod.LLM_ADJUDICATED);
        assertThat(analysis.reasoning()).startsWith("Adjudication answer incomplete");
    }

    @Test
    void transportFailureFallsBackToDeclaredLocation() {
        LocationAnalysis analysis = validator(ScriptedLlmClient.failing("connection refused"))
                .validate("Remote", "The role is based in Eschweiler.");

        assertThat(analysis.method()).isEqualTo(ValidationMethod.ERROR_FALLBACK);
        assertThat(analysis.conflictDetected()).isFalse();
        assertThat(analysis.confidence()).isZero();
        assertThat(analysis.authoritativeLocation()).isEqualTo("Remote");
        assertThat(analysis.reasoning()).contains("Validation failed").contains("connection refused");
        assertThat(analysis.extractedLocations()).containsExactly("Eschweiler");
    }

    @Test
    void unavailableEndpointSkipsAdjudication() {
        ScriptedLlmClient client = ScriptedLlmClient.responding("unused");
        HybridLocationValidator validator = new HybridLocationValidator(client,
                LlmAvailability.unavailable("disabled by configuration"), TEMPLATE, GAZETTEER,
                LocationValidationProperties.defaults(), Duration.ofSeconds(5), VerdictMetricsPublisher.NOOP);

        LocationAnalysis analysis = validator.validate("Remote", "The role is based in Eschweiler.");

        assertThat(analysis.method()).isEqualTo(ValidationMethod.ERROR_FALLBACK);
        assertThat(analysis.reasoning()).contains("disabled by configuration");
        assertThat(client.calls()).isZero();
    }

    @Test
    void excerptSentToAdjudicatorIsTruncated() {
        ScriptedLlmClient client = ScriptedLlmClient.responding("CONFLICT: NO\nLOCATION: Remote\nREASONING: ok");
        HybridLocationValidator validator = new HybridLocationValidator(client, LlmAvailability.ready(),
                TEMPLATE, GAZETTEER, new LocationValidationProperties(null, 100, null), Duration.ofSeconds(5),
                VerdictMetricsPublisher.NOOP);
        String body = "The role is based in Eschweiler. " + "filler ".repeat(40) + "TAIL-MARKER";

        validator.validate("Remote", body);

        assertThat(client.prompts().get(0)).doesNotContain("TAIL-MARKER");
    }

    @Test
    void raisedThresholdSendsGazetteerConflictsToAdjudication() {
        ScriptedLlmClient client = ScriptedLlmClient.responding(
                "CONFLICT: YES\nLOCATION: Pune, India\nREASONING: The Pune delivery centre is named.");
        HybridLocationValidator validator = new HybridLocationValidator(client, LlmAvailability.ready(),
                TEMPLATE, GAZETTEER, new LocationValidationProperties(0.9, null, null), Duration.ofSeconds(5),
                VerdictMetricsPublisher.NOOP);

        LocationAnalysis analysis = validator.validate("Frankfurt", PUNE_POSTING);

        assertThat(analysis.method()).isEqualTo(ValidationMethod.LLM_ADJUDICATED);
        assertThat(analysis.conflictDetected()).isTrue();
        assertThat(analysis.riskLevel()).isEqualTo(RiskLevel.CRITICAL);
    }

    @Test
    void recordsValidationMetric() {
        validator(ScriptedLlmClient.responding("unused")).validate("Frankfurt", PUNE_POSTING);

        assertThat(registry.find("jobverdict.location.validation")
                .tag("method", "GAZETTEER").tag("conflict", "true").counter().count()).isEqualTo(1.0);
    }

    private HybridLocationValidator validator(ScriptedLlmClient client) {
        return new HybridLocationValidator(client, LlmAvailability.ready(), TEMPLATE, GAZETTEER,
                LocationValidationProperties.defaults(), Duration.ofSeconds(5),
                new VerdictMetricsPublisher(new VerdictMetrics(registry)));
    }
}
