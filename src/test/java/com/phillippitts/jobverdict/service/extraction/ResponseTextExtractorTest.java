package com.phillippitts.jobverdict.service.extraction;

import com.phillippitts.jobverdict.domain.ContentType;
import com.phillippitts.jobverdict.domain.MatchLevel;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseTextExtractorTest {

    private static final String WELL_FORMED = """
            **Domain knowledge assessment:** Solid background in payments platforms.
            Familiar with PSD2.

            **CV-to-role match:** Good match

            **Application narrative:** I built the card tokenisation service at my current employer.
            """;

    @Test
    void extractsLabelledMatchLevel() {
        assertThat(ResponseTextExtractor.extractMatchLevel(WELL_FORMED).value()).isEqualTo(MatchLevel.GOOD);
        assertThat(ResponseTextExtractor.extractMatchLevel("cv-to-role match: LOW").value()).isEqualTo(MatchLevel.LOW);
        assertThat(ResponseTextExtractor.extractMatchLevel("The match level is moderate.").value())
                .isEqualTo(MatchLevel.MODERATE);
    }

    @Test
    void fallsBackToBareMarker() {
        assertThat(ResponseTextExtractor.extractMatchLevel("Overall this is a moderate match for me.").value())
                .isEqualTo(MatchLevel.MODERATE);
    }

    @Test
    void labelledLevelWinsOverMarkerInsideNarrative() {
        String response = "Application narrative: people say this is a good match.\nCV-to-role match: Low match";
        assertThat(ResponseTextExtractor.extractMatchLevel(response).value()).isEqualTo(MatchLevel.LOW);
    }

    @Test
    void missingLevelIsNotFound() {
        assertThat(ResponseTextExtractor.extractMatchLevel("no verdict here").isFound()).isFalse();
        assertThat(ResponseTextExtractor.extractMatchLevel("").isFound()).isFalse();
        assertThat(ResponseTextExtractor.extractMatchLevel(null).isFound()).isFalse();
    }

    @Test
    void extractsAssessmentUpToBlankLine() {
        Extraction<String> assessment = ResponseTextExtractor.extractDomainAssessment(WELL_FORMED);
        assertThat(assessment.value()).isEqualTo("Solid background in payments platforms.\nFamiliar with PSD2.");
    }

    @Test
    void assessmentStopsAtNextHeader() {
        String response = "Domain knowledge assessment: Strong.\nCV-to-role match: Good match";
        assertThat(ResponseTextExtractor.extractDomainAssessment(response).value()).isEqualTo("Strong.");
    }

    @Test
    void headerWithoutBodyYieldsEmptyAssessment() {
        Extraction<String> assessment = ResponseTextExtractor.extractDomainAssessment("Domain knowledge assessment:");
        assertThat(assessment.isFound()).isTrue();
        assertThat(assessment.value()).isEmpty();
    }

    @Test
    void assessmentWithoutColonIsNotFound() {
        assertThat(ResponseTextExtractor.extractDomainAssessment("Domain knowledge assessment is fine").isFound())
                .isFalse();
    }

    @Test
    void goodLevelReturnsNarrative() {
        NarrativeExtraction n = ResponseTextExtractor.extractNarrativeOrRationale(WELL_FORMED, MatchLevel.GOOD).value();
        assertThat(n.contentType()).isEqualTo(ContentType.APPLICATION_NARRATIVE);
        assertThat(n.text()).isEqualTo("I built the card tokenisation service at my current employer.");
        assertThat(n.mismatch()).isFalse();
    }

    @Test
    void goodLevelWithOnlyRationaleIsFlaggedAsMismatch() {
        String response = "CV-to-role match: Good match\nNo-go rationale: Too far from home.";
        NarrativeExtraction n = ResponseTextExtractor.extractNarrativeOrRationale(response, MatchLevel.GOOD).value();
        assertThat(n.contentType()).isEqualTo(ContentType.NO_GO_RATIONALE);
        assertThat(n.text()).isEqualTo("Too far from home.");
        assertThat(n.mismatch()).isTrue();
    }

    @Test
    void lowLevelConvertsStrayNarrativeIntoRationale() {
        String response = "CV-to-role match: Low match\nApplication narrative: I love this company.";
        NarrativeExtraction n = ResponseTextExtractor.extractNarrativeOrRationale(response, MatchLevel.LOW).value();
        assertThat(n.contentType()).isEqualTo(ContentType.NO_GO_RATIONALE);
        assertThat(n.text()).startsWith(ResponseTextExtractor.REASONS_PREFIX)
                .contains("[Extracted from incorrectly formatted narrative: I love this company.]");
        assertThat(n.mismatch()).isTrue();
    }

    @Test
    void lowLevelFallsBackToDeclineSentence() {
        String response = "CV-to-role match: Low match\nI decided not to apply due to the travel requirements.";
        NarrativeExtraction n = ResponseTextExtractor.extractNarrativeOrRationale(response, MatchLevel.LOW).value();
        assertThat(n.text()).isEqualTo(ResponseTextExtractor.DECLINE_PREFIX + "due to the travel requirements.");
    }

    @Test
    void moderateLevelPrefersRationale() {
        String response = "No-go rationale: Missing leadership.\nApplication narrative: ignored";
        NarrativeExtraction n =
                ResponseTextExtractor.extractNarrativeOrRationale(response, MatchLevel.MODERATE).value();
        assertThat(n.text()).isEqualTo("Missing leadership.");
        assertThat(n.mismatch()).isFalse();
    }

    @Test
    void extractionIsDeterministic() {
        assertThat(ResponseTextExtractor.extractNarrativeOrRationale(WELL_FORMED, MatchLevel.GOOD))
                .isEqualTo(ResponseTextExtractor.extractNarrativeOrRationale(WELL_FORMED, MatchLevel.GOOD));
        assertThat(ResponseTextExtractor.extractDomainAssessment(WELL_FORMED))
                .isEqualTo(ResponseTextExtractor.extractDomainAssessment(WELL_FORMED));
    }

    @Test
    void nothingToExtractIsNotFound() {
        assertThat(ResponseTextExtractor.extractNarrativeOrRationale("just words", MatchLevel.LOW).isFound()).isFalse();
        assertThat(ResponseTextExtractor.extractNarrativeOrRationale(null, MatchLevel.GOOD).isFound()).isFalse();
    }
}
