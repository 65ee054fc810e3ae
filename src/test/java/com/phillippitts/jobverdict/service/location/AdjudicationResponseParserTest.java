package com.phillippitts.jobverdict.service.location;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AdjudicationResponseParserTest {

    @Test
    void parsesPlainAnswer() {
        AdjudicationResponseParser.Answer answer = AdjudicationResponseParser.parse("""
                CONFLICT: YES
                LOCATION: Pune, India
                REASONING: The description says the team sits in Pune.
                """);

        assertThat(answer.isComplete()).isTrue();
        assertThat(answer.conflict()).isTrue();
        assertThat(answer.location()).isEqualTo("Pune, India");
        assertThat(answer.reasoning()).isEqualTo("The description says the team sits in Pune.");
    }

    @Test
    void acceptsMarkdownAndChatter() {
        AdjudicationResponseParser.Answer answer = AdjudicationResponseParser.parse("""
                Sure, here is my assessment.

                **CONFLICT:** false
                **AUTHORITATIVE_LOCATION:** Berlin
                **REASONING:** Berlin is named as the office.
                """);

        assertThat(answer.conflict()).isFalse();
        assertThat(answer.location()).isEqualTo("Berlin");
        assertThat(answer.reasoningOrEmpty()).contains("Berlin is named");
    }

    @Test
    void reasoningStopsAtNextField() {
        AdjudicationResponseParser.Answer answer = AdjudicationResponseParser.parse("""
                REASONING: Mentions Dublin twice.
                CONFLICT: YES
                LOCATION: Dublin
                """);

        assertThat(answer.reasoning()).isEqualTo("Mentions Dublin twice.");
        assertThat(answer.location()).isEqualTo("Dublin");
    }

    @Test
    void missingFieldsMakeAnswerIncomplete() {
        assertThat(AdjudicationResponseParser.parse("CONFLICT: YES").isComplete()).isFalse();
        assertThat(AdjudicationResponseParser.parse("I think it is fine.").isComplete()).isFalse();
        assertThat(AdjudicationResponseParser.parse(null).reasoningOrEmpty()).isEmpty();
    }
}
