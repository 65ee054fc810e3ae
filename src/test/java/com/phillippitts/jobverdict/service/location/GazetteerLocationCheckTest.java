package com.phillippitts.jobverdict.service.location;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GazetteerLocationCheckTest {

    private static final Gazetteer GAZETTEER = GazetteerLoader.fromClasspath("gazetteer.json");

    private final GazetteerLocationCheck check = new GazetteerLocationCheck(GAZETTEER);

    @Test
    void descriptionWithoutPlacesKeepsDeclaredLocation() {
        GazetteerLocationCheck.Verdict verdict = check.check("Berlin", "We build great software together.");

        assertThat(verdict.conflictDetected()).isFalse();
        assertThat(verdict.authoritativeLocation()).isEqualTo("Berlin");
        assertThat(verdict.confidence()).isEqualTo(0.95);
        assertThat(verdict.extractedLocations()).isEmpty();
    }

    @Test
    void unrecognisableDeclaredLocationIsLowConfidence() {
        GazetteerLocationCheck.Verdict verdict = check.check("Remote", "Our Berlin office hosts the team.");

        assertThat(verdict.conflictDetected()).isFalse();
        assertThat(verdict.confidence()).isEqualTo(0.5);
        assertThat(verdict.reasoning()).contains("Berlin");
    }

    @Test
    void mentionOfDeclaredCityConfirmsIt() {
        GazetteerLocationCheck.Verdict verdict = check.check("München, Germany",
                "Join us in Munich. Occasional travel to Hamburg.");

        assertThat(verdict.conflictDetected()).isFalse();
        assertThat(verdict.confidence()).isEqualTo(0.95);
        assertThat(verdict.reasoning()).contains("declared city Munich (1 time)");
        assertThat(verdict.extractedLocations()).containsExactly("Munich", "Hamburg");
    }

    @Test
    void onlyOtherCitiesIsAConflict() {
        GazetteerLocationCheck.Verdict verdict = check.check("Frankfurt",
                "This position is in Pune. The Pune team works closely with Mumbai. Relocation to Pune required.");

        assertThat(verdict.conflictDetected()).isTrue();
        assertThat(verdict.confidence()).isEqualTo(0.85);
        assertThat(verdict.authoritativeLocation()).isEqualTo("Pune, India");
        assertThat(verdict.reasoning())
                .isEqualTo("Job description mentions Pune, India (3 times) but not the declared city Frankfurt");
    }

    @Test
    void onlyUnknownPlacesIsInconclusive() {
        GazetteerLocationCheck.Verdict verdict = check.check("Berlin", "The role is based in Eschweiler.");

        assertThat(verdict.conflictDetected()).isFalse();
        assertThat(verdict.confidence()).isEqualTo(0.6);
        assertThat(verdict.authoritativeLocation()).isEqualTo("Berlin");
        assertThat(verdict.reasoning()).contains("Eschweiler");
    }
}
