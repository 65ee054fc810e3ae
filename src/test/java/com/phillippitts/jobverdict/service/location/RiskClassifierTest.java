package com.phillippitts.jobverdict.service.location;

import com.phillippitts.jobverdict.domain.RiskLevel;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RiskClassifierTest {

    private final RiskClassifier classifier =
            new RiskClassifier(GazetteerLoader.fromClasspath("gazetteer.json"));

    @Test
    void noConflictIsNone() {
        assertThat(classifier.classify(false, "Frankfurt", "Pune, India")).isEqualTo(RiskLevel.NONE);
    }

    @Test
    void otherCountryIsCritical() {
        assertThat(classifier.classify(true, "Frankfurt", "Pune, India")).isEqualTo(RiskLevel.CRITICAL);
        assertThat(classifier.classify(true, "Berlin", "Vienna")).isEqualTo(RiskLevel.CRITICAL);
    }

    @Test
    void otherStateOfSameCountryIsMedium() {
        assertThat(classifier.classify(true, "Frankfurt", "Munich")).isEqualTo(RiskLevel.MEDIUM);
    }

    @Test
    void sameStateIsLow() {
        assertThat(classifier.classify(true, "Frankfurt", "Eschborn")).isEqualTo(RiskLevel.LOW);
    }

    @Test
    void unresolvableSideIsLow() {
        assertThat(classifier.classify(true, "Remote", "Pune")).isEqualTo(RiskLevel.LOW);
        assertThat(classifier.classify(true, "Berlin", "Eschweiler")).isEqualTo(RiskLevel.LOW);
    }
}
