package com.phillippitts.jobverdict.service.consensus;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.phillippitts.jobverdict.domain.MatchLevel.GOOD;
import static com.phillippitts.jobverdict.domain.MatchLevel.LOW;
import static com.phillippitts.jobverdict.domain.MatchLevel.MODERATE;
import static org.assertj.core.api.Assertions.assertThat;

class LowestMatchWinsPolicyTest {

    private final LowestMatchWinsPolicy policy = new LowestMatchWinsPolicy();

    @Test
    void anyLowWins() {
        assertThat(policy.resolve(List.of(GOOD, GOOD, GOOD, GOOD, LOW))).contains(LOW);
        assertThat(policy.resolve(List.of(LOW, MODERATE))).contains(LOW);
    }

    @Test
    void moderateBeatsGood() {
        assertThat(policy.resolve(List.of(GOOD, GOOD, MODERATE, GOOD, GOOD))).contains(MODERATE);
    }

    @Test
    void goodRequiresUnanimity() {
        assertThat(policy.resolve(List.of(GOOD, GOOD, GOOD))).contains(GOOD);
        assertThat(policy.resolve(List.of(GOOD))).contains(GOOD);
    }

    @Test
    void emptyInputHasNoConsensus() {
        assertThat(policy.resolve(List.of())).isEmpty();
        assertThat(policy.resolve(null)).isEmpty();
    }

    @Test
    void orderDoesNotMatter() {
        assertThat(policy.resolve(List.of(MODERATE, GOOD))).isEqualTo(policy.resolve(List.of(GOOD, MODERATE)));
    }
}
