package com.phillippitts.jobverdict.service.consensus;

import com.phillippitts.jobverdict.domain.MatchLevel;

import java.util.List;
import java.util.Optional;

/**
 * Picks the most conservative level seen: the minimum on {@code Low < Moderate < Good}, with any
 * single Low forcing Low. A Good verdict therefore requires every run to say Good.
 */
public final class LowestMatchWinsPolicy implements ConsensusPolicy {

    @Override
    public Optional<MatchLevel> resolve(List<MatchLevel> levels) {
        if (levels == null || levels.isEmpty()) {
            return Optional.empty();
        }
        // One strongly negative run must not be diluted by several lukewarm positives
        if (levels.contains(MatchLevel.LOW)) {
            return Optional.of(MatchLevel.LOW);
        }
        return levels.stream().reduce(MatchLevel::lowest);
    }

    @Override
    public String name() {
        return "lowest-match-wins";
    }
}
