package com.phillippitts.jobverdict.service.consensus;

import com.phillippitts.jobverdict.domain.MatchLevel;

import java.util.List;
import java.util.Optional;

/**
 * Combines the match levels extracted from independent runs into one candidate level.
 *
 * <p>Implementations must be order-independent (runs may complete in any order) and stateless.
 */
public interface ConsensusPolicy {

    /**
     * @param levels levels actually extracted, one per successful run (never contains null)
     * @return combined level, or empty when no level was extracted
     */
    Optional<MatchLevel> resolve(List<MatchLevel> levels);

    /**
     * Name used in logs.
     */
    String name();
}
