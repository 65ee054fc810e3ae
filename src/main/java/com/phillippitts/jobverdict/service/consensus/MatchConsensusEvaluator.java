package com.phillippitts.jobverdict.service.consensus;

import com.phillippitts.jobverdict.domain.MatchResult;
import com.phillippitts.jobverdict.exception.EvaluationCancelledException;

/**
 * Runs several independent LLM match evaluations for one candidate and job and combines them into a
 * single conservative {@link MatchResult}.
 *
 * <p>Transport failures never escape: they are recorded as failed runs. The only failure reported to
 * the caller is a result carrying {@link com.phillippitts.jobverdict.domain.ErrorKind#EXTRACTION_FAILURE}
 * when no run yielded a level.
 */
public interface MatchConsensusEvaluator {

    /**
     * @throws EvaluationCancelledException if the calling thread is interrupted mid-evaluation
     */
    MatchResult evaluate(String candidateProfile, String jobDescription);
}
