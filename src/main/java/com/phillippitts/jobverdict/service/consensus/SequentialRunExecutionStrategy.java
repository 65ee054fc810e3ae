package com.phillippitts.jobverdict.service.consensus;

import com.phillippitts.jobverdict.domain.EvaluationRun;
import com.phillippitts.jobverdict.exception.EvaluationCancelledException;

import java.util.ArrayList;
import java.util.List;

/**
 * Executes runs one after another on the calling thread.
 */
public final class SequentialRunExecutionStrategy implements RunExecutionStrategy {

    @Override
    public List<EvaluationRun> execute(int runCount, RunTask run) {
        List<EvaluationRun> runs = new ArrayList<>(runCount);
        for (int i = 0; i < runCount; i++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new EvaluationCancelledException("Evaluation cancelled after " + i + " of " + runCount + " runs");
            }
            runs.add(run.run(i, () -> false));
        }
        return runs;
    }

    @Override
    public String name() {
        return "sequential";
    }
}
