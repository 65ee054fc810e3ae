package com.phillippitts.jobverdict.service.consensus;

import com.phillippitts.jobverdict.domain.EvaluationRun;
import com.phillippitts.jobverdict.exception.EvaluationCancelledException;

import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Executes the independent logical runs of one consensus evaluation.
 *
 * <ul>
 *   <li>{@link SequentialRunExecutionStrategy} - one run after another on the calling thread</li>
 *   <li>{@link ParallelRunExecutionStrategy} - bounded worker pool with an overall deadline</li>
 * </ul>
 *
 * <p>The combination step does not depend on execution order, so both strategies yield the same
 * verdict for the same run outcomes.
 */
public interface RunExecutionStrategy {

    /**
     * Runs {@code runCount} logical runs.
     *
     * @param runCount number of runs
     * @param run      executes the run with the given index; never throws for transport failures
     * @return one record per run, ordered by run index
     * @throws EvaluationCancelledException if the calling thread is interrupted
     */
    List<EvaluationRun> execute(int runCount, RunTask run);

    String name();

    /**
     * One logical run. {@code abandoned} turns true once the strategy has stopped waiting for the
     * result; the run must not start further attempts after that.
     */
    @FunctionalInterface
    interface RunTask {
        EvaluationRun run(int runIndex, BooleanSupplier abandoned);
    }
}
