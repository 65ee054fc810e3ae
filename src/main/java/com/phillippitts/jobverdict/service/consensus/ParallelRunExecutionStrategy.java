package com.phillippitts.jobverdict.service.consensus;

import com.phillippitts.jobverdict.domain.EvaluationRun;
import com.phillippitts.jobverdict.exception.EvaluationCancelledException;
import com.phillippitts.jobverdict.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Executes runs concurrently on a bounded executor.
 *
 * <p><b>Thread Model:</b> each run becomes one task on the injected executor, which should be sized
 * to the LLM endpoint's concurrency limit. The caller blocks until every run finishes or the overall
 * deadline passes.
 *
 * <p><b>Deadline:</b> runs still in flight at the deadline are cancelled and recorded as failed with
 * reason "timed out", exactly like a run that exhausted its retries. A call already in progress is
 * not interrupted, but the run sees the abandon flag and starts no further attempts.
 *
 * <p><b>Cancellation:</b> if the calling thread is interrupted while waiting, all in-flight runs are
 * cancelled and {@link EvaluationCancelledException} is thrown; no partial list is returned.
 */
public final class ParallelRunExecutionStrategy implements RunExecutionStrategy {

    private static final Logger LOG = LogManager.getLogger(ParallelRunExecutionStrategy.class);

    private final Executor executor;
    private final Duration deadline;

    /**
     * @param executor bounded pool for run tasks
     * @param deadline bound on the whole batch of runs
     */
    public ParallelRunExecutionStrategy(Executor executor, Duration deadline) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.deadline = Objects.requireNonNull(deadline, "deadline");
        if (deadline.isZero() || deadline.isNegative()) {
            throw new IllegalArgumentException("deadline must be positive, got: " + deadline);
        }
    }

    @Override
    public List<EvaluationRun> execute(int runCount, RunTask run) {
        long t0 = System.nanoTime();
        AtomicBoolean abandoned = new AtomicBoolean();
        List<CompletableFuture<EvaluationRun>> futures = new ArrayList<>(runCount);
        for (int i = 0; i < runCount; i++) {
            final int runIndex = i;
            futures.add(CompletableFuture.supplyAsync(() -> run.run(runIndex, abandoned::get), executor));
        }

        try {
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
                    .get(deadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            LOG.warn("Evaluation runs exceeded deadline of {} ms; abandoning unfinished runs", deadline.toMillis());
            abandoned.set(true);
            futures.forEach(f -> f.cancel(true));
        } catch (InterruptedException ie) {
            abandoned.set(true);
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new EvaluationCancelledException("Evaluation cancelled while runs were in flight", ie);
        } catch (ExecutionException ee) {
            // Individual failures are recorded per run below
            LOG.debug("At least one run completed exceptionally: {}", ee.getMessage());
        }

        long elapsedMs = TimeUtils.elapsedMillis(t0);
        List<EvaluationRun> runs = new ArrayList<>(runCount);
        for (int i = 0; i < runCount; i++) {
            runs.add(resultOrFailure(futures.get(i), i, elapsedMs));
        }
        return runs;
    }

    @Override
    public String name() {
        return "parallel";
    }

    private EvaluationRun resultOrFailure(CompletableFuture<EvaluationRun> f, int runIndex, long elapsedMs) {
        if (f.isCancelled() || !f.isDone()) {
            return EvaluationRun.failed("", runIndex, 0, elapsedMs, "timed out");
        }
        try {
            return f.get();
        } catch (ExecutionException e) {
            LOG.error("Run {} failed unexpectedly", runIndex, e.getCause());
            return EvaluationRun.failed("", runIndex, 0, elapsedMs, "unexpected error: " + e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EvaluationCancelledException("Evaluation cancelled while collecting runs", e);
        }
    }
}
