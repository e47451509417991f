// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrun.impl;

import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;

/**
 * Runs single tests on behalf of a {@link TestRun}. The same worker logic backs both the pooled
 * and the single threaded execution modes, so parallelism groups behave the same in both.
 *
 * A worker never writes to the tests of the run. It records the result into a private copy of
 * the test and hands that copy back as a {@link Delivery}.
 */
final class TestWorker {
  private static final Logger logger = Logger.getLogger("pants-testrun");

  private final RunConfig config;
  private final ParallelismGroupRegistry groups;
  private final ResultCollector collector;
  private final Aborter aborter;

  TestWorker(RunConfig config, ParallelismGroupRegistry groups, ResultCollector collector,
      Aborter aborter) {
    this.config = Preconditions.checkNotNull(config);
    this.groups = Preconditions.checkNotNull(groups);
    this.collector = Preconditions.checkNotNull(collector);
    this.aborter = Preconditions.checkNotNull(aborter);
  }

  /**
   * Runs the test at {@code index}.
   *
   * @return The finished test, or {@code null} if the run was cancelled before the test started,
   *     including while the worker waited for its parallelism group.
   * @throws InterruptedException If the worker was interrupted, normally because the pool is
   *     being torn down.
   * @throws RunInterruptedException If the test format signalled an operator interrupt.
   * @throws TestExecutionException If the test format failed during a debug run.
   */
  @Nullable
  Delivery run(int index, TestUnit test) throws InterruptedException {
    if (collector.isCancelled()) {
      logger.fine("Run cancelled, not starting " + test.getPath());
      return null;
    }
    TestUnit finished = test.copy();
    Result result = execute(finished);
    if (result == null) {
      return null;
    }
    finished.setResult(result);
    return new Delivery(index, finished);
  }

  @Nullable
  private Result execute(TestUnit test) throws InterruptedException {
    Stopwatch stopwatch = Stopwatch.createUnstarted();
    Result result;
    try (ParallelismGroupRegistry.Permit permit = groups.acquire(test.resolveParallelismGroup())) {
      if (collector.isCancelled()) {
        logger.fine("Run cancelled while " + test.getPath() + " waited for its group");
        return null;
      }
      stopwatch.start();
      ExecutionOutcome outcome = test.getSuite().getFormat().execute(test, config);
      stopwatch.stop();
      result = Results.normalize(outcome);
      // Counted before the permit goes back so tests queued on the group see the cancellation.
      collector.noteFinished(result);
    } catch (RunInterruptedException e) {
      // Abort before any cleanup.
      logger.warning("Interrupted while running " + test.getPath() + ", aborting");
      aborter.abort();
      throw e;
    } catch (InterruptedException e) {
      throw e;
    } catch (Throwable e) {
      if (config.isDebug()) {
        throw new TestExecutionException(test.getPath(), e);
      }
      logger.fine("Error running " + test.getPath() + ": " + e);
      result = Results.fromError(e);
    }
    return result.withElapsed(stopwatch.elapsed(TimeUnit.NANOSECONDS), TimeUnit.NANOSECONDS);
  }
}
