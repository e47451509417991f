// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrun.impl;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

import com.google.common.base.Preconditions;

/**
 * Takes finished tests as they come home, in whatever order, and folds them into the run.
 *
 * All calls to {@link #consume} must come from one thread. That thread is the only one that ever
 * writes results into the run's tests or updates the display. Workers read the cancellation flag
 * and report failures through {@link #noteFinished} as soon as a test finishes, so a run past its
 * failure limit stops starting tests before the failing result has been consumed.
 */
final class ResultCollector {
  private static final Logger logger = Logger.getLogger("pants-testrun");

  private final List<TestUnit> tests;
  private final TestDisplay display;
  private final int maxFailures;

  private final AtomicInteger finishedFailures = new AtomicInteger();
  private int failureCount;
  private int completedCount;
  private volatile boolean cancelled;

  /**
   * @param tests The run's tests, indexed the same way deliveries are.
   * @param display Where to report each finished test.
   * @param maxFailures Number of FAIL results after which the run is cancelled, 0 for no limit.
   */
  ResultCollector(List<TestUnit> tests, TestDisplay display, int maxFailures) {
    Preconditions.checkArgument(maxFailures >= 0);
    this.tests = Preconditions.checkNotNull(tests);
    this.display = Preconditions.checkNotNull(display);
    this.maxFailures = maxFailures;
  }

  void consume(Delivery delivery) {
    TestUnit test = tests.get(delivery.getIndex());
    TestUnit finished = delivery.getTest();
    if (!test.getPath().equals(finished.getPath())) {
      throw new SchedulerConsistencyException(String.format(
          "Result for %s was delivered to %s at index %d", finished.getPath(), test.getPath(),
          delivery.getIndex()));
    }
    if (test.hasResult()) {
      throw new SchedulerConsistencyException("Duplicate result delivered for " + test.getPath());
    }

    Result result = finished.getResult();
    test.setResult(result);
    completedCount++;
    display.update(test);

    if (result.getCode() == ResultCode.FAIL) {
      failureCount++;
      if (maxFailures > 0 && failureCount == maxFailures) {
        logger.warning(String.format("Reached %d failures, no further tests will be started",
            maxFailures));
        cancelled = true;
      }
    }
  }

  /**
   * Called by a worker as soon as a test finishes, possibly from many threads at once. Cancels
   * the run once the finished FAIL results reach the failure limit.
   */
  void noteFinished(Result result) {
    if (maxFailures > 0 && result.getCode() == ResultCode.FAIL
        && finishedFailures.incrementAndGet() >= maxFailures) {
      cancelled = true;
    }
  }

  /**
   * Stops any further tests from being started.
   */
  void cancel() {
    cancelled = true;
  }

  boolean isCancelled() {
    return cancelled;
  }

  int getFailureCount() {
    return failureCount;
  }

  int getCompletedCount() {
    return completedCount;
  }
}
