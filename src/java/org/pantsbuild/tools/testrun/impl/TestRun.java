// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrun.impl;

import java.io.PrintStream;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

import javax.annotation.Nullable;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * A concrete, configured test run.
 *
 * Tests either run on a fixed pool of worker threads, or one after another on the calling thread
 * when the run is configured as single process. Finished tests are always folded back into the
 * run by the calling thread, so the display never sees two updates at once.
 */
public class TestRun {
  private static final Logger logger = Logger.getLogger("pants-testrun");

  /** Longest the controlling thread waits for a result before checking on the run again. */
  private static final long POLL_INTERVAL_NANOS = TimeUnit.SECONDS.toNanos(1);

  private final RunConfig config;
  private final ImmutableList<TestUnit> tests;
  private final ParallelismGroupRegistry parallelismGroups;
  private final Aborter aborter;
  private final PrintStream out;

  public TestRun(RunConfig config, List<TestUnit> tests) {
    this(config, tests, Aborter.HALT, System.out);
  }

  @VisibleForTesting
  TestRun(RunConfig config, List<TestUnit> tests, Aborter aborter, PrintStream out) {
    this.config = Preconditions.checkNotNull(config);
    this.tests = ImmutableList.copyOf(tests);
    this.parallelismGroups = new ParallelismGroupRegistry(config.getParallelismGroups());
    this.aborter = Preconditions.checkNotNull(aborter);
    this.out = Preconditions.checkNotNull(out);
  }

  public RunConfig getConfig() {
    return config;
  }

  public ImmutableList<TestUnit> getTests() {
    return tests;
  }

  ParallelismGroupRegistry getParallelismGroups() {
    return parallelismGroups;
  }

  /**
   * Runs every test of this run with no time limit.
   *
   * @see #executeTests(TestDisplay, int, long, TimeUnit)
   */
  public RunSummary executeTests(TestDisplay display, int jobs) {
    return executeTests(display, jobs, 0, TimeUnit.SECONDS);
  }

  /**
   * Runs each test of this run using up to {@code jobs} worker threads and tells the display
   * about each test as it finishes.
   *
   * Once this returns every test holds a result. Tests that never got to run, because the
   * deadline passed or too many tests failed, are given an UNRESOLVED result with no output.
   * Tests that already held a result when the run started are left alone. Nothing at all
   * happens if there are no tests or {@code jobs} is 0.
   *
   * @param display Told about each finished test; calls are serialized but may not happen on the
   *     calling thread.
   * @param jobs Maximum number of tests to run at once.
   * @param maxTime How long to let the run go on before giving up on outstanding tests, 0 for no
   *     limit.
   * @param unit The unit of {@code maxTime}.
   * @return A summary of the run.
   * @throws RunInterruptedException If the run was interrupted.
   * @throws SchedulerConsistencyException If a result came home for the wrong test.
   * @throws TestExecutionException If a test format failed during a debug run.
   */
  public RunSummary executeTests(TestDisplay display, int jobs, long maxTime, TimeUnit unit) {
    Preconditions.checkNotNull(display);
    Preconditions.checkNotNull(unit);
    Preconditions.checkArgument(jobs >= 0, "jobs cannot be negative: %s", jobs);
    Preconditions.checkArgument(maxTime >= 0, "max time cannot be negative: %s", maxTime);

    if (tests.isEmpty() || jobs == 0) {
      return new RunSummary(tests, 0);
    }

    List<Integer> pending = Lists.newArrayList();
    for (int i = 0; i < tests.size(); i++) {
      if (!tests.get(i).hasResult()) {
        pending.add(i);
      }
    }

    // Compute the deadline once up front; waits are measured against it as we go.
    Long deadline = maxTime > 0 ? System.nanoTime() + unit.toNanos(maxTime) : null;

    ResultCollector collector = new ResultCollector(tests, display, config.getMaxFailures());
    TestWorker worker = new TestWorker(config, parallelismGroups, collector, aborter);
    if (config.isSingleProcess()) {
      executeSerially(pending, worker, collector, deadline);
    } else if (!pending.isEmpty()) {
      executeInPool(Math.min(jobs, pending.size()), pending, worker, collector, deadline);
    }

    int notRun = 0;
    for (TestUnit test : tests) {
      if (!test.hasResult()) {
        test.setResult(Result.unresolved());
        notRun++;
      }
    }
    if (notRun > 0) {
      logger.warning(String.format("%d of %d tests were not run", notRun, tests.size()));
    }
    return new RunSummary(tests, notRun);
  }

  private void executeSerially(List<Integer> pending, TestWorker worker,
      ResultCollector collector, @Nullable Long deadline) {
    for (int index : pending) {
      if (collector.isCancelled()) {
        break;
      }
      if (deadline != null && System.nanoTime() - deadline >= 0) {
        logger.warning("Test run deadline passed, not starting any more tests");
        collector.cancel();
        break;
      }
      Delivery delivery;
      try {
        delivery = worker.run(index, tests.get(index));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new RunInterruptedException("Test run interrupted", e);
      }
      if (delivery != null) {
        collector.consume(delivery);
      }
    }
  }

  private void executeInPool(int numThreads, List<Integer> pending, final TestWorker worker,
      ResultCollector collector, @Nullable Long deadline) {

    ThreadFactory threadFactory = new ThreadFactoryBuilder()
        .setDaemon(true)
        .setNameFormat("test-run-worker-%d")
        .build();
    ExecutorService executor = Executors.newFixedThreadPool(numThreads, threadFactory);
    CompletionService<Delivery> deliveries = new ExecutorCompletionService<Delivery>(executor);

    Thread interruptHook = createInterruptHook(executor);
    Runtime.getRuntime().addShutdownHook(interruptHook);
    try {
      for (final int index : pending) {
        final TestUnit test = tests.get(index);
        deliveries.submit(new Callable<Delivery>() {
          @Override
          public Delivery call() throws InterruptedException {
            return worker.run(index, test);
          }
        });
      }
      executor.shutdown();

      int outstanding = pending.size();
      while (outstanding > 0) {
        // A bounded wait keeps us responsive to interrupts even without a deadline.
        long waitNanos = POLL_INTERVAL_NANOS;
        if (deadline != null) {
          long remaining = deadline - System.nanoTime();
          if (remaining <= 0) {
            logger.warning(String.format(
                "Test run deadline passed with %d tests outstanding, terminating", outstanding));
            collector.cancel();
            break;
          }
          waitNanos = Math.min(waitNanos, remaining);
        }
        Future<Delivery> done = deliveries.poll(waitNanos, TimeUnit.NANOSECONDS);
        if (done == null) {
          continue;
        }
        outstanding--;
        Delivery delivery = getDelivery(done);
        if (delivery != null) {
          collector.consume(delivery);
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RunInterruptedException("Test run interrupted", e);
    } finally {
      // Stop anything still in flight.
      executor.shutdownNow();
      Runtime.getRuntime().removeShutdownHook(interruptHook);
    }
  }

  @Nullable
  private static Delivery getDelivery(Future<Delivery> done) throws InterruptedException {
    try {
      return done.get();
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof InterruptedException) {
        logger.fine("Worker interrupted before finishing its test");
        return null;
      }
      Throwables.throwIfUnchecked(cause);
      throw new IllegalStateException("Unexpected failure in test worker", cause);
    }
  }

  /**
   * Returns a thread that, run as a shutdown hook while tests are in flight, stops the workers
   * and aborts right away rather than waiting for tests to notice the VM is going down.
   */
  private Thread createInterruptHook(final ExecutorService executor) {
    return new Thread("test-run-interrupt-hook") {
      @Override public void run() {
        out.println();
        out.println("Ctrl-C detected, terminating.");
        out.flush();
        executor.shutdownNow();
        aborter.abort();
      }
    };
  }
}
