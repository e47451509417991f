// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrun.impl;

/**
 * Knows how to actually perform a test.
 *
 * Implementations are called concurrently from several worker threads and must not mutate the
 * test they are handed. Any exception thrown is recorded against the test as an
 * {@link ResultCode#UNRESOLVED UNRESOLVED} result, except for {@link RunInterruptedException},
 * which aborts the whole run.
 */
public interface TestFormat {

  /**
   * Runs {@code test}.
   *
   * @param test The test to run.
   * @param config The configuration of the run the test is part of.
   * @return The test outcome.
   * @throws Exception If the test could not be run at all.
   */
  ExecutionOutcome execute(TestUnit test, RunConfig config) throws Exception;
}
