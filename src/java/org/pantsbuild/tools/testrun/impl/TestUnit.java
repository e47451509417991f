// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrun.impl;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

/**
 * One independently runnable test and the single result it eventually gets.
 *
 * The path identifies the test for the whole run. The result slot starts out empty and can be
 * filled exactly once.
 */
public final class TestUnit {
  private final String path;
  private final TestSuiteConfig suite;
  private Result result;

  public TestUnit(String path, TestSuiteConfig suite) {
    Preconditions.checkArgument(path != null && !path.isEmpty(), "A test needs a path");
    this.path = path;
    this.suite = Preconditions.checkNotNull(suite);
  }

  public String getPath() {
    return path;
  }

  public TestSuiteConfig getSuite() {
    return suite;
  }

  /**
   * Returns the name of the parallelism group this test runs in, asking the suite's selector. An
   * empty name means no group.
   */
  @Nullable
  String resolveParallelismGroup() {
    return Strings.emptyToNull(suite.getParallelismGroup().groupFor(this));
  }

  /**
   * Returns this test's result, or {@code null} if it has none yet.
   */
  @Nullable
  public synchronized Result getResult() {
    return result;
  }

  public synchronized boolean hasResult() {
    return result != null;
  }

  /**
   * Fills the result slot.
   *
   * @throws IllegalStateException If this test already has a result.
   */
  public synchronized void setResult(Result result) {
    Preconditions.checkNotNull(result);
    Preconditions.checkState(this.result == null, "Test %s already has result %s", path,
        this.result);
    this.result = result;
  }

  /**
   * Returns a copy of this test with an empty result slot, for a worker to record into.
   */
  TestUnit copy() {
    return new TestUnit(path, suite);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("suite", suite.getName())
        .add("path", path)
        .add("result", getResult())
        .toString();
  }
}
