// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrun.impl;

import java.util.List;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.Multiset;

/**
 * What a finished {@link TestRun} produced.
 */
public final class RunSummary {
  private final ImmutableList<TestUnit> tests;
  private final ImmutableMultiset<ResultCode> codes;
  private final int notRunCount;

  RunSummary(List<TestUnit> tests, int notRunCount) {
    this.tests = ImmutableList.copyOf(tests);
    ImmutableMultiset.Builder<ResultCode> codes = ImmutableMultiset.builder();
    for (TestUnit test : tests) {
      Result result = test.getResult();
      if (result != null) {
        codes.add(result.getCode());
      }
    }
    this.codes = codes.build();
    this.notRunCount = notRunCount;
  }

  /**
   * All tests of the run, in their original order.
   */
  public ImmutableList<TestUnit> getTests() {
    return tests;
  }

  /**
   * How many tests ended with each result code.
   */
  public Multiset<ResultCode> getCodeCounts() {
    return codes;
  }

  public int getCount(ResultCode code) {
    return codes.count(code);
  }

  /**
   * Number of tests that were never started and so were marked UNRESOLVED.
   */
  public int getNotRunCount() {
    return notRunCount;
  }

  /**
   * Returns {@code true} if the run stopped, on a deadline or too many failures, before every
   * test got to run.
   */
  public boolean isEndedEarly() {
    return notRunCount > 0;
  }

  public boolean hasFailures() {
    for (ResultCode code : codes.elementSet()) {
      if (code.isFailure()) {
        return true;
      }
    }
    return false;
  }

  public int getExitCode() {
    return hasFailures() ? 1 : 0;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("tests", tests.size())
        .add("codes", codes)
        .add("notRun", notRunCount)
        .toString();
  }
}
