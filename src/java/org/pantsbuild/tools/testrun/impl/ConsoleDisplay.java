// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrun.impl;

import java.io.PrintStream;
import java.util.List;

import com.google.common.collect.Lists;

/**
 * A display that logs each finished test with a single character, or with a line naming the
 * test when verbose.
 */
class ConsoleDisplay implements TestDisplay {
  private final PrintStream out;
  private final boolean verbose;
  private final int total;
  private final List<TestUnit> failures = Lists.newArrayList();
  private int finished;

  ConsoleDisplay(PrintStream out, boolean verbose, int total) {
    this.out = out;
    this.verbose = verbose;
    this.total = total;
  }

  @Override
  public void update(TestUnit test) {
    finished++;
    Result result = test.getResult();
    if (result.getCode().isFailure()) {
      failures.add(test);
    }
    if (verbose) {
      out.printf("%s: %s :: %s (%d of %d)%n", result.getCode(), test.getSuite().getName(),
          test.getPath(), finished, total);
      if (result.getCode().isFailure() && !result.getOutput().isEmpty()) {
        out.println(result.getOutput());
      }
    } else {
      out.append(symbol(result.getCode()));
    }
    out.flush();
  }

  private static char symbol(ResultCode code) {
    switch (code) {
      case PASS:
        return '.';
      case FAIL:
        return 'F';
      case XFAIL:
        return 'x';
      case XPASS:
        return 'X';
      case UNRESOLVED:
        return 'E';
      case TIMEOUT:
        return 'T';
      case UNSUPPORTED:
      case EXCLUDED:
        return 'S';
      default:
        throw new IllegalStateException("Unknown result code " + code);
    }
  }

  /**
   * Prints the tests that failed, the count of each result code and whether the run ended early.
   */
  void printSummary(RunSummary summary) {
    out.println();
    if (!failures.isEmpty()) {
      out.printf("Failing Tests (%d):%n", failures.size());
      for (TestUnit test : failures) {
        out.printf("    %s :: %s%n", test.getSuite().getName(), test.getPath());
      }
      out.println();
    }
    for (ResultCode code : ResultCode.values()) {
      int count = summary.getCount(code);
      if (count > 0) {
        out.printf("  %s: %d%n", code.getLabel(), count);
      }
    }
    if (summary.isEndedEarly()) {
      out.printf("Run ended early, %d tests were not run%n", summary.getNotRunCount());
    }
    out.flush();
  }
}
