// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrun.impl;

import com.google.common.base.Throwables;

/**
 * Utilities for turning whatever a test format produced into a {@link Result}.
 */
final class Results {

  private Results() {
    // utility
  }

  /**
   * Normalizes an execution outcome. Normalizing a {@link Result} returns it unchanged.
   *
   * @param outcome What the test format returned, possibly {@code null}.
   * @return The normalized result.
   * @throws IllegalStateException If the format returned nothing usable.
   */
  static Result normalize(ExecutionOutcome outcome) {
    if (outcome == null) {
      throw new IllegalStateException("unexpected result from test execution");
    }
    Result result = outcome.toResult();
    if (result == null) {
      throw new IllegalStateException(
          "unexpected result from test execution: " + outcome.getClass().getName());
    }
    return result;
  }

  /**
   * Builds the UNRESOLVED result recorded when a test format blows up instead of returning.
   */
  static Result fromError(Throwable error) {
    return new Result(ResultCode.UNRESOLVED,
        "Exception during script execution:\n" + Throwables.getStackTraceAsString(error) + "\n");
  }
}
