// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrun.impl;

/**
 * The closed set of outcomes a single test unit can end a run with.
 */
public enum ResultCode {
  PASS("Passed", false),
  FAIL("Failed", true),
  XFAIL("Expectedly Failed", false),
  XPASS("Unexpectedly Passed", true),
  UNRESOLVED("Unresolved", true),
  UNSUPPORTED("Unsupported", false),
  EXCLUDED("Excluded", false),
  TIMEOUT("Timed Out", true);

  private final String label;
  private final boolean failure;

  ResultCode(String label, boolean failure) {
    this.label = label;
    this.failure = failure;
  }

  /**
   * Returns a human readable label for this code, suitable for summaries.
   */
  public String getLabel() {
    return label;
  }

  /**
   * Returns {@code true} if a test ending with this code should make the overall run fail.
   */
  public boolean isFailure() {
    return failure;
  }
}
