// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrun.impl;

import com.google.common.base.Preconditions;

/**
 * A finished test on its way home from a worker: the worker's own copy of the test, now holding
 * a result, and the position of the original in the run.
 */
final class Delivery {
  private final int index;
  private final TestUnit test;

  Delivery(int index, TestUnit test) {
    Preconditions.checkArgument(index >= 0);
    Preconditions.checkArgument(test.hasResult(), "Test %s was delivered without a result",
        test.getPath());
    this.index = index;
    this.test = test;
  }

  int getIndex() {
    return index;
  }

  TestUnit getTest() {
    return test;
  }
}
