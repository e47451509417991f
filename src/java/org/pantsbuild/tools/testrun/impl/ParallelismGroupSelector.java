// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrun.impl;

import javax.annotation.Nullable;

/**
 * Picks the parallelism group a test runs in.
 *
 * The selector is consulted once per test, when the test is dispatched to a worker, so grouping
 * can depend on attributes only known after the tests were collected.
 */
public interface ParallelismGroupSelector {

  /**
   * A selector that puts no test in any group.
   */
  ParallelismGroupSelector NONE = new ParallelismGroupSelector() {
    @Override public String groupFor(TestUnit test) {
      return null;
    }
  };

  /**
   * Returns the name of the group {@code test} must run in, or {@code null} for no group.
   */
  @Nullable
  String groupFor(TestUnit test);
}
