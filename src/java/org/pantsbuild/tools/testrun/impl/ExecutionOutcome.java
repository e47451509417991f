// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrun.impl;

/**
 * What a {@link TestFormat} hands back after executing a test.
 *
 * There are two shapes: a fully formed {@link Result}, and the older {@link StatusAndOutput} pair
 * that carries no timing. Both are turned into a {@link Result} exactly once, right after the
 * format returns, so nothing downstream has to care which shape was used.
 */
public interface ExecutionOutcome {

  /**
   * Converts this outcome into a result. Results return themselves.
   */
  Result toResult();
}
