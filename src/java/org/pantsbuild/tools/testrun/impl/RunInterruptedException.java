// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrun.impl;

/**
 * Signals that the operator asked for the test run to stop. Unlike any other error raised while
 * running a test, this one is never turned into a result: it tears down the whole run.
 */
public class RunInterruptedException extends RuntimeException {
  public RunInterruptedException(String message) {
    super(message);
  }

  public RunInterruptedException(String message, Throwable cause) {
    super(message, cause);
  }
}
