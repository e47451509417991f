// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrun.impl;

/**
 * Raised in debug runs when a test format throws, instead of recording the error as an
 * UNRESOLVED result.
 */
public class TestExecutionException extends RuntimeException {
  public TestExecutionException(String testPath, Throwable cause) {
    super(String.format("FATAL: Error executing test '%s': %s", testPath, cause.getMessage()),
        cause);
  }
}
