// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrun.impl;

/**
 * Indicates a bug in the scheduler itself, for example a result coming home for the wrong test.
 */
public class SchedulerConsistencyException extends RuntimeException {
  public SchedulerConsistencyException(String message) {
    super(message);
  }
}
