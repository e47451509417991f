// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrun.impl;

/**
 * Receives progress as tests finish.
 *
 * {@link #update} is called once per finished test, one call at a time, so implementations need
 * no locking of their own. Calls do not necessarily happen on the thread that started the run.
 */
public interface TestDisplay {

  /**
   * @param test A finished test, holding its result.
   */
  void update(TestUnit test);
}
