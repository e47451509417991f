// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrun.impl;

/**
 * Ends the process right away when the operator interrupts a run, skipping all normal teardown.
 */
public interface Aborter {

  /**
   * Flushes stdout and halts the VM, running no shutdown hooks.
   */
  Aborter HALT = new Aborter() {
    @Override public void abort() {
      System.out.flush();
      Runtime.getRuntime().halt(3);
    }
  };

  void abort();
}
