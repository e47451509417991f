package org.pantsbuild.tools.testrun;

import org.pantsbuild.tools.testrun.impl.ConsoleRunnerImpl;

/**
 * Main entry point for the test-run task.
 *
 * All implementation classes live in sub-packages so they can be shaded.
 */
public class ConsoleRunner {
  public static void main(String args[]) {
    ConsoleRunnerImpl.main(args);
  }
}
