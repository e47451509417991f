// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrun.impl;

import java.io.File;
import java.io.IOException;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

import com.google.common.base.Charsets;
import com.google.common.base.Preconditions;

import org.apache.commons.io.FileUtils;

/**
 * Runs each test as an executable in a child process. Exit status 0 passes, anything else fails,
 * and a test still running after the timeout is killed and reported as timed out.
 */
class ProcessTestFormat implements TestFormat {
  private static final Logger logger = Logger.getLogger("pants-testrun");

  private final long timeoutSeconds;

  /**
   * @param timeoutSeconds How long a single test may run, or 0 for no limit.
   */
  ProcessTestFormat(long timeoutSeconds) {
    Preconditions.checkArgument(timeoutSeconds >= 0, "timeout cannot be negative: %s",
        timeoutSeconds);
    this.timeoutSeconds = timeoutSeconds;
  }

  @Override
  public ExecutionOutcome execute(TestUnit test, RunConfig config)
      throws IOException, InterruptedException {

    File executable = new File(test.getPath()).getAbsoluteFile();
    if (!executable.isFile()) {
      throw new IOException("Test executable not found: " + executable);
    }

    File output = File.createTempFile("pants-testrun", ".out.txt");
    try {
      Process process = new ProcessBuilder(executable.getPath())
          .directory(executable.getParentFile())
          .redirectErrorStream(true)
          .redirectOutput(output)
          .start();
      try {
        if (timeoutSeconds > 0) {
          if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
            process.destroyForcibly().waitFor();
            return new Result(ResultCode.TIMEOUT,
                String.format("Reached timeout of %d seconds\n%s", timeoutSeconds,
                    FileUtils.readFileToString(output, Charsets.UTF_8)));
          }
        } else {
          process.waitFor();
        }
      } finally {
        // Only reached early when the worker is being torn down.
        if (process.isAlive()) {
          process.destroyForcibly();
        }
      }

      int exitCode = process.exitValue();
      logger.fine(String.format("%s exited with %d", test.getPath(), exitCode));
      String captured = FileUtils.readFileToString(output, Charsets.UTF_8);
      return new StatusAndOutput(exitCode == 0 ? ResultCode.PASS : ResultCode.FAIL, captured);
    } finally {
      FileUtils.deleteQuietly(output);
    }
  }
}
