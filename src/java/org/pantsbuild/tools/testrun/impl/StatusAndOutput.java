// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrun.impl;

import com.google.common.base.Preconditions;

/**
 * The older (code, output) outcome some test formats still return. It carries no timing; the
 * worker that ran the test fills in the elapsed time.
 */
public final class StatusAndOutput implements ExecutionOutcome {
  private final ResultCode code;
  private final String output;

  public StatusAndOutput(ResultCode code, String output) {
    this.code = Preconditions.checkNotNull(code);
    this.output = Preconditions.checkNotNull(output);
  }

  public ResultCode getCode() {
    return code;
  }

  public String getOutput() {
    return output;
  }

  @Override
  public Result toResult() {
    return new Result(code, output);
  }
}
