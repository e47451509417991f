// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrun.impl;

import java.util.concurrent.TimeUnit;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * The outcome of running one test: a status code, free-form output and the wall-clock time the
 * test took.
 */
public final class Result implements ExecutionOutcome {
  private final ResultCode code;
  private final String output;
  private final long elapsedNanos;

  public Result(ResultCode code, String output) {
    this(code, output, 0L);
  }

  public Result(ResultCode code, String output, long elapsedNanos) {
    Preconditions.checkNotNull(code);
    Preconditions.checkNotNull(output);
    Preconditions.checkArgument(elapsedNanos >= 0, "elapsed time cannot be negative: %s",
        elapsedNanos);
    this.code = code;
    this.output = output;
    this.elapsedNanos = elapsedNanos;
  }

  /**
   * The result given to tests that were never run.
   */
  static Result unresolved() {
    return new Result(ResultCode.UNRESOLVED, "", 0L);
  }

  public ResultCode getCode() {
    return code;
  }

  public String getOutput() {
    return output;
  }

  public long getElapsed(TimeUnit unit) {
    return unit.convert(elapsedNanos, TimeUnit.NANOSECONDS);
  }

  public double getElapsedSeconds() {
    return elapsedNanos / 1e9;
  }

  /**
   * Returns a copy of this result with its elapsed time replaced.
   */
  public Result withElapsed(long elapsed, TimeUnit unit) {
    return new Result(code, output, unit.toNanos(elapsed));
  }

  @Override
  public Result toResult() {
    return this;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Result)) {
      return false;
    }
    Result other = (Result) o;
    return code == other.code
        && elapsedNanos == other.elapsedNanos
        && output.equals(other.output);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(code, output, elapsedNanos);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("code", code)
        .add("elapsed", String.format("%.3fs", getElapsedSeconds()))
        .toString();
  }
}
