// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrun.impl;

import java.util.Map;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/**
 * Settings shared, read-only, by every worker of a test run.
 */
public final class RunConfig {
  private final ImmutableMap<String, Integer> parallelismGroups;
  private final int maxFailures;
  private final boolean singleProcess;
  private final boolean debug;

  private RunConfig(Builder builder) {
    this.parallelismGroups = builder.parallelismGroups.build();
    this.maxFailures = builder.maxFailures;
    this.singleProcess = builder.singleProcess;
    this.debug = builder.debug;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Maximum number of concurrently running tests, per parallelism group name.
   */
  public ImmutableMap<String, Integer> getParallelismGroups() {
    return parallelismGroups;
  }

  /**
   * Number of failed tests after which no further tests are started, or 0 for no limit.
   */
  public int getMaxFailures() {
    return maxFailures;
  }

  public boolean hasMaxFailures() {
    return maxFailures > 0;
  }

  /**
   * Whether tests run one after another on the calling thread instead of in a worker pool.
   */
  public boolean isSingleProcess() {
    return singleProcess;
  }

  /**
   * Whether errors thrown by test formats should fail the run instead of being recorded.
   */
  public boolean isDebug() {
    return debug;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("parallelismGroups", parallelismGroups)
        .add("maxFailures", maxFailures)
        .add("singleProcess", singleProcess)
        .add("debug", debug)
        .toString();
  }

  public static final class Builder {
    private final ImmutableMap.Builder<String, Integer> parallelismGroups = ImmutableMap.builder();
    private int maxFailures;
    private boolean singleProcess;
    private boolean debug;

    private Builder() {
    }

    public Builder addParallelismGroup(String name, int capacity) {
      Preconditions.checkNotNull(name);
      Preconditions.checkArgument(capacity > 0,
          "Parallelism group %s must have a positive capacity, given %s", name, capacity);
      parallelismGroups.put(name, capacity);
      return this;
    }

    public Builder addParallelismGroups(Map<String, Integer> groups) {
      for (Map.Entry<String, Integer> group : groups.entrySet()) {
        addParallelismGroup(group.getKey(), group.getValue());
      }
      return this;
    }

    public Builder setMaxFailures(int maxFailures) {
      Preconditions.checkArgument(maxFailures >= 0, "max failures cannot be negative: %s",
          maxFailures);
      this.maxFailures = maxFailures;
      return this;
    }

    public Builder setSingleProcess(boolean singleProcess) {
      this.singleProcess = singleProcess;
      return this;
    }

    public Builder setDebug(boolean debug) {
      this.debug = debug;
      return this;
    }

    public RunConfig build() {
      return new RunConfig(this);
    }
  }
}
