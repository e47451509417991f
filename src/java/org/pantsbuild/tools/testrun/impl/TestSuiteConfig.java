// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrun.impl;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * The configuration a set of test units was collected under: how to run them and which
 * parallelism group each of them belongs to.
 */
public final class TestSuiteConfig {
  private final String name;
  private final TestFormat format;
  private final ParallelismGroupSelector parallelismGroup;

  public TestSuiteConfig(String name, TestFormat format) {
    this(name, format, ParallelismGroupSelector.NONE);
  }

  public TestSuiteConfig(String name, TestFormat format,
      ParallelismGroupSelector parallelismGroup) {
    this.name = Preconditions.checkNotNull(name);
    this.format = Preconditions.checkNotNull(format);
    this.parallelismGroup = Preconditions.checkNotNull(parallelismGroup);
  }

  /**
   * Creates a suite config whose tests all run in the same group.
   *
   * @param name The suite name.
   * @param format How to run the suite's tests.
   * @param group The group every test runs in, or {@code null} for none.
   */
  public static TestSuiteConfig withGroup(String name, TestFormat format,
      @Nullable final String group) {
    if (group == null) {
      return new TestSuiteConfig(name, format);
    }
    return new TestSuiteConfig(name, format, new ParallelismGroupSelector() {
      @Override public String groupFor(TestUnit test) {
        return group;
      }
    });
  }

  public String getName() {
    return name;
  }

  public TestFormat getFormat() {
    return format;
  }

  public ParallelismGroupSelector getParallelismGroup() {
    return parallelismGroup;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("name", name).toString();
  }
}
