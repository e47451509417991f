// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrun.impl;

import com.google.common.collect.ImmutableMap;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class RunConfigTest {

  @Test
  public void testDefaults() {
    RunConfig config = RunConfig.builder().build();
    assertTrue(config.getParallelismGroups().isEmpty());
    assertEquals(0, config.getMaxFailures());
    assertFalse(config.hasMaxFailures());
    assertFalse(config.isSingleProcess());
    assertFalse(config.isDebug());
  }

  @Test
  public void testBuilder() {
    RunConfig config = RunConfig.builder()
        .addParallelismGroup("heavy", 1)
        .addParallelismGroups(ImmutableMap.of("network", 3))
        .setMaxFailures(5)
        .setSingleProcess(true)
        .setDebug(true)
        .build();
    assertEquals(ImmutableMap.of("heavy", 1, "network", 3), config.getParallelismGroups());
    assertEquals(5, config.getMaxFailures());
    assertTrue(config.hasMaxFailures());
    assertTrue(config.isSingleProcess());
    assertTrue(config.isDebug());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNonPositiveCapacityRejected() {
    RunConfig.builder().addParallelismGroup("heavy", 0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeMaxFailuresRejected() {
    RunConfig.builder().setMaxFailures(-1);
  }
}
