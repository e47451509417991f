// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrun.impl;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

import org.junit.Test;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ParallelismGroupRegistryTest {

  @Test
  public void testGroups() {
    ParallelismGroupRegistry registry =
        new ParallelismGroupRegistry(ImmutableMap.of("heavy", 1, "network", 4));
    assertThat(registry.groups(), containsInAnyOrder("heavy", "network"));
    assertEquals(1, registry.capacity("heavy"));
    assertEquals(4, registry.capacity("network"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNonPositiveCapacityRejected() {
    new ParallelismGroupRegistry(ImmutableMap.of("heavy", 0));
  }

  @Test
  public void testUnknownGroup() throws InterruptedException {
    ParallelismGroupRegistry registry = new ParallelismGroupRegistry(ImmutableMap.of("heavy", 1));
    try {
      registry.acquire("light");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException expected) {
      assertThat(expected.getMessage(), containsString("Unknown parallelism group: light"));
    }
  }

  @Test
  public void testNoGroupNeverBlocks() throws InterruptedException {
    ParallelismGroupRegistry registry =
        new ParallelismGroupRegistry(ImmutableMap.<String, Integer>of());
    for (int i = 0; i < 100; i++) {
      registry.acquire(null);
    }
  }

  @Test
  public void testPermitReleasedOnce() throws Exception {
    final ParallelismGroupRegistry registry =
        new ParallelismGroupRegistry(ImmutableMap.of("heavy", 1));
    ParallelismGroupRegistry.Permit permit = registry.acquire("heavy");
    assertFalse(tryAcquireFromOtherThread(registry));

    permit.close();
    permit.close();

    // A second close must not have freed a second slot.
    ParallelismGroupRegistry.Permit second = registry.acquire("heavy");
    assertFalse(tryAcquireFromOtherThread(registry));
    second.close();
    assertTrue(tryAcquireFromOtherThread(registry));
  }

  private static boolean tryAcquireFromOtherThread(final ParallelismGroupRegistry registry)
      throws Exception {
    ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      Future<?> acquired = executor.submit(new Callable<Void>() {
        @Override public Void call() throws InterruptedException {
          registry.acquire("heavy").close();
          return null;
        }
      });
      try {
        acquired.get(200, TimeUnit.MILLISECONDS);
        return true;
      } catch (TimeoutException e) {
        return false;
      }
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  public void testCapacityNeverExceededUnderLoad() throws Exception {
    final int capacity = 2;
    final ParallelismGroupRegistry registry =
        new ParallelismGroupRegistry(ImmutableMap.of("heavy", capacity));
    final AtomicInteger running = new AtomicInteger();
    final AtomicInteger maxRunning = new AtomicInteger();

    ExecutorService executor = Executors.newFixedThreadPool(8);
    try {
      List<Future<?>> futures = Lists.newArrayList();
      for (int i = 0; i < 200; i++) {
        futures.add(executor.submit(new Callable<Void>() {
          @Override public Void call() throws InterruptedException {
            try (ParallelismGroupRegistry.Permit permit = registry.acquire("heavy")) {
              int now = running.incrementAndGet();
              int max;
              do {
                max = maxRunning.get();
              } while (now > max && !maxRunning.compareAndSet(max, now));
              Thread.sleep(1);
              running.decrementAndGet();
            }
            return null;
          }
        }));
      }
      for (Future<?> future : futures) {
        future.get(30, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }
    assertThat(maxRunning.get(), lessThanOrEqualTo(capacity));
    assertEquals(0, running.get());
  }
}
