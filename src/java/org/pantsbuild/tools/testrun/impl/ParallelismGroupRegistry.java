// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrun.impl;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/**
 * Limits how many tests of a given resource class run at once, no matter how many workers the
 * run has. For example some tests need lots of memory and run faster with less parallelism.
 *
 * A single registry is shared by every worker of a run; each named group is backed by one counting
 * semaphore.
 */
public class ParallelismGroupRegistry {

  /**
   * A held slot in a parallelism group. Closing it gives the slot back; closing more than once
   * has no further effect.
   */
  public interface Permit extends AutoCloseable {
    @Override
    void close();
  }

  private static final Permit NO_GROUP = new Permit() {
    @Override public void close() {
      // nothing held
    }
  };

  private final ImmutableMap<String, Integer> capacities;
  private final ImmutableMap<String, Semaphore> semaphores;

  /**
   * @param capacities Maximum number of concurrently running tests, per group name. Each capacity
   *     must be positive.
   */
  public ParallelismGroupRegistry(Map<String, Integer> capacities) {
    Preconditions.checkNotNull(capacities);
    ImmutableMap.Builder<String, Semaphore> semaphores = ImmutableMap.builder();
    for (Map.Entry<String, Integer> entry : capacities.entrySet()) {
      int capacity = Preconditions.checkNotNull(entry.getValue());
      Preconditions.checkArgument(capacity > 0,
          "Parallelism group %s must have a positive capacity, given %s", entry.getKey(), capacity);
      semaphores.put(entry.getKey(), new Semaphore(capacity, true));
    }
    this.capacities = ImmutableMap.copyOf(capacities);
    this.semaphores = semaphores.build();
  }

  public Set<String> groups() {
    return capacities.keySet();
  }

  public int capacity(String group) {
    Integer capacity = capacities.get(group);
    Preconditions.checkArgument(capacity != null, "Unknown parallelism group: %s", group);
    return capacity;
  }

  /**
   * Blocks until {@code group} has a free slot and takes it.
   *
   * @param group The group to run in, or {@code null} to skip group limits entirely.
   * @return The held slot, to be closed once the test finished.
   * @throws IllegalArgumentException If {@code group} was never registered.
   * @throws InterruptedException If the waiting thread is interrupted.
   */
  public Permit acquire(@Nullable String group) throws InterruptedException {
    if (group == null) {
      return NO_GROUP;
    }
    final Semaphore semaphore = semaphores.get(group);
    Preconditions.checkArgument(semaphore != null, "Unknown parallelism group: %s", group);
    semaphore.acquire();
    final AtomicBoolean released = new AtomicBoolean();
    return new Permit() {
      @Override public void close() {
        if (released.compareAndSet(false, true)) {
          semaphore.release();
        }
      }
    };
  }
}
