// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrun.impl;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TestUnitTest {
  private static final TestFormat UNUSED = new TestFormat() {
    @Override public ExecutionOutcome execute(TestUnit test, RunConfig config) {
      throw new UnsupportedOperationException();
    }
  };

  @Test
  public void testResultIsSetOnce() {
    TestUnit test = new TestUnit("a/b.test", new TestSuiteConfig("suite", UNUSED));
    assertFalse(test.hasResult());
    assertNull(test.getResult());

    Result pass = new Result(ResultCode.PASS, "");
    test.setResult(pass);
    assertTrue(test.hasResult());
    assertSame(pass, test.getResult());

    try {
      test.setResult(new Result(ResultCode.FAIL, ""));
      fail("Expected IllegalStateException");
    } catch (IllegalStateException expected) {
      assertSame(pass, test.getResult());
    }
  }

  @Test
  public void testCopyHasEmptyResult() {
    TestSuiteConfig suite = new TestSuiteConfig("suite", UNUSED);
    TestUnit test = new TestUnit("a/b.test", suite);
    test.setResult(new Result(ResultCode.PASS, ""));

    TestUnit copy = test.copy();
    assertEquals("a/b.test", copy.getPath());
    assertSame(suite, copy.getSuite());
    assertFalse(copy.hasResult());
  }

  @Test
  public void testParallelismGroupResolvedFromTest() {
    TestSuiteConfig suite = new TestSuiteConfig("suite", UNUSED, new ParallelismGroupSelector() {
      @Override public String groupFor(TestUnit test) {
        return test.getPath().endsWith(".heavy") ? "heavy" : null;
      }
    });
    assertEquals("heavy", new TestUnit("x.heavy", suite).resolveParallelismGroup());
    assertNull(new TestUnit("x.light", suite).resolveParallelismGroup());
    assertEquals("g",
        new TestUnit("y", TestSuiteConfig.withGroup("s", UNUSED, "g")).resolveParallelismGroup());
    assertNull(
        new TestUnit("y", TestSuiteConfig.withGroup("s", UNUSED, null)).resolveParallelismGroup());
  }

  @Test
  public void testEmptyParallelismGroupIsNoGroup() {
    TestSuiteConfig suite = TestSuiteConfig.withGroup("suite", UNUSED, "");
    assertNull(new TestUnit("a/b.test", suite).resolveParallelismGroup());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEmptyPathRejected() {
    new TestUnit("", new TestSuiteConfig("suite", UNUSED));
  }
}
