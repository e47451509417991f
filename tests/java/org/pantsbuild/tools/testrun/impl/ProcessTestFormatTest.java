// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrun.impl;

import java.io.File;
import java.io.IOException;
import java.util.concurrent.TimeUnit;

import com.google.common.base.Charsets;
import com.google.common.base.Stopwatch;
import com.google.common.io.Files;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;
import static org.junit.Assume.assumeTrue;

public class ProcessTestFormatTest {

  @Rule
  public TemporaryFolder temporary = new TemporaryFolder();

  private final RunConfig config = RunConfig.builder().build();

  @Before
  public void setUp() {
    assumeTrue("Needs a POSIX shell", new File("/bin/sh").canExecute());
  }

  static File writeScript(File dir, String name, String body) throws IOException {
    File script = new File(dir, name);
    Files.asCharSink(script, Charsets.UTF_8).write("#!/bin/sh\n" + body + "\n");
    if (!script.setExecutable(true)) {
      throw new IOException("Could not make " + script + " executable");
    }
    return script;
  }

  private TestUnit unit(File script, ProcessTestFormat format) {
    return new TestUnit(script.getPath(), new TestSuiteConfig("scripts", format));
  }

  @Test
  public void testPassingScript() throws Exception {
    ProcessTestFormat format = new ProcessTestFormat(0);
    File script = writeScript(temporary.getRoot(), "pass.sh", "echo hello; echo oops >&2");

    ExecutionOutcome outcome = format.execute(unit(script, format), config);

    assertThat(outcome, instanceOf(StatusAndOutput.class));
    Result result = outcome.toResult();
    assertEquals(ResultCode.PASS, result.getCode());
    assertThat(result.getOutput(), containsString("hello"));
    assertThat(result.getOutput(), containsString("oops"));
  }

  @Test
  public void testFailingScript() throws Exception {
    ProcessTestFormat format = new ProcessTestFormat(0);
    File script = writeScript(temporary.getRoot(), "fail.sh", "echo broken; exit 3");

    Result result = format.execute(unit(script, format), config).toResult();

    assertEquals(ResultCode.FAIL, result.getCode());
    assertThat(result.getOutput(), containsString("broken"));
  }

  @Test
  public void testRunsInScriptDirectory() throws Exception {
    ProcessTestFormat format = new ProcessTestFormat(0);
    File script = writeScript(temporary.getRoot(), "pwd.sh", "pwd");

    Result result = format.execute(unit(script, format), config).toResult();

    assertThat(result.getOutput(), containsString(temporary.getRoot().getName()));
  }

  @Test
  public void testTimeout() throws Exception {
    ProcessTestFormat format = new ProcessTestFormat(1);
    File script = writeScript(temporary.getRoot(), "slow.sh", "echo starting; exec sleep 30");

    Stopwatch stopwatch = Stopwatch.createStarted();
    Result result = format.execute(unit(script, format), config).toResult();

    assertThat(stopwatch.elapsed(TimeUnit.SECONDS), lessThan(10L));
    assertEquals(ResultCode.TIMEOUT, result.getCode());
    assertThat(result.getOutput(), containsString("Reached timeout of 1 seconds"));
  }

  @Test
  public void testMissingExecutable() throws Exception {
    ProcessTestFormat format = new ProcessTestFormat(0);
    File missing = new File(temporary.getRoot(), "missing.sh");
    try {
      format.execute(unit(missing, format), config);
      fail("Expected IOException");
    } catch (IOException expected) {
      assertThat(expected.getMessage(), containsString("Test executable not found"));
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeTimeoutRejected() {
    new ProcessTestFormat(-1);
  }
}
