// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrun.impl;

import java.io.BufferedOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import javax.annotation.Nullable;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Charsets;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.io.Files;

import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.kohsuke.args4j.spi.StringArrayOptionHandler;

/**
 * Runs executable test scripts through a {@link TestRun} and reports on the console.
 */
public class ConsoleRunnerImpl {
  /** Should be set to false for unit testing via {@link #setCallSystemExitOnFinish} */
  private static boolean callSystemExitOnFinish = true;

  private static final String SUITE_NAME = "console";

  private final RunConfig config;
  private final int jobs;
  private final long maxTimeSeconds;
  private final long timeoutSeconds;
  private final String parallelismGroup;
  private final boolean verbose;
  private final PrintStream out;
  private final PrintStream err;

  ConsoleRunnerImpl(
      RunConfig config,
      int jobs,
      long maxTimeSeconds,
      long timeoutSeconds,
      @Nullable String parallelismGroup,
      boolean verbose,
      PrintStream out,
      PrintStream err) {

    Preconditions.checkNotNull(config);
    Preconditions.checkArgument(jobs > 0, "jobs must be positive: %s", jobs);
    Preconditions.checkNotNull(out);
    Preconditions.checkNotNull(err);
    Preconditions.checkArgument(parallelismGroup == null
            || config.getParallelismGroups().containsKey(parallelismGroup),
        "Parallelism group %s has no capacity configured", parallelismGroup);

    this.config = config;
    this.jobs = jobs;
    this.maxTimeSeconds = maxTimeSeconds;
    this.timeoutSeconds = timeoutSeconds;
    this.parallelismGroup = parallelismGroup;
    this.verbose = verbose;
    this.out = out;
    this.err = err;
  }

  /**
   * Runs the given test executables and exits with the run's exit code.
   */
  void run(Collection<String> tests) {
    TestSuiteConfig suite = TestSuiteConfig.withGroup(
        SUITE_NAME, new ProcessTestFormat(timeoutSeconds), parallelismGroup);
    List<TestUnit> units = Lists.newArrayList();
    for (String test : tests) {
      units.add(new TestUnit(test, suite));
    }

    ConsoleDisplay display = new ConsoleDisplay(out, verbose, units.size());
    TestRun run = new TestRun(config, units, Aborter.HALT, out);
    int exitCode;
    try {
      RunSummary summary = run.executeTests(display, jobs, maxTimeSeconds, TimeUnit.SECONDS);
      display.printSummary(summary);
      exitCode = summary.getExitCode();
    } catch (TestExecutionException e) {
      err.println(e.getMessage());
      e.getCause().printStackTrace(err);
      exitCode = 1;
    }
    out.flush();
    err.flush();
    exit(exitCode);
  }

  /**
   * Parses a {@code name=capacity} list, entries separated by commas.
   */
  @VisibleForTesting
  static Map<String, Integer> parseParallelismGroups(String groups) {
    Map<String, Integer> parsed = Maps.newLinkedHashMap();
    for (String group : Splitter.on(',').trimResults().omitEmptyStrings().split(groups)) {
      List<String> parts = Splitter.on('=').trimResults().splitToList(group);
      if (parts.size() != 2 || parts.get(0).isEmpty()) {
        throw new IllegalArgumentException(
            "Parallelism groups should be given as name=capacity, found: " + group);
      }
      int capacity;
      try {
        capacity = Integer.parseInt(parts.get(1));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(
            "Parallelism group capacity must be a number, found: " + group, e);
      }
      if (capacity <= 0) {
        throw new IllegalArgumentException(
            "Parallelism group capacity must be positive, found: " + group);
      }
      parsed.put(parts.get(0), capacity);
    }
    return parsed;
  }

  /**
   * Expands arguments of the form {@code @path} into the whitespace delimited arguments found in
   * the named file.
   */
  @VisibleForTesting
  static List<String> expandArgFiles(String[] args) throws IOException {
    List<String> tests = Lists.newArrayList();
    for (String test : args) {
      if (test.startsWith("@")) {
        String argFileContents =
            Files.asCharSource(new File(test.substring(1)), Charsets.UTF_8).read().trim();
        if (!argFileContents.isEmpty()) {
          tests.addAll(Arrays.asList(argFileContents.split("\\s+")));
        }
      } else {
        tests.add(test);
      }
    }
    return ImmutableList.copyOf(tests);
  }

  /**
   * Launcher for ConsoleRunner.
   *
   * @param args options from the command line
   */
  public static void main(String[] args) {
    /**
     * Command line option bean.
     */
    class Options {
      private int jobs = 0;

      @Option(name = "-j", aliases = "-jobs",
          usage = "Number of tests to run at once. Must be positive, or 0 to set automatically.")
      public void setJobs(int jobs) {
        if (jobs < 0) {
          throw new IllegalArgumentException("-jobs cannot be negative");
        }
        this.jobs = jobs;
      }

      @Option(name = "-max-time",
          usage = "Seconds after which to stop starting tests, 0 for no limit.")
      private long maxTime;

      @Option(name = "-max-failures",
          usage = "Stop starting tests after this many failures, 0 for no limit.")
      private int maxFailures;

      @Option(name = "-timeout", usage = "Seconds a single test may run, 0 for no limit.")
      private long timeout;

      @Option(name = "-single-process",
          usage = "Run tests one after another in this process; useful for debugging.")
      private boolean singleProcess;

      @Option(name = "-debug", usage = "Fail the run on the first error running a test.")
      private boolean debug;

      private final Map<String, Integer> parallelismGroups = Maps.newLinkedHashMap();

      @Option(name = "-parallelism-groups",
          usage = "Capacities of parallelism groups as name=N[,name=N...]; may be repeated.")
      public void addParallelismGroups(String groups) {
        parallelismGroups.putAll(parseParallelismGroups(groups));
      }

      @Option(name = "-group", usage = "The parallelism group every test runs in.")
      private String group;

      @Option(name = "-v", aliases = "-verbose", usage = "Show a line for each finished test.")
      private boolean verbose;

      @Argument(usage = "Paths of executable tests to run.  Names prefixed with @ are considered "
                        + "arg file paths and these will be loaded and the whitespace delimited "
                        + "arguments found inside added to the list",
                required = true,
                metaVar = "TESTS",
                handler = StringArrayOptionHandler.class)
      private String[] tests = {};
    }

    Options options = new Options();
    CmdLineParser parser = new CmdLineParser(options);
    try {
      parser.parseArgument(args);
      if (options.maxTime < 0 || options.maxFailures < 0 || options.timeout < 0) {
        throw new IllegalArgumentException(
            "-max-time, -max-failures and -timeout cannot be negative");
      }
    } catch (CmdLineException e) {
      System.err.println(e.getMessage());
      parser.printUsage(System.err);
      exit(1);
      return;
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      parser.printUsage(System.err);
      exit(1);
      return;
    }

    int jobs = options.jobs;
    if (jobs == 0) {
      jobs = Runtime.getRuntime().availableProcessors();
      System.err.printf("Auto-detected %d processors, using -jobs=%d\n", jobs, jobs);
    }

    RunConfig config = RunConfig.builder()
        .addParallelismGroups(options.parallelismGroups)
        .setMaxFailures(options.maxFailures)
        .setSingleProcess(options.singleProcess)
        .setDebug(options.debug)
        .build();

    List<String> tests;
    try {
      tests = expandArgFiles(options.tests);
    } catch (IOException e) {
      System.err.printf("Failed to load args from arg file: %s\n", e.getMessage());
      exit(1);
      return;
    }

    ConsoleRunnerImpl runner;
    try {
      runner = new ConsoleRunnerImpl(
          config,
          jobs,
          options.maxTime,
          options.timeout,
          options.group,
          options.verbose,
          // NB: Buffering helps speedup output-heavy runs.
          new PrintStream(new BufferedOutputStream(System.out), true),
          new PrintStream(new BufferedOutputStream(System.err), true));
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      exit(1);
      return;
    }
    runner.run(tests);
  }

  private static void exit(int code) {
    if (callSystemExitOnFinish) {
      // We're a main - its fine to exit.
      System.exit(code);
    } else {
      if (code != 0) {
        throw new RuntimeException("ConsoleRunner exited with status " + code);
      }
    }
  }

  // ---------------------------- For testing only ---------------------------------

  public static void setCallSystemExitOnFinish(boolean exitOnFinish) {
    callSystemExitOnFinish = exitOnFinish;
  }
}
