package com.mk.fx.qa.lode.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.lode.core.LoadTestAbortedException;
import com.mk.fx.qa.lode.core.LoadTestEngine;
import com.mk.fx.qa.lode.core.config.InvalidConfigException;
import com.mk.fx.qa.lode.core.config.LoadTestConfig;
import com.mk.fx.qa.lode.core.metrics.ProgressListener;
import com.mk.fx.qa.lode.core.report.LoadTestReport;
import java.io.PrintStream;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;

/**
 * {@code lode} command-line entry point. Parses options, runs one load test and prints the report
 * to stdout; progress and diagnostics go to stderr.
 *
 * <p>Exit status: {@value #EXIT_OK} when the run completed (whatever the per-request outcomes),
 * {@value #EXIT_INVALID} for unusable arguments or configuration, {@value #EXIT_ABORTED} when the
 * run was interrupted.
 */
@Slf4j
public final class LodeCli {

  public static final int EXIT_OK = 0;
  public static final int EXIT_INVALID = 1;
  public static final int EXIT_ABORTED = 2;

  static final String PROGRAM_NAME = "lode";
  static final String ENGINE_LOGGER = "com.mk.fx.qa.lode";

  private final PrintStream out;
  private final PrintStream err;
  private final Supplier<LoadTestEngine> engineFactory;

  public LodeCli(PrintStream out, PrintStream err) {
    this(out, err, LoadTestEngine::new);
  }

  @VisibleForTesting
  LodeCli(PrintStream out, PrintStream err, Supplier<LoadTestEngine> engineFactory) {
    this.out = out;
    this.err = err;
    this.engineFactory = engineFactory;
  }

  public static void main(String... args) {
    Thread mainThread = Thread.currentThread();
    AtomicBoolean running = new AtomicBoolean(true);
    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                () -> {
                  if (running.get()) {
                    mainThread.interrupt();
                    joinQuietly(mainThread);
                  }
                },
                "lode-shutdown"));

    int status = new LodeCli(System.out, System.err).execute(args);
    running.set(false);
    if (status == EXIT_ABORTED) {
      // shutdown hooks are already running, System.exit would block on them
      Runtime.getRuntime().halt(status);
    }
    System.exit(status);
  }

  /** Runs the command and returns its exit status. Never calls {@link System#exit}. */
  public int execute(String... args) {
    var arguments = new LodeArguments();
    JCommander commander =
        JCommander.newBuilder().programName(PROGRAM_NAME).addObject(arguments).build();
    try {
      commander.parse(args);
    } catch (ParameterException e) {
      err.println("error: " + e.getMessage());
      err.print(usage(commander));
      return EXIT_INVALID;
    }

    if (arguments.isHelp()) {
      out.print(usage(commander));
      return EXIT_OK;
    }

    configureLogging(arguments.isVerbose());

    LoadTestConfig config;
    try {
      config = arguments.toConfig();
    } catch (InvalidConfigException e) {
      log.warn("Invalid configuration: {}", e.getMessage());
      err.println("error: " + e.getMessage());
      return EXIT_INVALID;
    }

    boolean text = arguments.getFormat() == OutputFormat.TEXT;
    ProgressListener progress = text ? new ConsoleProgress(err) : ProgressListener.NONE;
    try (LoadTestEngine engine = engineFactory.get()) {
      LoadTestReport report = engine.run(config, progress);
      out.print(ReportFormatter.format(report, arguments.getFormat()));
      if (!text) {
        out.println();
      }
      out.flush();
      return EXIT_OK;
    } catch (InvalidConfigException e) {
      log.warn("Invalid configuration: {}", e.getMessage());
      err.println("error: " + e.getMessage());
      return EXIT_INVALID;
    } catch (LoadTestAbortedException e) {
      log.warn("Run {} aborted", e.getRunId());
      err.println();
      err.println("aborted: run " + e.getRunId() + " was interrupted, no report produced");
      return EXIT_ABORTED;
    }
  }

  static String usage(JCommander commander) {
    var sb = new StringBuilder();
    commander.getUsageFormatter().usage(sb);
    return sb.toString();
  }

  /** WARN by default; {@code --verbose} lets the engine's INFO lines through. */
  static void configureLogging(boolean verbose) {
    if (LoggerFactory.getLogger(ENGINE_LOGGER) instanceof Logger logger) {
      logger.setLevel(verbose ? Level.INFO : Level.WARN);
    }
  }

  private static void joinQuietly(Thread thread) {
    try {
      thread.join(TimeUnit.SECONDS.toMillis(5));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
