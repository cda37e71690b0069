package io.cronclash.cli;

import io.cronclash.CheckResult;
import io.cronclash.ConflictCheck;
import io.cronclash.CronClashException;
import io.cronclash.conflict.ScheduledJob;
import io.cronclash.discovery.KnownJobRegistry;
import io.cronclash.discovery.PatternJobDiscovery;
import io.cronclash.discovery.SourceScanner;
import io.cronclash.eval.ConcurrentProjectionCache;
import io.cronclash.report.JsonReporter;
import io.cronclash.report.ScheduleVisualizer;
import io.cronclash.report.TextReporter;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point.
 *
 * <p>Exit codes: 0 when clean, 1 when an error conflict exists (or any conflict with {@code
 * --strict}), 2 on usage or report errors.
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);

  /** Directories scanned when no files are given, relative to the working directory. */
  static final List<String> DEFAULT_DIRS = List.of("press/cron", "press/worker");

  /** Provenance directory for registry jobs used when nothing else is found. */
  static final String FALLBACK_DIR = "press/cron";

  static final int EXIT_USAGE = 2;

  private Main() {}

  public static void main(String[] args) {
    int code =
        run(args, System.out, System.err, Path.of("").toAbsolutePath(), Clock.systemUTC());
    System.exit(code);
  }

  /**
   * Runs the checker.
   *
   * @param args the command line
   * @param out receives the report
   * @param err receives usage errors
   * @param workDir the directory relative paths are resolved against
   * @param clock the source of the anchor instant
   * @return the process exit code
   */
  static int run(String[] args, PrintStream out, PrintStream err, Path workDir, Clock clock) {
    CliOptions options;
    try {
      options = CliOptions.parse(args);
    } catch (CronClashException e) {
      err.println(e.displayRich());
      err.print(CliOptions.USAGE);
      return EXIT_USAGE;
    }
    if (options.help()) {
      out.print(CliOptions.USAGE);
      return 0;
    }

    ConflictCheck check =
        ConflictCheck.create(options.detection(), clock, new ConcurrentProjectionCache());
    SourceScanner scanner =
        new SourceScanner(
            KnownJobRegistry.defaults(),
            new PatternJobDiscovery(check.options().defaultDurationMinutes()));

    List<ScheduledJob> jobs = discover(options, scanner, workDir);
    CheckResult result = check.run(jobs);
    log.info(
        "Checked {} jobs: {} errors, {} warnings",
        result.jobs().size(),
        result.errors(),
        result.warnings());

    try {
      if (options.json()) {
        out.println(JsonReporter.render(result));
      } else {
        out.print(TextReporter.render(result, options.verbose()));
        if (options.verbose() && !jobs.isEmpty()) {
          out.print(ScheduleVisualizer.renderDaily(jobs, check.projector(), result.anchor()));
        }
      }
    } catch (CronClashException e) {
      err.println(e.displayRich());
      return EXIT_USAGE;
    }
    return result.exitCode(options.strict());
  }

  private static List<ScheduledJob> discover(
      CliOptions options, SourceScanner scanner, Path workDir) {
    List<ScheduledJob> jobs = new ArrayList<>();
    if (!options.files().isEmpty()) {
      for (String glob : options.files()) {
        try {
          jobs.addAll(scanner.scanGlob(workDir, glob));
        } catch (CronClashException e) {
          log.warn("Skipping {}: {}", glob, e.getMessage());
        }
      }
      return jobs;
    }

    for (String dir : DEFAULT_DIRS) {
      try {
        jobs.addAll(scanner.scanDirectory(workDir.resolve(dir)));
      } catch (CronClashException e) {
        log.warn("Skipping {}: {}", dir, e.getMessage());
      }
    }
    if (jobs.isEmpty()) {
      log.info("No jobs found under {}, checking known jobs", DEFAULT_DIRS);
      jobs.addAll(scanner.registryFallback(FALLBACK_DIR));
    }
    return jobs;
  }
}
