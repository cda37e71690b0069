package io.cronclash.cli;

import io.cronclash.CronClashException;
import io.cronclash.DetectionOptions;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Parsed command line.
 *
 * @param verbose list every job and draw the daily grid
 * @param json emit a JSON document instead of text
 * @param strict fail on warnings as well as errors
 * @param help print usage and exit
 * @param files globs of files to scan, relative to the working directory; empty for the defaults
 * @param detection the detection settings
 */
public record CliOptions(
    boolean verbose,
    boolean json,
    boolean strict,
    boolean help,
    List<String> files,
    DetectionOptions detection) {

  /** Usage text printed for {@code --help} and after usage errors. */
  public static final String USAGE =
      String.join(
          "\n",
          "usage: cronclash [options]",
          "",
          "Check for scheduling conflicts between cron jobs.",
          "",
          "options:",
          "  -v, --verbose               list jobs and draw the daily schedule",
          "      --json                  output a JSON report for CI",
          "      --strict                exit with 1 on any conflict, not just errors",
          "      --files GLOB [GLOB...]  files to check (default: press/cron, press/worker)",
          "      --zone ZONE             zone cron times are read in (default: UTC)",
          "      --default-duration MIN  duration of jobs without an estimate (default: 30)",
          "  -h, --help                  show this message",
          "");

  /** Creates a new CliOptions with a defensive copy of files. */
  public CliOptions {
    files = List.copyOf(files);
  }

  /**
   * Parses the command line.
   *
   * @param args the arguments
   * @return the parsed options
   * @throws CronClashException if an argument is unknown or a value is missing or invalid
   */
  public static CliOptions parse(String... args) throws CronClashException {
    boolean verbose = false;
    boolean json = false;
    boolean strict = false;
    boolean help = false;
    List<String> files = new ArrayList<>();
    DetectionOptions detection = DetectionOptions.defaults();

    int i = 0;
    while (i < args.length) {
      String arg = args[i++];
      switch (arg) {
        case "-v", "--verbose" -> verbose = true;
        case "--json" -> json = true;
        case "--strict" -> strict = true;
        case "-h", "--help" -> help = true;
        case "--files" -> {
          int first = i;
          while (i < args.length && !args[i].startsWith("-")) {
            files.add(args[i++]);
          }
          if (i == first) {
            throw CronClashException.usage("--files needs at least one glob", arg);
          }
        }
        case "--zone" -> detection = detection.withZone(parseZone(value(args, i++, arg)));
        case "--default-duration" ->
            detection =
                detection.withDefaultDurationMinutes(parseMinutes(value(args, i++, arg), arg));
        default -> throw CronClashException.usage("unknown argument " + arg, arg);
      }
    }
    return new CliOptions(verbose, json, strict, help, files, detection);
  }

  private static String value(String[] args, int index, String flag) throws CronClashException {
    if (index >= args.length) {
      throw CronClashException.usage(flag + " needs a value", flag);
    }
    return args[index];
  }

  private static ZoneId parseZone(String text) throws CronClashException {
    try {
      return ZoneId.of(text);
    } catch (DateTimeException e) {
      throw CronClashException.usage("unknown zone " + text, text);
    }
  }

  private static int parseMinutes(String text, String flag) throws CronClashException {
    int minutes;
    try {
      minutes = Integer.parseInt(text);
    } catch (NumberFormatException e) {
      minutes = 0;
    }
    if (minutes <= 0) {
      throw CronClashException.usage(flag + " must be a positive number of minutes", text);
    }
    return minutes;
  }
}
