package io.cronclash.discovery;

import io.cronclash.CronClashException;
import io.cronclash.conflict.ScheduledJob;
import io.cronclash.cron.CronExpression;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds cron schedules in Python-style source text, one line at a time.
 *
 * <p>Recognized forms (case-insensitive):
 *
 * <ul>
 *   <li>{@code scheduler.add_job(fn, trigger='cron', hour=2, minute=0)}
 *   <li>{@code @scheduler.scheduled_job('cron', hour=2, minute=0)}
 *   <li>{@code BACKUP_SCHEDULE = "0 2 * * *"}
 *   <li>{@code cron: "0 2 * * *"}
 *   <li>{@code schedule="0 2 1 * *"}
 * </ul>
 *
 * <p>A line yields at most one job, from the first form that matches. The job is named after the
 * nearest {@code def} or {@code name="..."} in the surrounding lines.
 */
public final class PatternJobDiscovery implements JobDiscovery {
  private static final Logger log = LoggerFactory.getLogger(PatternJobDiscovery.class);

  private static final List<Pattern> PATTERNS =
      List.of(
          Pattern.compile(
              "add_job\\s*\\([^)]*trigger\\s*=\\s*['\"]cron['\"][^)]*"
                  + "hour\\s*=\\s*(\\d+)[^)]*minute\\s*=\\s*(\\d+)",
              Pattern.CASE_INSENSITIVE),
          Pattern.compile(
              "scheduled_job\\s*\\([^)]*['\"]cron['\"][^)]*"
                  + "hour\\s*=\\s*(\\d+)[^)]*minute\\s*=\\s*(\\d+)",
              Pattern.CASE_INSENSITIVE),
          Pattern.compile(
              "SCHEDULE\\s*=\\s*['\"](\\d+\\s+\\d+\\s+\\*\\s+\\*\\s+\\*)['\"]",
              Pattern.CASE_INSENSITIVE),
          Pattern.compile(
              "cron:\\s*['\"](\\d+\\s+\\d+\\s+\\*\\s+\\*\\s+\\*)['\"]", Pattern.CASE_INSENSITIVE),
          Pattern.compile(
              "schedule\\s*=\\s*['\"](\\d+\\s+\\d+\\s+[\\d*]+\\s+[\\d*]+\\s+[\\d*]+)['\"]",
              Pattern.CASE_INSENSITIVE));

  private static final Pattern FUNCTION_NAME = Pattern.compile("def\\s+(\\w+)");
  private static final Pattern NAME_ASSIGNMENT =
      Pattern.compile("name\\s*=\\s*['\"]([^'\"]+)['\"]");

  /** Lines before the match included in the naming window. */
  private static final int NAME_LOOKBEHIND = 4;

  /** Lines after the match included in the naming window. */
  private static final int NAME_LOOKAHEAD = 1;

  private final int defaultDurationMinutes;

  /** Creates a discovery that gives found jobs the default 30-minute duration. */
  public PatternJobDiscovery() {
    this(ScheduledJob.DEFAULT_DURATION_MINUTES);
  }

  /**
   * Creates a discovery.
   *
   * @param defaultDurationMinutes the duration given to every found job
   */
  public PatternJobDiscovery(int defaultDurationMinutes) {
    this.defaultDurationMinutes = defaultDurationMinutes;
  }

  @Override
  public List<ScheduledJob> discover(String sourceFile, String content) {
    String[] lines = content.split("\n", -1);
    String fileName = fileName(sourceFile);
    List<ScheduledJob> jobs = new ArrayList<>();

    for (int i = 0; i < lines.length; i++) {
      int lineNumber = i + 1;
      Optional<String> cron = cronOnLine(lines[i]);
      if (cron.isEmpty()) {
        continue;
      }
      try {
        CronExpression schedule = CronExpression.parse(cron.get());
        String name =
            jobName(lines, lineNumber).orElse("Job in " + fileName + ":" + lineNumber);
        jobs.add(
            ScheduledJob.of(name, schedule, sourceFile, lineNumber)
                .withDuration(defaultDurationMinutes));
      } catch (CronClashException e) {
        log.warn("Ignoring schedule at {}:{}: {}", sourceFile, lineNumber, e.getMessage());
      }
    }
    return jobs;
  }

  /**
   * Extracts the cron text from a single line.
   *
   * @param line the source line
   * @return the cron text, or empty if no recognized form is on the line
   */
  static Optional<String> cronOnLine(String line) {
    for (Pattern pattern : PATTERNS) {
      Matcher m = pattern.matcher(line);
      if (m.find()) {
        if (m.groupCount() == 2) {
          String hour = m.group(1);
          String minute = m.group(2);
          return Optional.of(minute + " " + hour + " * * *");
        }
        return Optional.of(m.group(1));
      }
    }
    return Optional.empty();
  }

  /**
   * Names a job from the lines around it.
   *
   * @param lines all lines of the file
   * @param lineNumber the 1-based line of the schedule
   * @return a function-derived or explicit name, or empty if neither is nearby
   */
  static Optional<String> jobName(String[] lines, int lineNumber) {
    int start = Math.max(0, lineNumber - 1 - NAME_LOOKBEHIND);
    int end = Math.min(lines.length, lineNumber + NAME_LOOKAHEAD + 1);
    String context = String.join("\n", Arrays.copyOfRange(lines, start, end));

    Matcher function = FUNCTION_NAME.matcher(context);
    if (function.find()) {
      return Optional.of(titleCase(function.group(1).replace('_', ' ')));
    }
    Matcher name = NAME_ASSIGNMENT.matcher(context);
    if (name.find()) {
      return Optional.of(name.group(1));
    }
    return Optional.empty();
  }

  /** Upper-cases the first letter of every run of letters and lower-cases the rest. */
  static String titleCase(String text) {
    StringBuilder sb = new StringBuilder(text.length());
    boolean previousIsLetter = false;
    for (char ch : text.toCharArray()) {
      if (Character.isLetter(ch)) {
        sb.append(previousIsLetter ? Character.toLowerCase(ch) : Character.toUpperCase(ch));
        previousIsLetter = true;
      } else {
        sb.append(ch);
        previousIsLetter = false;
      }
    }
    return sb.toString();
  }

  private static String fileName(String sourceFile) {
    int slash = Math.max(sourceFile.lastIndexOf('/'), sourceFile.lastIndexOf('\\'));
    return slash < 0 ? sourceFile : sourceFile.substring(slash + 1);
  }
}
