package io.cronclash;

import java.util.Optional;

/** Exception thrown for malformed schedules, failed discovery or reporting, and usage errors. */
public final class CronClashException extends Exception {
  /** The error kind. */
  private final ErrorKind kind;

  /** The offending input, if any. */
  private final String input;

  /** An optional hint for fixing the error. */
  private final String suggestion;

  private CronClashException(
      ErrorKind kind, String message, String input, String suggestion, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.input = input;
    this.suggestion = suggestion;
  }

  /**
   * Creates an error for a cron text with the wrong number of fields.
   *
   * @param message the error message
   * @param input the cron text as supplied
   * @return a new CronClashException of kind {@link ErrorKind#INVALID_SCHEDULE_FORMAT}
   */
  public static CronClashException invalidSchedule(String message, String input) {
    return new CronClashException(
        ErrorKind.INVALID_SCHEDULE_FORMAT,
        message,
        input,
        "minute hour day-of-month month day-of-week",
        null);
  }

  /**
   * Creates a discovery error.
   *
   * @param message the error message
   * @param cause the underlying failure
   * @return a new CronClashException of kind {@link ErrorKind#DISCOVERY}
   */
  public static CronClashException discovery(String message, Throwable cause) {
    return new CronClashException(ErrorKind.DISCOVERY, message, null, null, cause);
  }

  /**
   * Creates a report rendering error.
   *
   * @param message the error message
   * @param cause the underlying failure
   * @return a new CronClashException of kind {@link ErrorKind#REPORT}
   */
  public static CronClashException report(String message, Throwable cause) {
    return new CronClashException(ErrorKind.REPORT, message, null, null, cause);
  }

  /**
   * Creates a command line usage error.
   *
   * @param message the error message
   * @param input the offending argument, may be null
   * @return a new CronClashException of kind {@link ErrorKind#USAGE}
   */
  public static CronClashException usage(String message, String input) {
    return new CronClashException(ErrorKind.USAGE, message, input, "--help", null);
  }

  /**
   * Returns the kind of error.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Returns the offending input, if available.
   *
   * @return the input, or empty if not available
   */
  public Optional<String> input() {
    return Optional.ofNullable(input);
  }

  /**
   * Returns a suggestion for fixing the error, if available.
   *
   * @return the suggestion, or empty if not available
   */
  public Optional<String> suggestion() {
    return Optional.ofNullable(suggestion);
  }

  /**
   * Formats the error for terminal output.
   *
   * <p>For errors with an input, produces output like:
   *
   * <pre>
   * error: expected 5 cron fields, got 4
   *   0 2 * *
   *   expected: minute hour day-of-month month day-of-week
   * </pre>
   *
   * @return a formatted error message
   */
  public String displayRich() {
    StringBuilder sb = new StringBuilder();
    sb.append("error: ").append(getMessage());
    if (input != null) {
      sb.append("\n  ").append(input);
      if (suggestion != null && !suggestion.isEmpty()) {
        sb.append("\n  ");
        sb.append(kind == ErrorKind.USAGE ? "try: " : "expected: ");
        sb.append(suggestion);
      }
    }
    return sb.toString();
  }
}
