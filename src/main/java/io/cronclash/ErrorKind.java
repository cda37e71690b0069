package io.cronclash;

/** The type of error raised while parsing schedules, discovering jobs, or reporting. */
public enum ErrorKind {
  /** A cron text does not split into exactly five fields. */
  INVALID_SCHEDULE_FORMAT("invalid-schedule-format"),
  /** A source file or directory could not be scanned for jobs. */
  DISCOVERY("discovery"),
  /** A report could not be rendered. */
  REPORT("report"),
  /** The command line could not be understood. */
  USAGE("usage");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the kind as a lowercase string
   */
  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
