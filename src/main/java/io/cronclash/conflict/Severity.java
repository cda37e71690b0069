package io.cronclash.conflict;

/** How serious a detected overlap is. */
public enum Severity {
  /** Informational; fails a run only in strict mode. */
  WARNING("warning", "WARN"),
  /** Actionable; always fails a run. */
  ERROR("error", "ERROR");

  private final String value;
  private final String label;

  Severity(String value, String label) {
    this.value = value;
    this.label = label;
  }

  /**
   * Returns the lowercase string representation used in structured reports.
   *
   * @return {@code "warning"} or {@code "error"}
   */
  public String value() {
    return value;
  }

  /**
   * Returns the short tag used in text reports.
   *
   * @return {@code "WARN"} or {@code "ERROR"}
   */
  public String label() {
    return label;
  }

  @Override
  public String toString() {
    return value;
  }
}
