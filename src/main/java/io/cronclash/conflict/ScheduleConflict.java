package io.cronclash.conflict;

/**
 * An overlap between two jobs.
 *
 * @param job1 the job encountered first
 * @param job2 the job encountered second
 * @param severity the classified severity
 * @param message the human-readable description
 */
public record ScheduleConflict(
    ScheduledJob job1, ScheduledJob job2, Severity severity, String message) {

  /**
   * Returns true if this conflict is an error.
   *
   * @return true for {@link Severity#ERROR}
   */
  public boolean isError() {
    return severity == Severity.ERROR;
  }

  /**
   * Returns true if this conflict is about the given unordered pair.
   *
   * @param a one job
   * @param b the other job
   * @return true if {@code {a, b}} equals {@code {job1, job2}}
   */
  public boolean involves(ScheduledJob a, ScheduledJob b) {
    return (job1.equals(a) && job2.equals(b)) || (job1.equals(b) && job2.equals(a));
  }
}
