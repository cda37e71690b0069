package io.cronclash;

import io.cronclash.conflict.ScheduleConflict;
import io.cronclash.conflict.ScheduledJob;
import io.cronclash.conflict.Severity;
import java.time.Instant;
import java.util.List;

/**
 * The outcome of one conflict check.
 *
 * @param anchor the instant all projections started from
 * @param jobs the jobs that were checked, in input order
 * @param conflicts the detected conflicts, in detection order
 */
public record CheckResult(
    Instant anchor, List<ScheduledJob> jobs, List<ScheduleConflict> conflicts) {
  /** Creates a new CheckResult with defensive copies of lists. */
  public CheckResult {
    jobs = List.copyOf(jobs);
    conflicts = List.copyOf(conflicts);
  }

  /**
   * Returns the number of conflicts with the given severity.
   *
   * @param severity the severity to count
   * @return the count
   */
  public long count(Severity severity) {
    return conflicts.stream().filter(c -> c.severity() == severity).count();
  }

  /**
   * Returns the number of error conflicts.
   *
   * @return the count
   */
  public long errors() {
    return count(Severity.ERROR);
  }

  /**
   * Returns the number of warning conflicts.
   *
   * @return the count
   */
  public long warnings() {
    return count(Severity.WARNING);
  }

  /**
   * Returns the process exit code for this result.
   *
   * @param strict whether warnings fail the run too
   * @return 1 if an error exists, or in strict mode if any conflict exists; 0 otherwise
   */
  public int exitCode(boolean strict) {
    if (errors() > 0) {
      return 1;
    }
    return strict && !conflicts.isEmpty() ? 1 : 0;
  }
}
