package io.cronclash.conflict;

import java.util.Set;

/**
 * Turns an overlap between two jobs into a {@link ScheduleConflict}.
 *
 * <p>An overlap is an {@link Severity#ERROR} when both jobs are flagged resource intensive, or
 * when both carry the same resource-class tag ({@code io-intensive} or {@code cpu-intensive}).
 * Every other overlap is a {@link Severity#WARNING}.
 */
public final class ConflictClassifier {

  /** Tags that mark a job as competing for a specific resource. */
  public static final Set<String> RESOURCE_CLASS_TAGS = Set.of("io-intensive", "cpu-intensive");

  /**
   * Classifies the severity of an overlap.
   *
   * @param job1 the first job
   * @param job2 the second job
   * @return the severity
   */
  public Severity severity(ScheduledJob job1, ScheduledJob job2) {
    if (job1.resourceIntensive() && job2.resourceIntensive()) {
      return Severity.ERROR;
    }
    for (String tag : RESOURCE_CLASS_TAGS) {
      if (job1.tags().contains(tag) && job2.tags().contains(tag)) {
        return Severity.ERROR;
      }
    }
    return Severity.WARNING;
  }

  /**
   * Renders the conflict message, e.g. {@code 'Daily Backup' (0 2 * * *) overlaps with 'Backup
   * Pruning' (30 2 * * *)}.
   *
   * @param job1 the first job
   * @param job2 the second job
   * @return the message
   */
  public String message(ScheduledJob job1, ScheduledJob job2) {
    return String.format(
        "'%s' (%s) overlaps with '%s' (%s)",
        job1.name(), job1.schedule().raw(), job2.name(), job2.schedule().raw());
  }

  /**
   * Builds the conflict record for two overlapping jobs.
   *
   * @param job1 the job encountered first
   * @param job2 the job encountered second
   * @return the classified conflict
   */
  public ScheduleConflict classify(ScheduledJob job1, ScheduledJob job2) {
    return new ScheduleConflict(job1, job2, severity(job1, job2), message(job1, job2));
  }
}
