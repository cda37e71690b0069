package io.cronclash;

import io.cronclash.conflict.ConflictClassifier;
import io.cronclash.conflict.ConflictDetector;
import io.cronclash.conflict.ScheduleConflict;
import io.cronclash.conflict.ScheduledJob;
import io.cronclash.eval.OccurrenceProjector;
import io.cronclash.eval.ProjectionCache;
import io.cronclash.overlap.IntervalOverlapEngine;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * The main entry point for checking a set of jobs for overlapping runs.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * ConflictCheck check = ConflictCheck.create(DetectionOptions.defaults());
 * CheckResult result = check.run(List.of(
 *     ScheduledJob.of("Backup", CronExpression.parse("0 2 * * *"), "backup.py", 1),
 *     ScheduledJob.of("Prune", CronExpression.parse("15 2 * * *"), "prune.py", 1)));
 * result.conflicts().forEach(c -> System.out.println(c.message()));
 * }</pre>
 */
public final class ConflictCheck {
  private final DetectionOptions options;
  private final Clock clock;
  private final OccurrenceProjector projector;
  private final ConflictDetector detector;

  private ConflictCheck(DetectionOptions options, Clock clock, ProjectionCache cache) {
    this.options = options;
    this.clock = clock;
    this.projector = new OccurrenceProjector(options.zone(), cache);
    this.detector =
        new ConflictDetector(
            new IntervalOverlapEngine(projector, options.horizon()),
            new ConflictClassifier(),
            clock);
  }

  /**
   * Creates a check anchored at the system UTC clock, without projection caching.
   *
   * @param options the detection options
   * @return a new ConflictCheck
   */
  public static ConflictCheck create(DetectionOptions options) {
    return create(options, Clock.systemUTC(), ProjectionCache.none());
  }

  /**
   * Creates a check.
   *
   * @param options the detection options
   * @param clock the source of the anchor instant
   * @param cache the projection cache
   * @return a new ConflictCheck
   */
  public static ConflictCheck create(
      DetectionOptions options, Clock clock, ProjectionCache cache) {
    return new ConflictCheck(options, clock, cache);
  }

  /**
   * Runs the check. The anchor is read from the clock once and used for every pair.
   *
   * @param jobs the jobs in input order
   * @return the jobs, the conflicts and the anchor used
   */
  public CheckResult run(List<ScheduledJob> jobs) {
    Instant anchor = clock.instant();
    List<ScheduleConflict> conflicts = detector.detect(jobs, anchor);
    return new CheckResult(anchor, jobs, conflicts);
  }

  /**
   * Returns the options this check was created with.
   *
   * @return the options
   */
  public DetectionOptions options() {
    return options;
  }

  /**
   * Returns the projector used by this check, for callers that render schedules.
   *
   * @return the projector
   */
  public OccurrenceProjector projector() {
    return projector;
  }
}
