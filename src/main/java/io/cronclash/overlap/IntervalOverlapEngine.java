package io.cronclash.overlap;

import io.cronclash.cron.CronExpression;
import io.cronclash.eval.OccurrenceProjector;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether two schedules have intersecting running windows.
 *
 * <p>Both schedules are projected {@code horizon} occurrences ahead of the same anchor, and every
 * window of the first is compared with every window of the second. Both sides use the same
 * duration. A schedule that projects to nothing cannot overlap anything.
 *
 * <p>The horizon is a count, not a time span. At the default of 24 an every-15-minutes schedule is
 * only looked at six hours ahead, so a daily job firing later in the day is not seen as
 * conflicting with it.
 */
public final class IntervalOverlapEngine {
  private final OccurrenceProjector projector;
  private final int horizon;

  /**
   * Creates an engine using the default horizon.
   *
   * @param projector the occurrence projector
   */
  public IntervalOverlapEngine(OccurrenceProjector projector) {
    this(projector, OccurrenceProjector.DEFAULT_HORIZON);
  }

  /**
   * Creates an engine.
   *
   * @param projector the occurrence projector
   * @param horizon number of occurrences projected per schedule
   */
  public IntervalOverlapEngine(OccurrenceProjector projector, int horizon) {
    if (horizon <= 0) {
      throw new IllegalArgumentException("horizon must be positive, got " + horizon);
    }
    this.projector = projector;
    this.horizon = horizon;
  }

  /**
   * Returns true if any running window of {@code a} intersects any running window of {@code b}.
   *
   * @param a the first schedule
   * @param b the second schedule
   * @param durationMinutes the running time assumed for both
   * @param anchor the instant both projections start from
   * @return true if the schedules overlap
   */
  public boolean overlaps(CronExpression a, CronExpression b, int durationMinutes, Instant anchor) {
    return findOverlap(a, b, durationMinutes, anchor).isPresent();
  }

  /**
   * Finds the first pair of intersecting running windows, scanning {@code a} in order and, for each
   * of its windows, {@code b} in order.
   *
   * @param a the first schedule
   * @param b the second schedule
   * @param durationMinutes the running time assumed for both
   * @param anchor the instant both projections start from
   * @return the first intersecting pair, or empty if none was found
   */
  public Optional<OverlapWindow> findOverlap(
      CronExpression a, CronExpression b, int durationMinutes, Instant anchor) {
    List<Instant> runsA = projector.project(a, anchor, horizon);
    List<Instant> runsB = projector.project(b, anchor, horizon);
    if (runsA.isEmpty() || runsB.isEmpty()) {
      return Optional.empty();
    }

    Duration duration = Duration.ofMinutes(durationMinutes);
    for (Instant startA : runsA) {
      Interval windowA = Interval.of(startA, duration);
      for (Instant startB : runsB) {
        Interval windowB = Interval.of(startB, duration);
        if (windowA.intersects(windowB)) {
          return Optional.of(new OverlapWindow(windowA, windowB));
        }
      }
    }
    return Optional.empty();
  }

  /**
   * Returns the number of occurrences projected per schedule.
   *
   * @return the horizon
   */
  public int horizon() {
    return horizon;
  }
}
