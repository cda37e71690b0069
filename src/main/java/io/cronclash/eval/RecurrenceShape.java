package io.cronclash.eval;

import java.time.Duration;

/**
 * The recurrence shapes the projector understands.
 *
 * <p>Anything outside the first three is {@link #UNMODELED}: it projects to no occurrences and so
 * never takes part in a conflict.
 */
public enum RecurrenceShape {
  /** Plain integer minute and hour, e.g. {@code 0 2 * * *}. */
  FIXED_DAILY(Duration.ofDays(1)),
  /** {@code *}{@code /15 * * * *}. */
  QUARTER_HOURLY(Duration.ofMinutes(15)),
  /** {@code 0 * * * *}. */
  HOURLY(Duration.ofHours(1)),
  /** Any other expression. */
  UNMODELED(Duration.ZERO);

  private final Duration period;

  RecurrenceShape(Duration period) {
    this.period = period;
  }

  /**
   * Returns the spacing between consecutive occurrences.
   *
   * @return the period, or {@link Duration#ZERO} for {@link #UNMODELED}
   */
  public Duration period() {
    return period;
  }

  /**
   * Returns true if occurrences can be projected for this shape.
   *
   * @return false only for {@link #UNMODELED}
   */
  public boolean isModeled() {
    return this != UNMODELED;
  }
}
