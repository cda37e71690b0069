package io.cronclash.overlap;

import java.time.Duration;
import java.time.Instant;

/**
 * A half-open time range {@code [start, end)}.
 *
 * @param start the start instant (inclusive)
 * @param end the end instant (exclusive)
 */
public record Interval(Instant start, Instant end) {
  /** Rejects ranges that end before they start. */
  public Interval {
    if (end.isBefore(start)) {
      throw new IllegalArgumentException("interval ends before it starts: " + start + " > " + end);
    }
  }

  /**
   * Creates the running window of a job started at the given instant.
   *
   * @param start the occurrence instant
   * @param duration the assumed running time
   * @return {@code [start, start + duration)}
   */
  public static Interval of(Instant start, Duration duration) {
    return new Interval(start, start.plus(duration));
  }

  /**
   * Returns true if the two ranges share at least one instant. Adjacent ranges do not intersect.
   *
   * @param other the other range
   * @return true if {@code start < other.end && other.start < end}
   */
  public boolean intersects(Interval other) {
    return start.isBefore(other.end) && other.start.isBefore(end);
  }

  /**
   * Returns the length of this range.
   *
   * @return the duration between start and end
   */
  public Duration length() {
    return Duration.between(start, end);
  }

  @Override
  public String toString() {
    return "[" + start + ", " + end + ")";
  }
}
