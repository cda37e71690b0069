package io.cronclash;

import io.cronclash.conflict.ScheduledJob;
import io.cronclash.eval.OccurrenceProjector;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Settings for a conflict check.
 *
 * @param horizon number of occurrences projected per schedule
 * @param defaultDurationMinutes duration given to discovered jobs that do not state one
 * @param zone the zone cron wall-clock fields are read in
 */
public record DetectionOptions(int horizon, int defaultDurationMinutes, ZoneId zone) {
  /** Validates the numeric settings and defaults the zone to UTC. */
  public DetectionOptions {
    if (horizon <= 0) {
      throw new IllegalArgumentException("horizon must be positive, got " + horizon);
    }
    if (defaultDurationMinutes <= 0) {
      throw new IllegalArgumentException(
          "default duration must be positive, got " + defaultDurationMinutes);
    }
    zone = zone == null ? ZoneOffset.UTC : zone;
  }

  /**
   * Returns the default settings: 24 occurrences, 30 minutes, UTC.
   *
   * @return the default options
   */
  public static DetectionOptions defaults() {
    return new DetectionOptions(
        OccurrenceProjector.DEFAULT_HORIZON,
        ScheduledJob.DEFAULT_DURATION_MINUTES,
        ZoneOffset.UTC);
  }

  /**
   * Returns a copy with the specified horizon.
   *
   * @param horizon the horizon
   * @return a new DetectionOptions with the updated horizon
   */
  public DetectionOptions withHorizon(int horizon) {
    return new DetectionOptions(horizon, defaultDurationMinutes, zone);
  }

  /**
   * Returns a copy with the specified default duration.
   *
   * @param minutes the default duration
   * @return a new DetectionOptions with the updated default duration
   */
  public DetectionOptions withDefaultDurationMinutes(int minutes) {
    return new DetectionOptions(horizon, minutes, zone);
  }

  /**
   * Returns a copy with the specified zone.
   *
   * @param zone the zone
   * @return a new DetectionOptions with the updated zone
   */
  public DetectionOptions withZone(ZoneId zone) {
    return new DetectionOptions(horizon, defaultDurationMinutes, zone);
  }
}
