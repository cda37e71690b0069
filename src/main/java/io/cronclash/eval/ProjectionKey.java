package io.cronclash.eval;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

/**
 * Cache key for one projection call. Expressions that differ only in whitespace share a key.
 *
 * @param fields the five cron fields
 * @param anchorMinute the anchor truncated to whole minutes
 * @param count the number of occurrences requested
 * @param zone the zone wall-clock fields are read in
 */
public record ProjectionKey(List<String> fields, Instant anchorMinute, int count, ZoneId zone) {
  /** Creates a new ProjectionKey with a defensive copy of fields. */
  public ProjectionKey {
    fields = List.copyOf(fields);
  }
}
