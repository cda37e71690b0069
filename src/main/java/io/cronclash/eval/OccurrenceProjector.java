package io.cronclash.eval;

import io.cronclash.cron.CronExpression;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Projects a bounded list of future occurrences for a cron expression.
 *
 * <h2>Recognized Shapes</h2>
 *
 * <p>Shapes are tried in order and the first match wins. Day-of-month, month and day-of-week must
 * all be {@code *} for any of them to match.
 *
 * <ol>
 *   <li><b>Fixed daily:</b> minute and hour are plain integers within range. The first candidate
 *       is the anchor's date at {@code hour:minute}.
 *   <li><b>Quarter-hourly:</b> minute {@code *}{@code /15}, hour {@code *}. The first candidate is
 *       the anchor rounded down to a 15-minute boundary.
 *   <li><b>Hourly:</b> minute {@code 0}, hour {@code *}. The first candidate is the top of the
 *       anchor's hour.
 * </ol>
 *
 * <p>If the first candidate is not after the anchor it is advanced by one period. Later
 * occurrences follow at exact period spacing. Every other expression projects to an empty list.
 *
 * <h2>Anchor</h2>
 *
 * <p>The anchor is truncated to whole minutes before use. Wall-clock fields are read in the
 * projector's zone (UTC unless configured otherwise).
 *
 * <h2>Daylight Saving Time</h2>
 *
 * <p>Only the first candidate is resolved against the zone. Later occurrences are spaced in elapsed
 * time, so in a zone with DST transitions a fixed-daily schedule keeps 24-hour spacing and its
 * wall-clock time shifts by the transition after it (02:00 reads as 01:00 after a fall-back). A
 * first candidate that falls in a spring-forward gap is pushed forward by the gap length.
 */
public final class OccurrenceProjector {
  private static final Logger log = LoggerFactory.getLogger(OccurrenceProjector.class);

  /** Default number of occurrences to project. */
  public static final int DEFAULT_HORIZON = 24;

  private static final Pattern PLAIN_INTEGER = Pattern.compile("\\d+");

  private static final String QUARTER_HOUR_STEP = "*/15";

  private final ZoneId zone;
  private final ProjectionCache cache;

  /** Creates a projector reading wall-clock fields in UTC, without caching. */
  public OccurrenceProjector() {
    this(ZoneOffset.UTC, ProjectionCache.none());
  }

  /**
   * Creates a projector.
   *
   * @param zone the zone wall-clock fields are read in
   * @param cache the projection cache
   */
  public OccurrenceProjector(ZoneId zone, ProjectionCache cache) {
    this.zone = zone;
    this.cache = cache;
  }

  /**
   * Returns the zone wall-clock fields are read in.
   *
   * @return the zone
   */
  public ZoneId zone() {
    return zone;
  }

  /**
   * Classifies the recurrence shape of an expression.
   *
   * @param expr the cron expression
   * @return the shape, {@link RecurrenceShape#UNMODELED} if none of the known shapes match
   */
  public static RecurrenceShape shapeOf(CronExpression expr) {
    if (!expr.isEveryDay()) {
      return RecurrenceShape.UNMODELED;
    }
    if (isPlainInteger(expr.minute()) && isPlainInteger(expr.hour())) {
      // Syntactically valid but out of range, e.g. hour 99
      return fieldValue(expr.minute()) < 60 && fieldValue(expr.hour()) < 24
          ? RecurrenceShape.FIXED_DAILY
          : RecurrenceShape.UNMODELED;
    }
    if (QUARTER_HOUR_STEP.equals(expr.minute()) && CronExpression.ANY.equals(expr.hour())) {
      return RecurrenceShape.QUARTER_HOURLY;
    }
    if ("0".equals(expr.minute()) && CronExpression.ANY.equals(expr.hour())) {
      return RecurrenceShape.HOURLY;
    }
    return RecurrenceShape.UNMODELED;
  }

  /**
   * Projects the next {@link #DEFAULT_HORIZON} occurrences after the anchor.
   *
   * @param expr the cron expression
   * @param anchor the reference instant
   * @return the occurrences in increasing order, empty if the shape is not modeled
   */
  public List<Instant> project(CronExpression expr, Instant anchor) {
    return project(expr, anchor, DEFAULT_HORIZON);
  }

  /**
   * Projects up to {@code count} occurrences after the anchor.
   *
   * @param expr the cron expression
   * @param anchor the reference instant
   * @param count the number of occurrences to project
   * @return the occurrences in increasing order, empty if the shape is not modeled
   */
  public List<Instant> project(CronExpression expr, Instant anchor, int count) {
    if (count <= 0) {
      return List.of();
    }
    Instant anchorMinute = anchor.truncatedTo(ChronoUnit.MINUTES);
    ProjectionKey key = new ProjectionKey(expr.fields(), anchorMinute, count, zone);
    return cache.get(key, () -> compute(expr, anchorMinute, count));
  }

  private List<Instant> compute(CronExpression expr, Instant anchorMinute, int count) {
    RecurrenceShape shape = shapeOf(expr);
    if (!shape.isModeled()) {
      log.debug("No occurrences projected for unmodeled schedule '{}'", expr.raw());
      return List.of();
    }

    ZonedDateTime now = anchorMinute.atZone(zone);
    Instant first = firstCandidate(shape, expr, now);
    Duration period = shape.period();
    if (!first.isAfter(anchorMinute)) {
      first = first.plus(period);
    }

    List<Instant> results = new ArrayList<>(count);
    Instant current = first;
    for (int i = 0; i < count; i++) {
      results.add(current);
      current = current.plus(period);
    }
    return List.copyOf(results);
  }

  private static Instant firstCandidate(
      RecurrenceShape shape, CronExpression expr, ZonedDateTime now) {
    return switch (shape) {
      case FIXED_DAILY -> {
        LocalTime time =
            LocalTime.of(Integer.parseInt(expr.hour()), Integer.parseInt(expr.minute()));
        yield now.toLocalDate().atTime(time).atZone(now.getZone()).toInstant();
      }
      case QUARTER_HOURLY -> now.withMinute((now.getMinute() / 15) * 15).toInstant();
      case HOURLY -> now.truncatedTo(ChronoUnit.HOURS).toInstant();
      case UNMODELED -> throw new IllegalStateException("no candidate for unmodeled schedule");
    };
  }

  private static boolean isPlainInteger(String field) {
    return PLAIN_INTEGER.matcher(field).matches();
  }

  private static int fieldValue(String field) {
    try {
      return Integer.parseInt(field);
    } catch (NumberFormatException e) {
      return Integer.MAX_VALUE;
    }
  }
}
