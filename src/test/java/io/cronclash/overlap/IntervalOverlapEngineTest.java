package io.cronclash.overlap;

import static org.junit.jupiter.api.Assertions.*;

import io.cronclash.CronClashException;
import io.cronclash.cron.CronExpression;
import io.cronclash.eval.OccurrenceProjector;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

public class IntervalOverlapEngineTest {
  private static final Instant ANCHOR = Instant.parse("2024-01-01T01:00:00Z");

  private final IntervalOverlapEngine engine = new IntervalOverlapEngine(new OccurrenceProjector());

  private static CronExpression cron(String text) throws CronClashException {
    return CronExpression.parse(text);
  }

  @Test
  void testAdjacentWindowsDoNotOverlap() throws CronClashException {
    assertFalse(engine.overlaps(cron("0 2 * * *"), cron("30 2 * * *"), 30, ANCHOR));
  }

  @Test
  void testOneExtraMinuteOverlaps() throws CronClashException {
    assertTrue(engine.overlaps(cron("0 2 * * *"), cron("30 2 * * *"), 31, ANCHOR));
  }

  @Test
  void testSameTimeOverlaps() throws CronClashException {
    assertTrue(engine.overlaps(cron("0 2 * * *"), cron("0 2 * * *"), 1, ANCHOR));
  }

  @Test
  void testOverlapIsSymmetric() throws CronClashException {
    List<String> schedules =
        List.of(
            "0 2 * * *",
            "30 2 * * *",
            "45 23 * * *",
            "*/15 * * * *",
            "0 * * * *",
            "0 2 1 * *",
            "5 0 * * *");
    for (String a : schedules) {
      for (String b : schedules) {
        for (int duration : List.of(1, 15, 30, 31, 90)) {
          assertEquals(
              engine.overlaps(cron(a), cron(b), duration, ANCHOR),
              engine.overlaps(cron(b), cron(a), duration, ANCHOR),
              a + " vs " + b + " for " + duration + " min");
        }
      }
    }
  }

  @Test
  void testUnmodeledScheduleNeverOverlaps() throws CronClashException {
    assertFalse(engine.overlaps(cron("0 2 1 * *"), cron("0 2 * * *"), 120, ANCHOR));
    assertFalse(engine.overlaps(cron("0 2 * * *"), cron("0 2 1 * *"), 120, ANCHOR));
    assertFalse(engine.overlaps(cron("0 2 1 * *"), cron("0 2 1 * *"), 120, ANCHOR));
  }

  @Test
  void testLateNightRunSpillsPastMidnight() throws CronClashException {
    assertTrue(engine.overlaps(cron("45 23 * * *"), cron("5 0 * * *"), 30, ANCHOR));
  }

  @Test
  void testFindOverlapReportsFirstWindows() throws CronClashException {
    Optional<OverlapWindow> window =
        engine.findOverlap(cron("0 2 * * *"), cron("30 2 * * *"), 31, ANCHOR);
    assertTrue(window.isPresent());
    assertEquals(
        Interval.of(Instant.parse("2024-01-01T02:00:00Z"), Duration.ofMinutes(31)),
        window.get().first());
    assertEquals(
        Interval.of(Instant.parse("2024-01-01T02:30:00Z"), Duration.ofMinutes(31)),
        window.get().second());
  }

  @Test
  void testHorizonBoundsLookahead() throws CronClashException {
    // 24 quarter-hour runs from midnight end at 06:00, so noon is out of sight
    Instant midnight = Instant.parse("2024-01-01T00:00:00Z");
    assertFalse(engine.overlaps(cron("*/15 * * * *"), cron("0 12 * * *"), 30, midnight));

    IntervalOverlapEngine wide = new IntervalOverlapEngine(new OccurrenceProjector(), 96);
    assertTrue(wide.overlaps(cron("*/15 * * * *"), cron("0 12 * * *"), 30, midnight));
  }

  @Test
  void testHorizonMustBePositive() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new IntervalOverlapEngine(new OccurrenceProjector(), 0));
  }

  @Test
  void testIntervalIntersection() {
    Instant t = Instant.parse("2024-01-01T02:00:00Z");
    Interval a = Interval.of(t, Duration.ofMinutes(30));
    Interval b = Interval.of(t.plus(Duration.ofMinutes(30)), Duration.ofMinutes(30));
    Interval c = Interval.of(t.plus(Duration.ofMinutes(29)), Duration.ofMinutes(30));
    assertFalse(a.intersects(b));
    assertFalse(b.intersects(a));
    assertTrue(a.intersects(c));
    assertTrue(c.intersects(b));
    assertEquals(Duration.ofMinutes(30), a.length());
    assertThrows(IllegalArgumentException.class, () -> new Interval(t, t.minusSeconds(1)));
  }
}
