package io.cronclash.conflict;

import static org.junit.jupiter.api.Assertions.*;

import io.cronclash.CronClashException;
import io.cronclash.cron.CronExpression;
import io.cronclash.eval.OccurrenceProjector;
import io.cronclash.overlap.IntervalOverlapEngine;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;

public class ConflictDetectorTest {
  private static final Instant ANCHOR = Instant.parse("2024-01-01T01:00:00Z");

  private final ConflictDetector detector =
      new ConflictDetector(
          new IntervalOverlapEngine(new OccurrenceProjector()),
          new ConflictClassifier(),
          Clock.fixed(ANCHOR, ZoneOffset.UTC));

  private static ScheduledJob job(String name, String cron, int duration)
      throws CronClashException {
    return ScheduledJob.of(name, CronExpression.parse(cron), name + ".py", 1)
        .withDuration(duration);
  }

  private static ScheduledJob intensiveIo(String name, String cron, int duration)
      throws CronClashException {
    return job(name, cron, duration)
        .withResourceIntensive(true)
        .withTags(List.of("io-intensive"));
  }

  @Test
  void testBackupAndPruneAreAdjacent() throws CronClashException {
    List<ScheduledJob> jobs =
        List.of(intensiveIo("Backup", "0 2 * * *", 60), intensiveIo("Prune", "0 3 * * *", 30));
    assertTrue(detector.detect(jobs).isEmpty());
  }

  @Test
  void testLongPruneOverlapsBackup() throws CronClashException {
    ScheduledJob backup = intensiveIo("Backup", "0 2 * * *", 60);
    ScheduledJob prune = intensiveIo("Prune", "30 2 * * *", 90);
    List<ScheduleConflict> conflicts = detector.detect(List.of(backup, prune));
    assertEquals(1, conflicts.size());
    ScheduleConflict conflict = conflicts.get(0);
    assertSame(backup, conflict.job1());
    assertSame(prune, conflict.job2());
    assertEquals(Severity.ERROR, conflict.severity());
    assertEquals("'Backup' (0 2 * * *) overlaps with 'Prune' (30 2 * * *)", conflict.message());
  }

  @Test
  void testLongerDurationOfThePairIsUsed() throws CronClashException {
    // 10 minutes alone would not reach 02:30, the partner's 45 does
    ScheduledJob shortFirst = job("Short", "0 2 * * *", 10);
    ScheduledJob longSecond = job("Long", "30 2 * * *", 45);
    assertEquals(1, detector.detect(List.of(shortFirst, longSecond)).size());
  }

  @Test
  void testAtMostOneConflictPerPair() throws CronClashException {
    // every quarter hour meets every hour many times within the horizon
    List<ScheduledJob> jobs = List.of(job("Poll", "*/15 * * * *", 5), job("Sync", "0 * * * *", 5));
    assertEquals(1, detector.detect(jobs).size());
  }

  @Test
  void testUnmodeledJobNeverConflicts() throws CronClashException {
    List<ScheduledJob> jobs =
        List.of(
            intensiveIo("Monthly", "0 2 1 * *", 120),
            intensiveIo("Backup", "0 2 * * *", 60),
            intensiveIo("Rebuild", "15 2 * * *", 30));
    List<ScheduleConflict> conflicts = detector.detect(jobs);
    assertEquals(1, conflicts.size());
    assertEquals("Backup", conflicts.get(0).job1().name());
    assertEquals("Rebuild", conflicts.get(0).job2().name());
  }

  @Test
  void testPairsFollowInputOrder() throws CronClashException {
    ScheduledJob a = job("A", "0 2 * * *", 30);
    ScheduledJob b = job("B", "10 2 * * *", 30);
    ScheduledJob c = job("C", "20 2 * * *", 30);
    List<ScheduleConflict> conflicts = detector.detect(List.of(c, a, b));
    assertEquals(3, conflicts.size());
    assertTrue(conflicts.get(0).involves(c, a));
    assertSame(c, conflicts.get(0).job1());
    assertSame(c, conflicts.get(1).job1());
    assertSame(b, conflicts.get(1).job2());
    assertSame(a, conflicts.get(2).job1());
    assertSame(b, conflicts.get(2).job2());
  }

  @Test
  void testDetectionIsDeterministic() throws CronClashException {
    List<ScheduledJob> jobs =
        List.of(
            job("A", "0 2 * * *", 30),
            job("B", "10 2 * * *", 30),
            job("Poll", "*/15 * * * *", 5),
            job("Sync", "0 * * * *", 10),
            intensiveIo("Backup", "0 2 * * *", 60));
    assertEquals(detector.detect(jobs, ANCHOR), detector.detect(jobs, ANCHOR));
    assertEquals(detector.detect(jobs), detector.detect(jobs, ANCHOR));
  }

  @Test
  void testNoJobsOrOneJob() throws CronClashException {
    assertTrue(detector.detect(List.of()).isEmpty());
    assertTrue(detector.detect(List.of(job("Solo", "0 2 * * *", 600))).isEmpty());
  }
}
