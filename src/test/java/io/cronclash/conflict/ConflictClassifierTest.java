package io.cronclash.conflict;

import static org.junit.jupiter.api.Assertions.*;

import io.cronclash.CronClashException;
import io.cronclash.cron.CronExpression;
import java.util.List;
import org.junit.jupiter.api.Test;

public class ConflictClassifierTest {
  private final ConflictClassifier classifier = new ConflictClassifier();

  private static ScheduledJob job(String name, String cron) throws CronClashException {
    return ScheduledJob.of(name, CronExpression.parse(cron), name + ".py", 1);
  }

  @Test
  void testBothIntensiveIsError() throws CronClashException {
    ScheduledJob a = job("a", "0 2 * * *").withResourceIntensive(true);
    ScheduledJob b = job("b", "0 2 * * *").withResourceIntensive(true);
    assertEquals(Severity.ERROR, classifier.severity(a, b));
  }

  @Test
  void testOneIntensiveIsWarning() throws CronClashException {
    ScheduledJob a = job("a", "0 2 * * *").withResourceIntensive(true);
    ScheduledJob b = job("b", "0 2 * * *");
    assertEquals(Severity.WARNING, classifier.severity(a, b));
    assertEquals(Severity.WARNING, classifier.severity(b, a));
  }

  @Test
  void testSharedIoTagIsError() throws CronClashException {
    ScheduledJob a = job("a", "0 2 * * *").withTags(List.of("backup", "io-intensive"));
    ScheduledJob b = job("b", "0 2 * * *").withTags(List.of("io-intensive"));
    assertEquals(Severity.ERROR, classifier.severity(a, b));
  }

  @Test
  void testSharedCpuTagIsError() throws CronClashException {
    ScheduledJob a = job("a", "0 2 * * *").withTags(List.of("cpu-intensive"));
    ScheduledJob b = job("b", "0 2 * * *").withTags(List.of("report", "cpu-intensive"));
    assertEquals(Severity.ERROR, classifier.severity(a, b));
  }

  @Test
  void testDifferentResourceTagsOnlyWarn() throws CronClashException {
    ScheduledJob a = job("a", "0 2 * * *").withTags(List.of("io-intensive"));
    ScheduledJob b = job("b", "0 2 * * *").withTags(List.of("cpu-intensive"));
    assertEquals(Severity.WARNING, classifier.severity(a, b));
  }

  @Test
  void testSharedOrdinaryTagOnlyWarns() throws CronClashException {
    ScheduledJob a = job("a", "0 2 * * *").withTags(List.of("backup"));
    ScheduledJob b = job("b", "0 2 * * *").withTags(List.of("backup"));
    assertEquals(Severity.WARNING, classifier.severity(a, b));
  }

  @Test
  void testMessageUsesRawCronText() throws CronClashException {
    ScheduledJob a = job("Daily Backup", "0 2 * * *");
    ScheduledJob b = job("Backup Pruning", "30  2 * * *");
    assertEquals(
        "'Daily Backup' (0 2 * * *) overlaps with 'Backup Pruning' (30  2 * * *)",
        classifier.message(a, b));
  }

  @Test
  void testClassifyKeepsOrder() throws CronClashException {
    ScheduledJob a = job("a", "0 2 * * *");
    ScheduledJob b = job("b", "0 2 * * *");
    ScheduleConflict conflict = classifier.classify(a, b);
    assertSame(a, conflict.job1());
    assertSame(b, conflict.job2());
    assertFalse(conflict.isError());
    assertTrue(conflict.involves(b, a));
  }
}
