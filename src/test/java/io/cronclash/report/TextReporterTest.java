package io.cronclash.report;

import static org.junit.jupiter.api.Assertions.*;

import io.cronclash.CronClashException;
import org.junit.jupiter.api.Test;

public class TextReporterTest {

  @Test
  void testConflictsAreTagged() throws CronClashException {
    String text = TextReporter.render(ReportFixtures.conflicting(), false);
    assertTrue(text.contains("SCHEDULE CONFLICT REPORT"));
    assertTrue(text.contains("Jobs found: 3\n"));
    assertTrue(text.contains("Conflicts found: 2\n"));
    assertTrue(
        text.contains(
            "  [ERROR] 'Daily Backup' (0 2 * * *) overlaps with 'Backup Pruning' (30 2 * * *)\n"));
    assertTrue(
        text.contains(
            "  [WARN] 'Backup Pruning' (30 2 * * *) overlaps with 'Digest' (45 2 * * *)\n"));
    assertFalse(text.contains("Scheduled Jobs:"));
    assertFalse(text.contains("No scheduling conflicts detected."));
  }

  @Test
  void testVerboseListsJobs() throws CronClashException {
    String text = TextReporter.render(ReportFixtures.conflicting(), true);
    assertTrue(text.contains("Scheduled Jobs:"));
    assertTrue(text.contains("  - Daily Backup\n"));
    assertTrue(text.contains("    Schedule: 0 2 * * *\n"));
    assertTrue(text.contains("    Source: press/cron/b.py:1\n"));
    assertTrue(text.contains("    Duration: ~60 min\n"));
    assertTrue(text.contains("    Tags: backup, io-intensive\n"));
  }

  @Test
  void testUntaggedJobHasNoTagLine() throws CronClashException {
    String text = TextReporter.render(ReportFixtures.conflicting(), true);
    int digest = text.indexOf("  - Digest\n");
    assertTrue(digest >= 0);
    assertFalse(text.substring(digest, text.indexOf("Conflicts Detected:")).contains("Tags:"));
  }

  @Test
  void testCleanRun() throws CronClashException {
    String text = TextReporter.render(ReportFixtures.clean(), false);
    assertTrue(text.contains("Conflicts found: 0\n"));
    assertTrue(text.contains("No scheduling conflicts detected."));
  }
}
