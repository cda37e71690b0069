package io.cronclash.cli;

import static org.junit.jupiter.api.Assertions.*;

import io.cronclash.CronClashException;
import io.cronclash.DetectionOptions;
import io.cronclash.ErrorKind;
import java.time.ZoneId;
import java.util.List;
import org.junit.jupiter.api.Test;

public class CliOptionsTest {

  @Test
  void testDefaults() throws CronClashException {
    CliOptions options = CliOptions.parse();
    assertFalse(options.verbose());
    assertFalse(options.json());
    assertFalse(options.strict());
    assertFalse(options.help());
    assertTrue(options.files().isEmpty());
    assertEquals(DetectionOptions.defaults(), options.detection());
  }

  @Test
  void testFlags() throws CronClashException {
    CliOptions options = CliOptions.parse("-v", "--json", "--strict");
    assertTrue(options.verbose());
    assertTrue(options.json());
    assertTrue(options.strict());
  }

  @Test
  void testFilesTakeSeveralGlobs() throws CronClashException {
    CliOptions options = CliOptions.parse("--files", "press/cron/*.py", "jobs.py", "--strict");
    assertEquals(List.of("press/cron/*.py", "jobs.py"), options.files());
    assertTrue(options.strict());
  }

  @Test
  void testZoneAndDefaultDuration() throws CronClashException {
    CliOptions options = CliOptions.parse("--zone", "Europe/Berlin", "--default-duration", "45");
    assertEquals(ZoneId.of("Europe/Berlin"), options.detection().zone());
    assertEquals(45, options.detection().defaultDurationMinutes());
    assertEquals(24, options.detection().horizon());
  }

  @Test
  void testUsageErrors() {
    for (String[] args :
        List.of(
            new String[] {"--bogus"},
            new String[] {"--files"},
            new String[] {"--files", "--json"},
            new String[] {"--zone"},
            new String[] {"--zone", "Mars/Olympus"},
            new String[] {"--default-duration", "0"},
            new String[] {"--default-duration", "soon"})) {
      CronClashException e = assertThrows(CronClashException.class, () -> CliOptions.parse(args));
      assertEquals(ErrorKind.USAGE, e.kind(), String.join(" ", args));
    }
  }
}
