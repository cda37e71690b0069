package io.cronclash;

import static org.junit.jupiter.api.Assertions.*;

import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

public class DetectionOptionsTest {

  @Test
  void testDefaults() {
    DetectionOptions options = DetectionOptions.defaults();
    assertEquals(24, options.horizon());
    assertEquals(30, options.defaultDurationMinutes());
    assertEquals(ZoneOffset.UTC, options.zone());
  }

  @Test
  void testNullZoneMeansUtc() {
    assertEquals(ZoneOffset.UTC, new DetectionOptions(24, 30, null).zone());
  }

  @Test
  void testWithers() {
    DetectionOptions options =
        DetectionOptions.defaults()
            .withHorizon(96)
            .withDefaultDurationMinutes(10)
            .withZone(ZoneId.of("Asia/Tokyo"));
    assertEquals(96, options.horizon());
    assertEquals(10, options.defaultDurationMinutes());
    assertEquals(ZoneId.of("Asia/Tokyo"), options.zone());
  }

  @Test
  void testRejectsNonPositiveValues() {
    assertThrows(IllegalArgumentException.class, () -> new DetectionOptions(0, 30, null));
    assertThrows(IllegalArgumentException.class, () -> new DetectionOptions(24, 0, null));
  }
}
