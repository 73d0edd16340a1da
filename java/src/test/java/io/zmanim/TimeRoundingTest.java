package io.zmanim;

import static org.junit.jupiter.api.Assertions.*;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import org.junit.jupiter.api.Test;

/** Tests for display rounding. */
public class TimeRoundingTest {
  private static final ZoneId ZONE = ZoneId.of("America/New_York");

  private static ZonedDateTime at(int hour, int minute, int second) {
    return ZonedDateTime.of(2024, 3, 20, hour, minute, second, 0, ZONE);
  }

  @Test
  void testFloor() {
    assertEquals("06:59", TimeRounding.FLOOR.display(at(6, 59, 59)));
    assertEquals("07:00", TimeRounding.FLOOR.display(at(7, 0, 0)));
  }

  @Test
  void testCeil() {
    assertEquals("07:00", TimeRounding.CEIL.display(at(6, 59, 1)));
    assertEquals("07:00", TimeRounding.CEIL.display(at(7, 0, 0)));
    assertEquals("07:01", TimeRounding.CEIL.display(at(7, 0, 0).plusNanos(1)));
  }

  @Test
  void testMath() {
    assertEquals("06:59", TimeRounding.MATH.display(at(6, 59, 29)));
    assertEquals("07:00", TimeRounding.MATH.display(at(6, 59, 30)));
    assertEquals("00:00", TimeRounding.MATH.display(at(23, 59, 45)));
  }

  @Test
  void testExact() {
    assertEquals("04:48:07", TimeRounding.exact(at(4, 48, 7).plusNanos(900_000_000)));
  }
}
