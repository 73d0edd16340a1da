package io.zmanim.astro;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for the NOAA reference provider. */
public class NoaaAstronomicalProviderTest {
  private static final Location LAKEWOOD = Location.of(40.0828, -74.2094, ZoneId.of("America/New_York"));
  private static final Location TROMSO = Location.of(69.6492, 18.9553, ZoneId.of("Europe/Oslo"));
  private static final Location APIA = Location.of(-13.83, -171.76, ZoneId.of("Pacific/Apia"));
  private static final Location KIRITIMATI =
      Location.of(1.87, -157.4, ZoneId.of("Pacific/Kiritimati"));
  private static final Location JERUSALEM = Location.of(31.778, 35.2354, ZoneId.of("Asia/Jerusalem"));

  private static final List<LocalDate> DATES =
      List.of(LocalDate.of(2024, 3, 20), LocalDate.of(2024, 6, 21), LocalDate.of(2024, 12, 21));

  private final NoaaAstronomicalProvider provider = new NoaaAstronomicalProvider();

  @Test
  void testEquinoxSunriseAndSunset() {
    LocalDate date = LocalDate.of(2024, 3, 20);
    ZonedDateTime sunrise = provider.sunrise(date, LAKEWOOD).orElseThrow();
    ZonedDateTime sunset = provider.sunset(date, LAKEWOOD).orElseThrow();

    assertEquals(ZoneId.of("America/New_York"), sunrise.getZone());
    assertBetween(LocalTime.of(6, 55), LocalTime.of(7, 5), sunrise.toLocalTime());
    assertBetween(LocalTime.of(19, 5), LocalTime.of(19, 15), sunset.toLocalTime());
  }

  @Test
  void testSolarNoonBetweenSunriseAndSunset() {
    for (LocalDate date : DATES) {
      ZonedDateTime sunrise = provider.sunrise(date, LAKEWOOD).orElseThrow();
      ZonedDateTime sunset = provider.sunset(date, LAKEWOOD).orElseThrow();
      ZonedDateTime noon = provider.solarNoon(date, LAKEWOOD).orElseThrow();
      Duration morning = Duration.between(sunrise, noon);
      Duration afternoon = Duration.between(noon, sunset);
      assertTrue(morning.minus(afternoon).abs().compareTo(Duration.ofMinutes(2)) < 0, date.toString());
    }
  }

  @Test
  void testEveningCrossingsGetLaterWithDepth() {
    for (LocalDate date : DATES) {
      ZonedDateTime previous = provider.sunset(date, LAKEWOOD).orElseThrow();
      for (int degrees = 1; degrees <= 20; degrees++) {
        ZonedDateTime crossing =
            provider.solarAngleCrossing(date, LAKEWOOD, degrees, SolarSide.EVENING).orElseThrow();
        assertTrue(crossing.isAfter(previous), date + " at " + degrees + " degrees");
        previous = crossing;
      }
    }
  }

  @Test
  void testMorningCrossingsGetEarlierWithDepth() {
    for (LocalDate date : DATES) {
      ZonedDateTime previous = provider.sunrise(date, LAKEWOOD).orElseThrow();
      for (int degrees = 1; degrees <= 20; degrees++) {
        ZonedDateTime crossing =
            provider.solarAngleCrossing(date, LAKEWOOD, degrees, SolarSide.MORNING).orElseThrow();
        assertTrue(crossing.isBefore(previous), date + " at " + degrees + " degrees");
        previous = crossing;
      }
    }
  }

  @Test
  void testEventsFallOnTheLocalDateFarFromZoneMeridian() {
    LocalDate date = LocalDate.of(2024, 3, 20);
    for (Location location : List.of(APIA, KIRITIMATI)) {
      ZonedDateTime sunrise = provider.sunrise(date, location).orElseThrow();
      ZonedDateTime noon = provider.solarNoon(date, location).orElseThrow();
      ZonedDateTime sunset = provider.sunset(date, location).orElseThrow();
      ZonedDateTime dawn =
          provider.solarAngleCrossing(date, location, 16.1, SolarSide.MORNING).orElseThrow();

      assertEquals(date, dawn.toLocalDate(), location.zone().toString());
      assertEquals(date, sunrise.toLocalDate(), location.zone().toString());
      assertEquals(date, noon.toLocalDate(), location.zone().toString());
      assertEquals(date, sunset.toLocalDate(), location.zone().toString());
      assertBetween(LocalTime.of(6, 0), LocalTime.of(7, 0), sunrise.toLocalTime());
      assertBetween(LocalTime.of(18, 0), LocalTime.of(19, 0), sunset.toLocalTime());
      assertTrue(dawn.isBefore(sunrise));
    }
  }

  @Test
  void testConsecutiveSunrisesAreADayApartInApia() {
    ZonedDateTime first = provider.sunrise(LocalDate.of(2024, 3, 20), APIA).orElseThrow();
    ZonedDateTime second = provider.sunrise(LocalDate.of(2024, 3, 21), APIA).orElseThrow();
    Duration gap = Duration.between(first, second);
    assertTrue(gap.minus(Duration.ofDays(1)).abs().compareTo(Duration.ofMinutes(2)) < 0, gap.toString());
  }

  @Test
  void testMidnightSunHasNoSunsetOrDawn() {
    LocalDate date = LocalDate.of(2024, 6, 21);
    assertTrue(provider.sunset(date, TROMSO).isEmpty());
    assertTrue(provider.sunrise(date, TROMSO).isEmpty());
    assertTrue(provider.solarAngleCrossing(date, TROMSO, 18, SolarSide.MORNING).isEmpty());
    assertTrue(provider.solarNoon(date, TROMSO).isPresent());
  }

  @Test
  void testSummerSunNeverReachesDeepDepression() {
    LocalDate date = LocalDate.of(2024, 6, 21);
    assertTrue(provider.solarAngleCrossing(date, LAKEWOOD, 26, SolarSide.EVENING).isPresent());
    assertTrue(provider.solarAngleCrossing(date, LAKEWOOD, 27, SolarSide.EVENING).isEmpty());
  }

  @Test
  void testElevationAdvancesSunrise() {
    LocalDate date = LocalDate.of(2024, 3, 20);
    Location mountain = new Location(40.0828, -74.2094, 800, LAKEWOOD.zone());
    assertTrue(
        provider.sunrise(date, mountain).orElseThrow().isBefore(provider.sunrise(date, LAKEWOOD).orElseThrow()));
    assertTrue(
        provider.sunset(date, mountain).orElseThrow().isAfter(provider.sunset(date, LAKEWOOD).orElseThrow()));
  }

  @Test
  void testMoladTishrei5785() {
    // Thursday 3:21 and 13 parts, Jerusalem mean time.
    ZonedDateTime molad = provider.molad(LocalDate.of(2024, 10, 3), JERUSALEM).orElseThrow();
    Instant expected = Instant.parse("2024-10-03T01:00:46.837Z");
    assertTrue(
        Duration.between(expected, molad.toInstant()).abs().compareTo(Duration.ofSeconds(1)) < 0,
        molad.toString());
    assertEquals(JERUSALEM.zone(), molad.getZone());
  }

  @Test
  void testMoladAdvancesByOneLunation() {
    ZonedDateTime current = provider.molad(LocalDate.of(2024, 10, 3), JERUSALEM).orElseThrow();
    ZonedDateTime previous = provider.molad(LocalDate.of(2024, 10, 2), JERUSALEM).orElseThrow();
    Duration lunation = Duration.ofDays(29).plusHours(12).plusMinutes(44).plusMillis(3333);
    Duration actual = Duration.between(previous, current);
    assertTrue(actual.minus(lunation).abs().toMillis() <= 2, actual.toString());
  }

  private static void assertBetween(LocalTime low, LocalTime high, LocalTime actual) {
    assertFalse(actual.isBefore(low), actual + " before " + low);
    assertFalse(actual.isAfter(high), actual + " after " + high);
  }
}
