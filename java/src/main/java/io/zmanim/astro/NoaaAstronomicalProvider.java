package io.zmanim.astro;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.function.Function;

/**
 * Sun positions from the NOAA solar calculator equations, plus the traditional fixed-arithmetic
 * molad.
 *
 * <h2>Sun</h2>
 *
 * <p>Times are found by evaluating the hour angle at which the sun reaches a given zenith and
 * refining the estimate three times against the sun's declination and the equation of time at
 * the estimated moment. Visible sunrise and sunset use a zenith of 90.833 degrees (refraction plus
 * solar semi-diameter) deepened by the horizon dip for the observer's elevation. Angle crossings
 * use the geometric zenith {@code 90 + degrees} with no elevation adjustment.
 *
 * <p>The equations work on UTC days. Every answer is for the civil date in the location's zone,
 * so the UTC day holding local noon is tried first and its neighbours after it. This matters where
 * the zone offset is far from {@code longitude / 15}, as in Samoa or Kiribati.
 *
 * <h2>Molad</h2>
 *
 * <p>The molad grid starts at BaHaRaD (Sunday 23:11:20 Jerusalem mean time before Tishrei 1 of
 * year 1) and advances by 29 days 12 hours 793 parts. Jerusalem mean time is converted to UTC by
 * the longitude of Jerusalem.
 */
public final class NoaaAstronomicalProvider implements AstronomicalProvider {
  private static final double VISIBLE_ZENITH = 90.833;
  private static final double EARTH_RADIUS_KM = 6356.9;
  private static final double JULIAN_DAY_UNIX_EPOCH = 2440587.5;
  private static final double JULIAN_DAY_J2000 = 2451545.0;
  private static final int REFINEMENTS = 3;

  /** Fixed day number of 1970-01-01 counting 0001-01-01 as day 1. */
  private static final double FIXED_UNIX_EPOCH = 719163;
  private static final double HEBREW_EPOCH = -1373427;
  private static final double PARTS_PER_DAY = 25920;
  private static final double FIRST_MOLAD = HEBREW_EPOCH - 876 / PARTS_PER_DAY;
  private static final double LUNATION = 29 + 13753 / PARTS_PER_DAY;
  private static final double JERUSALEM_LONGITUDE = 35.2354;

  @Override
  public Optional<ZonedDateTime> sunrise(LocalDate date, Location location) {
    return horizonEvent(date, location, VISIBLE_ZENITH + horizonDip(location.elevation()), true);
  }

  @Override
  public Optional<ZonedDateTime> sunset(LocalDate date, Location location) {
    return horizonEvent(date, location, VISIBLE_ZENITH + horizonDip(location.elevation()), false);
  }

  @Override
  public Optional<ZonedDateTime> solarNoon(LocalDate date, Location location) {
    return onLocalDate(date, location, utcDay -> utcNoon(utcDay, location));
  }

  @Override
  public Optional<ZonedDateTime> solarAngleCrossing(
      LocalDate date, Location location, double degrees, SolarSide side) {
    return horizonEvent(date, location, 90 + degrees, side == SolarSide.MORNING);
  }

  @Override
  public Optional<ZonedDateTime> molad(LocalDate date, Location location) {
    Instant endOfDay = date.plusDays(1).atStartOfDay(location.zone()).toInstant();
    double moment = toJerusalemMoment(endOfDay);
    double lunations = Math.floor((moment - FIRST_MOLAD) / LUNATION);
    double molad = FIRST_MOLAD + lunations * LUNATION;
    return Optional.of(fromJerusalemMoment(molad).atZone(location.zone()));
  }

  private Optional<ZonedDateTime> horizonEvent(
      LocalDate date, Location location, double zenith, boolean rising) {
    return onLocalDate(date, location, utcDay -> utcHorizonEvent(utcDay, location, zenith, rising));
  }

  /** Finds the event computed for some UTC day that falls on {@code date} in the location's zone. */
  private static Optional<ZonedDateTime> onLocalDate(
      LocalDate date, Location location, Function<LocalDate, Optional<ZonedDateTime>> compute) {
    LocalDate utcDay =
        date.atTime(LocalTime.NOON)
            .atZone(location.zone())
            .withZoneSameInstant(ZoneOffset.UTC)
            .toLocalDate();
    for (LocalDate candidate : new LocalDate[] {utcDay, utcDay.minusDays(1), utcDay.plusDays(1)}) {
      Optional<ZonedDateTime> event = compute.apply(candidate);
      if (event.isPresent() && event.get().toLocalDate().equals(date)) {
        return event;
      }
    }
    return Optional.empty();
  }

  private static Optional<ZonedDateTime> utcNoon(LocalDate utcDay, Location location) {
    double jd0 = julianDay(utcDay);
    double minutes = 720 - 4 * location.longitude();
    for (int i = 0; i < REFINEMENTS; i++) {
      double t = julianCentury(jd0 + minutes / 1440.0);
      minutes = 720 - 4 * location.longitude() - equationOfTime(t);
    }
    return Optional.of(toZoned(utcDay, minutes, location));
  }

  private static Optional<ZonedDateTime> utcHorizonEvent(
      LocalDate utcDay, Location location, double zenith, boolean rising) {
    double jd0 = julianDay(utcDay);
    double lat = location.latitude();
    double lon = location.longitude();

    double minutes = 720 - 4 * lon;
    for (int i = 0; i < REFINEMENTS; i++) {
      double t = julianCentury(jd0 + minutes / 1440.0);
      double hourAngle = hourAngle(lat, sunDeclination(t), zenith);
      if (Double.isNaN(hourAngle)) {
        return Optional.empty();
      }
      double signed = rising ? hourAngle : -hourAngle;
      minutes = 720 - 4 * (lon + signed) - equationOfTime(t);
    }
    return Optional.of(toZoned(utcDay, minutes, location));
  }

  private static ZonedDateTime toZoned(LocalDate utcDay, double utcMinutes, Location location) {
    long nanos = Math.round(utcMinutes * 60_000_000_000.0);
    return utcDay.atStartOfDay(ZoneOffset.UTC).plusNanos(nanos).withZoneSameInstant(location.zone());
  }

  private static double horizonDip(double elevationMeters) {
    if (elevationMeters <= 0) {
      return 0;
    }
    double r = EARTH_RADIUS_KM * 1000;
    return Math.toDegrees(Math.acos(r / (r + elevationMeters)));
  }

  private static double julianDay(LocalDate date) {
    return date.toEpochDay() + JULIAN_DAY_UNIX_EPOCH;
  }

  private static double julianCentury(double julianDay) {
    return (julianDay - JULIAN_DAY_J2000) / 36525.0;
  }

  /** Hour angle in degrees, or NaN when the sun never reaches the zenith on that day. */
  private static double hourAngle(double latitude, double declination, double zenith) {
    double latRad = Math.toRadians(latitude);
    double decRad = Math.toRadians(declination);
    double cosHa =
        Math.cos(Math.toRadians(zenith)) / (Math.cos(latRad) * Math.cos(decRad))
            - Math.tan(latRad) * Math.tan(decRad);
    if (cosHa > 1 || cosHa < -1) {
      return Double.NaN;
    }
    return Math.toDegrees(Math.acos(cosHa));
  }

  private static double geomMeanLongSun(double t) {
    double l0 = 280.46646 + t * (36000.76983 + 0.0003032 * t);
    l0 %= 360;
    return l0 < 0 ? l0 + 360 : l0;
  }

  private static double geomMeanAnomalySun(double t) {
    return 357.52911 + t * (35999.05029 - 0.0001537 * t);
  }

  private static double eccentricityEarthOrbit(double t) {
    return 0.016708634 - t * (0.000042037 + 0.0000001267 * t);
  }

  private static double sunEquationOfCenter(double t) {
    double m = Math.toRadians(geomMeanAnomalySun(t));
    return Math.sin(m) * (1.914602 - t * (0.004817 + 0.000014 * t))
        + Math.sin(2 * m) * (0.019993 - 0.000101 * t)
        + Math.sin(3 * m) * 0.000289;
  }

  private static double sunApparentLong(double t) {
    double trueLong = geomMeanLongSun(t) + sunEquationOfCenter(t);
    double omega = 125.04 - 1934.136 * t;
    return trueLong - 0.00569 - 0.00478 * Math.sin(Math.toRadians(omega));
  }

  private static double obliquityCorrection(double t) {
    double seconds = 21.448 - t * (46.8150 + t * (0.00059 - t * 0.001813));
    double meanObliquity = 23.0 + (26.0 + seconds / 60.0) / 60.0;
    double omega = 125.04 - 1934.136 * t;
    return meanObliquity + 0.00256 * Math.cos(Math.toRadians(omega));
  }

  private static double sunDeclination(double t) {
    double e = Math.toRadians(obliquityCorrection(t));
    double lambda = Math.toRadians(sunApparentLong(t));
    return Math.toDegrees(Math.asin(Math.sin(e) * Math.sin(lambda)));
  }

  /** Equation of time in minutes. */
  private static double equationOfTime(double t) {
    double epsilon = Math.toRadians(obliquityCorrection(t));
    double l0 = Math.toRadians(geomMeanLongSun(t));
    double e = eccentricityEarthOrbit(t);
    double m = Math.toRadians(geomMeanAnomalySun(t));

    double y = Math.tan(epsilon / 2.0);
    y *= y;

    double eTime =
        y * Math.sin(2.0 * l0)
            - 2.0 * e * Math.sin(m)
            + 4.0 * e * y * Math.sin(m) * Math.cos(2.0 * l0)
            - 0.5 * y * y * Math.sin(4.0 * l0)
            - 1.25 * e * e * Math.sin(2.0 * m);
    return Math.toDegrees(eTime) * 4.0;
  }

  private static double toJerusalemMoment(Instant instant) {
    double days = instant.getEpochSecond() / 86400.0 + instant.getNano() / 86_400_000_000_000.0;
    return FIXED_UNIX_EPOCH + days + JERUSALEM_LONGITUDE / 360.0;
  }

  private static Instant fromJerusalemMoment(double moment) {
    double days = moment - JERUSALEM_LONGITUDE / 360.0 - FIXED_UNIX_EPOCH;
    return Instant.ofEpochMilli(Math.round(days * 86_400_000.0));
  }
}
