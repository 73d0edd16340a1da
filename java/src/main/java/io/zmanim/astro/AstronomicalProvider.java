package io.zmanim.astro;

import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Supplies the astronomical events formulas are anchored to.
 *
 * <p>Implementations must be pure: the same arguments always give the same answer, which lets the
 * evaluator memoize answers for the length of a run. An empty result means the event does not
 * happen on that date at that place (polar day or night, or a depression the sun never reaches).
 */
public interface AstronomicalProvider {

  /**
   * Returns visible sunrise, corrected for refraction and the observer's elevation.
   *
   * @param date the civil date in the location's zone
   * @param location the observer
   * @return the sunrise, or empty if the sun does not rise
   */
  Optional<ZonedDateTime> sunrise(LocalDate date, Location location);

  /**
   * Returns visible sunset, corrected for refraction and the observer's elevation.
   *
   * @param date the civil date in the location's zone
   * @param location the observer
   * @return the sunset, or empty if the sun does not set
   */
  Optional<ZonedDateTime> sunset(LocalDate date, Location location);

  /**
   * Returns the solar transit.
   *
   * @param date the civil date in the location's zone
   * @param location the observer
   * @return the solar noon
   */
  Optional<ZonedDateTime> solarNoon(LocalDate date, Location location);

  /**
   * Returns the time the sun's center is {@code degrees} below the geometric horizon.
   *
   * @param date the civil date in the location's zone
   * @param location the observer
   * @param degrees the depression below the horizon; zero is the geometric horizon
   * @param side the morning or evening crossing
   * @return the crossing, or empty if the sun does not reach that depression
   */
  Optional<ZonedDateTime> solarAngleCrossing(
      LocalDate date, Location location, double degrees, SolarSide side);

  /**
   * Returns the molad (mean lunar conjunction) of the lunar month in progress at the end of
   * {@code date}.
   *
   * @param date the civil date in the location's zone
   * @param location the observer, used for its zone
   * @return the molad
   */
  Optional<ZonedDateTime> molad(LocalDate date, Location location);
}
