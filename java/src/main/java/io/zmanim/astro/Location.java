package io.zmanim.astro;

import java.time.ZoneId;
import java.util.Objects;

/**
 * An observer position.
 *
 * @param latitude degrees north, -90 to 90
 * @param longitude degrees east, -180 to 180
 * @param elevation meters above sea level, never negative
 * @param zone the civil time zone results are expressed in
 */
public record Location(double latitude, double longitude, double elevation, ZoneId zone) {
  public Location {
    if (latitude < -90 || latitude > 90) {
      throw new IllegalArgumentException("latitude out of range: " + latitude);
    }
    if (longitude < -180 || longitude > 180) {
      throw new IllegalArgumentException("longitude out of range: " + longitude);
    }
    if (elevation < 0) {
      throw new IllegalArgumentException("elevation must not be negative: " + elevation);
    }
    Objects.requireNonNull(zone, "zone");
  }

  /**
   * Creates a sea-level location.
   *
   * @param latitude degrees north
   * @param longitude degrees east
   * @param zone the civil time zone
   * @return the location
   */
  public static Location of(double latitude, double longitude, ZoneId zone) {
    return new Location(latitude, longitude, 0, zone);
  }
}
