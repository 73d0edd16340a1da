package io.zmanim;

import io.zmanim.astro.Location;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * The zmanim to compute for one date and place.
 *
 * @param date the civil date in the location's zone
 * @param location the observer
 * @param keys the zman keys, in the order results are wanted
 * @param rounding how display times are rounded
 */
public record BatchRequest(
    LocalDate date, Location location, List<String> keys, TimeRounding rounding) {
  public BatchRequest {
    if (date == null) {
      throw new IllegalArgumentException("date is required");
    }
    if (location == null) {
      throw new IllegalArgumentException("location is required");
    }
    keys = List.copyOf(keys);
    Objects.requireNonNull(rounding, "rounding");
  }

  /**
   * Creates a request rounding to the nearest minute.
   *
   * @param date the date
   * @param location the observer
   * @param keys the zman keys
   * @return the request
   */
  public static BatchRequest of(LocalDate date, Location location, List<String> keys) {
    return new BatchRequest(date, location, keys, TimeRounding.MATH);
  }

  /**
   * Returns a copy with a different rounding.
   *
   * @param rounding the rounding
   * @return the request
   */
  public BatchRequest withRounding(TimeRounding rounding) {
    return new BatchRequest(date, location, keys, rounding);
  }
}
