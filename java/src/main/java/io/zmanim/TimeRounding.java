package io.zmanim;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/** How exact times are rounded to whole minutes for display. */
public enum TimeRounding {
  /** Drop the seconds. Suited to times that must not be shown late, such as a latest time. */
  FLOOR,
  /** Round any part of a minute up. Suited to earliest times. */
  CEIL,
  /** Round to the nearest minute, half a minute rounding up. */
  MATH;

  private static final DateTimeFormatter EXACT = DateTimeFormatter.ofPattern("HH:mm:ss");
  private static final DateTimeFormatter DISPLAY = DateTimeFormatter.ofPattern("HH:mm");

  /**
   * Rounds a time to a whole minute.
   *
   * @param time the exact time
   * @return the rounded time
   */
  public ZonedDateTime round(ZonedDateTime time) {
    ZonedDateTime floor = time.truncatedTo(ChronoUnit.MINUTES);
    boolean partial = !floor.equals(time);
    return switch (this) {
      case FLOOR -> floor;
      case CEIL -> partial ? floor.plusMinutes(1) : floor;
      case MATH -> time.getSecond() >= 30 ? floor.plusMinutes(1) : floor;
    };
  }

  /**
   * Formats a time rounded to the minute, as {@code HH:mm}.
   *
   * @param time the exact time
   * @return the display text
   */
  public String display(ZonedDateTime time) {
    return DISPLAY.format(round(time));
  }

  /**
   * Formats a time to the second, as {@code HH:mm:ss}, truncating fractions.
   *
   * @param time the exact time
   * @return the text
   */
  public static String exact(ZonedDateTime time) {
    return EXACT.format(time);
  }
}
