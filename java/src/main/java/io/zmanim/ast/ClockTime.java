package io.zmanim.ast;

import io.zmanim.Span;
import java.time.LocalTime;

/**
 * A fixed wall-clock time on the evaluation date (e.g., "12:30").
 *
 * @param hour the hour (0-23)
 * @param minute the minute (0-59)
 * @param span the source span
 */
public record ClockTime(int hour, int minute, Span span) implements Expr {
  /**
   * Returns the clock time as a local time.
   *
   * @return the local time
   */
  public LocalTime toLocalTime() {
    return LocalTime.of(hour, minute);
  }

  @Override
  public String toString() {
    return String.format("%02d:%02d", hour, minute);
  }
}
