package io.zmanim.eval;

import io.zmanim.ErrorKind;
import java.time.Duration;
import java.time.ZonedDateTime;

/**
 * The result of evaluating an expression: a time, a duration, or an error.
 *
 * <p>Errors are ordinary values. A failing sub-expression becomes the value of every expression
 * that depends on it, and independent formulas in the same run are unaffected.
 */
public sealed interface Value permits TimeValue, DurationValue, ErrorValue {

  /**
   * Wraps a time.
   *
   * @param time the time
   * @return the value
   */
  static Value time(ZonedDateTime time) {
    return new TimeValue(time);
  }

  /**
   * Wraps a duration.
   *
   * @param duration the duration
   * @return the value
   */
  static Value duration(Duration duration) {
    return new DurationValue(duration);
  }

  /**
   * Creates an error value.
   *
   * @param kind the error kind
   * @param message a human-readable message
   * @return the value
   */
  static ErrorValue error(ErrorKind kind, String message) {
    return new ErrorValue(kind, message);
  }

  /**
   * Returns whether this value is an error.
   *
   * @return true for {@link ErrorValue}
   */
  default boolean isError() {
    return this instanceof ErrorValue;
  }
}
