package io.zmanim.ast;

import io.zmanim.Span;
import java.time.Duration;

/**
 * A fixed clock duration such as "72min" or "14days".
 *
 * @param magnitude the amount, possibly fractional or negative
 * @param unit the unit of the amount
 * @param span the source span
 */
public record DurationLiteral(double magnitude, DurationUnit unit, Span span) implements Expr {
  /**
   * Converts this literal to a duration.
   *
   * @return the duration
   */
  public Duration toDuration() {
    return unit.toDuration(magnitude);
  }
}
