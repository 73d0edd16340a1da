package io.zmanim.ast;

import java.time.Duration;

/** The unit of a duration literal. */
public enum DurationUnit {
  MINUTES("min", 60_000_000_000L),
  HOURS("hr", 3_600_000_000_000L),
  DAYS("days", 86_400_000_000_000L);

  /** Magnitudes at or past this many nanoseconds do not fit a {@link Duration#ofNanos(long)}. */
  private static final double MAX_NANOS = 0x1p63;

  private final String symbol;
  private final long nanos;

  DurationUnit(String symbol, long nanos) {
    this.symbol = symbol;
    this.nanos = nanos;
  }

  /**
   * Returns the canonical unit suffix.
   *
   * @return the suffix written after the magnitude
   */
  public String symbol() {
    return symbol;
  }

  /**
   * Returns whether an amount of this unit can be represented in nanoseconds.
   *
   * @param magnitude the amount
   * @return true if {@link #toDuration(double)} accepts it
   */
  public boolean fits(double magnitude) {
    return Math.abs(magnitude * nanos) < MAX_NANOS;
  }

  /**
   * Converts an amount of this unit to a duration, rounded to the nanosecond.
   *
   * @param magnitude the amount
   * @return the duration
   * @throws ArithmeticException if the amount does not fit in nanoseconds
   */
  public Duration toDuration(double magnitude) {
    if (!fits(magnitude)) {
      throw new ArithmeticException("duration overflow: " + magnitude + symbol);
    }
    return Duration.ofNanos(Math.round(magnitude * nanos));
  }

  @Override
  public String toString() {
    return symbol;
  }
}
