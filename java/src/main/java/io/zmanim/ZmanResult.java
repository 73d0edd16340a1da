package io.zmanim;

import io.zmanim.eval.ErrorValue;
import io.zmanim.eval.TimeValue;
import io.zmanim.eval.Value;
import java.util.Objects;
import java.util.Optional;

/**
 * The outcome for one requested zman.
 *
 * @param key the zman key
 * @param status whether the zman was evaluated or filtered out
 * @param value the value when evaluated, null when excluded
 * @param rounding the rounding used for {@link #display()}
 */
public record ZmanResult(String key, Status status, Value value, TimeRounding rounding) {

  /** Whether a zman was evaluated. */
  public enum Status {
    /** Selected and evaluated; the value may still be an error. */
    EVALUATED,
    /** Filtered out by its tags for this day. */
    EXCLUDED
  }

  public ZmanResult {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(rounding, "rounding");
    if ((status == Status.EVALUATED) != (value != null)) {
      throw new IllegalArgumentException("evaluated results, and only those, carry a value");
    }
  }

  static ZmanResult evaluated(String key, Value value, TimeRounding rounding) {
    return new ZmanResult(key, Status.EVALUATED, value, rounding);
  }

  static ZmanResult excluded(String key, TimeRounding rounding) {
    return new ZmanResult(key, Status.EXCLUDED, null, rounding);
  }

  public boolean isExcluded() {
    return status == Status.EXCLUDED;
  }

  /**
   * Returns the error, if the zman was evaluated and failed.
   *
   * @return the error value, or empty
   */
  public Optional<ErrorValue> error() {
    return value instanceof ErrorValue e ? Optional.of(e) : Optional.empty();
  }

  /**
   * Returns the exact time as {@code HH:mm:ss}, if the value is a time.
   *
   * @return the text, or empty
   */
  public Optional<String> exact() {
    return value instanceof TimeValue t ? Optional.of(TimeRounding.exact(t.time())) : Optional.empty();
  }

  /**
   * Returns the rounded time as {@code HH:mm}, if the value is a time.
   *
   * @return the text, or empty
   */
  public Optional<String> display() {
    return value instanceof TimeValue t ? Optional.of(rounding.display(t.time())) : Optional.empty();
  }
}
