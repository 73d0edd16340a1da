package io.zmanim.eval;

import java.time.Duration;
import java.util.Objects;

/**
 * A length of time, such as one proportional hour.
 *
 * @param duration the duration
 */
public record DurationValue(Duration duration) implements Value {
  public DurationValue {
    Objects.requireNonNull(duration, "duration");
  }
}
