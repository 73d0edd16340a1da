package io.zmanim.eval;

import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * A resolved point in time.
 *
 * @param time the time, in the evaluation location's zone
 */
public record TimeValue(ZonedDateTime time) implements Value {
  public TimeValue {
    Objects.requireNonNull(time, "time");
  }
}
