package io.zmanim.calendar;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Set;

/**
 * The event tags active on one date.
 *
 * @param date the date
 * @param codes the active tag keys
 */
public record ActiveEventSet(LocalDate date, Set<String> codes) {
  public ActiveEventSet {
    Objects.requireNonNull(date, "date");
    codes = Set.copyOf(codes);
  }

  /**
   * Returns a set with no active events.
   *
   * @param date the date
   * @return the empty set
   */
  public static ActiveEventSet empty(LocalDate date) {
    return new ActiveEventSet(date, Set.of());
  }

  public boolean contains(String code) {
    return codes.contains(code);
  }

  public boolean isEmpty() {
    return codes.isEmpty();
  }
}
