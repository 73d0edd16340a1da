package io.zmanim.selection;

/** The role a tag plays in deciding whether a zman is shown. */
public enum TagType {
  /** A holiday or special day, such as {@code chanukah}. Filters. */
  EVENT,
  /** A day-of-week style tag, such as {@code shabbos}. Filters. */
  JEWISH_DAY,
  /** Modifies how event tags are matched, such as {@code day_before}. */
  TIMING,
  /** Grouping for display. Never filters. */
  CATEGORY;

  /**
   * Returns whether tags of this type take part in inclusion decisions.
   *
   * @return true for event and Jewish-day tags
   */
  public boolean isEventType() {
    return this == EVENT || this == JEWISH_DAY;
  }
}
