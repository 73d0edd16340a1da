package io.zmanim.calendar;

import java.util.Objects;

/**
 * Maps calendar titles matching a pattern to an event tag.
 *
 * @param pattern the title pattern
 * @param priority orders mappings, higher first; never suppresses a match
 * @param tagKey the tag activated by a match
 */
public record EventPatternMapping(WildcardPattern pattern, int priority, String tagKey) {
  public EventPatternMapping {
    Objects.requireNonNull(pattern, "pattern");
    Objects.requireNonNull(tagKey, "tagKey");
  }

  /**
   * Creates a mapping from pattern text.
   *
   * @param pattern the pattern text, using {@code %} as the wildcard
   * @param priority the priority
   * @param tagKey the tag key
   * @return the mapping
   */
  public static EventPatternMapping of(String pattern, int priority, String tagKey) {
    return new EventPatternMapping(WildcardPattern.compile(pattern), priority, tagKey);
  }

  /**
   * Tests a title against this mapping's pattern.
   *
   * @param title the calendar event title
   * @return true if the title matches
   */
  public boolean matches(String title) {
    return pattern.matches(title);
  }
}
