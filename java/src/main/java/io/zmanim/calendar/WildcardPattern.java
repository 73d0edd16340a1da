package io.zmanim.calendar;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A calendar-title pattern where {@code %} matches any run of characters, including none.
 *
 * <p>Every other character is literal and case-sensitive, and the whole title must match: {@code
 * "Chanukah%"} matches {@code "Chanukah: 3 Candles"} but not {@code "Erev Chanukah"}.
 */
public final class WildcardPattern {
  /** The wildcard character. */
  public static final char WILDCARD = '%';

  private final String pattern;
  private final Pattern regex;

  private WildcardPattern(String pattern) {
    this.pattern = pattern;
    this.regex = Pattern.compile(toRegex(pattern), Pattern.DOTALL);
  }

  /**
   * Compiles a pattern.
   *
   * @param pattern the pattern text
   * @return the compiled pattern
   */
  public static WildcardPattern compile(String pattern) {
    Objects.requireNonNull(pattern, "pattern");
    return new WildcardPattern(pattern);
  }

  private static String toRegex(String pattern) {
    StringBuilder sb = new StringBuilder();
    int literalStart = 0;
    for (int i = 0; i < pattern.length(); i++) {
      if (pattern.charAt(i) == WILDCARD) {
        appendLiteral(sb, pattern.substring(literalStart, i));
        sb.append(".*");
        literalStart = i + 1;
      }
    }
    appendLiteral(sb, pattern.substring(literalStart));
    return sb.toString();
  }

  private static void appendLiteral(StringBuilder sb, String literal) {
    if (!literal.isEmpty()) {
      sb.append(Pattern.quote(literal));
    }
  }

  /**
   * Tests a whole title against the pattern.
   *
   * @param title the calendar event title
   * @return true if the title matches
   */
  public boolean matches(String title) {
    return regex.matcher(title).matches();
  }

  public String pattern() {
    return pattern;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof WildcardPattern other && pattern.equals(other.pattern);
  }

  @Override
  public int hashCode() {
    return pattern.hashCode();
  }

  @Override
  public String toString() {
    return pattern;
  }
}
