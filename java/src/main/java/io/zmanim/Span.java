package io.zmanim;

/**
 * A range of character positions in formula source text.
 *
 * @param start the start position (inclusive)
 * @param end the end position (exclusive)
 */
public record Span(int start, int end) {
  /**
   * Returns the length of this span, never less than one so an underline is always visible.
   *
   * @return the number of characters covered by this span
   */
  public int length() {
    return Math.max(1, end - start);
  }

  /**
   * Returns the smallest span covering this span and {@code other}.
   *
   * @param other the span to join with
   * @return the covering span
   */
  public Span to(Span other) {
    return new Span(Math.min(start, other.start), Math.max(end, other.end));
  }
}
