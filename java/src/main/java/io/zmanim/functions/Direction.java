package io.zmanim.functions;

import io.zmanim.astro.SolarSide;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The side of the day, and the event it is measured from, named by a direction argument.
 *
 * <p>The {@code after_*sunrise} and {@code before_*sunset} words name the same morning and evening
 * crossings as their counterparts; an angle crossing has one time per side of the day.
 */
public enum Direction {
  BEFORE_SUNRISE("before_sunrise", SolarSide.MORNING, Anchor.VISIBLE),
  AFTER_SUNRISE("after_sunrise", SolarSide.MORNING, Anchor.VISIBLE),
  BEFORE_SUNSET("before_sunset", SolarSide.EVENING, Anchor.VISIBLE),
  AFTER_SUNSET("after_sunset", SolarSide.EVENING, Anchor.VISIBLE),
  BEFORE_VISIBLE_SUNRISE("before_visible_sunrise", SolarSide.MORNING, Anchor.VISIBLE),
  AFTER_VISIBLE_SUNRISE("after_visible_sunrise", SolarSide.MORNING, Anchor.VISIBLE),
  BEFORE_VISIBLE_SUNSET("before_visible_sunset", SolarSide.EVENING, Anchor.VISIBLE),
  AFTER_VISIBLE_SUNSET("after_visible_sunset", SolarSide.EVENING, Anchor.VISIBLE),
  BEFORE_GEOMETRIC_SUNRISE("before_geometric_sunrise", SolarSide.MORNING, Anchor.GEOMETRIC),
  AFTER_GEOMETRIC_SUNRISE("after_geometric_sunrise", SolarSide.MORNING, Anchor.GEOMETRIC),
  BEFORE_GEOMETRIC_SUNSET("before_geometric_sunset", SolarSide.EVENING, Anchor.GEOMETRIC),
  AFTER_GEOMETRIC_SUNSET("after_geometric_sunset", SolarSide.EVENING, Anchor.GEOMETRIC),
  BEFORE_NOON("before_noon", SolarSide.MORNING, Anchor.NOON),
  AFTER_NOON("after_noon", SolarSide.EVENING, Anchor.NOON);

  /** The event a direction is measured from. */
  public enum Anchor {
    /** Visible sunrise or sunset. */
    VISIBLE,
    /** Sun center on the geometric horizon. */
    GEOMETRIC,
    /** Solar noon; only meaningful for angle crossings. */
    NOON
  }

  private static final Map<String, Direction> BY_KEYWORD =
      Arrays.stream(values()).collect(Collectors.toMap(Direction::keyword, Function.identity()));

  private final String keyword;
  private final SolarSide side;
  private final Anchor anchor;

  Direction(String keyword, SolarSide side, Anchor anchor) {
    this.keyword = keyword;
    this.side = side;
    this.anchor = anchor;
  }

  public String keyword() {
    return keyword;
  }

  public SolarSide side() {
    return side;
  }

  public Anchor anchor() {
    return anchor;
  }

  /**
   * Looks up a direction by its formula keyword.
   *
   * @param word the lowercase word
   * @return the direction, or empty if the word is not a direction
   */
  public static Optional<Direction> fromKeyword(String word) {
    return Optional.ofNullable(BY_KEYWORD.get(word));
  }

  @Override
  public String toString() {
    return keyword;
  }
}
