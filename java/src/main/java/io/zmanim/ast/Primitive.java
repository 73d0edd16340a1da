package io.zmanim.ast;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/** Astronomical events a formula can name directly. */
public enum Primitive {
  /** Visible sunrise (upper limb, with refraction). */
  SUNRISE("sunrise"),
  /** Visible sunset (upper limb, with refraction). */
  SUNSET("sunset"),
  /** Alias of {@link #SUNRISE}. */
  VISIBLE_SUNRISE("visible_sunrise"),
  /** Alias of {@link #SUNSET}. */
  VISIBLE_SUNSET("visible_sunset"),
  /** Sun center on the geometric horizon, morning. */
  GEOMETRIC_SUNRISE("geometric_sunrise"),
  /** Sun center on the geometric horizon, evening. */
  GEOMETRIC_SUNSET("geometric_sunset"),
  /** Solar transit. */
  SOLAR_NOON("solar_noon"),
  /** Twelve hours after solar transit. */
  SOLAR_MIDNIGHT("solar_midnight"),
  /** Sun 6 degrees below the horizon, morning. */
  CIVIL_DAWN("civil_dawn"),
  /** Sun 6 degrees below the horizon, evening. */
  CIVIL_DUSK("civil_dusk"),
  /** Sun 12 degrees below the horizon, morning. */
  NAUTICAL_DAWN("nautical_dawn"),
  /** Sun 12 degrees below the horizon, evening. */
  NAUTICAL_DUSK("nautical_dusk"),
  /** Sun 18 degrees below the horizon, morning. */
  ASTRONOMICAL_DAWN("astronomical_dawn"),
  /** Sun 18 degrees below the horizon, evening. */
  ASTRONOMICAL_DUSK("astronomical_dusk"),
  /** Mean lunar conjunction of the current lunar month. */
  MOLAD("molad");

  private static final Map<String, Primitive> BY_KEYWORD =
      Arrays.stream(values()).collect(Collectors.toMap(Primitive::keyword, Function.identity()));

  private final String keyword;

  Primitive(String keyword) {
    this.keyword = keyword;
  }

  /**
   * Returns the word used for this primitive in formulas.
   *
   * @return the keyword
   */
  public String keyword() {
    return keyword;
  }

  /**
   * Looks up a primitive by its formula keyword.
   *
   * @param word the lowercase word
   * @return the primitive, or empty if the word is not a primitive
   */
  public static Optional<Primitive> fromKeyword(String word) {
    return Optional.ofNullable(BY_KEYWORD.get(word));
  }

  @Override
  public String toString() {
    return keyword;
  }
}
