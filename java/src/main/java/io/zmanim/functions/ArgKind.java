package io.zmanim.functions;

/** What a builtin expects at one argument position. */
public enum ArgKind {
  /** A numeric literal such as degrees or an hour count. */
  NUMBER,
  /** A direction keyword such as {@code after_sunset}. */
  DIRECTION,
  /** A named opinion base or {@code custom(start, end)}. */
  BASE,
  /** Any expression producing a time. */
  TIME
}
