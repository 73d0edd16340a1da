package io.zmanim.astro;

/** Which of the two daily horizon crossings of the sun is meant. */
public enum SolarSide {
  /** The crossing before solar noon. */
  MORNING,
  /** The crossing after solar noon. */
  EVENING
}
