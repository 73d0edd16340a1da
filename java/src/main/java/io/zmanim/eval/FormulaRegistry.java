package io.zmanim.eval;

import java.util.Optional;

/** Read-only lookup of formula text by zman key, used to resolve {@code @key} references. */
@FunctionalInterface
public interface FormulaRegistry {

  /**
   * Looks up the formula for a key.
   *
   * @param key the zman key
   * @return the formula text, or empty if the key is unknown
   */
  Optional<String> lookup(String key);
}
