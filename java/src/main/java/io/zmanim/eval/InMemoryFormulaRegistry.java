package io.zmanim.eval;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** A formula registry backed by an immutable map, loadable from a JSON object of key to text. */
public final class InMemoryFormulaRegistry implements FormulaRegistry {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final Map<String, String> formulas;

  private InMemoryFormulaRegistry(Map<String, String> formulas) {
    this.formulas = Collections.unmodifiableMap(new LinkedHashMap<>(formulas));
  }

  /**
   * Creates a registry from a map of key to formula text.
   *
   * @param formulas the formulas
   * @return the registry
   */
  public static InMemoryFormulaRegistry of(Map<String, String> formulas) {
    return new InMemoryFormulaRegistry(formulas);
  }

  /**
   * Reads a registry from a JSON object such as {@code {"alos_72": "sunrise - 72min"}}.
   *
   * @param json the JSON stream; not closed by this method
   * @return the registry
   * @throws UncheckedIOException if the stream cannot be read or is not such an object
   */
  public static InMemoryFormulaRegistry fromJson(InputStream json) {
    try {
      Map<String, String> formulas =
          MAPPER.readValue(json, new TypeReference<LinkedHashMap<String, String>>() {});
      return new InMemoryFormulaRegistry(formulas);
    } catch (IOException e) {
      throw new UncheckedIOException("failed to read formula registry", e);
    }
  }

  @Override
  public Optional<String> lookup(String key) {
    return Optional.ofNullable(formulas.get(key));
  }

  /**
   * Returns the registered keys in insertion order.
   *
   * @return the keys
   */
  public Set<String> keys() {
    return formulas.keySet();
  }
}
