package io.zmanim.functions;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.zmanim.ZmanimException;
import io.zmanim.ast.Expr;
import io.zmanim.parser.Parser;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The table of named day-boundary conventions.
 *
 * <p>Each entry is written in the formula language itself, for example:
 *
 * <pre>{@code
 * "mga": { "description": "72 minutes before sunrise to 72 minutes after sunset",
 *          "start": "sunrise - 72min", "end": "sunset + 72min" }
 * }</pre>
 *
 * <p>Entries are parsed and validated at load time. They may not use named bases themselves.
 */
public final class OpinionBases {
  /** Classpath resource holding the standard table. */
  public static final String DEFAULT_RESOURCE = "opinion-bases.json";

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final Map<String, BaseDefinition> bases;

  private OpinionBases(Map<String, BaseDefinition> bases) {
    this.bases = Collections.unmodifiableMap(new LinkedHashMap<>(bases));
  }

  /**
   * Returns the standard table loaded from {@value #DEFAULT_RESOURCE}.
   *
   * @return the standard bases
   */
  public static OpinionBases defaults() {
    return DefaultsHolder.INSTANCE;
  }

  /**
   * Returns a table with no entries.
   *
   * @return the empty table
   */
  public static OpinionBases empty() {
    return new OpinionBases(Map.of());
  }

  /**
   * Reads a table from JSON and validates every entry against {@code library}.
   *
   * @param json the JSON stream; not closed by this method
   * @param library the functions entries may call
   * @return the table
   * @throws UncheckedIOException if the stream cannot be read
   * @throws IllegalArgumentException if an entry is not a valid formula
   */
  public static OpinionBases load(InputStream json, FunctionLibrary library) {
    Map<String, Entry> entries;
    try {
      entries = MAPPER.readValue(json, new TypeReference<LinkedHashMap<String, Entry>>() {});
    } catch (IOException e) {
      throw new UncheckedIOException("failed to read opinion bases", e);
    }

    Map<String, BaseDefinition> bases = new LinkedHashMap<>();
    for (Map.Entry<String, Entry> e : entries.entrySet()) {
      String name = e.getKey();
      Entry entry = e.getValue();
      Expr start = compile(name, "start", entry.start(), library);
      Expr end = compile(name, "end", entry.end(), library);
      bases.put(name, new BaseDefinition(name, entry.description(), start, end));
    }
    return new OpinionBases(bases);
  }

  private static Expr compile(String name, String edge, String formula, FunctionLibrary library) {
    if (formula == null) {
      throw new IllegalArgumentException("opinion base '" + name + "' has no " + edge);
    }
    try {
      Expr expr = Parser.parse(formula);
      Validator.validate(expr, library, empty());
      return expr;
    } catch (ZmanimException e) {
      throw new IllegalArgumentException(
          "invalid " + edge + " for opinion base '" + name + "':\n" + e.withInput(formula).displayRich(),
          e);
    }
  }

  /**
   * Looks up a base by name.
   *
   * @param name the base name
   * @return the definition, or empty if unknown
   */
  public Optional<BaseDefinition> lookup(String name) {
    return Optional.ofNullable(bases.get(name));
  }

  /**
   * Returns whether a base with this name exists.
   *
   * @param name the base name
   * @return true if defined
   */
  public boolean contains(String name) {
    return bases.containsKey(name);
  }

  /**
   * Returns the base names in table order.
   *
   * @return the names
   */
  public Set<String> names() {
    return bases.keySet();
  }

  /** One JSON entry. */
  record Entry(String description, String start, String end) {}

  private static final class DefaultsHolder {
    private static final OpinionBases INSTANCE = loadDefaults();

    private static OpinionBases loadDefaults() {
      try (InputStream in = OpinionBases.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
        if (in == null) {
          throw new IllegalStateException("missing classpath resource " + DEFAULT_RESOURCE);
        }
        return load(in, FunctionLibrary.standard());
      } catch (IOException e) {
        throw new UncheckedIOException("failed to read " + DEFAULT_RESOURCE, e);
      }
    }
  }
}
