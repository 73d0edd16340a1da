package io.zmanim.calendar;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads event pattern tables from JSON arrays of {@code {"pattern", "priority", "tag"}} objects.
 */
public final class EventPatternTable {
  /** Classpath resource holding the standard table. */
  public static final String DEFAULT_RESOURCE = "event-patterns.json";

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private EventPatternTable() {}

  /**
   * Reads a pattern table.
   *
   * @param json the JSON stream; not closed by this method
   * @return the mappings in file order
   * @throws UncheckedIOException if the stream cannot be read or is malformed
   * @throws IllegalArgumentException if an entry lacks a pattern or tag
   */
  public static List<EventPatternMapping> load(InputStream json) {
    List<Entry> entries;
    try {
      entries = MAPPER.readValue(json, new TypeReference<List<Entry>>() {});
    } catch (IOException e) {
      throw new UncheckedIOException("failed to read event patterns", e);
    }

    List<EventPatternMapping> mappings = new ArrayList<>(entries.size());
    for (Entry entry : entries) {
      if (entry.pattern() == null || entry.tag() == null) {
        throw new IllegalArgumentException("event pattern entry needs a pattern and a tag: " + entry);
      }
      mappings.add(EventPatternMapping.of(entry.pattern(), entry.priority(), entry.tag()));
    }
    return List.copyOf(mappings);
  }

  /**
   * Returns the standard table loaded from {@value #DEFAULT_RESOURCE}.
   *
   * @return the standard mappings
   */
  public static List<EventPatternMapping> defaults() {
    return DefaultsHolder.MAPPINGS;
  }

  /** One JSON entry. */
  record Entry(String pattern, int priority, String tag) {}

  private static final class DefaultsHolder {
    private static final List<EventPatternMapping> MAPPINGS = loadDefaults();

    private static List<EventPatternMapping> loadDefaults() {
      try (InputStream in =
          EventPatternTable.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
        if (in == null) {
          throw new IllegalStateException("missing classpath resource " + DEFAULT_RESOURCE);
        }
        return load(in);
      } catch (IOException e) {
        throw new UncheckedIOException("failed to read " + DEFAULT_RESOURCE, e);
      }
    }
  }
}
