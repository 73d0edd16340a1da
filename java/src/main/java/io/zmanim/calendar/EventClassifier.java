package io.zmanim.calendar;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns calendar event titles into the set of active event tags.
 *
 * <p>Every title is tested against every mapping and all matching tags are kept. A title such as
 * {@code "Chanukah: 3 Candles"} activates both a day-specific tag and the generic {@code chanukah}
 * tag when both patterns match.
 */
public final class EventClassifier {
  private static final Logger log = LoggerFactory.getLogger(EventClassifier.class);

  private EventClassifier() {}

  /**
   * Classifies the titles of one date.
   *
   * @param titles the calendar event titles
   * @param patterns the pattern table
   * @param date the date the titles belong to
   * @return the active event set
   */
  public static ActiveEventSet classify(
      List<String> titles, List<EventPatternMapping> patterns, LocalDate date) {
    List<EventPatternMapping> ordered = new ArrayList<>(patterns);
    ordered.sort(Comparator.comparingInt(EventPatternMapping::priority).reversed());

    Set<String> codes = new LinkedHashSet<>();
    for (String title : titles) {
      for (EventPatternMapping mapping : ordered) {
        if (mapping.matches(title)) {
          log.debug("'{}' matches '{}' -> {}", title, mapping.pattern(), mapping.tagKey());
          codes.add(mapping.tagKey());
        }
      }
    }
    log.debug("active events on {}: {}", date, codes);
    return new ActiveEventSet(date, codes);
  }
}
