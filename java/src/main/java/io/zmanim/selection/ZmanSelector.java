package io.zmanim.selection;

import io.zmanim.calendar.ActiveEventSet;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides from its tags whether a zman applies on a day.
 *
 * <ol>
 *   <li>Only event and Jewish-day tags count; category tags never filter.
 *   <li>With no such tags the zman always applies.
 *   <li>Any active negated tag excludes it.
 *   <li>With no positive tags it applies; otherwise at least one positive tag must be active.
 * </ol>
 *
 * <p>When the zman also carries the timing tag {@value #DAY_BEFORE}, each positive tag {@code x}
 * is looked up as {@code erev_x}, so a candle-lighting time tagged {@code shabbos} and {@code
 * day_before} shows on Friday. Negation has no meaning on a timing tag and is ignored.
 */
public final class ZmanSelector {
  private static final Logger log = LoggerFactory.getLogger(ZmanSelector.class);

  /** Timing tag moving positive event tags to the day before. */
  public static final String DAY_BEFORE = "day_before";

  /** Prefix of the tag active on the day before an event. */
  public static final String EREV_PREFIX = "erev_";

  private ZmanSelector() {}

  /**
   * Decides whether a zman applies.
   *
   * @param associations the zman's tags
   * @param activeEvents the active events of the day
   * @return true if the zman should be evaluated
   */
  public static boolean shouldInclude(
      List<TagAssociation> associations, ActiveEventSet activeEvents) {
    List<TagAssociation> eventTags =
        associations.stream().filter(a -> a.type().isEventType()).collect(Collectors.toList());
    if (eventTags.isEmpty()) {
      log.debug("included: no event tags");
      return true;
    }

    for (TagAssociation tag : eventTags) {
      if (tag.negated() && activeEvents.contains(tag.tagKey())) {
        log.debug("excluded: negated tag '{}' is active", tag.tagKey());
        return false;
      }
    }

    boolean dayBefore =
        associations.stream()
            .anyMatch(a -> a.type() == TagType.TIMING && a.tagKey().equals(DAY_BEFORE));

    List<String> required =
        eventTags.stream()
            .filter(a -> !a.negated())
            .map(a -> dayBefore ? EREV_PREFIX + a.tagKey() : a.tagKey())
            .collect(Collectors.toList());
    if (required.isEmpty()) {
      log.debug("included: only negated tags, none active");
      return true;
    }

    for (String key : required) {
      if (activeEvents.contains(key)) {
        log.debug("included: tag '{}' is active", key);
        return true;
      }
    }
    log.debug("excluded: none of {} is active", required);
    return false;
  }
}
