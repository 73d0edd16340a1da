package io.zmanim.calendar;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Adds the weekly events to another source: {@code "Erev Shabbat"} on Fridays and {@code
 * "Shabbat"} on Saturdays.
 */
public final class WeeklyEventSource implements CalendarEventSource {
  public static final String EREV_SHABBAT = "Erev Shabbat";
  public static final String SHABBAT = "Shabbat";

  private final CalendarEventSource delegate;

  /**
   * Wraps a source.
   *
   * @param delegate the source supplying the non-weekly events
   */
  public WeeklyEventSource(CalendarEventSource delegate) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
  }

  /**
   * Returns a source with only the weekly events.
   *
   * @return the source
   */
  public static WeeklyEventSource alone() {
    return new WeeklyEventSource(date -> List.of());
  }

  @Override
  public List<String> eventsOn(LocalDate date) {
    List<String> titles = new ArrayList<>(delegate.eventsOn(date));
    DayOfWeek day = date.getDayOfWeek();
    if (day == DayOfWeek.FRIDAY && !titles.contains(EREV_SHABBAT)) {
      titles.add(EREV_SHABBAT);
    } else if (day == DayOfWeek.SATURDAY && !titles.contains(SHABBAT)) {
      titles.add(SHABBAT);
    }
    return titles;
  }
}
