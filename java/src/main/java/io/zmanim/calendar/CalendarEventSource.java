package io.zmanim.calendar;

import java.time.LocalDate;
import java.util.List;

/** Supplies the calendar event titles of a date, for example from a Hebrew calendar service. */
@FunctionalInterface
public interface CalendarEventSource {

  /**
   * Returns the event titles of a date.
   *
   * @param date the date
   * @return the titles, possibly empty
   */
  List<String> eventsOn(LocalDate date);
}
