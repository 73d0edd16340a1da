package io.zmanim.calendar;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

/** Tests for event classification and pattern tables. */
public class EventClassifierTest {
  private static final LocalDate DATE = LocalDate.of(2024, 12, 27);

  @Test
  void testAllMatchingTagsAreActive() {
    List<EventPatternMapping> patterns =
        List.of(
            EventPatternMapping.of("Chanukah: 3 Candles", 10, "chanukah_day_3"),
            EventPatternMapping.of("Chanukah%", 5, "chanukah"));
    ActiveEventSet active =
        EventClassifier.classify(List.of("Chanukah: 3 Candles"), patterns, DATE);
    assertEquals(Set.of("chanukah_day_3", "chanukah"), active.codes());
    assertEquals(DATE, active.date());
  }

  @Test
  void testPriorityNeverSuppresses() {
    List<EventPatternMapping> patterns =
        List.of(
            EventPatternMapping.of("Shabbat%", 1, "shabbos"),
            EventPatternMapping.of("Shabbat Chanukah", 100, "shabbos_chanukah"));
    ActiveEventSet active = EventClassifier.classify(List.of("Shabbat Chanukah"), patterns, DATE);
    assertTrue(active.contains("shabbos"));
    assertTrue(active.contains("shabbos_chanukah"));
  }

  @Test
  void testNoTitlesNoEvents() {
    ActiveEventSet active = EventClassifier.classify(List.of(), EventPatternTable.defaults(), DATE);
    assertTrue(active.isEmpty());
  }

  @Test
  void testDefaultTable() {
    ActiveEventSet active =
        EventClassifier.classify(
            List.of("Chanukah: 3 Candles", "Erev Shabbat", "Unmapped Event"),
            EventPatternTable.defaults(),
            DATE);
    assertEquals(Set.of("chanukah", "chanukah_day_3", "erev_shabbos"), active.codes());
  }

  @Test
  void testLoadTable() {
    String json =
        "[{\"pattern\": \"Purim\", \"priority\": 3, \"tag\": \"purim\"},"
            + " {\"pattern\": \"%Purim\", \"tag\": \"any_purim\"}]";
    List<EventPatternMapping> table =
        EventPatternTable.load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    assertEquals(2, table.size());
    assertEquals(3, table.get(0).priority());
    assertEquals(0, table.get(1).priority());
    assertEquals(
        Set.of("any_purim"),
        EventClassifier.classify(List.of("Shushan Purim"), table, DATE).codes());
  }

  @Test
  void testLoadRejectsIncompleteEntries() {
    String json = "[{\"pattern\": \"Purim\"}]";
    assertThrows(
        IllegalArgumentException.class,
        () -> EventPatternTable.load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8))));
    assertThrows(
        UncheckedIOException.class,
        () -> EventPatternTable.load(new ByteArrayInputStream("{".getBytes(StandardCharsets.UTF_8))));
  }
}
