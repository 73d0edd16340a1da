package io.zmanim.selection;

import static org.junit.jupiter.api.Assertions.*;

import io.zmanim.calendar.ActiveEventSet;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

/** Truth table for the inclusion rules. */
public class ZmanSelectorTest {
  private static final LocalDate DATE = LocalDate.of(2024, 12, 27);

  private static final EventTagDefinition SHABBOS =
      new EventTagDefinition("shabbos", TagType.JEWISH_DAY);
  private static final EventTagDefinition EREV_SHABBOS =
      new EventTagDefinition("erev_shabbos", TagType.JEWISH_DAY);
  private static final EventTagDefinition ROSH_CHODESH =
      new EventTagDefinition("rosh_chodesh", TagType.EVENT);
  private static final EventTagDefinition CHANUKAH =
      new EventTagDefinition("chanukah", TagType.EVENT);
  private static final EventTagDefinition ALOS = new EventTagDefinition("alos", TagType.CATEGORY);
  private static final EventTagDefinition DAY_BEFORE =
      new EventTagDefinition(ZmanSelector.DAY_BEFORE, TagType.TIMING);

  private static ActiveEventSet active(String... codes) {
    return new ActiveEventSet(DATE, Set.of(codes));
  }

  @Test
  void testNoEventTagsAlwaysIncluded() {
    assertTrue(ZmanSelector.shouldInclude(List.of(), active()));
    assertTrue(ZmanSelector.shouldInclude(List.of(TagAssociation.of(ALOS)), active()));
    assertTrue(ZmanSelector.shouldInclude(List.of(TagAssociation.of(ALOS)), active("shabbos")));
  }

  @Test
  void testSinglePositiveTag() {
    List<TagAssociation> tags = List.of(TagAssociation.of(EREV_SHABBOS));
    assertTrue(ZmanSelector.shouldInclude(tags, active("erev_shabbos")));
    assertFalse(ZmanSelector.shouldInclude(tags, active()));
    assertFalse(ZmanSelector.shouldInclude(tags, active("shabbos")));
  }

  @Test
  void testNegatedTagWins() {
    List<TagAssociation> tags =
        List.of(TagAssociation.of(SHABBOS), TagAssociation.not(ROSH_CHODESH));
    assertFalse(ZmanSelector.shouldInclude(tags, active("shabbos", "rosh_chodesh")));
    assertTrue(ZmanSelector.shouldInclude(tags, active("shabbos")));
    assertFalse(ZmanSelector.shouldInclude(tags, active()));
  }

  @Test
  void testOnlyNegatedTags() {
    List<TagAssociation> tags = List.of(TagAssociation.not(SHABBOS));
    assertTrue(ZmanSelector.shouldInclude(tags, active()));
    assertTrue(ZmanSelector.shouldInclude(tags, active("chanukah")));
    assertFalse(ZmanSelector.shouldInclude(tags, active("shabbos")));
  }

  @Test
  void testAnyPositiveTagSuffices() {
    List<TagAssociation> tags = List.of(TagAssociation.of(SHABBOS), TagAssociation.of(CHANUKAH));
    assertTrue(ZmanSelector.shouldInclude(tags, active("chanukah")));
    assertTrue(ZmanSelector.shouldInclude(tags, active("shabbos")));
    assertFalse(ZmanSelector.shouldInclude(tags, active("rosh_chodesh")));
  }

  @Test
  void testCategoryTagsNeverFilter() {
    List<TagAssociation> tags = List.of(TagAssociation.of(ALOS), TagAssociation.of(CHANUKAH));
    assertFalse(ZmanSelector.shouldInclude(tags, active("alos")));
    assertTrue(ZmanSelector.shouldInclude(tags, active("chanukah")));
  }

  @Test
  void testDayBeforeShiftsPositiveTags() {
    List<TagAssociation> tags = List.of(TagAssociation.of(SHABBOS), TagAssociation.of(DAY_BEFORE));
    assertTrue(ZmanSelector.shouldInclude(tags, active("erev_shabbos")));
    assertFalse(ZmanSelector.shouldInclude(tags, active("shabbos")));
  }

  @Test
  void testNegatedTimingTagStillShifts() {
    List<TagAssociation> tags =
        List.of(TagAssociation.of(SHABBOS), TagAssociation.not(DAY_BEFORE));
    assertTrue(ZmanSelector.shouldInclude(tags, active("erev_shabbos")));
    assertFalse(ZmanSelector.shouldInclude(tags, active("shabbos")));
  }

  @Test
  void testDayBeforeLeavesNegatedTags() {
    List<TagAssociation> tags =
        List.of(
            TagAssociation.of(SHABBOS), TagAssociation.not(CHANUKAH), TagAssociation.of(DAY_BEFORE));
    assertFalse(ZmanSelector.shouldInclude(tags, active("erev_shabbos", "chanukah")));
    assertTrue(ZmanSelector.shouldInclude(tags, active("erev_shabbos")));
  }

  @Test
  void testTimingTagAloneDoesNotFilter() {
    assertTrue(ZmanSelector.shouldInclude(List.of(TagAssociation.of(DAY_BEFORE)), active()));
  }
}
