package io.zmanim.functions;

import static org.junit.jupiter.api.Assertions.*;

import io.zmanim.astro.Location;
import io.zmanim.eval.Evaluator;
import io.zmanim.eval.ExecutionContext;
import io.zmanim.eval.TimeValue;
import io.zmanim.eval.Value;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for the opinion-base table. */
public class OpinionBasesTest {

  private static InputStream json(String text) {
    return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  void testDefaultTableNames() {
    assertEquals(
        List.of(
            "gra", "mga", "mga_60", "mga_72", "mga_90", "mga_96", "mga_120", "mga_72_zmanis",
            "mga_90_zmanis", "mga_96_zmanis", "mga_16_1", "mga_18", "mga_19_8", "mga_26",
            "baal_hatanya", "ateret_torah"),
        List.copyOf(OpinionBases.defaults().names()));
  }

  @Test
  void testEveryDefaultBaseGivesAnOrderedDay() {
    ExecutionContext ctx =
        ExecutionContext.builder(
                LocalDate.of(2024, 3, 20),
                Location.of(40.0828, -74.2094, ZoneId.of("America/New_York")))
            .build();
    for (String name : OpinionBases.defaults().names()) {
      Value start = Evaluator.evaluateFormula("proportional_hours(0, " + name + ")", ctx);
      Value end = Evaluator.evaluateFormula("proportional_hours(12, " + name + ")", ctx);
      TimeValue s = assertInstanceOf(TimeValue.class, start, name);
      TimeValue e = assertInstanceOf(TimeValue.class, end, name);
      assertTrue(e.time().isAfter(s.time()), name);
    }
  }

  @Test
  void testAteretTorahDayEndsLaterThanGra() {
    ExecutionContext ctx =
        ExecutionContext.builder(
                LocalDate.of(2024, 3, 20),
                Location.of(40.0828, -74.2094, ZoneId.of("America/New_York")))
            .build();
    TimeValue gra =
        assertInstanceOf(
            TimeValue.class, Evaluator.evaluateFormula("proportional_hours(3, gra)", ctx));
    TimeValue ateret =
        assertInstanceOf(
            TimeValue.class, Evaluator.evaluateFormula("proportional_hours(3, ateret_torah)", ctx));
    assertTrue(ateret.time().isAfter(gra.time()));
  }

  @Test
  void testLoadCustomTable() {
    OpinionBases bases =
        OpinionBases.load(
            json(
                "{\"short\": {\"description\": \"test\", \"start\": \"sunrise + 1hr\","
                    + " \"end\": \"sunset - 1hr\"}}"),
            FunctionLibrary.standard());
    assertTrue(bases.contains("short"));
    assertFalse(bases.contains("gra"));
    assertEquals("test", bases.lookup("short").orElseThrow().description());
  }

  @Test
  void testEntryMayNotUseNamedBase() {
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () ->
                OpinionBases.load(
                    json(
                        "{\"nested\": {\"start\": \"proportional_hours(1, gra)\","
                            + " \"end\": \"sunset\"}}"),
                    FunctionLibrary.standard()));
    assertTrue(e.getMessage().contains("nested"), e.getMessage());
  }

  @Test
  void testEntryNeedsBothEdges() {
    assertThrows(
        IllegalArgumentException.class,
        () -> OpinionBases.load(json("{\"half\": {\"start\": \"sunrise\"}}"), FunctionLibrary.standard()));
  }

  @Test
  void testMalformedJson() {
    assertThrows(
        UncheckedIOException.class,
        () -> OpinionBases.load(json("{not json"), FunctionLibrary.standard()));
  }
}
