package io.zmanim.eval;

import static org.junit.jupiter.api.Assertions.*;

import io.zmanim.ErrorKind;
import io.zmanim.ZmanimException;
import io.zmanim.functions.FunctionLibrary;
import io.zmanim.functions.OpinionBases;
import org.junit.jupiter.api.Test;

/** Tests for the parse and validation cache. */
public class FormulaCacheTest {
  private final FormulaCache cache =
      new FormulaCache(FunctionLibrary.standard(), OpinionBases.defaults());

  @Test
  void testSameTextCompiledOnce() {
    CompiledFormula first = cache.compile("sunrise - 72min");
    assertSame(first, cache.compile("sunrise - 72min"));
    assertEquals(1, cache.size());
  }

  @Test
  void testEditedTextIsNewEntry() {
    CompiledFormula before = cache.compile("sunrise - 72min");
    CompiledFormula after = cache.compile("sunrise - 90min");
    assertNotEquals(before.expr(), after.expr());
    assertEquals(2, cache.size());
  }

  @Test
  void testRejectedFormulaKeepsInputForRendering() {
    CompiledFormula compiled = cache.compile("solar(16.1, sideways)");
    ZmanimException e = compiled.failure().orElseThrow();
    assertNull(compiled.expr());
    assertEquals(ErrorKind.VALIDATION, e.kind());
    assertEquals("solar(16.1, sideways)", e.input().orElseThrow());
    assertTrue(e.displayRich().endsWith("^^^^^^^^"), e.displayRich());
  }

  @Test
  void testInvalidatedTextIsCompiledAgain() {
    CompiledFormula first = cache.compile("sunrise - 72min");
    cache.invalidate("sunrise - 72min");
    assertEquals(0, cache.size());
    CompiledFormula second = cache.compile("sunrise - 72min");
    assertNotSame(first, second);
    assertEquals(first.expr(), second.expr());
  }

  @Test
  void testSizeIsBounded() {
    FormulaCache bounded =
        new FormulaCache(FunctionLibrary.standard(), OpinionBases.defaults(), 3, Runnable::run);
    for (int minutes = 1; minutes <= 50; minutes++) {
      bounded.compile("sunrise - " + minutes + "min");
    }
    assertTrue(bounded.size() <= 3, String.valueOf(bounded.size()));
    CompiledFormula again = bounded.compile("sunrise - 1min");
    assertTrue(again.failure().isEmpty());
  }
}
