package io.zmanim.parser;

import static org.junit.jupiter.api.Assertions.*;

import io.zmanim.ErrorKind;
import io.zmanim.Span;
import io.zmanim.ZmanimException;
import io.zmanim.ast.BinaryOp;
import io.zmanim.ast.ClockTime;
import io.zmanim.ast.CustomBase;
import io.zmanim.ast.DurationLiteral;
import io.zmanim.ast.DurationUnit;
import io.zmanim.ast.Expr;
import io.zmanim.ast.FunctionCall;
import io.zmanim.ast.Identifier;
import io.zmanim.ast.NumberLiteral;
import io.zmanim.ast.Primitive;
import io.zmanim.ast.PrimitiveRef;
import io.zmanim.ast.Reference;
import java.time.Duration;
import org.junit.jupiter.api.Test;

/** Unit tests for tree shape and error reporting. */
public class ParserTest {

  @Test
  void testOffsetTree() throws ZmanimException {
    Expr expected =
        new BinaryOp(
            BinaryOp.Operator.MINUS,
            new PrimitiveRef(Primitive.SUNRISE, new Span(0, 7)),
            new DurationLiteral(72, DurationUnit.MINUTES, new Span(10, 15)),
            new Span(0, 15));
    assertEquals(expected, Parser.parse("sunrise - 72min"));
  }

  @Test
  void testLeftAssociative() throws ZmanimException {
    BinaryOp root = assertInstanceOf(BinaryOp.class, Parser.parse("sunrise + 1hr - 5min"));
    assertEquals(BinaryOp.Operator.MINUS, root.op());
    BinaryOp left = assertInstanceOf(BinaryOp.class, root.left());
    assertEquals(BinaryOp.Operator.PLUS, left.op());
    assertInstanceOf(DurationLiteral.class, root.right());
  }

  @Test
  void testFunctionArgumentsKeepWords() throws ZmanimException {
    FunctionCall call = assertInstanceOf(FunctionCall.class, Parser.parse("solar(16.1, before_sunrise)"));
    assertEquals("solar", call.name());
    assertEquals(2, call.args().size());
    assertEquals(16.1, assertInstanceOf(NumberLiteral.class, call.arg(0)).value());
    assertEquals("before_sunrise", assertInstanceOf(Identifier.class, call.arg(1)).name());
    assertEquals(new Span(0, 27), call.span());
  }

  @Test
  void testCustomBase() throws ZmanimException {
    FunctionCall call =
        assertInstanceOf(FunctionCall.class, Parser.parse("proportional_hours(4, custom(@alos, sunset))"));
    CustomBase base = assertInstanceOf(CustomBase.class, call.arg(1));
    assertEquals(new Reference("alos", new Span(29, 34)), base.start());
    assertEquals(new PrimitiveRef(Primitive.SUNSET, new Span(36, 42)), base.end());
  }

  @Test
  void testPrimitivesAndIdentifiers() throws ZmanimException {
    assertEquals(Primitive.MOLAD, assertInstanceOf(PrimitiveRef.class, Parser.parse("molad")).primitive());
    assertEquals(
        Primitive.VISIBLE_SUNSET,
        assertInstanceOf(PrimitiveRef.class, Parser.parse("Visible_Sunset")).primitive());
    assertEquals("gra", assertInstanceOf(Identifier.class, Parser.parse("gra")).name());
  }

  @Test
  void testDurationsAndTimes() throws ZmanimException {
    DurationLiteral days = assertInstanceOf(DurationLiteral.class, Parser.parse("14 days"));
    assertEquals(Duration.ofDays(14), days.toDuration());
    DurationLiteral half = assertInstanceOf(DurationLiteral.class, Parser.parse("1.5 hours"));
    assertEquals(Duration.ofMinutes(90), half.toDuration());
    DurationLiteral negative = assertInstanceOf(DurationLiteral.class, Parser.parse("-20 mins"));
    assertEquals(Duration.ofMinutes(-20), negative.toDuration());
    ClockTime time = assertInstanceOf(ClockTime.class, Parser.parse("7:30"));
    assertEquals(7, time.hour());
    assertEquals(30, time.minute());
  }

  @Test
  void testNestedGroupSpan() throws ZmanimException {
    Expr expr = Parser.parse("@a + (5min + 3min)");
    BinaryOp root = assertInstanceOf(BinaryOp.class, expr);
    assertInstanceOf(BinaryOp.class, root.right());
    assertEquals(new Span(0, 17), root.span());
  }

  @Test
  void testDisplayRichUnderline() {
    ZmanimException e = assertThrows(ZmanimException.class, () -> Parser.parse("solar(16.1, )"));
    assertEquals(ErrorKind.PARSE, e.kind());
    assertEquals(
        "error: expected direction after ','\n  solar(16.1, )\n              ^", e.displayRich());
  }

  @Test
  void testUnknownFunctionIsNotAParseError() throws ZmanimException {
    FunctionCall call = assertInstanceOf(FunctionCall.class, Parser.parse("coalesce(@a, @b)"));
    assertEquals("coalesce", call.name());
  }

  @Test
  void testEmptyCallParses() throws ZmanimException {
    FunctionCall call = assertInstanceOf(FunctionCall.class, Parser.parse("solar()"));
    assertTrue(call.args().isEmpty());
  }
}
