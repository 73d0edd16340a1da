package io.zmanim.lexer;

import static org.junit.jupiter.api.Assertions.*;

import io.zmanim.Span;
import io.zmanim.ZmanimException;
import io.zmanim.ast.DurationUnit;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

/** Unit tests for tokenization. */
public class LexerTest {

  private static List<TokenKind> kinds(String input) throws ZmanimException {
    return Lexer.tokenize(input).stream().map(Token::kind).collect(Collectors.toList());
  }

  @Test
  void testTokenKinds() throws ZmanimException {
    assertEquals(
        List.of(
            TokenKind.REFERENCE,
            TokenKind.PLUS,
            TokenKind.NUMBER,
            TokenKind.UNIT,
            TokenKind.MINUS,
            TokenKind.IDENT,
            TokenKind.LPAREN,
            TokenKind.TIME,
            TokenKind.COMMA,
            TokenKind.RPAREN),
        kinds("@alos + 1.5 hours - f(12:00, )"));
  }

  @Test
  void testUnitsAndSpans() throws ZmanimException {
    List<Token> tokens = Lexer.tokenize("72 Minutes");
    assertEquals(72.0, tokens.get(0).numberVal());
    assertEquals(new Span(0, 2), tokens.get(0).span());
    assertEquals(DurationUnit.MINUTES, tokens.get(1).unitVal());
    assertEquals(new Span(3, 10), tokens.get(1).span());
  }

  @Test
  void testWordsAreLowercased() throws ZmanimException {
    assertEquals("before_sunrise", Lexer.tokenize("BEFORE_Sunrise").get(0).text());
  }

  @Test
  void testReferenceKeepsCase() throws ZmanimException {
    assertEquals("Alos_72", Lexer.tokenize("@Alos_72").get(0).text());
  }

  @Test
  void testLeadingDotNumber() throws ZmanimException {
    assertEquals(0.5, Lexer.tokenize(".5hr").get(0).numberVal());
  }

  @Test
  void testTrailingDot() {
    ZmanimException e = assertThrows(ZmanimException.class, () -> Lexer.tokenize("5. min"));
    assertEquals("expected digits after '.'", e.getMessage());
  }
}
