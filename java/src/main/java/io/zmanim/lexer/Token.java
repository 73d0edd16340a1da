package io.zmanim.lexer;

import io.zmanim.Span;
import io.zmanim.ast.DurationUnit;

/**
 * Represents a lexed token.
 *
 * @param kind the type of token
 * @param span the location in the input
 * @param text the identifier or reference key (for IDENT and REFERENCE tokens)
 * @param numberVal the numeric value (for NUMBER tokens)
 * @param unitVal the duration unit (for UNIT tokens)
 * @param timeHour the hour (for TIME tokens)
 * @param timeMinute the minute (for TIME tokens)
 */
public record Token(
    TokenKind kind,
    Span span,
    String text,
    double numberVal,
    DurationUnit unitVal,
    int timeHour,
    int timeMinute) {
  /** Creates an operator or punctuation token. */
  public static Token symbol(TokenKind kind, Span span) {
    return new Token(kind, span, null, 0, null, 0, 0);
  }

  /** Creates a number token. */
  public static Token number(double value, Span span) {
    return new Token(TokenKind.NUMBER, span, null, value, null, 0, 0);
  }

  /** Creates a duration unit token. */
  public static Token unit(DurationUnit unit, Span span) {
    return new Token(TokenKind.UNIT, span, null, 0, unit, 0, 0);
  }

  /** Creates a clock time token. */
  public static Token time(int hour, int minute, Span span) {
    return new Token(TokenKind.TIME, span, null, 0, null, hour, minute);
  }

  /** Creates an identifier token. */
  public static Token ident(String name, Span span) {
    return new Token(TokenKind.IDENT, span, name, 0, null, 0, 0);
  }

  /** Creates a reference token carrying the referenced key without the '@'. */
  public static Token reference(String key, Span span) {
    return new Token(TokenKind.REFERENCE, span, key, 0, null, 0, 0);
  }

  /**
   * Describes this token for error messages.
   *
   * @return a short human-readable description
   */
  public String describe() {
    return switch (kind) {
      case NUMBER -> "number";
      case UNIT -> "unit '" + unitVal.symbol() + "'";
      case TIME -> "time";
      case IDENT -> "'" + text + "'";
      case REFERENCE -> "'@" + text + "'";
      case PLUS -> "'+'";
      case MINUS -> "'-'";
      case LPAREN -> "'('";
      case RPAREN -> "')'";
      case COMMA -> "','";
    };
  }
}
