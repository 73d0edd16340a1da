package io.zmanim.lexer;

import io.zmanim.Span;
import io.zmanim.ZmanimException;
import io.zmanim.ast.DurationUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Tokenizes formula text into a list of tokens. */
public final class Lexer {
  private final String input;
  private int pos;

  private Lexer(String input) {
    this.input = input;
    this.pos = 0;
  }

  /**
   * Tokenizes the formula text into a list of tokens.
   *
   * @param input the formula text to tokenize
   * @return a list of tokens
   * @throws ZmanimException if the input contains invalid tokens
   */
  public static List<Token> tokenize(String input) throws ZmanimException {
    return new Lexer(input).doTokenize();
  }

  private List<Token> doTokenize() throws ZmanimException {
    List<Token> tokens = new ArrayList<>();
    while (true) {
      skipWhitespace();
      if (pos >= input.length()) {
        break;
      }

      int start = pos;
      char ch = input.charAt(pos);

      TokenKind symbol = SYMBOLS.get(ch);
      if (symbol != null) {
        pos++;
        tokens.add(Token.symbol(symbol, new Span(start, pos)));
        continue;
      }

      if (ch == '@') {
        tokens.add(lexReference());
        continue;
      }

      if (isDigit(ch) || (ch == '.' && pos + 1 < input.length() && isDigit(input.charAt(pos + 1)))) {
        tokens.add(lexNumberOrTime());
        continue;
      }

      if (isWordStart(ch)) {
        tokens.add(lexWord());
        continue;
      }

      throw ZmanimException.lex(
          "unexpected character '" + ch + "'", new Span(start, start + 1), input);
    }

    return tokens;
  }

  private void skipWhitespace() {
    while (pos < input.length() && isWhitespace(input.charAt(pos))) {
      pos++;
    }
  }

  private Token lexReference() throws ZmanimException {
    int start = pos;
    pos++; // skip '@'
    int keyStart = pos;
    while (pos < input.length() && isWordPart(input.charAt(pos))) {
      pos++;
    }
    if (pos == keyStart) {
      throw ZmanimException.lex("expected zman key after '@'", new Span(start, pos), input);
    }
    return Token.reference(input.substring(keyStart, pos), new Span(start, pos));
  }

  private Token lexNumberOrTime() throws ZmanimException {
    int start = pos;

    while (pos < input.length() && isDigit(input.charAt(pos))) {
      pos++;
    }
    String digits = input.substring(start, pos);

    // Clock time: H:MM or HH:MM
    if ((digits.length() == 1 || digits.length() == 2)
        && pos < input.length()
        && input.charAt(pos) == ':') {
      pos++; // skip ':'
      int minStart = pos;
      while (pos < input.length() && isDigit(input.charAt(pos))) {
        pos++;
      }
      String minDigits = input.substring(minStart, pos);
      if (minDigits.length() != 2) {
        throw ZmanimException.lex("expected two-digit minutes in time", new Span(start, pos), input);
      }
      int hour = Integer.parseInt(digits);
      int minute = Integer.parseInt(minDigits);
      if (hour > 23 || minute > 59) {
        throw ZmanimException.lex("invalid time", new Span(start, pos), input);
      }
      return Token.time(hour, minute, new Span(start, pos));
    }

    // Decimal fraction
    if (pos < input.length() && input.charAt(pos) == '.') {
      pos++;
      int fracStart = pos;
      while (pos < input.length() && isDigit(input.charAt(pos))) {
        pos++;
      }
      if (pos == fracStart) {
        throw ZmanimException.lex("expected digits after '.'", new Span(start, pos), input);
      }
    }

    return Token.number(Double.parseDouble(input.substring(start, pos)), new Span(start, pos));
  }

  private Token lexWord() {
    int start = pos;
    while (pos < input.length() && isWordPart(input.charAt(pos))) {
      pos++;
    }
    String word = input.substring(start, pos).toLowerCase(Locale.ROOT);
    Span span = new Span(start, pos);

    DurationUnit unit = UNIT_MAP.get(word);
    if (unit != null) {
      return Token.unit(unit, span);
    }
    return Token.ident(word, span);
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isWordStart(char c) {
    return Character.isLetter(c) || c == '_';
  }

  private static boolean isWordPart(char c) {
    return isWordStart(c) || isDigit(c);
  }

  private static boolean isWhitespace(char c) {
    return c == ' ' || c == '\t' || c == '\n' || c == '\r';
  }

  private static final Map<Character, TokenKind> SYMBOLS =
      Map.of(
          '+', TokenKind.PLUS,
          '-', TokenKind.MINUS,
          '(', TokenKind.LPAREN,
          ')', TokenKind.RPAREN,
          ',', TokenKind.COMMA);

  private static final Map<String, DurationUnit> UNIT_MAP =
      Map.ofEntries(
          Map.entry("min", DurationUnit.MINUTES),
          Map.entry("mins", DurationUnit.MINUTES),
          Map.entry("minute", DurationUnit.MINUTES),
          Map.entry("minutes", DurationUnit.MINUTES),
          Map.entry("hr", DurationUnit.HOURS),
          Map.entry("hrs", DurationUnit.HOURS),
          Map.entry("hour", DurationUnit.HOURS),
          Map.entry("hours", DurationUnit.HOURS),
          Map.entry("day", DurationUnit.DAYS),
          Map.entry("days", DurationUnit.DAYS));
}
