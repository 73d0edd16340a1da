package io.zmanim.parser;

import io.zmanim.Span;
import io.zmanim.ZmanimException;
import io.zmanim.ast.*;
import io.zmanim.lexer.Lexer;
import io.zmanim.lexer.Token;
import io.zmanim.lexer.TokenKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Recursive descent parser for zman formulas.
 *
 * <p>The parser only checks surface syntax. Function names, directions and opinion bases are
 * recorded as written and checked later by the validator.
 */
public final class Parser {
  /** Argument labels used to phrase "expected ... after ','" messages for known builtins. */
  private static final Map<String, List<String>> ARGUMENT_LABELS =
      Map.of(
          "solar", List.of("degrees", "direction"),
          "seasonal_solar", List.of("degrees", "direction"),
          "proportional_hours", List.of("hours", "base"),
          "proportional_minutes", List.of("minutes", "direction"),
          "shaah_zmanis", List.of("base"),
          "midpoint", List.of("time", "time"));

  private final String input;
  private final List<Token> tokens;
  private int pos;

  private Parser(String input, List<Token> tokens) {
    this.input = input;
    this.tokens = tokens;
    this.pos = 0;
  }

  /**
   * Parses formula text into an expression tree.
   *
   * @param input the formula text
   * @return the root of the parsed tree
   * @throws ZmanimException if the text is not a well-formed formula
   */
  public static Expr parse(String input) throws ZmanimException {
    if (input == null || input.trim().isEmpty()) {
      throw ZmanimException.parse("empty formula", new Span(0, 0), input);
    }

    List<Token> tokens = Lexer.tokenize(input);
    if (tokens.isEmpty()) {
      throw ZmanimException.parse("empty formula", new Span(0, 0), input);
    }

    return new Parser(input, tokens).parseFormula();
  }

  private Expr parseFormula() throws ZmanimException {
    Expr expr = parseExpr();
    Token extra = peek();
    if (extra != null) {
      throw parseError("unexpected " + extra.describe() + " after expression", extra.span());
    }
    return expr;
  }

  private Expr parseExpr() throws ZmanimException {
    Expr left = parseOperand();

    while (check(TokenKind.PLUS) || check(TokenKind.MINUS)) {
      Token opTok = tokens.get(pos++);
      BinaryOp.Operator op =
          opTok.kind() == TokenKind.PLUS ? BinaryOp.Operator.PLUS : BinaryOp.Operator.MINUS;
      if (peek() == null) {
        throw parseError("expected operand after '" + op + "'", endSpan());
      }
      Expr right = parseOperand();
      left = new BinaryOp(op, left, right, left.span().to(right.span()));
    }

    return left;
  }

  private Expr parseOperand() throws ZmanimException {
    Token tok = peek();
    if (tok == null) {
      throw parseError("unexpected end of formula", endSpan());
    }

    return switch (tok.kind()) {
      case NUMBER -> parseNumberOrDuration(false, tok.span());
      case MINUS -> {
        pos++;
        if (!check(TokenKind.NUMBER)) {
          throw parseError(
              "expected number or duration after '-'", peek() != null ? peek().span() : endSpan());
        }
        yield parseNumberOrDuration(true, tok.span());
      }
      case TIME -> {
        pos++;
        yield new ClockTime(tok.timeHour(), tok.timeMinute(), tok.span());
      }
      case REFERENCE -> {
        pos++;
        yield new Reference(tok.text(), tok.span());
      }
      case LPAREN -> {
        pos++;
        Expr inner = parseExpr();
        expect(TokenKind.RPAREN, "expected ')' to close group");
        yield inner;
      }
      case IDENT -> parseWord();
      case UNIT -> throw parseError("expected number before " + tok.describe(), tok.span());
      default -> throw parseError("expected expression but got " + tok.describe(), tok.span());
    };
  }

  private Expr parseNumberOrDuration(boolean negative, Span startSpan) throws ZmanimException {
    Token numTok = tokens.get(pos++);
    double value = negative ? -numTok.numberVal() : numTok.numberVal();

    if (check(TokenKind.UNIT)) {
      Token unitTok = tokens.get(pos++);
      return new DurationLiteral(value, unitTok.unitVal(), startSpan.to(unitTok.span()));
    }
    return new NumberLiteral(value, startSpan.to(numTok.span()));
  }

  private Expr parseWord() throws ZmanimException {
    Token word = tokens.get(pos++);

    if (word.text().equals("custom")) {
      return parseCustomBase(word);
    }

    if (check(TokenKind.LPAREN)) {
      return parseCall(word);
    }

    Optional<Primitive> primitive = Primitive.fromKeyword(word.text());
    if (primitive.isPresent()) {
      return new PrimitiveRef(primitive.get(), word.span());
    }
    return new Identifier(word.text(), word.span());
  }

  private Expr parseCustomBase(Token word) throws ZmanimException {
    expect(TokenKind.LPAREN, "expected '(' after 'custom'");
    if (check(TokenKind.RPAREN) || peek() == null) {
      throw parseError("expected start expression in custom()", currentSpan());
    }
    Expr start = parseExpr();
    expect(TokenKind.COMMA, "expected ',' between custom start and end");
    if (check(TokenKind.RPAREN) || peek() == null) {
      throw parseError("expected end expression after ','", currentSpan());
    }
    Expr end = parseExpr();
    Token close = expect(TokenKind.RPAREN, "expected ')' to close custom()");
    return new CustomBase(start, end, word.span().to(close.span()));
  }

  private Expr parseCall(Token name) throws ZmanimException {
    expect(TokenKind.LPAREN, "expected '(' after " + name.describe());
    List<Expr> args = new ArrayList<>();

    if (check(TokenKind.RPAREN)) {
      Token close = tokens.get(pos++);
      return new FunctionCall(name.text(), args, name.span().to(close.span()));
    }

    while (true) {
      args.add(parseExpr());

      if (check(TokenKind.COMMA)) {
        pos++;
        if (check(TokenKind.RPAREN) || peek() == null) {
          throw parseError(
              "expected " + argumentLabel(name.text(), args.size()) + " after ','",
              currentSpan());
        }
        continue;
      }

      Token close = expect(TokenKind.RPAREN, "expected ',' or ')' after argument");
      return new FunctionCall(name.text(), args, name.span().to(close.span()));
    }
  }

  private static String argumentLabel(String function, int index) {
    List<String> labels = ARGUMENT_LABELS.get(function);
    if (labels != null && index < labels.size()) {
      return labels.get(index);
    }
    return "argument";
  }

  // Helper methods

  private Token peek() {
    return pos < tokens.size() ? tokens.get(pos) : null;
  }

  private boolean check(TokenKind kind) {
    Token tok = peek();
    return tok != null && tok.kind() == kind;
  }

  private Token expect(TokenKind kind, String message) throws ZmanimException {
    Token tok = peek();
    if (tok == null) {
      throw parseError(message + " but reached end of formula", endSpan());
    }
    if (tok.kind() != kind) {
      throw parseError(message + " but got " + tok.describe(), tok.span());
    }
    pos++;
    return tok;
  }

  private Span currentSpan() {
    Token tok = peek();
    return tok != null ? tok.span() : endSpan();
  }

  private Span endSpan() {
    if (tokens.isEmpty()) {
      return new Span(0, 0);
    }
    Span lastSpan = tokens.get(tokens.size() - 1).span();
    return new Span(lastSpan.end(), lastSpan.end());
  }

  private ZmanimException parseError(String message, Span span) {
    return ZmanimException.parse(message, span, input);
  }
}
