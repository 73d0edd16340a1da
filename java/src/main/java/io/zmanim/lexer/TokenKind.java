package io.zmanim.lexer;

/** The type of token. */
public enum TokenKind {
  /** A numeric literal (e.g., "16.1", "72"). */
  NUMBER,
  /** A duration unit word (e.g., "min", "hr", "days"). */
  UNIT,
  /** A clock time literal (e.g., "06:00"). */
  TIME,
  /** A bare word: primitive, function name, direction or opinion base. */
  IDENT,
  /** A cross-formula reference (e.g., "@alos_hashachar"). */
  REFERENCE,
  /** The "+" operator. */
  PLUS,
  /** The "-" operator. */
  MINUS,
  /** An opening parenthesis. */
  LPAREN,
  /** A closing parenthesis. */
  RPAREN,
  /** A comma separator. */
  COMMA
}
