package io.zmanim;

/** The category of a failure while parsing, validating or evaluating a formula. */
public enum ErrorKind {
  /** Lexer error - a character or word that cannot start a token. */
  LEX("lex"),
  /** Parser error - malformed formula syntax. */
  PARSE("parse"),
  /** Wrong argument count, kind or domain for a builtin. */
  VALIDATION("validation"),
  /** A {@code @key} reference that the registry does not know. */
  REFERENCE("reference"),
  /** A formula that references itself, directly or transitively. */
  CYCLE("cycle"),
  /** A call to a function the library does not define. */
  UNKNOWN_FUNCTION("unknown_function"),
  /** The astronomical provider could not produce a time. */
  COMPUTATION("computation");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the kind as a lowercase string
   */
  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
