package io.zmanim;

import java.util.Optional;

/** Exception thrown for errors in formula lexing, parsing, validation or evaluation. */
public final class ZmanimException extends Exception {
  /** The error kind. */
  private final ErrorKind kind;

  /** The source span where the error occurred. */
  private final Span span;

  /** The original formula text. */
  private final String input;

  private ZmanimException(ErrorKind kind, String message, Span span, String input) {
    super(message);
    this.kind = kind;
    this.span = span;
    this.input = input;
  }

  /**
   * Creates a new lexer error.
   *
   * @param message the error message
   * @param span the location of the error in the input
   * @param input the original formula text
   * @return a new ZmanimException for a lexer error
   */
  public static ZmanimException lex(String message, Span span, String input) {
    return new ZmanimException(ErrorKind.LEX, message, span, input);
  }

  /**
   * Creates a new parser error.
   *
   * @param message the error message, phrased as an expectation where possible
   * @param span the location of the error in the input
   * @param input the original formula text
   * @return a new ZmanimException for a parser error
   */
  public static ZmanimException parse(String message, Span span, String input) {
    return new ZmanimException(ErrorKind.PARSE, message, span, input);
  }

  /**
   * Creates a new validation error for a builtin argument problem.
   *
   * @param message the error message
   * @param span the location of the offending node
   * @return a new ZmanimException for a validation error
   */
  public static ZmanimException validation(String message, Span span) {
    return new ZmanimException(ErrorKind.VALIDATION, message, span, null);
  }

  /**
   * Creates a new error for a call to an undefined function.
   *
   * @param name the function name
   * @param span the location of the call
   * @return a new ZmanimException for an unknown function
   */
  public static ZmanimException unknownFunction(String name, Span span) {
    return new ZmanimException(
        ErrorKind.UNKNOWN_FUNCTION, "unknown function '" + name + "'", span, null);
  }

  /**
   * Returns the kind of error.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Returns the span where the error occurred, if available.
   *
   * @return the span, or empty if not available
   */
  public Optional<Span> span() {
    return Optional.ofNullable(span);
  }

  /**
   * Returns the original formula text, if available.
   *
   * @return the input, or empty if not available
   */
  public Optional<String> input() {
    return Optional.ofNullable(input);
  }

  /**
   * Returns a copy of this error that carries the formula text, so callers that validate an
   * already-parsed tree can still render the caret underline.
   *
   * @param formula the formula text the span refers to
   * @return this error with its input attached
   */
  public ZmanimException withInput(String formula) {
    if (input != null) {
      return this;
    }
    return new ZmanimException(kind, getMessage(), span, formula);
  }

  /**
   * Formats a rich error message with underline.
   *
   * <p>For errors with span and input, produces output like:
   *
   * <pre>
   * error: expected direction after ','
   *   solar(16.1, 72)
   *               ^^
   * </pre>
   *
   * @return a formatted error message
   */
  public String displayRich() {
    if (span != null && input != null) {
      StringBuilder sb = new StringBuilder();
      sb.append("error: ").append(getMessage()).append("\n");
      sb.append("  ").append(input).append("\n");
      sb.append(" ".repeat(span.start() + 2));
      sb.append("^".repeat(span.length()));
      return sb.toString();
    }

    return "error: " + getMessage();
  }
}
