package io.zmanim.eval;

import io.zmanim.ErrorKind;
import io.zmanim.ZmanimException;
import java.util.Objects;

/**
 * A failure attached to the expression or formula that produced it.
 *
 * @param kind the error kind
 * @param message a human-readable message
 */
public record ErrorValue(ErrorKind kind, String message) implements Value {
  public ErrorValue {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(message, "message");
  }

  /**
   * Converts a parse or validation exception to an error value.
   *
   * @param e the exception
   * @return the error value
   */
  public static ErrorValue of(ZmanimException e) {
    return new ErrorValue(e.kind(), e.getMessage());
  }

  @Override
  public String toString() {
    return kind + ": " + message;
  }
}
