package io.zmanim.ast;

import io.zmanim.Span;

/**
 * A left-associative addition or subtraction.
 *
 * @param op the operator
 * @param left the left operand
 * @param right the right operand
 * @param span the source span covering both operands
 */
public record BinaryOp(Operator op, Expr left, Expr right, Span span) implements Expr {

  /** The arithmetic operator. */
  public enum Operator {
    PLUS("+"),
    MINUS("-");

    private final String symbol;

    Operator(String symbol) {
      this.symbol = symbol;
    }

    @Override
    public String toString() {
      return symbol;
    }
  }
}
