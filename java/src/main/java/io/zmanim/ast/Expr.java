package io.zmanim.ast;

import io.zmanim.Span;

/**
 * Sealed interface for formula expression nodes.
 *
 * <p>There are 9 kinds of node:
 *
 * <ul>
 *   <li>{@link NumberLiteral} - "16.1"
 *   <li>{@link DurationLiteral} - "72min", "14 days"
 *   <li>{@link PrimitiveRef} - "sunrise", "molad"
 *   <li>{@link ClockTime} - "12:30"
 *   <li>{@link FunctionCall} - "solar(16.1, before_sunrise)"
 *   <li>{@link BinaryOp} - "sunset + 18min"
 *   <li>{@link Reference} - "@alos_hashachar"
 *   <li>{@link Identifier} - "gra", "after_sunset"
 *   <li>{@link CustomBase} - "custom(@alos, @tzais)"
 * </ul>
 *
 * <p>Nodes are immutable records, so two parses of the same text compare equal.
 */
public sealed interface Expr
    permits NumberLiteral,
        DurationLiteral,
        PrimitiveRef,
        ClockTime,
        FunctionCall,
        BinaryOp,
        Reference,
        Identifier,
        CustomBase {

  /**
   * Returns the source range this node was parsed from.
   *
   * @return the span
   */
  Span span();
}
