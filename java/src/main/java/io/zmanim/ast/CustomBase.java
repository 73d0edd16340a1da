package io.zmanim.ast;

import io.zmanim.Span;

/**
 * An ad hoc day boundary, written "custom(start, end)". Only meaningful as the base argument of
 * {@code proportional_hours} or {@code shaah_zmanis}.
 *
 * @param start the expression for the start of the day
 * @param end the expression for the end of the day
 * @param span the source span
 */
public record CustomBase(Expr start, Expr end, Span span) implements Expr {}
