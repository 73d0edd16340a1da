package io.zmanim.ast;

import io.zmanim.Span;

/**
 * A bare numeric literal, used for degrees, hour counts and minute counts.
 *
 * @param value the number
 * @param span the source span
 */
public record NumberLiteral(double value, Span span) implements Expr {}
