package io.zmanim.ast;

import io.zmanim.Span;

/**
 * A reference to an astronomical primitive such as sunrise.
 *
 * @param primitive the primitive
 * @param span the source span
 */
public record PrimitiveRef(Primitive primitive, Span span) implements Expr {}
