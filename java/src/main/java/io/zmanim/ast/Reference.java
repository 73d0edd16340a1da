package io.zmanim.ast;

import io.zmanim.Span;

/**
 * A reference to another formula by key, written "@key".
 *
 * @param key the referenced zman key
 * @param span the source span
 */
public record Reference(String key, Span span) implements Expr {}
