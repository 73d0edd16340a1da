package io.zmanim.ast;

import io.zmanim.Span;

/**
 * A bare word in argument position. The parser does not know whether it names a direction or an
 * opinion base; the function that receives it decides.
 *
 * @param name the lowercase word
 * @param span the source span
 */
public record Identifier(String name, Span span) implements Expr {}
