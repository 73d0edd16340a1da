package io.zmanim.functions;

import io.zmanim.ast.Expr;

/**
 * A named day-boundary convention (shita): where the halachic day starts and ends.
 *
 * @param name the base name used in formulas, such as {@code gra}
 * @param description a short human-readable description
 * @param start the expression for the start of the day
 * @param end the expression for the end of the day
 */
public record BaseDefinition(String name, String description, Expr start, Expr end) {}
