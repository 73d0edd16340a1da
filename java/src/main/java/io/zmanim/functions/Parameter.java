package io.zmanim.functions;

/**
 * One declared argument of a builtin.
 *
 * @param label the name used in error messages
 * @param kind what the argument must be
 */
public record Parameter(String label, ArgKind kind) {}
