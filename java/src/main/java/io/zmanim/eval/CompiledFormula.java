package io.zmanim.eval;

import io.zmanim.ZmanimException;
import io.zmanim.ast.Expr;
import java.util.Optional;

/**
 * The outcome of parsing and validating one formula text: either a tree ready to evaluate or the
 * error that rejected it.
 *
 * @param source the formula text
 * @param expr the validated tree, or null when rejected
 * @param error the rejection, or null when accepted
 */
public record CompiledFormula(String source, Expr expr, ZmanimException error) {

  static CompiledFormula accepted(String source, Expr expr) {
    return new CompiledFormula(source, expr, null);
  }

  static CompiledFormula rejected(String source, ZmanimException error) {
    return new CompiledFormula(source, null, error.withInput(source));
  }

  /**
   * Returns the rejection, if any.
   *
   * @return the error, or empty when the formula is valid
   */
  public Optional<ZmanimException> failure() {
    return Optional.ofNullable(error);
  }
}
