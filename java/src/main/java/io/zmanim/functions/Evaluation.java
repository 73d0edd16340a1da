package io.zmanim.functions;

import io.zmanim.ast.Expr;
import io.zmanim.ast.Primitive;
import io.zmanim.astro.SolarSide;
import io.zmanim.eval.Value;
import java.time.LocalDate;

/**
 * What a builtin may ask of the evaluator running it. All requests go through the evaluator's
 * memoization and cycle detection.
 */
public interface Evaluation {

  /**
   * Evaluates a sub-expression on the current resolution path.
   *
   * @param expr the expression
   * @return its value
   */
  Value evaluate(Expr expr);

  /**
   * Evaluates an expression shared by many formulas once per run, memoized under {@code key}.
   *
   * @param key a run-wide key that cannot collide with zman keys
   * @param expr the expression
   * @return its value
   */
  Value evaluateShared(String key, Expr expr);

  /**
   * Returns the civil date of the run.
   *
   * @return the date
   */
  LocalDate date();

  /**
   * Returns an astronomical primitive for the run's date and location.
   *
   * @param primitive the primitive
   * @return a time, or a COMPUTATION error if it does not occur
   */
  Value primitive(Primitive primitive);

  /**
   * Returns an astronomical primitive for another date at the run's location.
   *
   * @param date the civil date
   * @param primitive the primitive
   * @return a time, or a COMPUTATION error if it does not occur
   */
  Value primitiveOn(LocalDate date, Primitive primitive);

  /**
   * Returns the time the sun's center is {@code degrees} below the horizon.
   *
   * @param degrees the depression; zero is the geometric horizon
   * @param side morning or evening
   * @return a time, or a COMPUTATION error if the sun does not reach that depression
   */
  Value solarCrossing(double degrees, SolarSide side);

  /**
   * Returns the time the sun's center is {@code degrees} below the horizon on another date.
   *
   * @param date the civil date
   * @param degrees the depression; zero is the geometric horizon
   * @param side morning or evening
   * @return a time, or a COMPUTATION error if the sun does not reach that depression
   */
  Value solarCrossingOn(LocalDate date, double degrees, SolarSide side);

  /**
   * Returns the named opinion bases in effect for the run.
   *
   * @return the base table
   */
  OpinionBases bases();
}
