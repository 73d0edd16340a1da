package io.zmanim.functions;

import io.zmanim.ZmanimException;
import io.zmanim.ast.FunctionCall;
import io.zmanim.eval.Value;
import java.util.List;

/**
 * A builtin function of the formula language.
 *
 * <p>The validator checks every call against {@link #parameters()} and {@link
 * #checkArguments(FunctionCall)} before anything is evaluated, so {@link #apply} may assume
 * argument shapes: a {@code NUMBER} position holds a {@code NumberLiteral}, a {@code DIRECTION}
 * position an {@code Identifier} naming an accepted direction, and so on.
 */
public interface ZmanFunction {

  /**
   * Returns the name formulas call this function by.
   *
   * @return the function name
   */
  String name();

  /**
   * Returns the declared arguments, in order.
   *
   * @return the parameters
   */
  List<Parameter> parameters();

  /**
   * Checks argument domains beyond their shape, such as an angle range.
   *
   * @param call the call, already checked against {@link #parameters()}
   * @throws ZmanimException with kind VALIDATION if an argument is out of its domain
   */
  default void checkArguments(FunctionCall call) throws ZmanimException {}

  /**
   * Returns whether a direction is allowed at this function's direction positions.
   *
   * @param direction the direction
   * @return true if accepted
   */
  default boolean accepts(Direction direction) {
    return true;
  }

  /**
   * Computes the value of a validated call.
   *
   * @param call the call
   * @param evaluation access to sub-expression evaluation and astronomical primitives
   * @return the result, which may be an error value
   */
  Value apply(FunctionCall call, Evaluation evaluation);
}
