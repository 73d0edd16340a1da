package io.zmanim.ast;

import io.zmanim.Span;
import java.util.List;

/**
 * A call to a builtin function. The name is not checked by the parser.
 *
 * @param name the function name
 * @param args the ordered argument nodes
 * @param span the source span covering the name through the closing parenthesis
 */
public record FunctionCall(String name, List<Expr> args, Span span) implements Expr {
  public FunctionCall {
    args = List.copyOf(args);
  }

  /**
   * Returns the argument at the given position.
   *
   * @param index the zero-based position
   * @return the argument node
   */
  public Expr arg(int index) {
    return args.get(index);
  }
}
