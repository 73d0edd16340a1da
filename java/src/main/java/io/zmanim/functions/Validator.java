package io.zmanim.functions;

import io.zmanim.ZmanimException;
import io.zmanim.ast.BinaryOp;
import io.zmanim.ast.ClockTime;
import io.zmanim.ast.CustomBase;
import io.zmanim.ast.DurationLiteral;
import io.zmanim.ast.Expr;
import io.zmanim.ast.FunctionCall;
import io.zmanim.ast.Identifier;
import io.zmanim.ast.NumberLiteral;
import io.zmanim.ast.PrimitiveRef;
import io.zmanim.ast.Reference;
import io.zmanim.display.Display;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Checks a parsed tree against the function library and the opinion-base table.
 *
 * <p>Validation runs before any astronomical query, so a formula with a bad argument never costs a
 * provider call. References are not followed here; an unknown {@code @key} is only discovered
 * when it is evaluated.
 */
public final class Validator {
  private final FunctionLibrary library;
  private final OpinionBases bases;

  private Validator(FunctionLibrary library, OpinionBases bases) {
    this.library = library;
    this.bases = bases;
  }

  /**
   * Validates an expression tree.
   *
   * @param expr the root of the tree
   * @param library the builtin functions
   * @param bases the named opinion bases
   * @throws ZmanimException with kind VALIDATION or UNKNOWN_FUNCTION on the first problem found
   */
  public static void validate(Expr expr, FunctionLibrary library, OpinionBases bases)
      throws ZmanimException {
    new Validator(library, bases).checkValue(expr);
  }

  private void checkValue(Expr expr) throws ZmanimException {
    if (expr instanceof DurationLiteral d) {
      if (!d.unit().fits(d.magnitude())) {
        throw ZmanimException.validation(
            "duration overflow: " + describe(d) + " exceeds the largest duration", d.span());
      }
      return;
    }
    if (expr instanceof ClockTime
        || expr instanceof PrimitiveRef
        || expr instanceof Reference) {
      return;
    }
    if (expr instanceof NumberLiteral n) {
      throw ZmanimException.validation(
          "number " + Display.render(n) + " needs a unit, such as " + Display.render(n) + "min",
          n.span());
    }
    if (expr instanceof Identifier id) {
      throw ZmanimException.validation(
          "'" + id.name() + "' is not a time; directions and opinion bases are only allowed as"
              + " function arguments",
          id.span());
    }
    if (expr instanceof CustomBase c) {
      throw ZmanimException.validation(
          "custom() is only allowed as the base of proportional_hours or shaah_zmanis", c.span());
    }
    if (expr instanceof BinaryOp op) {
      checkValue(op.left());
      checkValue(op.right());
      return;
    }
    if (expr instanceof FunctionCall call) {
      checkCall(call);
      return;
    }
    throw new IllegalArgumentException("unsupported node: " + expr);
  }

  private void checkCall(FunctionCall call) throws ZmanimException {
    Optional<ZmanFunction> found = library.lookup(call.name());
    if (found.isEmpty()) {
      throw ZmanimException.unknownFunction(call.name(), call.span());
    }
    ZmanFunction fn = found.get();

    List<Parameter> params = fn.parameters();
    if (call.args().size() != params.size()) {
      String labels = params.stream().map(Parameter::label).collect(Collectors.joining(", "));
      throw ZmanimException.validation(
          call.name()
              + "() requires "
              + params.size()
              + (params.size() == 1 ? " argument" : " arguments")
              + " ("
              + labels
              + "), got "
              + call.args().size(),
          call.span());
    }

    for (int i = 0; i < params.size(); i++) {
      checkArgument(fn, params.get(i), call.arg(i));
    }
    fn.checkArguments(call);
  }

  private void checkArgument(ZmanFunction fn, Parameter param, Expr arg) throws ZmanimException {
    switch (param.kind()) {
      case NUMBER -> {
        if (!(arg instanceof NumberLiteral)) {
          throw ZmanimException.validation(
              fn.name() + "() expects a number for " + param.label(), arg.span());
        }
      }
      case DIRECTION -> {
        Optional<Direction> direction =
            arg instanceof Identifier id ? Direction.fromKeyword(id.name()) : Optional.empty();
        if (direction.isEmpty()) {
          throw ZmanimException.validation(
              fn.name() + "() expects a direction for " + param.label() + ", got " + describe(arg),
              arg.span());
        }
        if (!fn.accepts(direction.get())) {
          throw ZmanimException.validation(
              fn.name() + "() does not accept direction '" + direction.get() + "'", arg.span());
        }
      }
      case BASE -> {
        if (arg instanceof CustomBase custom) {
          checkValue(custom.start());
          checkValue(custom.end());
        } else if (arg instanceof Identifier id) {
          if (!bases.contains(id.name())) {
            throw ZmanimException.validation(
                "unknown opinion base '" + id.name() + "'", id.span());
          }
        } else {
          throw ZmanimException.validation(
              fn.name() + "() expects an opinion base or custom(start, end) for " + param.label()
                  + ", got " + describe(arg),
              arg.span());
        }
      }
      case TIME -> checkValue(arg);
    }
  }

  private static String describe(Expr arg) {
    return "'" + Display.render(arg) + "'";
  }
}
