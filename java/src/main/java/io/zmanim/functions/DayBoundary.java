package io.zmanim.functions;

import io.zmanim.ErrorKind;
import io.zmanim.ast.CustomBase;
import io.zmanim.ast.Expr;
import io.zmanim.ast.Identifier;
import io.zmanim.eval.TimeValue;
import io.zmanim.eval.Value;
import java.time.ZonedDateTime;
import java.util.function.BiFunction;

/** The base argument of a proportional-hour function: a named convention or a custom pair. */
public sealed interface DayBoundary {

  /**
   * A convention from the opinion-base table. Its edges are shared by every formula in a run.
   *
   * @param base the table entry
   */
  record Named(BaseDefinition base) implements DayBoundary {
    @Override
    public Value start(Evaluation evaluation) {
      return evaluation.evaluateShared("#base:" + base.name() + ":start", base.start());
    }

    @Override
    public Value end(Evaluation evaluation) {
      return evaluation.evaluateShared("#base:" + base.name() + ":end", base.end());
    }
  }

  /**
   * An ad hoc boundary written {@code custom(start, end)}.
   *
   * @param startExpr the start expression
   * @param endExpr the end expression
   */
  record Custom(Expr startExpr, Expr endExpr) implements DayBoundary {
    @Override
    public Value start(Evaluation evaluation) {
      return evaluation.evaluate(startExpr);
    }

    @Override
    public Value end(Evaluation evaluation) {
      return evaluation.evaluate(endExpr);
    }
  }

  /**
   * Evaluates the start of the day.
   *
   * @param evaluation the running evaluation
   * @return the start value
   */
  Value start(Evaluation evaluation);

  /**
   * Evaluates the end of the day.
   *
   * @param evaluation the running evaluation
   * @return the end value
   */
  Value end(Evaluation evaluation);

  /**
   * Builds the boundary for a validated base argument.
   *
   * @param arg an {@link Identifier} naming a base, or a {@link CustomBase}
   * @param bases the base table
   * @return the boundary
   * @throws IllegalArgumentException if the argument was not validated as a base
   */
  static DayBoundary of(Expr arg, OpinionBases bases) {
    if (arg instanceof CustomBase custom) {
      return new Custom(custom.start(), custom.end());
    }
    if (arg instanceof Identifier id) {
      return bases
          .lookup(id.name())
          .<DayBoundary>map(Named::new)
          .orElseThrow(() -> new IllegalArgumentException("unknown opinion base: " + id.name()));
    }
    throw new IllegalArgumentException("not a base argument: " + arg);
  }

  /**
   * Evaluates both edges and, if both are times with the end after the start, applies {@code
   * fn}. Otherwise returns the first error encountered.
   *
   * @param evaluation the running evaluation
   * @param fn the computation over start and end
   * @return the computed value or an error
   */
  default Value with(Evaluation evaluation, BiFunction<ZonedDateTime, ZonedDateTime, Value> fn) {
    Value start = start(evaluation);
    if (start.isError()) {
      return start;
    }
    Value end = end(evaluation);
    if (end.isError()) {
      return end;
    }
    if (!(start instanceof TimeValue s) || !(end instanceof TimeValue e)) {
      return Value.error(ErrorKind.VALIDATION, "day boundary start and end must be times");
    }
    if (!e.time().isAfter(s.time())) {
      return Value.error(
          ErrorKind.COMPUTATION,
          "day boundary ends at " + e.time() + ", not after its start at " + s.time());
    }
    return fn.apply(s.time(), e.time());
  }
}
