package io.zmanim.functions;

import io.zmanim.ast.FunctionCall;
import io.zmanim.eval.Value;
import java.time.Duration;
import java.util.List;

/**
 * {@code proportional_hours(n, base)}: {@code n} twelfths of the day defined by {@code base},
 * counted from its start. {@code proportional_hours(3, gra)} is the end of the Shema time by the
 * Gra.
 */
final class ProportionalHoursFunction implements ZmanFunction {
  private static final List<Parameter> PARAMETERS =
      List.of(new Parameter("hours", ArgKind.NUMBER), new Parameter("base", ArgKind.BASE));

  @Override
  public String name() {
    return "proportional_hours";
  }

  @Override
  public List<Parameter> parameters() {
    return PARAMETERS;
  }

  @Override
  public Value apply(FunctionCall call, Evaluation evaluation) {
    double hours = Builtins.number(call.arg(0));
    DayBoundary boundary = DayBoundary.of(call.arg(1), evaluation.bases());
    return boundary.with(
        evaluation,
        (start, end) ->
            Value.time(start.plus(Builtins.scale(Duration.between(start, end), hours / 12))));
  }
}
