package io.zmanim.functions;

import io.zmanim.ast.FunctionCall;
import io.zmanim.eval.Value;
import java.time.Duration;
import java.util.List;

/** {@code shaah_zmanis(base)}: the length of one proportional hour of the given day. */
final class ShaahZmanisFunction implements ZmanFunction {
  private static final List<Parameter> PARAMETERS = List.of(new Parameter("base", ArgKind.BASE));

  @Override
  public String name() {
    return "shaah_zmanis";
  }

  @Override
  public List<Parameter> parameters() {
    return PARAMETERS;
  }

  @Override
  public Value apply(FunctionCall call, Evaluation evaluation) {
    DayBoundary boundary = DayBoundary.of(call.arg(0), evaluation.bases());
    return boundary.with(
        evaluation, (start, end) -> Value.duration(Duration.between(start, end).dividedBy(12)));
  }
}
