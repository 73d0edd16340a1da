package io.zmanim.functions;

import io.zmanim.ErrorKind;
import io.zmanim.ast.FunctionCall;
import io.zmanim.eval.TimeValue;
import io.zmanim.eval.Value;
import java.time.Duration;
import java.util.List;

/** {@code midpoint(a, b)}: the instant halfway between two times. */
final class MidpointFunction implements ZmanFunction {
  private static final List<Parameter> PARAMETERS =
      List.of(new Parameter("time", ArgKind.TIME), new Parameter("time", ArgKind.TIME));

  @Override
  public String name() {
    return "midpoint";
  }

  @Override
  public List<Parameter> parameters() {
    return PARAMETERS;
  }

  @Override
  public Value apply(FunctionCall call, Evaluation evaluation) {
    Value a = evaluation.evaluate(call.arg(0));
    if (a.isError()) {
      return a;
    }
    Value b = evaluation.evaluate(call.arg(1));
    if (b.isError()) {
      return b;
    }
    if (!(a instanceof TimeValue first) || !(b instanceof TimeValue second)) {
      return Value.error(ErrorKind.VALIDATION, "midpoint() expects two times");
    }
    Duration half = Duration.between(first.time(), second.time()).dividedBy(2);
    return Value.time(first.time().plus(half));
  }
}
