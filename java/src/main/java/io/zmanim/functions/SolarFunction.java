package io.zmanim.functions;

import io.zmanim.ZmanimException;
import io.zmanim.ast.FunctionCall;
import io.zmanim.display.Display;
import io.zmanim.eval.Value;
import java.util.List;

/**
 * {@code solar(degrees, direction)}: the moment the sun's center is {@code degrees} below the
 * horizon, on the morning or evening side named by the direction.
 *
 * <p>For example {@code solar(16.1, before_sunrise)} is alos hashachar by the 16.1 degree opinion.
 */
final class SolarFunction implements ZmanFunction {
  private static final List<Parameter> PARAMETERS =
      List.of(new Parameter("degrees", ArgKind.NUMBER), new Parameter("direction", ArgKind.DIRECTION));

  @Override
  public String name() {
    return "solar";
  }

  @Override
  public List<Parameter> parameters() {
    return PARAMETERS;
  }

  @Override
  public void checkArguments(FunctionCall call) throws ZmanimException {
    double degrees = Builtins.number(call.arg(0));
    if (!(degrees > 0 && degrees < 90)) {
      throw ZmanimException.validation(
          "solar() degrees must be greater than 0 and less than 90, got "
              + Display.render(call.arg(0)),
          call.arg(0).span());
    }
  }

  @Override
  public Value apply(FunctionCall call, Evaluation evaluation) {
    double degrees = Builtins.number(call.arg(0));
    Direction direction = Builtins.direction(call.arg(1));
    return evaluation.solarCrossing(degrees, direction.side());
  }
}
