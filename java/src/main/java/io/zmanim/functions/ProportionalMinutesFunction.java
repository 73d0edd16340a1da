package io.zmanim.functions;

import io.zmanim.ast.FunctionCall;
import io.zmanim.astro.SolarSide;
import io.zmanim.eval.DurationValue;
import io.zmanim.eval.TimeValue;
import io.zmanim.eval.Value;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * {@code proportional_minutes(m, direction)}: {@code m} minutes scaled to the length of the day.
 *
 * <p>The offset is {@code (sunset - sunrise) * m / 720}, so on a twelve hour day it equals {@code
 * m} plain minutes. The day is always measured between visible sunrise and sunset. The offset is
 * subtracted from the morning anchor or added to the evening one; geometric directions anchor on
 * the geometric horizon crossing instead of the visible event.
 */
final class ProportionalMinutesFunction implements ZmanFunction {
  private static final List<Parameter> PARAMETERS =
      List.of(
          new Parameter("minutes", ArgKind.NUMBER), new Parameter("direction", ArgKind.DIRECTION));

  private static final Set<Direction> DIRECTIONS =
      EnumSet.of(
          Direction.BEFORE_SUNRISE,
          Direction.AFTER_SUNSET,
          Direction.BEFORE_VISIBLE_SUNRISE,
          Direction.AFTER_VISIBLE_SUNSET,
          Direction.BEFORE_GEOMETRIC_SUNRISE,
          Direction.AFTER_GEOMETRIC_SUNSET);

  @Override
  public String name() {
    return "proportional_minutes";
  }

  @Override
  public List<Parameter> parameters() {
    return PARAMETERS;
  }

  @Override
  public boolean accepts(Direction direction) {
    return DIRECTIONS.contains(direction);
  }

  @Override
  public Value apply(FunctionCall call, Evaluation evaluation) {
    double minutes = Builtins.number(call.arg(0));
    Direction direction = Builtins.direction(call.arg(1));

    Value dayLength = Builtins.dayLength(evaluation, evaluation.date());
    if (dayLength.isError()) {
      return dayLength;
    }
    Duration offset = Builtins.scale(((DurationValue) dayLength).duration(), minutes / 720);

    Value anchor = Builtins.anchor(evaluation, direction, evaluation.date());
    if (anchor.isError()) {
      return anchor;
    }
    ZonedDateTime time = ((TimeValue) anchor).time();
    return direction.side() == SolarSide.MORNING
        ? Value.time(time.minus(offset))
        : Value.time(time.plus(offset));
  }
}
