package io.zmanim.functions;

import io.zmanim.ZmanimException;
import io.zmanim.ast.FunctionCall;
import io.zmanim.astro.SolarSide;
import io.zmanim.display.Display;
import io.zmanim.eval.DurationValue;
import io.zmanim.eval.TimeValue;
import io.zmanim.eval.Value;
import java.time.Duration;
import java.time.LocalDate;
import java.time.MonthDay;
import java.time.ZonedDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * {@code seasonal_solar(degrees, direction)}: a depression angle fixed at the equinox and carried
 * through the year as a share of the day.
 *
 * <p>On the March equinox of the date's year the sun reaches {@code degrees} some time before
 * sunrise (or after sunset). That interval is scaled by the ratio of today's day length to the
 * equinox day length and applied to today's anchor, so it is shorter in winter and longer in
 * summer than the fixed-angle {@code solar()} time. On the equinox itself both agree.
 */
final class SeasonalSolarFunction implements ZmanFunction {
  private static final MonthDay EQUINOX = MonthDay.of(3, 20);

  private static final List<Parameter> PARAMETERS =
      List.of(new Parameter("degrees", ArgKind.NUMBER), new Parameter("direction", ArgKind.DIRECTION));

  private static final Set<Direction> DIRECTIONS =
      EnumSet.of(
          Direction.BEFORE_VISIBLE_SUNRISE,
          Direction.AFTER_VISIBLE_SUNSET,
          Direction.BEFORE_GEOMETRIC_SUNRISE,
          Direction.AFTER_GEOMETRIC_SUNSET);

  @Override
  public String name() {
    return "seasonal_solar";
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
  public void checkArguments(FunctionCall call) throws ZmanimException {
    double degrees = Builtins.number(call.arg(0));
    if (!(degrees > 0 && degrees < 90)) {
      throw ZmanimException.validation(
          "seasonal_solar() degrees must be greater than 0 and less than 90, got "
              + Display.render(call.arg(0)),
          call.arg(0).span());
    }
  }

  @Override
  public Value apply(FunctionCall call, Evaluation evaluation) {
    double degrees = Builtins.number(call.arg(0));
    Direction direction = Builtins.direction(call.arg(1));
    LocalDate today = evaluation.date();
    LocalDate equinox = EQUINOX.atYear(today.getYear());

    Value equinoxAnchor = Builtins.anchor(evaluation, direction, equinox);
    if (equinoxAnchor.isError()) {
      return equinoxAnchor;
    }
    Value equinoxCrossing = evaluation.solarCrossingOn(equinox, degrees, direction.side());
    if (equinoxCrossing.isError()) {
      return equinoxCrossing;
    }
    Duration equinoxOffset =
        Duration.between(((TimeValue) equinoxCrossing).time(), ((TimeValue) equinoxAnchor).time())
            .abs();

    Value equinoxDay = Builtins.dayLength(evaluation, equinox);
    if (equinoxDay.isError()) {
      return equinoxDay;
    }
    Value day = Builtins.dayLength(evaluation, today);
    if (day.isError()) {
      return day;
    }
    double ratio =
        (double) ((DurationValue) day).duration().toNanos()
            / ((DurationValue) equinoxDay).duration().toNanos();
    Duration offset = Builtins.scale(equinoxOffset, ratio);

    Value anchor = Builtins.anchor(evaluation, direction, today);
    if (anchor.isError()) {
      return anchor;
    }
    ZonedDateTime time = ((TimeValue) anchor).time();
    return direction.side() == SolarSide.MORNING
        ? Value.time(time.minus(offset))
        : Value.time(time.plus(offset));
  }
}
