package io.zmanim.functions;

import io.zmanim.ErrorKind;
import io.zmanim.ast.Expr;
import io.zmanim.ast.Identifier;
import io.zmanim.ast.NumberLiteral;
import io.zmanim.ast.Primitive;
import io.zmanim.astro.SolarSide;
import io.zmanim.eval.TimeValue;
import io.zmanim.eval.Value;
import java.time.Duration;
import java.time.LocalDate;

/** Argument access and arithmetic shared by the builtin functions. */
final class Builtins {
  private static final double MAX_NANOS = 0x1p63;

  private Builtins() {}

  /**
   * Multiplies a duration by a real factor, rounded to the nanosecond.
   *
   * @throws ArithmeticException if the product does not fit in nanoseconds
   */
  static Duration scale(Duration duration, double factor) {
    double nanos = duration.toNanos() * factor;
    if (!(Math.abs(nanos) < MAX_NANOS)) {
      throw new ArithmeticException("duration overflow");
    }
    return Duration.ofNanos(Math.round(nanos));
  }

  /** Reads a validated NUMBER argument. */
  static double number(Expr arg) {
    return ((NumberLiteral) arg).value();
  }

  /** Reads a validated DIRECTION argument. */
  static Direction direction(Expr arg) {
    String word = ((Identifier) arg).name();
    return Direction.fromKeyword(word)
        .orElseThrow(() -> new IllegalArgumentException("not a direction: " + word));
  }

  /** Visible sunset minus visible sunrise on {@code date}, or an error. */
  static Value dayLength(Evaluation evaluation, LocalDate date) {
    Value rise = evaluation.primitiveOn(date, Primitive.SUNRISE);
    if (rise.isError()) {
      return rise;
    }
    Value set = evaluation.primitiveOn(date, Primitive.SUNSET);
    if (set.isError()) {
      return set;
    }
    Duration length = Duration.between(((TimeValue) rise).time(), ((TimeValue) set).time());
    if (length.isNegative() || length.isZero()) {
      return Value.error(ErrorKind.COMPUTATION, "sunset is not after sunrise");
    }
    return Value.duration(length);
  }

  /** The sunrise or sunset a direction's offset is measured from. */
  static Value anchor(Evaluation evaluation, Direction direction, LocalDate date) {
    boolean morning = direction.side() == SolarSide.MORNING;
    return switch (direction.anchor()) {
      case VISIBLE -> evaluation.primitiveOn(date, morning ? Primitive.SUNRISE : Primitive.SUNSET);
      case GEOMETRIC -> evaluation.primitiveOn(
          date, morning ? Primitive.GEOMETRIC_SUNRISE : Primitive.GEOMETRIC_SUNSET);
      case NOON -> evaluation.primitiveOn(date, Primitive.SOLAR_NOON);
    };
  }
}
