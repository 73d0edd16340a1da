package io.zmanim.eval;

import io.zmanim.ErrorKind;
import io.zmanim.ZmanimException;
import io.zmanim.ast.BinaryOp;
import io.zmanim.ast.ClockTime;
import io.zmanim.ast.DurationLiteral;
import io.zmanim.ast.Expr;
import io.zmanim.ast.FunctionCall;
import io.zmanim.ast.Primitive;
import io.zmanim.ast.PrimitiveRef;
import io.zmanim.ast.Reference;
import io.zmanim.astro.SolarSide;
import io.zmanim.display.Display;
import io.zmanim.functions.Evaluation;
import io.zmanim.functions.OpinionBases;
import io.zmanim.functions.Validator;
import io.zmanim.functions.ZmanFunction;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates formulas against an {@link ExecutionContext}.
 *
 * <p>Each top-level call owns its resolution path. A key met again while still on that path is a
 * circular reference and yields a {@link ErrorKind#CYCLE} error naming the loop, such as {@code a
 * -> b -> a}. Every resolved key is memoized in the context, including failures, so each formula
 * is evaluated at most once per run.
 */
public final class Evaluator {
  private static final Logger log = LoggerFactory.getLogger(Evaluator.class);

  private Evaluator() {}

  /**
   * Evaluates the formula registered under {@code key}.
   *
   * @param key the zman key
   * @param ctx the run
   * @return the value, or an error value
   */
  public static Value evaluate(String key, ExecutionContext ctx) {
    return new Resolution(ctx).resolve(key);
  }

  /**
   * Evaluates an already-parsed expression that is not in the registry, for example a formula
   * being previewed. The expression is validated first. References it makes are memoized in
   * {@code ctx} as usual.
   *
   * @param expr the expression
   * @param ctx the run
   * @return the value, or an error value
   */
  public static Value evaluateExpression(Expr expr, ExecutionContext ctx) {
    try {
      Validator.validate(expr, ctx.library(), ctx.bases());
    } catch (ZmanimException e) {
      return ErrorValue.of(e);
    }
    return new Resolution(ctx).evaluate(expr);
  }

  /**
   * Parses, validates and evaluates formula text that is not in the registry.
   *
   * @param source the formula text
   * @param ctx the run
   * @return the value, or an error value
   */
  public static Value evaluateFormula(String source, ExecutionContext ctx) {
    CompiledFormula compiled = ctx.formulas().compile(source);
    if (compiled.error() != null) {
      return ErrorValue.of(compiled.error());
    }
    return new Resolution(ctx).evaluate(compiled.expr());
  }

  /** One top-level evaluation: the context plus this evaluation's own resolution path. */
  private static final class Resolution implements Evaluation {
    private final ExecutionContext ctx;
    private final Set<String> path = new LinkedHashSet<>();

    Resolution(ExecutionContext ctx) {
      this.ctx = ctx;
    }

    Value resolve(String key) {
      return within(key, () -> compute(key));
    }

    private Value compute(String key) {
      Optional<String> source = ctx.registry().lookup(key);
      if (source.isEmpty()) {
        log.debug("unknown zman '{}'", key);
        return Value.error(ErrorKind.REFERENCE, "unknown zman '@" + key + "'");
      }
      CompiledFormula compiled = ctx.formulas().compile(source.get());
      if (compiled.error() != null) {
        log.debug("formula for '{}' rejected: {}", key, compiled.error().getMessage());
        return ErrorValue.of(compiled.error());
      }
      return evaluate(compiled.expr());
    }

    @Override
    public Value evaluateShared(String key, Expr expr) {
      return within(key, () -> evaluate(expr));
    }

    private Value within(String key, Supplier<Value> body) {
      ResolutionState state = ctx.state(key, path);
      if (state == ResolutionState.DONE) {
        return ctx.memoized(key).orElseThrow();
      }
      if (state == ResolutionState.IN_PROGRESS) {
        String cycle = describeCycle(key);
        log.debug("circular reference: {}", cycle);
        return Value.error(ErrorKind.CYCLE, "circular reference: " + cycle);
      }

      log.debug("resolving '{}'", key);
      path.add(key);
      Value value;
      try {
        value = body.get();
      } finally {
        path.remove(key);
      }
      return ctx.memoize(key, value);
    }

    private String describeCycle(String key) {
      List<String> loop = new ArrayList<>();
      boolean inLoop = false;
      for (String k : path) {
        if (k.equals(key)) {
          inLoop = true;
        }
        if (inLoop) {
          loop.add(k);
        }
      }
      loop.add(key);
      return String.join(" -> ", loop);
    }

    @Override
    public Value evaluate(Expr expr) {
      if (expr instanceof DurationLiteral d) {
        return Value.duration(d.toDuration());
      }
      if (expr instanceof ClockTime t) {
        return Value.time(ZonedDateTime.of(ctx.date(), t.toLocalTime(), ctx.location().zone()));
      }
      if (expr instanceof PrimitiveRef p) {
        return primitive(p.primitive());
      }
      if (expr instanceof Reference r) {
        return resolve(r.key());
      }
      if (expr instanceof FunctionCall call) {
        Optional<ZmanFunction> fn = ctx.library().lookup(call.name());
        if (fn.isEmpty()) {
          return ErrorValue.of(ZmanimException.unknownFunction(call.name(), call.span()));
        }
        try {
          return fn.get().apply(call, this);
        } catch (ArithmeticException e) {
          log.debug("{}() failed: {}", call.name(), e.getMessage());
          return Value.error(ErrorKind.COMPUTATION, call.name() + "(): " + e.getMessage());
        }
      }
      if (expr instanceof BinaryOp op) {
        return arithmetic(op);
      }
      return Value.error(
          ErrorKind.VALIDATION, "'" + Display.render(expr) + "' cannot be evaluated on its own");
    }

    private Value arithmetic(BinaryOp op) {
      Value left = evaluate(op.left());
      if (left.isError()) {
        return left;
      }
      Value right = evaluate(op.right());
      if (right.isError()) {
        return right;
      }

      if (op.op() == BinaryOp.Operator.PLUS) {
        if (left instanceof TimeValue t && right instanceof DurationValue d) {
          return Value.time(t.time().plus(d.duration()));
        }
        if (left instanceof DurationValue d && right instanceof TimeValue t) {
          return Value.time(t.time().plus(d.duration()));
        }
        if (left instanceof DurationValue a && right instanceof DurationValue b) {
          return Value.duration(a.duration().plus(b.duration()));
        }
        return Value.error(ErrorKind.VALIDATION, "cannot add two times");
      }

      if (left instanceof TimeValue t && right instanceof DurationValue d) {
        return Value.time(t.time().minus(d.duration()));
      }
      if (left instanceof TimeValue a && right instanceof TimeValue b) {
        return Value.duration(Duration.between(b.time(), a.time()));
      }
      if (left instanceof DurationValue a && right instanceof DurationValue b) {
        return Value.duration(a.duration().minus(b.duration()));
      }
      return Value.error(ErrorKind.VALIDATION, "cannot subtract a time from a duration");
    }

    @Override
    public LocalDate date() {
      return ctx.date();
    }

    @Override
    public Value primitive(Primitive primitive) {
      return primitiveOn(ctx.date(), primitive);
    }

    @Override
    public Value primitiveOn(LocalDate date, Primitive primitive) {
      return switch (primitive) {
        case SUNRISE, VISIBLE_SUNRISE -> event(
            date, "sunrise", () -> ctx.provider().sunrise(date, ctx.location()), "sunrise");
        case SUNSET, VISIBLE_SUNSET -> event(
            date, "sunset", () -> ctx.provider().sunset(date, ctx.location()), "sunset");
        case GEOMETRIC_SUNRISE -> solarCrossingOn(date, 0, SolarSide.MORNING);
        case GEOMETRIC_SUNSET -> solarCrossingOn(date, 0, SolarSide.EVENING);
        case SOLAR_NOON -> solarNoon(date);
        case SOLAR_MIDNIGHT -> {
          Value noon = solarNoon(date);
          yield noon instanceof TimeValue t ? Value.time(t.time().plusHours(12)) : noon;
        }
        case CIVIL_DAWN -> solarCrossingOn(date, 6, SolarSide.MORNING);
        case CIVIL_DUSK -> solarCrossingOn(date, 6, SolarSide.EVENING);
        case NAUTICAL_DAWN -> solarCrossingOn(date, 12, SolarSide.MORNING);
        case NAUTICAL_DUSK -> solarCrossingOn(date, 12, SolarSide.EVENING);
        case ASTRONOMICAL_DAWN -> solarCrossingOn(date, 18, SolarSide.MORNING);
        case ASTRONOMICAL_DUSK -> solarCrossingOn(date, 18, SolarSide.EVENING);
        case MOLAD -> event(
            date, "molad", () -> ctx.provider().molad(date, ctx.location()), "molad");
      };
    }

    private Value solarNoon(LocalDate date) {
      return event(
          date,
          "solar_noon",
          () -> ctx.provider().solarNoon(date, ctx.location()),
          "solar noon");
    }

    @Override
    public Value solarCrossing(double degrees, SolarSide side) {
      return solarCrossingOn(ctx.date(), degrees, side);
    }

    @Override
    public Value solarCrossingOn(LocalDate date, double degrees, SolarSide side) {
      String what =
          "the sun "
              + Display.number(degrees)
              + " degrees below the horizon ("
              + side.name().toLowerCase(Locale.ROOT)
              + ")";
      return event(
          date,
          "solar:" + degrees + ":" + side,
          () -> ctx.provider().solarAngleCrossing(date, ctx.location(), degrees, side),
          what);
    }

    private Value event(
        LocalDate date, String query, Supplier<Optional<ZonedDateTime>> compute, String what) {
      Optional<ZonedDateTime> time = ctx.astronomy(date + ":" + query, compute);
      if (time.isEmpty()) {
        log.warn("{} does not occur on {} at {}", what, date, ctx.location());
        return Value.error(
            ErrorKind.COMPUTATION, what + " does not occur on " + date + " at this location");
      }
      return Value.time(time.get());
    }

    @Override
    public OpinionBases bases() {
      return ctx.bases();
    }
  }
}
