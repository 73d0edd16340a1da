package io.zmanim;

import io.zmanim.astro.AstronomicalProvider;
import io.zmanim.astro.NoaaAstronomicalProvider;
import io.zmanim.calendar.ActiveEventSet;
import io.zmanim.calendar.CalendarEventSource;
import io.zmanim.calendar.EventClassifier;
import io.zmanim.calendar.EventPatternMapping;
import io.zmanim.calendar.EventPatternTable;
import io.zmanim.calendar.WeeklyEventSource;
import io.zmanim.eval.Evaluator;
import io.zmanim.eval.ExecutionContext;
import io.zmanim.eval.FormulaCache;
import io.zmanim.eval.FormulaRegistry;
import io.zmanim.eval.Value;
import io.zmanim.functions.FunctionLibrary;
import io.zmanim.functions.OpinionBases;
import io.zmanim.selection.TagAssociationStore;
import io.zmanim.selection.ZmanSelector;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes a day's zmanim: classifies the day's calendar events, keeps the zmanim whose tags
 * apply, and evaluates those in one run.
 *
 * <pre>{@code
 * ZmanimCalculator calculator =
 *     ZmanimCalculator.builder(registry).tags(tagStore).build();
 * BatchResult result =
 *     calculator.calculate(BatchRequest.of(date, location, List.of("alos", "candle_lighting")));
 * }</pre>
 *
 * <p>A calculator is immutable and may serve concurrent batches. Parsed formulas are cached
 * across batches; evaluated values never are.
 */
public final class ZmanimCalculator {
  private static final Logger log = LoggerFactory.getLogger(ZmanimCalculator.class);

  private final FormulaRegistry registry;
  private final AstronomicalProvider provider;
  private final CalendarEventSource events;
  private final List<EventPatternMapping> patterns;
  private final TagAssociationStore tags;
  private final FunctionLibrary library;
  private final OpinionBases bases;
  private final ExecutorService executor;
  private final FormulaCache formulas;

  private ZmanimCalculator(Builder builder) {
    this.registry = builder.registry;
    this.provider = builder.provider;
    this.events = builder.events;
    this.patterns = builder.patterns;
    this.tags = builder.tags;
    this.library = builder.library;
    this.bases = builder.bases != null ? builder.bases : OpinionBases.defaults();
    this.executor = builder.executor;
    this.formulas = new FormulaCache(library, bases, builder.cacheSize);
  }

  /**
   * Starts a calculator over a formula registry.
   *
   * @param registry the formulas by key
   * @return a builder
   */
  public static Builder builder(FormulaRegistry registry) {
    return new Builder(registry);
  }

  /**
   * Forgets the parsed form of a formula text. Call it when the formula holding the text is edited
   * or removed.
   *
   * @param source the old formula text
   */
  public void invalidate(String source) {
    formulas.invalidate(source);
  }

  /**
   * Computes one batch. Failing formulas become error results; the batch itself never fails
   * because of a formula.
   *
   * @param request the batch
   * @return one result per requested key, in request order
   */
  public BatchResult calculate(BatchRequest request) {
    List<String> titles = events.eventsOn(request.date());
    ActiveEventSet active = EventClassifier.classify(titles, patterns, request.date());

    ExecutionContext ctx =
        ExecutionContext.builder(request.date(), request.location())
            .registry(registry)
            .provider(provider)
            .library(library)
            .bases(bases)
            .formulas(formulas)
            .build();

    List<String> selected = new ArrayList<>();
    for (String key : request.keys()) {
      if (ZmanSelector.shouldInclude(tags.tagsFor(key), active)) {
        selected.add(key);
      }
    }

    Map<String, Value> values =
        executor != null ? evaluateParallel(selected, ctx) : evaluate(selected, ctx);

    List<ZmanResult> results = new ArrayList<>(request.keys().size());
    int failed = 0;
    for (String key : request.keys()) {
      Value value = values.get(key);
      if (value == null) {
        results.add(ZmanResult.excluded(key, request.rounding()));
      } else {
        if (value.isError()) {
          failed++;
        }
        results.add(ZmanResult.evaluated(key, value, request.rounding()));
      }
    }

    log.info(
        "calculated {} of {} zmanim for {} ({} failed, active events {})",
        selected.size(),
        request.keys().size(),
        request.date(),
        failed,
        active.codes());
    return new BatchResult(request.date(), active, results);
  }

  private static Map<String, Value> evaluate(List<String> keys, ExecutionContext ctx) {
    Map<String, Value> values = new LinkedHashMap<>();
    for (String key : keys) {
      values.put(key, Evaluator.evaluate(key, ctx));
    }
    return values;
  }

  private Map<String, Value> evaluateParallel(List<String> keys, ExecutionContext ctx) {
    Map<String, Future<Value>> futures = new LinkedHashMap<>();
    for (String key : keys) {
      futures.put(key, executor.submit(() -> Evaluator.evaluate(key, ctx)));
    }

    Map<String, Value> values = new LinkedHashMap<>();
    try {
      for (Map.Entry<String, Future<Value>> e : futures.entrySet()) {
        values.put(e.getKey(), e.getValue().get());
      }
    } catch (InterruptedException e) {
      futures.values().forEach(f -> f.cancel(true));
      Thread.currentThread().interrupt();
      throw new IllegalStateException("interrupted while calculating zmanim", e);
    } catch (ExecutionException e) {
      futures.values().forEach(f -> f.cancel(true));
      throw new IllegalStateException("zman evaluation failed unexpectedly", e.getCause());
    }
    return values;
  }

  /** Builder for {@link ZmanimCalculator}. */
  public static final class Builder {
    private final FormulaRegistry registry;
    private AstronomicalProvider provider = new NoaaAstronomicalProvider();
    private CalendarEventSource events = WeeklyEventSource.alone();
    private List<EventPatternMapping> patterns;
    private TagAssociationStore tags = key -> List.of();
    private FunctionLibrary library = FunctionLibrary.standard();
    private OpinionBases bases;
    private ExecutorService executor;
    private long cacheSize = FormulaCache.DEFAULT_MAXIMUM_SIZE;

    private Builder(FormulaRegistry registry) {
      this.registry = Objects.requireNonNull(registry, "registry");
    }

    public Builder provider(AstronomicalProvider provider) {
      this.provider = Objects.requireNonNull(provider, "provider");
      return this;
    }

    public Builder events(CalendarEventSource events) {
      this.events = Objects.requireNonNull(events, "events");
      return this;
    }

    public Builder patterns(List<EventPatternMapping> patterns) {
      this.patterns = List.copyOf(patterns);
      return this;
    }

    public Builder tags(TagAssociationStore tags) {
      this.tags = Objects.requireNonNull(tags, "tags");
      return this;
    }

    public Builder library(FunctionLibrary library) {
      this.library = Objects.requireNonNull(library, "library");
      return this;
    }

    public Builder bases(OpinionBases bases) {
      this.bases = Objects.requireNonNull(bases, "bases");
      return this;
    }

    /**
     * Evaluates the zmanim of a batch concurrently on {@code executor}. The calculator does not
     * shut it down.
     *
     * @param executor the executor
     * @return this builder
     */
    public Builder executor(ExecutorService executor) {
      this.executor = Objects.requireNonNull(executor, "executor");
      return this;
    }

    /**
     * Limits how many distinct formula texts stay parsed between batches.
     *
     * @param cacheSize the entry limit
     * @return this builder
     */
    public Builder cacheSize(long cacheSize) {
      if (cacheSize < 0) {
        throw new IllegalArgumentException("cacheSize must not be negative: " + cacheSize);
      }
      this.cacheSize = cacheSize;
      return this;
    }

    public ZmanimCalculator build() {
      if (patterns == null) {
        patterns = EventPatternTable.defaults();
      }
      return new ZmanimCalculator(this);
    }
  }
}
