package io.zmanim.eval;

import io.zmanim.astro.AstronomicalProvider;
import io.zmanim.astro.Location;
import io.zmanim.astro.NoaaAstronomicalProvider;
import io.zmanim.functions.FunctionLibrary;
import io.zmanim.functions.OpinionBases;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Everything one evaluation run needs: the date and place, where formulas come from, and the
 * run's caches.
 *
 * <p>A context belongs to exactly one run. Its memo is write-once per key, so concurrent
 * evaluations of different top-level keys may share it: whichever worker finishes a key first
 * wins, and every later reader sees that value.
 */
public final class ExecutionContext {
  private final LocalDate date;
  private final Location location;
  private final FormulaRegistry registry;
  private final AstronomicalProvider provider;
  private final FunctionLibrary library;
  private final OpinionBases bases;
  private final FormulaCache formulas;

  private final ConcurrentMap<String, Value> memo = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Optional<ZonedDateTime>> astronomy =
      new ConcurrentHashMap<>();

  private ExecutionContext(Builder builder) {
    this.date = Objects.requireNonNull(builder.date, "date");
    this.location = Objects.requireNonNull(builder.location, "location");
    this.registry = builder.registry;
    this.provider = builder.provider;
    this.library = builder.library;
    this.bases = builder.bases;
    this.formulas =
        builder.formulas != null ? builder.formulas : new FormulaCache(library, bases);
  }

  /**
   * Starts a context for a date and location.
   *
   * @param date the civil date in the location's zone
   * @param location the observer
   * @return a builder
   */
  public static Builder builder(LocalDate date, Location location) {
    return new Builder(date, location);
  }

  public LocalDate date() {
    return date;
  }

  public Location location() {
    return location;
  }

  public FormulaRegistry registry() {
    return registry;
  }

  public AstronomicalProvider provider() {
    return provider;
  }

  public FunctionLibrary library() {
    return library;
  }

  public OpinionBases bases() {
    return bases;
  }

  public FormulaCache formulas() {
    return formulas;
  }

  /**
   * Returns the memoized value of a key, if it has been resolved in this run.
   *
   * @param key the zman key or reserved shared key
   * @return the value, or empty
   */
  public Optional<Value> memoized(String key) {
    return Optional.ofNullable(memo.get(key));
  }

  /**
   * Records the value of a key unless another evaluation recorded one first.
   *
   * @param key the key
   * @param value the freshly computed value
   * @return the value now recorded for the key
   */
  Value memoize(String key, Value value) {
    Value existing = memo.putIfAbsent(key, value);
    return existing != null ? existing : value;
  }

  /**
   * Classifies a key relative to one resolution path.
   *
   * @param key the key
   * @param path the keys currently being resolved by the caller
   * @return the key's state
   */
  ResolutionState state(String key, Set<String> path) {
    if (memo.containsKey(key)) {
      return ResolutionState.DONE;
    }
    if (path.contains(key)) {
      return ResolutionState.IN_PROGRESS;
    }
    return ResolutionState.UNVISITED;
  }

  /** Answers an astronomical query once per run. */
  Optional<ZonedDateTime> astronomy(String query, Supplier<Optional<ZonedDateTime>> compute) {
    return astronomy.computeIfAbsent(query, q -> compute.get());
  }

  /**
   * Returns a snapshot of everything memoized so far.
   *
   * @return an immutable copy of the memo
   */
  public Map<String, Value> snapshot() {
    return Map.copyOf(memo);
  }

  /** Builder for {@link ExecutionContext}. */
  public static final class Builder {
    private final LocalDate date;
    private final Location location;
    private FormulaRegistry registry = key -> Optional.empty();
    private AstronomicalProvider provider = new NoaaAstronomicalProvider();
    private FunctionLibrary library = FunctionLibrary.standard();
    private OpinionBases bases;
    private FormulaCache formulas;

    private Builder(LocalDate date, Location location) {
      this.date = date;
      this.location = location;
    }

    public Builder registry(FormulaRegistry registry) {
      this.registry = Objects.requireNonNull(registry, "registry");
      return this;
    }

    public Builder provider(AstronomicalProvider provider) {
      this.provider = Objects.requireNonNull(provider, "provider");
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
     * Shares a parse cache with other runs. It must have been built with the same library and
     * bases as this context.
     *
     * @param formulas the cache
     * @return this builder
     */
    public Builder formulas(FormulaCache formulas) {
      this.formulas = Objects.requireNonNull(formulas, "formulas");
      return this;
    }

    public ExecutionContext build() {
      if (bases == null) {
        bases = OpinionBases.defaults();
      }
      return new ExecutionContext(this);
    }
  }
}
