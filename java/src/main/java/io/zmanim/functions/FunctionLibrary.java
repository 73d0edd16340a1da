package io.zmanim.functions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** An immutable set of builtin functions, looked up by name. */
public final class FunctionLibrary {
  private static final FunctionLibrary STANDARD =
      new FunctionLibrary(Map.of())
          .with(new SolarFunction())
          .with(new ProportionalHoursFunction())
          .with(new ProportionalMinutesFunction())
          .with(new ShaahZmanisFunction())
          .with(new MidpointFunction())
          .with(new SeasonalSolarFunction());

  private final Map<String, ZmanFunction> functions;

  private FunctionLibrary(Map<String, ZmanFunction> functions) {
    this.functions = Collections.unmodifiableMap(new LinkedHashMap<>(functions));
  }

  /**
   * Returns the library of standard builtins.
   *
   * @return the standard library
   */
  public static FunctionLibrary standard() {
    return STANDARD;
  }

  /**
   * Creates a library holding exactly the given functions.
   *
   * @param functions the functions
   * @return the library
   */
  public static FunctionLibrary of(List<ZmanFunction> functions) {
    FunctionLibrary library = new FunctionLibrary(Map.of());
    for (ZmanFunction fn : functions) {
      library = library.with(fn);
    }
    return library;
  }

  /**
   * Returns a copy of this library with {@code fn} added, replacing any function of the same name.
   *
   * @param fn the function
   * @return the new library
   */
  public FunctionLibrary with(ZmanFunction fn) {
    Map<String, ZmanFunction> copy = new LinkedHashMap<>(functions);
    copy.put(fn.name(), fn);
    return new FunctionLibrary(copy);
  }

  public Optional<ZmanFunction> lookup(String name) {
    return Optional.ofNullable(functions.get(name));
  }

  public Set<String> names() {
    return functions.keySet();
  }
}
