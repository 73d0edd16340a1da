package io.zmanim.eval;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.zmanim.ZmanimException;
import io.zmanim.ast.Expr;
import io.zmanim.functions.FunctionLibrary;
import io.zmanim.functions.OpinionBases;
import io.zmanim.functions.Validator;
import io.zmanim.parser.Parser;
import java.util.concurrent.Executor;

/**
 * Parses and validates formula text once per distinct text.
 *
 * <p>Entries are keyed by the text itself, so editing a formula produces a new key. The old entry
 * can be dropped with {@link #invalidate(String)}; otherwise it ages out once the cache holds more
 * than its maximum number of texts. Trees are immutable, which makes one cache safe to share
 * between concurrent runs.
 */
public final class FormulaCache {
  /** Entry limit used when none is given. */
  public static final long DEFAULT_MAXIMUM_SIZE = 10_000;

  private final FunctionLibrary library;
  private final OpinionBases bases;
  private final Cache<String, CompiledFormula> compiled;

  /**
   * Creates a cache validating against the given library and base table.
   *
   * @param library the builtin functions
   * @param bases the named opinion bases
   */
  public FormulaCache(FunctionLibrary library, OpinionBases bases) {
    this(library, bases, DEFAULT_MAXIMUM_SIZE);
  }

  /**
   * Creates a cache holding at most {@code maximumSize} compiled texts.
   *
   * @param library the builtin functions
   * @param bases the named opinion bases
   * @param maximumSize the entry limit
   */
  public FormulaCache(FunctionLibrary library, OpinionBases bases, long maximumSize) {
    this(library, bases, maximumSize, null);
  }

  FormulaCache(FunctionLibrary library, OpinionBases bases, long maximumSize, Executor executor) {
    this.library = library;
    this.bases = bases;
    Caffeine<Object, Object> builder = Caffeine.newBuilder().maximumSize(maximumSize);
    if (executor != null) {
      builder.executor(executor);
    }
    this.compiled = builder.build();
  }

  /**
   * Returns the compiled form of a formula, parsing and validating it on first use.
   *
   * @param source the formula text
   * @return the compiled formula
   */
  public CompiledFormula compile(String source) {
    return compiled.get(source, this::doCompile);
  }

  private CompiledFormula doCompile(String source) {
    try {
      Expr expr = Parser.parse(source);
      Validator.validate(expr, library, bases);
      return CompiledFormula.accepted(source, expr);
    } catch (ZmanimException e) {
      return CompiledFormula.rejected(source, e);
    }
  }

  /**
   * Drops the compiled form of a text, typically after the formula holding it was edited.
   *
   * @param source the formula text
   */
  public void invalidate(String source) {
    compiled.invalidate(source);
  }

  /**
   * Returns the number of texts currently held.
   *
   * @return the entry count
   */
  public long size() {
    compiled.cleanUp();
    return compiled.estimatedSize();
  }
}
