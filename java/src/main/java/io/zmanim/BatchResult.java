package io.zmanim;

import io.zmanim.calendar.ActiveEventSet;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The results of one batch, one per requested key in request order.
 *
 * @param date the date computed
 * @param activeEvents the events found active on that date
 * @param results the per-key results
 */
public record BatchResult(LocalDate date, ActiveEventSet activeEvents, List<ZmanResult> results) {
  public BatchResult {
    results = List.copyOf(results);
  }

  /**
   * Finds the result for a key.
   *
   * @param key the zman key
   * @return the result, or empty if the key was not requested
   */
  public Optional<ZmanResult> get(String key) {
    return results.stream().filter(r -> r.key().equals(key)).findFirst();
  }

  public List<ZmanResult> evaluated() {
    return results.stream().filter(r -> !r.isExcluded()).collect(Collectors.toList());
  }

  public List<ZmanResult> excluded() {
    return results.stream().filter(ZmanResult::isExcluded).collect(Collectors.toList());
  }
}
