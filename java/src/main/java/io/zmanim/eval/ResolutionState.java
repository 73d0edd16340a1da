package io.zmanim.eval;

/** Where a formula key stands within one evaluation run. */
public enum ResolutionState {
  /** Not yet evaluated in this run. */
  UNVISITED,
  /** On the current resolution path; meeting it again means a cycle. */
  IN_PROGRESS,
  /** Evaluated and memoized. */
  DONE
}
