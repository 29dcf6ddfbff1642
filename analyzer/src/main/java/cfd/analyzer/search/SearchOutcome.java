package cfd.analyzer.search;

public enum SearchOutcome {
  FOUND,
  FRONTIER_EXHAUSTED,
  DISTANCE_BOUND,
  ITERATION_BOUND,
}
