package cfd.analyzer.search;

/**
 * @param distance minimal distance to the target, or {@link #UNREACHABLE}
 * @param iterations number of states expanded
 * @param peakFrontierSize largest frontier size observed
 */
public record SearchResult(
  int distance,
  SearchOutcome outcome,
  int iterations,
  int peakFrontierSize
) {
  public static final int UNREACHABLE = -1;

  public boolean isReachable() {
    return outcome == SearchOutcome.FOUND;
  }
}
