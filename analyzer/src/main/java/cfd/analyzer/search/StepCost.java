package cfd.analyzer.search;

/** Weight charged for passing {@code position} on the way to its successors. */
@FunctionalInterface
public interface StepCost<P> {
  int costOf(P position);

  static <P> StepCost<P> uniform(int cost) {
    if (cost < 0) throw new IllegalArgumentException(
      "step cost must be >= 0, got " + cost
    );
    return position -> cost;
  }
}
