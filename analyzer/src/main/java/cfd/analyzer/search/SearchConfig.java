package cfd.analyzer.search;

/**
 * Bounds of one search.
 *
 * @param maxDistance the search gives up once the closest pending state is this far away
 * @param maxIterations maximum number of expanded states
 * @param maxQueueLength states offered to a frontier holding more than this are dropped
 * @param stepCost uniform cost of passing one position
 */
public record SearchConfig(
  int maxDistance,
  int maxIterations,
  int maxQueueLength,
  int stepCost
) {
  public static final int DEFAULT_MAX_DISTANCE = 10_000;
  public static final int DEFAULT_MAX_ITERATIONS = 1_000_000;
  public static final int DEFAULT_MAX_QUEUE_LENGTH = 100_000;
  public static final int DEFAULT_STEP_COST = 1;

  public SearchConfig {
    if (maxDistance <= 0) throw new IllegalArgumentException(
      "maxDistance must be > 0, got " + maxDistance
    );
    if (maxIterations <= 0) throw new IllegalArgumentException(
      "maxIterations must be > 0, got " + maxIterations
    );
    if (maxQueueLength <= 0) throw new IllegalArgumentException(
      "maxQueueLength must be > 0, got " + maxQueueLength
    );
    if (stepCost < 0) throw new IllegalArgumentException(
      "stepCost must be >= 0, got " + stepCost
    );
  }

  public static SearchConfig defaults() {
    return new SearchConfig(
      DEFAULT_MAX_DISTANCE,
      DEFAULT_MAX_ITERATIONS,
      DEFAULT_MAX_QUEUE_LENGTH,
      DEFAULT_STEP_COST
    );
  }

  public SearchConfig withMaxDistance(int value) {
    return new SearchConfig(value, maxIterations, maxQueueLength, stepCost);
  }

  public SearchConfig withMaxIterations(int value) {
    return new SearchConfig(maxDistance, value, maxQueueLength, stepCost);
  }

  public SearchConfig withMaxQueueLength(int value) {
    return new SearchConfig(maxDistance, maxIterations, value, stepCost);
  }

  public SearchConfig withStepCost(int value) {
    return new SearchConfig(maxDistance, maxIterations, maxQueueLength, value);
  }
}
