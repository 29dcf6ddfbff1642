package cfd.analyzer.search;

import java.util.Objects;

/** A position reached at some distance, with the returns still pending. */
public record SearchState<P>(P position, int distance, CallStack<P> stack) {
  public SearchState {
    Objects.requireNonNull(position, "position");
    Objects.requireNonNull(stack, "stack");
    if (distance < 0) throw new IllegalArgumentException(
      "negative distance: " + distance
    );
  }
}
