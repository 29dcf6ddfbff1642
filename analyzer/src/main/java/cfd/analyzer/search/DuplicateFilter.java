package cfd.analyzer.search;

import cfd.analyzer.graph.ProgramGraph;
import java.util.HashSet;
import java.util.Set;

/**
 * Remembers which (block entry, call stack) pairs were already admitted to the frontier. Positions
 * inside a block are never tracked: a block has a single straight path, so its entry decides.
 */
public final class DuplicateFilter<P> {

  private final ProgramGraph<P, ?, ?> graph;
  private final Set<Key<P>> seen = new HashSet<>();

  public DuplicateFilter(ProgramGraph<P, ?, ?> graph) {
    this.graph = graph;
  }

  public boolean wasSeen(SearchState<P> state) {
    if (!graph.isBlockEntry(state.position())) return false;
    return seen.contains(keyOf(state));
  }

  public void markSeen(SearchState<P> state) {
    if (graph.isBlockEntry(state.position())) seen.add(keyOf(state));
  }

  public int size() {
    return seen.size();
  }

  private static <P> Key<P> keyOf(SearchState<P> state) {
    return new Key<>(state.position(), state.stack());
  }

  private record Key<P>(P position, CallStack<P> stack) {}
}
