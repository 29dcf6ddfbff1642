package cfd.analyzer.search;

/** Sees every state the searcher takes off the frontier, in expansion order. */
@FunctionalInterface
public interface ExpansionListener<P> {
  void onExpand(SearchState<P> state);
}
