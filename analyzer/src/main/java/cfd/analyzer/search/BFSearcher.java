package cfd.analyzer.search;

import cfd.analyzer.graph.Callee;
import cfd.analyzer.graph.MalformedGraphException;
import cfd.analyzer.graph.PositionKind;
import cfd.analyzer.graph.ProgramGraph;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Bounded, call-stack-sensitive breadth-first search for the minimal distance between a start
 * position and a target.
 *
 * <p>A state is a position plus the stack of calls still waiting for their return, so a return
 * only flows back to the call that was actually taken. States are expanded in order of distance;
 * the first target state taken off the frontier carries the minimal distance. The search reports
 * {@link SearchResult#UNREACHABLE} when the frontier runs dry, when the closest pending state is
 * at least {@code maxDistance} away, or after {@code maxIterations} expansions.
 *
 * <p>An instance runs a single search; it is not thread-safe.
 */
public final class BFSearcher<P, B, F> {

  private final ProgramGraph<P, B, F> graph;
  private final SearchConfig config;
  private final Predicate<P> target;
  private final StepCost<P> stepCost;
  private final RecursionGuard<P, F> recursionGuard;
  private final DuplicateFilter<P> duplicateFilter;
  private final Frontier<P> frontier;
  private ExpansionListener<P> listener = state -> {};

  private int iterationCounter;
  private SearchResult result;

  public BFSearcher(
    ProgramGraph<P, B, F> graph,
    SearchConfig config,
    P start,
    P target
  ) {
    this(graph, config, start, target, List.of());
  }

  /**
   * @param initialStack calls already on the stack when the search starts, outermost first
   */
  public BFSearcher(
    ProgramGraph<P, B, F> graph,
    SearchConfig config,
    P start,
    P target,
    List<P> initialStack
  ) {
    this(
      graph,
      config,
      start,
      Objects.requireNonNull(target, "target")::equals,
      initialStack,
      StepCost.uniform(config.stepCost())
    );
  }

  public BFSearcher(
    ProgramGraph<P, B, F> graph,
    SearchConfig config,
    P start,
    Predicate<P> target,
    List<P> initialStack,
    StepCost<P> stepCost
  ) {
    this.graph = Objects.requireNonNull(graph, "graph");
    this.config = Objects.requireNonNull(config, "config");
    this.target = Objects.requireNonNull(target, "target");
    this.stepCost = Objects.requireNonNull(stepCost, "stepCost");
    this.recursionGuard = new RecursionGuard<>(graph);
    this.duplicateFilter = new DuplicateFilter<>(graph);
    this.frontier = new Frontier<>(config.maxQueueLength());

    addToSearchQueue(new SearchState<>(start, 0, CallStack.of(initialStack)));
  }

  public BFSearcher<P, B, F> withExpansionListener(
    ExpansionListener<P> listener
  ) {
    this.listener = Objects.requireNonNull(listener, "listener");
    return this;
  }

  /** @return the minimal distance, or {@link SearchResult#UNREACHABLE} */
  public int searchForMinimalDistance() {
    return search().distance();
  }

  public SearchResult search() {
    if (result == null) result = runSearch();
    return result;
  }

  private SearchResult runSearch() {
    while (true) {
      if (frontier.isEmpty()) {
        return unreachable(SearchOutcome.FRONTIER_EXHAUSTED);
      }
      SearchState<P> front = frontier.peek();
      if (front.distance() >= config.maxDistance()) {
        return unreachable(SearchOutcome.DISTANCE_BOUND);
      }
      if (iterationCounter >= config.maxIterations()) {
        return unreachable(SearchOutcome.ITERATION_BOUND);
      }
      if (target.test(front.position())) {
        return new SearchResult(
          front.distance(),
          SearchOutcome.FOUND,
          iterationCounter,
          frontier.peakSize()
        );
      }
      doSingleSearchIteration();
      iterationCounter++;
    }
  }

  private SearchResult unreachable(SearchOutcome outcome) {
    return new SearchResult(
      SearchResult.UNREACHABLE,
      outcome,
      iterationCounter,
      frontier.peakSize()
    );
  }

  private void doSingleSearchIteration() {
    SearchState<P> curr = frontier.poll();
    listener.onExpand(curr);

    P position = curr.position();
    PositionKind kind = graph.kindOf(position);
    if (kind == null) {
      throw new MalformedGraphException("position has no kind: " + position);
    }

    switch (kind) {
      case CALL:
        expandCall(curr);
        break;
      case RETURN:
        // Returning out of the outermost frame has nowhere to go
        if (!curr.stack().isEmpty()) {
          StackEntry<P> goBackTo = curr.stack().top();
          enqueue(
            curr,
            goBackTo.resumePosition(graph),
            curr.stack().pop()
          );
        }
        break;
      case TERMINATOR:
        for (B successor : graph.successorsOf(graph.blockOf(position))) {
          enqueue(curr, graph.firstPositionOf(successor), curr.stack());
        }
        break;
      default:
        enqueue(curr, graph.nextPosition(position), curr.stack());
    }
  }

  private void expandCall(SearchState<P> curr) {
    P position = curr.position();
    Callee<F, B> callee = graph.calleeOf(position);

    if (callee.isDefined() && !graph.isIntrinsic(callee.function())) {
      StackEntry<P> next = new StackEntry<>(position);
      if (!recursionGuard.wouldIntroduceRecursion(curr.stack(), next)) {
        enqueue(
          curr,
          graph.firstPositionOf(callee.entryBlock()),
          curr.stack().push(next)
        );
      }
    } else {
      // No body to enter: the call is a plain instruction
      enqueue(curr, graph.nextPosition(position), curr.stack());
    }
  }

  private void enqueue(SearchState<P> from, P next, CallStack<P> stack) {
    addToSearchQueue(
      new SearchState<>(next, advance(from), stack)
    );
  }

  private int advance(SearchState<P> from) {
    int cost = stepCost.costOf(from.position());
    if (cost < 0) throw new IllegalStateException(
      "negative step cost " + cost + " at " + from.position()
    );
    return (int) Math.min((long) from.distance() + cost, Integer.MAX_VALUE);
  }

  private void addToSearchQueue(SearchState<P> state) {
    if (duplicateFilter.wasSeen(state)) return;
    if (frontier.offer(state)) duplicateFilter.markSeen(state);
  }
}
