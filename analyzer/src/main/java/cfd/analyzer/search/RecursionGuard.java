package cfd.analyzer.search;

import cfd.analyzer.graph.Callee;
import cfd.analyzer.graph.ProgramGraph;
import java.util.Objects;

/**
 * Rejects a call whose callee is already active anywhere on the stack. Direct and mutual recursion
 * both stop at their second activation, which keeps the call dimension of the search finite.
 */
public final class RecursionGuard<P, F> {

  private final ProgramGraph<P, ?, F> graph;

  public RecursionGuard(ProgramGraph<P, ?, F> graph) {
    this.graph = graph;
  }

  public boolean wouldIntroduceRecursion(
    CallStack<P> stack,
    StackEntry<P> candidate
  ) {
    if (stack.isEmpty()) return false;

    F nextCalled = calledFunction(candidate);
    if (nextCalled == null) return false;
    for (StackEntry<P> probe : stack) {
      if (Objects.equals(nextCalled, calledFunction(probe))) return true;
    }
    return false;
  }

  private F calledFunction(StackEntry<P> entry) {
    Callee<F, ?> callee = graph.calleeOf(entry.call());
    return callee.isDefined() ? callee.function() : null;
  }
}
