package cfd.analyzer.search;

import cfd.analyzer.graph.ProgramGraph;
import java.util.Objects;

/**
 * A pending return: the call at {@code call} was taken, and a return out of the callee resumes
 * right after it. Two entries are the same call site iff they wrap the same position.
 */
public record StackEntry<P>(P call) {
  public StackEntry {
    Objects.requireNonNull(call, "call");
  }

  /** Position execution resumes at once the callee returns. */
  public P resumePosition(ProgramGraph<P, ?, ?> graph) {
    return graph.nextPosition(call);
  }
}
