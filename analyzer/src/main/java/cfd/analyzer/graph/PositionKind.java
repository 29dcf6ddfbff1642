package cfd.analyzer.graph;

/** What a position does to control flow, as seen by the distance search. */
public enum PositionKind {
  /** Transfers control into a callee (or behaves as a plain step if the callee has no body). */
  CALL,
  /** Leaves the current function. */
  RETURN,
  /** Ends a block; control continues at the first position of each successor block. */
  TERMINATOR,
  /** Any other instruction; control continues at the next position of the same block. */
  OTHER,
}
