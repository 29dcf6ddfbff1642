package cfd.analyzer.graph;

import java.util.List;

/**
 * Read-only view of a program's interprocedural control flow, as consumed by the distance search.
 *
 * <p>Positions, blocks and functions must have stable identity ({@code equals}/{@code hashCode})
 * for the lifetime of one search.
 *
 * @param <P> position (a single instruction)
 * @param <B> basic block
 * @param <F> function
 */
public interface ProgramGraph<P, B, F> {
  /** Block that contains {@code position}. */
  B blockOf(P position);

  /** First position of {@code block}. */
  P firstPositionOf(B block);

  /**
   * Sequential successor of {@code position}. Defined for every position that does not end its
   * block, and for block tails that fall through to a single successor.
   */
  P nextPosition(P position);

  /** Normal control-flow successors of {@code block}, in a stable order. */
  List<B> successorsOf(B block);

  PositionKind kindOf(P position);

  /** Target of the call at {@code callPosition}; only asked for {@link PositionKind#CALL}. */
  Callee<F, B> calleeOf(P callPosition);

  /** Whether calls to {@code function} are stepped over even though it has a body. */
  boolean isIntrinsic(F function);

  /** Whether {@code position} is the first position of its block. */
  default boolean isBlockEntry(P position) {
    return firstPositionOf(blockOf(position)).equals(position);
  }
}
