package cfd.analyzer.program;

import cfd.analyzer.graph.Callee;
import cfd.analyzer.graph.MalformedGraphException;
import cfd.analyzer.graph.PositionKind;
import cfd.analyzer.graph.ProgramGraph;
import java.util.List;

/** {@link ProgramGraph} over the in-memory {@link Program} model. */
public final class ProgramGraphAdapter
  implements ProgramGraph<Instruction, ProgramBlock, ProgramFunction> {

  @Override
  public ProgramBlock blockOf(Instruction position) {
    ProgramBlock block = position.block();
    List<Instruction> instructions = block.instructions();
    int i = position.index();
    if (i < 0 || i >= instructions.size() || instructions.get(i) != position) {
      throw new MalformedGraphException(
        "instruction " + position.ref() + " is not part of its own block"
      );
    }
    return block;
  }

  @Override
  public Instruction firstPositionOf(ProgramBlock block) {
    if (block.instructions().isEmpty()) {
      throw new MalformedGraphException("empty block " + block);
    }
    return block.first();
  }

  @Override
  public Instruction nextPosition(Instruction position) {
    List<Instruction> instructions = blockOf(position).instructions();
    int next = position.index() + 1;
    if (next >= instructions.size()) {
      throw new MalformedGraphException(
        "no instruction after " + position.ref() + " in its block"
      );
    }
    return instructions.get(next);
  }

  @Override
  public List<ProgramBlock> successorsOf(ProgramBlock block) {
    return block.terminator().targets();
  }

  @Override
  public PositionKind kindOf(Instruction position) {
    switch (position.opcode()) {
      case CALL:
        return PositionKind.CALL;
      case RET:
        return PositionKind.RETURN;
      case BR:
        return PositionKind.TERMINATOR;
      case OP:
        return PositionKind.OTHER;
      default:
        return null;
    }
  }

  @Override
  public Callee<ProgramFunction, ProgramBlock> calleeOf(Instruction callPosition) {
    ProgramFunction fn = callPosition.callee();
    if (fn == null || fn.isExternal() || fn.blocks().isEmpty()) {
      return Callee.external();
    }
    return Callee.defined(fn, fn.entryBlock());
  }

  @Override
  public boolean isIntrinsic(ProgramFunction function) {
    return function.isIntrinsic();
  }
}
