package cfd.analyzer.program;

import java.util.List;
import java.util.Locale;

/** One instruction of a {@link ProgramBlock}. Identity is object identity. */
public final class Instruction {

  private final Opcode opcode;
  private final ProgramBlock block;
  private final int index;
  private final String calleeName;
  private final List<String> targetLabels;

  private ProgramFunction callee;
  private List<ProgramBlock> targets = List.of();

  Instruction(
    Opcode opcode,
    ProgramBlock block,
    int index,
    String calleeName,
    List<String> targetLabels
  ) {
    this.opcode = opcode;
    this.block = block;
    this.index = index;
    this.calleeName = calleeName;
    this.targetLabels = List.copyOf(targetLabels);
  }

  public Opcode opcode() {
    return opcode;
  }

  public ProgramBlock block() {
    return block;
  }

  public int index() {
    return index;
  }

  /** Name the call refers to; {@code null} unless this is a {@link Opcode#CALL}. */
  public String calleeName() {
    return calleeName;
  }

  /** Function called, or {@code null} if the name did not resolve to any function. */
  public ProgramFunction callee() {
    return callee;
  }

  /** Successor blocks of a {@link Opcode#BR}. */
  public List<ProgramBlock> targets() {
    return targets;
  }

  List<String> targetLabels() {
    return targetLabels;
  }

  void resolve(ProgramFunction callee, List<ProgramBlock> targets) {
    this.callee = callee;
    this.targets = List.copyOf(targets);
  }

  /** Reference in {@code function:block:index} form. */
  public String ref() {
    return block.function().name() + ":" + block.label() + ":" + index;
  }

  @Override
  public String toString() {
    return ref() + " " + opcode.name().toLowerCase(Locale.ROOT) +
    (calleeName != null ? " " + calleeName : "") +
    (!targetLabels.isEmpty() ? " " + String.join(",", targetLabels) : "");
  }
}
