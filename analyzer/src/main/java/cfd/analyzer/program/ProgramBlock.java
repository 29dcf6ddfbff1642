package cfd.analyzer.program;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Labelled straight-line sequence of instructions ending in a terminator. */
public final class ProgramBlock {

  private final ProgramFunction function;
  private final String label;
  private final List<Instruction> instructions = new ArrayList<>();

  ProgramBlock(ProgramFunction function, String label) {
    this.function = function;
    this.label = label;
  }

  public ProgramFunction function() {
    return function;
  }

  public String label() {
    return label;
  }

  public List<Instruction> instructions() {
    return Collections.unmodifiableList(instructions);
  }

  public Instruction first() {
    return instructions.get(0);
  }

  public Instruction terminator() {
    return instructions.get(instructions.size() - 1);
  }

  void add(Instruction instruction) {
    instructions.add(instruction);
  }

  @Override
  public String toString() {
    return function.name() + ":" + label;
  }
}
