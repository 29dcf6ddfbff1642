package cfd.analyzer.program;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/** A function: either defined (blocks, the first is the entry) or external (no body). */
public final class ProgramFunction {

  private final String name;
  private final boolean external;
  private final boolean intrinsic;
  private final List<ProgramBlock> blocks = new ArrayList<>();

  ProgramFunction(String name, boolean external, boolean intrinsic) {
    this.name = name;
    this.external = external;
    this.intrinsic = intrinsic;
  }

  public String name() {
    return name;
  }

  public boolean isExternal() {
    return external;
  }

  public boolean isIntrinsic() {
    return intrinsic;
  }

  public List<ProgramBlock> blocks() {
    return Collections.unmodifiableList(blocks);
  }

  public ProgramBlock entryBlock() {
    if (blocks.isEmpty()) throw new IllegalStateException(
      "function " + name + " has no body"
    );
    return blocks.get(0);
  }

  public Optional<ProgramBlock> block(String label) {
    return blocks.stream().filter(b -> b.label().equals(label)).findFirst();
  }

  void add(ProgramBlock block) {
    blocks.add(block);
  }

  @Override
  public String toString() {
    return name;
  }
}
