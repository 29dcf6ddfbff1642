package cfd.analyzer.program;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fluent builder for {@link Program}. Instructions are appended to the block opened last:
 *
 * <pre>{@code
 * Program p = new ProgramBuilder()
 *   .function("main")
 *   .block("entry").call("helper").op().br("left", "right")
 *   .block("left").ret()
 *   .block("right").op().ret()
 *   .function("helper")
 *   .block("entry").ret()
 *   .external("puts")
 *   .build();
 * }</pre>
 *
 * A call naming no known function is kept as an unresolved (external) call.
 */
public final class ProgramBuilder {

  private final Map<String, FunctionDef> functions = new LinkedHashMap<>();
  private FunctionDef currentFunction;
  private BlockDef currentBlock;

  public ProgramBuilder function(String name) {
    currentFunction = declare(name, false);
    currentBlock = null;
    return this;
  }

  /** Declares a function without a body. */
  public ProgramBuilder external(String name) {
    declare(name, true);
    currentFunction = null;
    currentBlock = null;
    return this;
  }

  /** Marks the current function as intrinsic: calls to it are stepped over. */
  public ProgramBuilder intrinsic() {
    requireFunction().intrinsic = true;
    return this;
  }

  public ProgramBuilder block(String label) {
    FunctionDef fn = requireFunction();
    for (BlockDef b : fn.blocks) {
      if (b.label.equals(label)) throw new IllegalArgumentException(
        "duplicate block " + fn.name + ":" + label
      );
    }
    currentBlock = new BlockDef(label);
    fn.blocks.add(currentBlock);
    return this;
  }

  public ProgramBuilder op() {
    return append(new InstructionDef(Opcode.OP, null, List.of()));
  }

  public ProgramBuilder op(int count) {
    for (int i = 0; i < count; i++) op();
    return this;
  }

  public ProgramBuilder call(String callee) {
    return append(new InstructionDef(Opcode.CALL, callee, List.of()));
  }

  public ProgramBuilder ret() {
    return append(new InstructionDef(Opcode.RET, null, List.of()));
  }

  public ProgramBuilder br(String... targets) {
    return append(
      new InstructionDef(Opcode.BR, null, Arrays.asList(targets))
    );
  }

  /**
   * @throws IllegalArgumentException if a block does not end with exactly one terminator, a
   *     branch names an unknown block, or a defined function has no blocks
   */
  public Program build() {
    Map<String, ProgramFunction> built = new LinkedHashMap<>();
    for (FunctionDef def : functions.values()) {
      built.put(
        def.name,
        new ProgramFunction(def.name, def.external, def.intrinsic)
      );
    }

    List<Instruction> all = new ArrayList<>();
    for (FunctionDef def : functions.values()) {
      ProgramFunction fn = built.get(def.name);
      if (!def.external && def.blocks.isEmpty()) {
        throw new IllegalArgumentException("function " + def.name + " has no blocks");
      }
      for (BlockDef bs : def.blocks) {
        validate(def, bs);
        ProgramBlock block = new ProgramBlock(fn, bs.label);
        for (int i = 0; i < bs.instructions.size(); i++) {
          InstructionDef is = bs.instructions.get(i);
          Instruction inst = new Instruction(
            is.opcode,
            block,
            i,
            is.callee,
            is.targets
          );
          block.add(inst);
          all.add(inst);
        }
        fn.add(block);
      }
    }

    for (Instruction inst : all) {
      ProgramFunction owner = inst.block().function();
      List<ProgramBlock> targets = new ArrayList<>();
      for (String label : inst.targetLabels()) {
        targets.add(
          owner
            .block(label)
            .orElseThrow(() ->
              new IllegalArgumentException(
                "branch " + inst.ref() + " targets unknown block '" + label + "'"
              )
            )
        );
      }
      ProgramFunction callee = inst.opcode() == Opcode.CALL
        ? built.get(inst.calleeName())
        : null;
      inst.resolve(callee, targets);
    }
    return new Program(built);
  }

  // ================= helpers =================

  private FunctionDef declare(String name, boolean external) {
    if (name == null || name.isBlank()) throw new IllegalArgumentException(
      "function name must not be blank"
    );
    if (functions.containsKey(name)) throw new IllegalArgumentException(
      "duplicate function " + name
    );
    FunctionDef def = new FunctionDef(name, external);
    functions.put(name, def);
    return def;
  }

  private FunctionDef requireFunction() {
    if (currentFunction == null) throw new IllegalStateException(
      "no function open; call function(name) first"
    );
    return currentFunction;
  }

  private ProgramBuilder append(InstructionDef inst) {
    if (currentBlock == null) throw new IllegalStateException(
      "no block open; call block(label) first"
    );
    currentBlock.instructions.add(inst);
    return this;
  }

  private static void validate(FunctionDef fn, BlockDef block) {
    String where = fn.name + ":" + block.label;
    if (block.instructions.isEmpty()) {
      throw new IllegalArgumentException("empty block " + where);
    }
    int last = block.instructions.size() - 1;
    for (int i = 0; i < block.instructions.size(); i++) {
      boolean terminator = block.instructions.get(i).opcode.isTerminator();
      if (i < last && terminator) throw new IllegalArgumentException(
        "terminator before the end of block " + where + " at " + i
      );
      if (i == last && !terminator) throw new IllegalArgumentException(
        "block " + where + " does not end with ret or br"
      );
    }
  }

  private static final class FunctionDef {

    final String name;
    final boolean external;
    boolean intrinsic;
    final List<BlockDef> blocks = new ArrayList<>();

    FunctionDef(String name, boolean external) {
      this.name = name;
      this.external = external;
    }
  }

  private static final class BlockDef {

    final String label;
    final List<InstructionDef> instructions = new ArrayList<>();

    BlockDef(String label) {
      this.label = label;
    }
  }

  private record InstructionDef(
    Opcode opcode,
    String callee,
    List<String> targets
  ) {}
}
