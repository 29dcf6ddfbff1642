package cfd.analyzer.search;

import static org.junit.jupiter.api.Assertions.*;

import cfd.analyzer.program.Instruction;
import cfd.analyzer.program.Program;
import cfd.analyzer.program.ProgramBuilder;
import cfd.analyzer.program.ProgramFunction;
import java.util.Arrays;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RecursionGuardTest {

  private Program program;
  private RecursionGuard<Instruction, ProgramFunction> guard;

  @BeforeEach
  void setUp() {
    program =
      new ProgramBuilder()
        .function("main")
        .block("entry")
        .call("a")
        .call("b")
        .call("puts")
        .ret()
        .function("a")
        .block("entry")
        .call("b")
        .call("a")
        .ret()
        .function("b")
        .block("entry")
        .call("a")
        .call("puts")
        .ret()
        .external("puts")
        .build();
    guard = new RecursionGuard<>(program.graph());
  }

  private StackEntry<Instruction> entry(String ref) {
    return new StackEntry<>(program.position(ref));
  }

  private CallStack<Instruction> stack(String... refs) {
    return CallStack.of(
      Arrays.stream(refs).map(program::position).collect(Collectors.toList())
    );
  }

  @Test
  void emptyStackNeverRecurses() {
    assertFalse(guard.wouldIntroduceRecursion(CallStack.empty(), entry("a:entry:1")));
  }

  @Test
  void directRecursionIsDetected() {
    assertTrue(guard.wouldIntroduceRecursion(stack("main:entry:0"), entry("a:entry:1")));
  }

  @Test
  void mutualRecursionIsDetectedDeeperInTheStack() {
    CallStack<Instruction> s = stack("main:entry:0", "a:entry:0");

    assertTrue(guard.wouldIntroduceRecursion(s, entry("b:entry:0")));
  }

  @Test
  void callToADifferentFunctionIsAllowed() {
    assertFalse(guard.wouldIntroduceRecursion(stack("main:entry:0"), entry("a:entry:0")));
  }

  @Test
  void externalCallsNeverMatchDefinedOnes() {
    assertFalse(
      guard.wouldIntroduceRecursion(stack("main:entry:1"), entry("b:entry:1"))
    );
    assertFalse(
      guard.wouldIntroduceRecursion(stack("main:entry:2"), entry("b:entry:1"))
    );
  }
}
