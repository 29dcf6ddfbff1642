package cfd.analyzer.program;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class ProgramBuilderTest {

  @Test
  void buildsFunctionsBlocksAndResolvedCalls() {
    Program p = new ProgramBuilder()
      .function("main")
      .block("entry")
      .call("helper")
      .op(2)
      .br("exit")
      .block("exit")
      .ret()
      .function("helper")
      .block("entry")
      .ret()
      .external("puts")
      .build();

    assertEquals(3, p.functions().size());
    Instruction call = p.position("main:entry:0");
    assertEquals(Opcode.CALL, call.opcode());
    assertSame(p.function("helper").orElseThrow(), call.callee());
    Instruction br = p.position("main:entry:3");
    assertEquals(List.of(p.function("main").orElseThrow().block("exit").orElseThrow()), br.targets());
    assertTrue(p.function("puts").orElseThrow().isExternal());
    assertEquals("main:entry:3", br.ref());
  }

  @Test
  void unknownCalleeStaysUnresolved() {
    Program p = new ProgramBuilder()
      .function("main")
      .block("entry")
      .call("missing")
      .ret()
      .build();

    Instruction call = p.position("main:entry:0");
    assertNull(call.callee());
    assertEquals("missing", call.calleeName());
  }

  @Test
  void blockMustEndWithTerminator() {
    ProgramBuilder b = new ProgramBuilder().function("main").block("entry").op();

    assertThrows(IllegalArgumentException.class, b::build);
  }

  @Test
  void terminatorMustBeLast() {
    ProgramBuilder b = new ProgramBuilder()
      .function("main")
      .block("entry")
      .ret()
      .op()
      .ret();

    assertThrows(IllegalArgumentException.class, b::build);
  }

  @Test
  void branchToUnknownBlockIsRejected() {
    ProgramBuilder b = new ProgramBuilder().function("main").block("entry").br("nowhere");

    assertThrows(IllegalArgumentException.class, b::build);
  }

  @Test
  void duplicateNamesAreRejected() {
    assertThrows(
      IllegalArgumentException.class,
      () -> new ProgramBuilder().function("f").block("a").ret().function("f")
    );
    assertThrows(
      IllegalArgumentException.class,
      () -> new ProgramBuilder().function("f").block("a").ret().block("a")
    );
  }

  @Test
  void definedFunctionNeedsABlock() {
    ProgramBuilder b = new ProgramBuilder().function("empty");

    assertThrows(IllegalArgumentException.class, b::build);
  }

  @Test
  void instructionsNeedAnOpenBlock() {
    assertThrows(IllegalStateException.class, () -> new ProgramBuilder().op());
    assertThrows(IllegalStateException.class, () -> new ProgramBuilder().block("entry"));
  }

  @Test
  void positionRejectsBadReferences() {
    Program p = new ProgramBuilder().function("main").block("entry").ret().build();

    assertThrows(IllegalArgumentException.class, () -> p.position("main:entry"));
    assertThrows(IllegalArgumentException.class, () -> p.position("other:entry:0"));
    assertThrows(IllegalArgumentException.class, () -> p.position("main:exit:0"));
    assertThrows(IllegalArgumentException.class, () -> p.position("main:entry:x"));
    assertThrows(IllegalArgumentException.class, () -> p.position("main:entry:1"));
  }
}
