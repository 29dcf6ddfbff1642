package cfd.analyzer.search;

import cfd.analyzer.program.Program;
import cfd.analyzer.program.ProgramBuilder;

/** Small programs shared by the search tests. */
final class TestPrograms {

  private TestPrograms() {}

  /** main: nine plain instructions then ret. */
  static Program straightLine() {
    return new ProgramBuilder()
      .function("main")
      .block("entry")
      .op(9)
      .ret()
      .build();
  }

  /** main calls helper once; helper runs two instructions and returns. */
  static Program callAndReturn() {
    return new ProgramBuilder()
      .function("main")
      .block("entry")
      .op()
      .call("helper")
      .op()
      .ret()
      .function("helper")
      .block("entry")
      .op(2)
      .ret()
      .build();
  }

  /** main calls work from two call sites. */
  static Program twoCallSites() {
    return new ProgramBuilder()
      .function("main")
      .block("entry")
      .call("work")
      .op()
      .call("work")
      .op()
      .ret()
      .function("work")
      .block("entry")
      .op()
      .ret()
      .build();
  }

  /** Diamond with a 1-instruction and a 3-instruction arm meeting in join. */
  static Program unevenBranches() {
    return new ProgramBuilder()
      .function("main")
      .block("entry")
      .op()
      .br("long", "short")
      .block("long")
      .op(3)
      .br("join")
      .block("short")
      .br("join")
      .block("join")
      .op()
      .ret()
      .build();
  }
}
