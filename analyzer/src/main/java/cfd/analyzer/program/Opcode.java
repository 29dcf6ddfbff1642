package cfd.analyzer.program;

public enum Opcode {
  /** Call of a named function. */
  CALL,
  /** Return from the current function; ends its block. */
  RET,
  /** Jump to zero or more successor blocks; ends its block. */
  BR,
  /** Any other instruction. */
  OP;

  public boolean isTerminator() {
    return this == RET || this == BR;
  }
}
