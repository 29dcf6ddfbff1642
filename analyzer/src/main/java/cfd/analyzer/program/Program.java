package cfd.analyzer.program;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** An in-memory program: named functions made of labelled blocks. Built by {@link ProgramBuilder}. */
public final class Program {

  private final Map<String, ProgramFunction> functions;

  Program(Map<String, ProgramFunction> functions) {
    this.functions = Collections.unmodifiableMap(new LinkedHashMap<>(functions));
  }

  public Collection<ProgramFunction> functions() {
    return functions.values();
  }

  public Optional<ProgramFunction> function(String name) {
    return Optional.ofNullable(functions.get(name));
  }

  /**
   * Resolves a {@code function:block:index} reference.
   *
   * @throws IllegalArgumentException if the reference is malformed or names nothing
   */
  public Instruction position(String ref) {
    String[] parts = ref.split(":");
    if (parts.length != 3) throw new IllegalArgumentException(
      "expected function:block:index, got '" + ref + "'"
    );
    ProgramFunction fn = function(parts[0]).orElseThrow(() ->
      new IllegalArgumentException("unknown function in '" + ref + "'")
    );
    ProgramBlock block = fn
      .block(parts[1])
      .orElseThrow(() ->
        new IllegalArgumentException("unknown block in '" + ref + "'")
      );
    int index;
    try {
      index = Integer.parseInt(parts[2].trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("bad index in '" + ref + "'", e);
    }
    if (index < 0 || index >= block.instructions().size()) {
      throw new IllegalArgumentException("index out of block in '" + ref + "'");
    }
    return block.instructions().get(index);
  }

  public ProgramGraphAdapter graph() {
    return new ProgramGraphAdapter();
  }
}
