package cfd.analyzer.graph;

import java.util.Objects;

/**
 * Resolved target of a call position: either a function with a body (and its entry block) or an
 * external / unresolved target that the search steps over.
 */
public final class Callee<F, B> {

  private static final Callee<?, ?> EXTERNAL = new Callee<>(null, null);

  private final F function;
  private final B entryBlock;

  private Callee(F function, B entryBlock) {
    this.function = function;
    this.entryBlock = entryBlock;
  }

  public static <F, B> Callee<F, B> defined(F function, B entryBlock) {
    return new Callee<>(
      Objects.requireNonNull(function, "function"),
      Objects.requireNonNull(entryBlock, "entryBlock")
    );
  }

  @SuppressWarnings("unchecked")
  public static <F, B> Callee<F, B> external() {
    return (Callee<F, B>) EXTERNAL;
  }

  public boolean isDefined() {
    return function != null;
  }

  public F function() {
    if (function == null) throw new IllegalStateException(
      "external callee has no function"
    );
    return function;
  }

  public B entryBlock() {
    if (entryBlock == null) throw new IllegalStateException(
      "external callee has no entry block"
    );
    return entryBlock;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Callee)) return false;
    Callee<?, ?> other = (Callee<?, ?>) o;
    return (
      Objects.equals(function, other.function) &&
      Objects.equals(entryBlock, other.entryBlock)
    );
  }

  @Override
  public int hashCode() {
    return Objects.hash(function, entryBlock);
  }

  @Override
  public String toString() {
    return isDefined() ? "defined(" + function + ")" : "external";
  }
}
