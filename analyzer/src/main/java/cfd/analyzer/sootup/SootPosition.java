package cfd.analyzer.sootup;

import java.util.Objects;
import sootup.core.jimple.common.stmt.Stmt;
import sootup.core.signatures.MethodSignature;

/**
 * A Jimple statement inside a given method. Statements compare by identity: two equal-looking
 * {@code return} statements in one body are distinct positions.
 */
public final class SootPosition {

  private final MethodSignature method;
  private final Stmt stmt;

  public SootPosition(MethodSignature method, Stmt stmt) {
    this.method = Objects.requireNonNull(method, "method");
    this.stmt = Objects.requireNonNull(stmt, "stmt");
  }

  public MethodSignature method() {
    return method;
  }

  public Stmt stmt() {
    return stmt;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof SootPosition)) return false;
    SootPosition other = (SootPosition) o;
    return stmt == other.stmt && method.equals(other.method);
  }

  @Override
  public int hashCode() {
    return 31 * method.hashCode() + System.identityHashCode(stmt);
  }

  @Override
  public String toString() {
    return method + " @ " + stmt;
  }
}
