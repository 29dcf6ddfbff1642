package cfd.analyzer.sootup;

import cfd.analyzer.graph.Callee;
import cfd.analyzer.graph.MalformedGraphException;
import cfd.analyzer.graph.PositionKind;
import cfd.analyzer.graph.ProgramGraph;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sootup.callgraph.CallGraph;
import sootup.core.graph.BasicBlock;
import sootup.core.graph.StmtGraph;
import sootup.core.jimple.common.expr.AbstractInvokeExpr;
import sootup.core.jimple.common.stmt.InvokableStmt;
import sootup.core.jimple.common.stmt.JReturnStmt;
import sootup.core.jimple.common.stmt.JReturnVoidStmt;
import sootup.core.jimple.common.stmt.Stmt;
import sootup.core.signatures.MethodSignature;
import sootup.java.core.JavaSootMethod;
import sootup.java.core.views.JavaView;

/**
 * {@link ProgramGraph} over SootUp Jimple bodies. Blocks are the basic blocks of each method's
 * {@link StmtGraph}; only normal (non-exceptional) successors are followed.
 *
 * <p>Call targets come from the call graph when one is given: a single target is entered,
 * several targets (dynamic dispatch) are treated like an indirect call and stepped over. Without
 * call-graph information the invoke's declared signature is used. Methods missing from the view or
 * without a body are external.
 */
public final class SootUpProgramGraph
  implements ProgramGraph<SootPosition, BasicBlock<?>, MethodSignature> {

  private static final Logger log = LoggerFactory.getLogger(
    SootUpProgramGraph.class
  );

  private final JavaView view;
  private final CallGraph callGraph;
  private final LibraryFilter libraries;
  private final boolean pruneLibs;

  private final Map<MethodSignature, MethodBlocks> methods = new HashMap<>();
  private final Map<BasicBlock<?>, MethodSignature> blockOwners =
    new IdentityHashMap<>();
  private final Map<SootPosition, Callee<MethodSignature, BasicBlock<?>>> callees =
    new HashMap<>();

  /**
   * @param callGraph used for call-target resolution; may be {@code null}
   * @param pruneLibs whether calls into library classes are stepped over
   */
  public SootUpProgramGraph(
    JavaView view,
    CallGraph callGraph,
    LibraryFilter libraries,
    boolean pruneLibs
  ) {
    this.view = view;
    this.callGraph = callGraph;
    this.libraries = libraries;
    this.pruneLibs = pruneLibs;
  }

  /**
   * Statement number {@code index} of {@code method}, counting in {@link
   * sootup.core.model.Body#getStmts()} order.
   *
   * @throws IllegalArgumentException if the method has no body or the index is out of range
   */
  public SootPosition position(MethodSignature method, int index) {
    MethodBlocks mb = indexed(method).orElseThrow(() ->
      new IllegalArgumentException("no body for " + method)
    );
    if (index < 0 || index >= mb.stmts.size()) {
      throw new IllegalArgumentException(
        "statement index " + index + " out of range for " + method +
        " (" + mb.stmts.size() + " statements)"
      );
    }
    return new SootPosition(method, mb.stmts.get(index));
  }

  /** Statements of {@code method} in {@link sootup.core.model.Body#getStmts()} order. */
  public List<Stmt> statementsOf(MethodSignature method) {
    return indexed(method).map(mb -> mb.stmts).orElse(List.of());
  }

  @Override
  public BasicBlock<?> blockOf(SootPosition position) {
    BasicBlock<?> block = requireIndexed(position.method()).blockOf.get(
      position.stmt()
    );
    if (block == null) {
      throw new MalformedGraphException(
        "statement is not part of any block of its method: " + position
      );
    }
    return block;
  }

  @Override
  public SootPosition firstPositionOf(BasicBlock<?> block) {
    return new SootPosition(ownerOf(block), block.getHead());
  }

  @Override
  public SootPosition nextPosition(SootPosition position) {
    BasicBlock<?> block = blockOf(position);
    List<Stmt> stmts = block.getStmts();
    int i = indexOf(stmts, position.stmt());
    if (i < 0) {
      throw new MalformedGraphException(
        "statement is not part of its own block: " + position
      );
    }
    if (i + 1 < stmts.size()) {
      return new SootPosition(position.method(), stmts.get(i + 1));
    }
    // Block tail that falls through, e.g. a call right before a branch target
    List<? extends BasicBlock<?>> successors = block.getSuccessors();
    if (successors.size() != 1) {
      throw new MalformedGraphException(
        "no sequential successor for " + position + " (" +
        successors.size() + " successor blocks)"
      );
    }
    return firstPositionOf(successors.get(0));
  }

  @Override
  public List<BasicBlock<?>> successorsOf(BasicBlock<?> block) {
    return new ArrayList<>(block.getSuccessors());
  }

  @Override
  public PositionKind kindOf(SootPosition position) {
    Stmt stmt = position.stmt();
    if (invokeOf(stmt).isPresent()) return PositionKind.CALL;
    if (
      stmt instanceof JReturnStmt || stmt instanceof JReturnVoidStmt
    ) return PositionKind.RETURN;
    if (blockOf(position).getTail() == stmt) return PositionKind.TERMINATOR;
    return PositionKind.OTHER;
  }

  @Override
  public Callee<MethodSignature, BasicBlock<?>> calleeOf(
    SootPosition callPosition
  ) {
    return callees.computeIfAbsent(callPosition, this::resolveCallee);
  }

  @Override
  public boolean isIntrinsic(MethodSignature function) {
    if (pruneLibs && libraries.isLibrary(function.getDeclClassType())) {
      return true;
    }
    return view.getMethod(function).map(JavaSootMethod::isNative).orElse(false);
  }

  // ================= helpers =================

  private Callee<MethodSignature, BasicBlock<?>> resolveCallee(
    SootPosition callPosition
  ) {
    Optional<AbstractInvokeExpr> invoke = invokeOf(callPosition.stmt());
    if (invoke.isEmpty()) return Callee.external();

    MethodSignature declared = invoke.get().getMethodSignature();
    MethodSignature target = declared;
    if (callGraph != null && callGraph.containsMethod(callPosition.method())) {
      List<MethodSignature> targets = callGraph
        .callsFrom(callPosition.method())
        .stream()
        .filter(call -> call.getInvokableStmt() == callPosition.stmt())
        .map(CallGraph.Call::getTargetMethodSignature)
        .distinct()
        .collect(Collectors.toList());
      if (targets.size() > 1) {
        log.debug(
          "{} dispatches to {} targets, stepping over",
          callPosition,
          targets.size()
        );
        return Callee.external();
      }
      if (targets.size() == 1) target = targets.get(0);
    }

    Optional<MethodBlocks> body = indexed(target);
    if (body.isEmpty()) return Callee.external();
    return Callee.defined(target, body.get().entry);
  }

  private static Optional<AbstractInvokeExpr> invokeOf(Stmt stmt) {
    if (!(stmt instanceof InvokableStmt)) return Optional.empty();
    return ((InvokableStmt) stmt).getInvokeExpr();
  }

  private MethodBlocks requireIndexed(MethodSignature method) {
    return indexed(method).orElseThrow(() ->
      new MalformedGraphException("position in a method without body: " + method)
    );
  }

  private MethodSignature ownerOf(BasicBlock<?> block) {
    MethodSignature owner = blockOwners.get(block);
    if (owner == null) throw new MalformedGraphException(
      "block does not belong to any indexed method: " + block
    );
    return owner;
  }

  private Optional<MethodBlocks> indexed(MethodSignature method) {
    MethodBlocks cached = methods.get(method);
    if (cached != null) return Optional.of(cached);

    Optional<JavaSootMethod> sootMethod = view.getMethod(method);
    if (sootMethod.isEmpty() || !sootMethod.get().hasBody()) {
      return Optional.empty();
    }
    StmtGraph<?> graph = sootMethod.get().getBody().getStmtGraph();
    MethodBlocks mb = new MethodBlocks(sootMethod.get().getBody().getStmts());
    for (BasicBlock<?> block : graph.getBlocks()) {
      blockOwners.put(block, method);
      for (Stmt stmt : block.getStmts()) mb.blockOf.put(stmt, block);
    }
    mb.entry = mb.blockOf.get(graph.getStartingStmt());
    if (mb.entry == null) {
      throw new MalformedGraphException("no entry block in " + method);
    }
    log.debug(
      "indexed {}: {} statements, {} blocks",
      method,
      mb.stmts.size(),
      graph.getBlocks().size()
    );
    methods.put(method, mb);
    return Optional.of(mb);
  }

  private static int indexOf(List<Stmt> stmts, Stmt stmt) {
    for (int i = 0; i < stmts.size(); i++) {
      if (stmts.get(i) == stmt) return i;
    }
    return -1;
  }

  private static final class MethodBlocks {

    final List<Stmt> stmts;
    final Map<Stmt, BasicBlock<?>> blockOf = new IdentityHashMap<>();
    BasicBlock<?> entry;

    MethodBlocks(List<Stmt> stmts) {
      this.stmts = List.copyOf(stmts);
    }
  }
}
