package cfd.analyzer.sootup;

import java.util.function.Function;
import sootup.core.signatures.MethodSignature;
import sootup.java.core.views.JavaView;

/**
 * Resolves {@code <signature>#<index>} references, e.g. {@code <a.B: int f(int)>#3}, to the
 * statement with that index in the method's Jimple body.
 */
public final class SootPositionResolver implements Function<String, SootPosition> {

  private final JavaView view;
  private final SootUpProgramGraph graph;

  public SootPositionResolver(JavaView view, SootUpProgramGraph graph) {
    this.view = view;
    this.graph = graph;
  }

  public static String ref(String signature, int index) {
    return signature + "#" + index;
  }

  public MethodSignature signature(String signature) {
    return view.getIdentifierFactory().parseMethodSignature(signature.trim());
  }

  @Override
  public SootPosition apply(String ref) {
    int sep = ref.lastIndexOf('#');
    if (sep < 0) throw new IllegalArgumentException(
      "expected <signature>#<index>, got '" + ref + "'"
    );
    int index;
    try {
      index = Integer.parseInt(ref.substring(sep + 1).trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("bad statement index in '" + ref + "'", e);
    }
    return graph.position(signature(ref.substring(0, sep)), index);
  }
}
