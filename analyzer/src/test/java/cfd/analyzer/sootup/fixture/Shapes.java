package cfd.analyzer.sootup.fixture;

/** Virtual dispatch and native calls for the SootUp graph tests. */
public class Shapes {

  static int any(Shape s) {
    int a = s.area();
    return a;
  }

  static int square(Square s) {
    int a = s.area();
    return a;
  }

  static native int measure();
}
