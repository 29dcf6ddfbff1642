package cfd.analyzer.sootup.fixture;

/** Bytecode fixture for the SootUp graph tests. */
public class Calls {

  static int helper(int x) {
    return x + 1;
  }

  static int twice(int x) {
    int a = helper(x);
    int b = helper(a);
    return b;
  }

  static int recurse(int n) {
    if (n <= 0) {
      return 0;
    }
    return recurse(n - 1) + 1;
  }

  static int abs(int x) {
    int y = Math.abs(x);
    return y;
  }
}
