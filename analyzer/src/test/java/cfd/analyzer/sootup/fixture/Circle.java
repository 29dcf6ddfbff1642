package cfd.analyzer.sootup.fixture;

public final class Circle implements Shape {

  private final int radius;

  public Circle(int radius) {
    this.radius = radius;
  }

  @Override
  public int area() {
    return 3 * radius * radius;
  }
}
