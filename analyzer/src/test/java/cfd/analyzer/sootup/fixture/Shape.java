package cfd.analyzer.sootup.fixture;

public interface Shape {
  int area();
}
