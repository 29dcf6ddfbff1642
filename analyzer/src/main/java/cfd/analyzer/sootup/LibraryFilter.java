package cfd.analyzer.sootup;

import java.util.List;
import sootup.core.types.ClassType;

/** Decides which classes count as library code by package prefix. */
public final class LibraryFilter {

  public static final List<String> DEFAULT_PREFIXES = List.of(
    "java.",
    "javax.",
    "jdk.",
    "sun.",
    "kotlin."
  );

  private final List<String> prefixes;

  public LibraryFilter(List<String> prefixes) {
    this.prefixes = List.copyOf(prefixes);
  }

  public static LibraryFilter defaults() {
    return new LibraryFilter(DEFAULT_PREFIXES);
  }

  public boolean isLibrary(ClassType type) {
    String fqn = type.getFullyQualifiedName();
    return prefixes.stream().anyMatch(fqn::startsWith);
  }
}
