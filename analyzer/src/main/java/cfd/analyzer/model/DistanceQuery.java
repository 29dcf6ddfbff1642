package cfd.analyzer.model;

import java.util.List;

/**
 * One distance question, with positions given as textual references understood by the program
 * representation in use.
 *
 * @param initialStack call positions already active at the start, outermost first
 */
public record DistanceQuery(
  String name,
  String start,
  String target,
  List<String> initialStack
) {
  public DistanceQuery {
    initialStack = List.copyOf(initialStack);
  }
}
