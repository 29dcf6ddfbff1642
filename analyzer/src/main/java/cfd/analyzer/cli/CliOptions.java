package cfd.analyzer.cli;

import java.nio.file.Path;
import java.util.*;

public record CliOptions(
  Optional<Path> program,
  List<Path> classpath,
  Optional<String> startMethod,
  int startIndex,
  Optional<String> targetMethod,
  int targetIndex,
  Optional<String> initialStack,
  Path out,
  boolean append,
  int maxDistance,
  int maxIterations,
  int maxQueueLength,
  int stepCost,
  boolean pruneLibs,
  boolean useJrt,
  boolean useCallGraph,
  boolean trace
) {}
