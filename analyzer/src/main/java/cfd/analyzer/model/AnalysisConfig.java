package cfd.analyzer.model;

import cfd.analyzer.cli.CliOptions;
import cfd.analyzer.search.SearchConfig;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

public record AnalysisConfig(
  String programPath,
  List<String> classpath,
  String startMethod,
  int startIndex,
  String targetMethod,
  int targetIndex,
  String initialStack,
  String outPath,
  boolean append,
  boolean pruneLibs,
  boolean useJrt,
  boolean useCallGraph,
  boolean trace,
  SearchConfig search
) {
  public static AnalysisConfig from(CliOptions o) {
    return new AnalysisConfig(
      o.program().map(Path::toString).orElse(""),
      o.classpath().stream().map(Path::toString).collect(Collectors.toList()),
      o.startMethod().orElse(""),
      o.startIndex(),
      o.targetMethod().orElse(""),
      o.targetIndex(),
      o.initialStack().orElse(""),
      o.out().toString(),
      o.append(),
      o.pruneLibs(),
      o.useJrt(),
      o.useCallGraph(),
      o.trace(),
      new SearchConfig(
        o.maxDistance(),
        o.maxIterations(),
        o.maxQueueLength(),
        o.stepCost()
      )
    );
  }

  public boolean programMode() {
    return !programPath.isBlank();
  }

  public boolean writesToStdout() {
    return "-".equals(outPath);
  }
}
