package cfd.analyzer.app;

import cfd.analyzer.cli.*;
import cfd.analyzer.io.*;
import cfd.analyzer.model.*;
import cfd.analyzer.sootup.*;
import cfd.analyzer.sootupview.*;
import java.nio.file.*;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sootup.callgraph.CallGraph;
import sootup.callgraph.ClassHierarchyAnalysisAlgorithm;
import sootup.core.signatures.MethodSignature;
import sootup.java.core.views.JavaView;

public final class Main {

  private static final Logger log = LoggerFactory.getLogger(Main.class);

  public static void main(String[] args) throws Exception {
    CliOptions opts = CliParser.parse(args);
    AnalysisConfig cfg = AnalysisConfig.from(opts);

    int done;
    try (OutputSink out = new JsonlOutputSink(cfg)) {
      QueryRunner runner = new QueryRunner(cfg.search(), cfg.trace(), out);
      if (cfg.programMode()) {
        done = runProgram(cfg, runner);
      } else if (!cfg.classpath().isEmpty()) {
        done = runBytecode(cfg, runner, new DefaultViewFactory());
      } else {
        throw new IllegalArgumentException(
          "either --program <file.json> or --classpath <dirs> is required"
        );
      }
    }

    if (!cfg.writesToStdout()) System.out.println(
      "\nDone: " + done + " queries -> " + cfg.outPath()
    );
  }

  static int runProgram(AnalysisConfig cfg, QueryRunner runner)
    throws Exception {
    ProgramDocument doc = new JsonProgramReader().read(
      Paths.get(cfg.programPath())
    );
    return runner.runAll(
      doc.program().graph(),
      doc.program()::position,
      doc.queries()
    );
  }

  static int runBytecode(
    AnalysisConfig cfg,
    QueryRunner runner,
    ViewFactory viewFactory
  ) throws Exception {
    if (cfg.startMethod().isBlank() || cfg.targetMethod().isBlank()) {
      throw new IllegalArgumentException(
        "--start and --target method signatures are required with --classpath"
      );
    }
    List<Path> entries = cfg
      .classpath()
      .stream()
      .map(Paths::get)
      .collect(Collectors.toList());
    JavaView view = viewFactory.forClasspath(entries, cfg.useJrt());

    MethodSignature startSig = view
      .getIdentifierFactory()
      .parseMethodSignature(cfg.startMethod().trim());

    CallGraph cg = null;
    if (cfg.useCallGraph()) {
      cg = new ClassHierarchyAnalysisAlgorithm(view).initialize(List.of(startSig));
      log.info("CHA call graph built from {}", startSig);
    }

    SootUpProgramGraph graph = new SootUpProgramGraph(
      view,
      cg,
      LibraryFilter.defaults(),
      cfg.pruneLibs()
    );
    SootPositionResolver resolver = new SootPositionResolver(view, graph);

    List<String> stack = cfg.initialStack().isBlank()
      ? List.of()
      : Arrays
        .stream(cfg.initialStack().split(";"))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .collect(Collectors.toList());
    DistanceQuery query = new DistanceQuery(
      "cli",
      SootPositionResolver.ref(cfg.startMethod(), cfg.startIndex()),
      SootPositionResolver.ref(cfg.targetMethod(), cfg.targetIndex()),
      stack
    );
    return runner.runAll(graph, resolver, List.of(query));
  }
}
