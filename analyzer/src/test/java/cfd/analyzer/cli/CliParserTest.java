package cfd.analyzer.cli;

import static org.junit.jupiter.api.Assertions.*;

import cfd.analyzer.model.AnalysisConfig;
import cfd.analyzer.search.SearchConfig;
import java.io.File;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CliParserTest {

  private static CliOptions parse(Map<String, String> env, String... args) {
    return CliParser.parse(args, env::get);
  }

  @Test
  void defaults() {
    CliOptions o = parse(Map.of(), "--program", "p.json");

    assertEquals(Paths.get("p.json"), o.program().orElseThrow());
    assertEquals(Paths.get("distances.jsonl"), o.out());
    assertFalse(o.append());
    assertEquals(SearchConfig.DEFAULT_MAX_DISTANCE, o.maxDistance());
    assertEquals(SearchConfig.DEFAULT_MAX_ITERATIONS, o.maxIterations());
    assertEquals(SearchConfig.DEFAULT_MAX_QUEUE_LENGTH, o.maxQueueLength());
    assertEquals(SearchConfig.DEFAULT_STEP_COST, o.stepCost());
    assertTrue(o.pruneLibs());
    assertFalse(o.useJrt());
    assertTrue(o.useCallGraph());
    assertFalse(o.trace());
    assertTrue(o.classpath().isEmpty());
  }

  @Test
  void bytecodeOptions() {
    CliOptions o = parse(
      Map.of(),
      "--classpath",
      "a" + File.pathSeparator + " b " + File.pathSeparator,
      "--start",
      "<A: void run()>",
      "--startIndex",
      "2",
      "--target",
      "<A: void stop()>",
      "--targetIndex",
      "4",
      "--stack",
      "<A: void main()>#1",
      "--pruneLibs",
      "false",
      "--useJrt",
      "--trace",
      "--out",
      "-"
    );

    assertEquals(List.of(Paths.get("a"), Paths.get("b")), o.classpath());
    assertEquals("<A: void run()>", o.startMethod().orElseThrow());
    assertEquals(2, o.startIndex());
    assertEquals(4, o.targetIndex());
    assertEquals("<A: void main()>#1", o.initialStack().orElseThrow());
    assertFalse(o.pruneLibs());
    assertTrue(o.useJrt());
    assertTrue(o.trace());
    assertTrue(AnalysisConfig.from(o).writesToStdout());
    assertFalse(AnalysisConfig.from(o).programMode());
  }

  @Test
  void boundsFromCommandLine() {
    CliOptions o = parse(
      Map.of(),
      "--maxDistance",
      "50",
      "--maxIterations",
      "7",
      "--maxQueueLength",
      "3",
      "--stepCost",
      "2"
    );

    SearchConfig search = AnalysisConfig.from(o).search();
    assertEquals(new SearchConfig(50, 7, 3, 2), search);
  }

  @Test
  void environmentWinsOverCommandLine() {
    CliOptions o = parse(
      Map.of("MAX_DISTANCE", "99", "MAX_QUEUE_LENGTH", " 12 "),
      "--maxDistance",
      "50",
      "--maxQueueLength",
      "3"
    );

    assertEquals(99, o.maxDistance());
    assertEquals(12, o.maxQueueLength());
    assertEquals(SearchConfig.DEFAULT_MAX_ITERATIONS, o.maxIterations());
  }

  @Test
  void nonNumericBoundIsRejected() {
    IllegalArgumentException e = assertThrows(
      IllegalArgumentException.class,
      () -> parse(Map.of(), "--maxDistance", "far")
    );
    assertTrue(e.getMessage().contains("--maxDistance"));
    assertThrows(
      IllegalArgumentException.class,
      () -> parse(Map.of("MAX_ITERATIONS", "lots"))
    );
  }

  @Test
  void nonPositiveBoundFailsWhenBuildingTheConfig() {
    CliOptions o = parse(Map.of(), "--maxIterations", "0");

    assertThrows(IllegalArgumentException.class, () -> AnalysisConfig.from(o));
  }
}
