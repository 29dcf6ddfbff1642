package cfd.analyzer.cli;

import cfd.analyzer.search.SearchConfig;
import java.io.File;
import java.nio.file.*;
import java.util.*;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Parses {@code --key value} arguments; a key followed by another key (or nothing) is a boolean
 * flag set to true. Search bounds can also come from the environment ({@code MAX_DISTANCE},
 * {@code MAX_ITERATIONS}, {@code MAX_QUEUE_LENGTH}), which wins over the command line.
 */
public final class CliParser {

  private CliParser() {}

  public static CliOptions parse(String[] args) {
    return parse(args, System::getenv);
  }

  static CliOptions parse(String[] args, Function<String, String> env) {
    Map<String, String> m = toMap(args);

    Optional<Path> program = optional(m, "program").map(Paths::get);
    List<Path> classpath = optional(m, "classpath")
      .map(cp ->
        Arrays
          .stream(cp.split(Pattern.quote(File.pathSeparator)))
          .map(String::trim)
          .filter(s -> !s.isEmpty())
          .map(Paths::get)
          .collect(Collectors.toList())
      )
      .orElse(List.of());

    Optional<String> startMethod = optional(m, "start");
    int startIndex = getInt(m, "startIndex", 0);
    Optional<String> targetMethod = optional(m, "target");
    int targetIndex = getInt(m, "targetIndex", 0);
    Optional<String> initialStack = optional(m, "stack");

    Path out = Paths.get(m.getOrDefault("out", "distances.jsonl"));
    boolean append = getBool(m, "append", false);

    int maxDistance = getIntOpt(
      env,
      m,
      "MAX_DISTANCE",
      "maxDistance",
      SearchConfig.DEFAULT_MAX_DISTANCE
    );
    int maxIterations = getIntOpt(
      env,
      m,
      "MAX_ITERATIONS",
      "maxIterations",
      SearchConfig.DEFAULT_MAX_ITERATIONS
    );
    int maxQueueLength = getIntOpt(
      env,
      m,
      "MAX_QUEUE_LENGTH",
      "maxQueueLength",
      SearchConfig.DEFAULT_MAX_QUEUE_LENGTH
    );
    int stepCost = getInt(m, "stepCost", SearchConfig.DEFAULT_STEP_COST);

    boolean pruneLibs = getBool(m, "pruneLibs", true);
    boolean useJrt = getBool(m, "useJrt", false);
    boolean useCallGraph = getBool(m, "useCallGraph", true);
    boolean trace = getBool(m, "trace", false);

    return new CliOptions(
      program,
      classpath,
      startMethod,
      startIndex,
      targetMethod,
      targetIndex,
      initialStack,
      out,
      append,
      maxDistance,
      maxIterations,
      maxQueueLength,
      stepCost,
      pruneLibs,
      useJrt,
      useCallGraph,
      trace
    );
  }

  private static Map<String, String> toMap(String[] args) {
    Map<String, String> m = new LinkedHashMap<>();
    for (int i = 0; i < args.length; i++) {
      String a = args[i];
      if (!a.startsWith("--")) continue;
      String k = a.substring(2);
      String v = (i + 1 < args.length && !args[i + 1].startsWith("--"))
        ? args[++i]
        : "true";
      m.put(k, v);
    }
    return m;
  }

  private static Optional<String> optional(Map<String, String> m, String k) {
    return Optional.ofNullable(m.get(k)).map(String::trim).filter(s -> !s.isBlank());
  }

  private static boolean getBool(Map<String, String> m, String k, boolean def) {
    String v = m.get(k);
    if (v == null) return def;
    v = v.trim().toLowerCase(Locale.ROOT);
    return (
      v.isEmpty() ||
      v.equals("1") ||
      v.equals("true") ||
      v.equals("yes") ||
      v.equals("y")
    );
  }

  private static int getInt(Map<String, String> m, String k, int def) {
    String v = m.get(k);
    if (v == null) return def;
    return parseInt("--" + k, v);
  }

  private static int getIntOpt(
    Function<String, String> env,
    Map<String, String> m,
    String envKey,
    String k,
    int def
  ) {
    String v = env.apply(envKey);
    if (v != null && !v.isBlank()) return parseInt(envKey, v);
    return getInt(m, k, def);
  }

  private static int parseInt(String name, String value) {
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
        name + " expects an integer, got '" + value + "'",
        e
      );
    }
  }
}
