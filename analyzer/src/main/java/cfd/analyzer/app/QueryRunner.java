package cfd.analyzer.app;

import cfd.analyzer.graph.PositionKind;
import cfd.analyzer.graph.ProgramGraph;
import cfd.analyzer.io.OutputSink;
import cfd.analyzer.model.DistanceQuery;
import cfd.analyzer.model.DistanceRecord;
import cfd.analyzer.search.BFSearcher;
import cfd.analyzer.search.SearchConfig;
import cfd.analyzer.search.SearchResult;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Runs distance queries against one program graph and hands each result to the output sink. */
public final class QueryRunner {

  private static final Logger log = LoggerFactory.getLogger(QueryRunner.class);

  private final SearchConfig config;
  private final boolean trace;
  private final OutputSink out;

  public QueryRunner(SearchConfig config, boolean trace, OutputSink out) {
    this.config = config;
    this.trace = trace;
    this.out = out;
  }

  /**
   * Queries whose positions cannot be resolved, or whose initial stack holds a position that is
   * not a call, are logged and skipped.
   *
   * @return number of queries answered
   */
  public <P, B, F> int runAll(
    ProgramGraph<P, B, F> graph,
    Function<String, P> resolver,
    List<DistanceQuery> queries
  ) throws Exception {
    int done = 0;
    for (DistanceQuery q : queries) {
      P start;
      P target;
      List<P> stack = new ArrayList<>();
      try {
        start = resolver.apply(q.start());
        target = resolver.apply(q.target());
        for (String call : q.initialStack()) stack.add(resolver.apply(call));
      } catch (IllegalArgumentException e) {
        log.warn("Skipping query {}: {}", q.name(), e.getMessage());
        continue;
      }
      P notACall = stack
        .stream()
        .filter(call -> graph.kindOf(call) != PositionKind.CALL)
        .findFirst()
        .orElse(null);
      if (notACall != null) {
        log.warn(
          "Skipping query {}: stack entry {} is not a call",
          q.name(),
          notACall
        );
        continue;
      }
      out.write(run(graph, q, start, target, stack));
      done++;
    }
    return done;
  }

  public <P, B, F> DistanceRecord run(
    ProgramGraph<P, B, F> graph,
    DistanceQuery q,
    P start,
    P target,
    List<P> initialStack
  ) {
    BFSearcher<P, B, F> searcher = new BFSearcher<>(
      graph,
      config,
      start,
      target,
      initialStack
    );
    if (trace) searcher.withExpansionListener(s ->
      log.info(
        "[{}] expand d={} depth={} at {}",
        q.name(),
        s.distance(),
        s.stack().size(),
        s.position()
      )
    );

    Instant t0 = Instant.now();
    SearchResult res = searcher.search();
    long ms = Duration.between(t0, Instant.now()).toMillis();

    if (res.isReachable()) {
      log.info(
        "{}: distance {} ({} iterations, {} ms)",
        q.name(),
        res.distance(),
        res.iterations(),
        ms
      );
    } else {
      log.info(
        "{}: unreachable, {} after {} iterations ({} ms)",
        q.name(),
        res.outcome(),
        res.iterations(),
        ms
      );
    }
    return new DistanceRecord(q, res, ms);
  }
}
