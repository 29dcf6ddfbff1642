package cfd.analyzer.io;

import cfd.analyzer.model.*;
import cfd.analyzer.search.SearchResult;
import java.io.BufferedWriter;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import org.json.JSONArray;
import org.json.JSONObject;

/** One JSON object per line and query; {@code -} as output path writes to stdout. */
public final class JsonlOutputSink implements OutputSink {

  private final BufferedWriter writer;
  private final boolean ownsWriter;

  public JsonlOutputSink(AnalysisConfig cfg) throws Exception {
    if (cfg.writesToStdout()) {
      this.writer = new BufferedWriter(
        new OutputStreamWriter(System.out, StandardCharsets.UTF_8)
      );
      this.ownsWriter = false;
    } else {
      Path outPath = Paths.get(cfg.outPath());
      Path dir = outPath.toAbsolutePath().getParent();
      if (dir != null) Files.createDirectories(dir);
      this.writer = Files.newBufferedWriter(
        outPath,
        StandardCharsets.UTF_8,
        cfg.append()
          ? new OpenOption[] {
            StandardOpenOption.CREATE,
            StandardOpenOption.WRITE,
            StandardOpenOption.APPEND,
          }
          : new OpenOption[] {
            StandardOpenOption.CREATE,
            StandardOpenOption.TRUNCATE_EXISTING,
            StandardOpenOption.WRITE,
          }
      );
      this.ownsWriter = true;
    }
  }

  @Override
  public void write(DistanceRecord r) throws Exception {
    writer.write(toJson(r).toString());
    writer.write("\n");
  }

  static JSONObject toJson(DistanceRecord r) {
    DistanceQuery q = r.query();
    SearchResult res = r.result();
    return new JSONObject()
      .put("query", q.name())
      .put("start", q.start())
      .put("target", q.target())
      .put("initialStack", new JSONArray(q.initialStack()))
      .put("distance", res.distance())
      .put("reachable", res.isReachable())
      .put("outcome", res.outcome().name())
      .put("iterations", res.iterations())
      .put("peakFrontierSize", res.peakFrontierSize())
      .put("elapsedMs", r.elapsedMs());
  }

  @Override
  public void close() throws Exception {
    if (ownsWriter) writer.close(); else writer.flush();
  }
}
