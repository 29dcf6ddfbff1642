package cfd.analyzer.io;

import cfd.analyzer.model.DistanceQuery;
import cfd.analyzer.program.Program;
import cfd.analyzer.program.ProgramBuilder;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a program and its distance queries from JSON:
 *
 * <pre>
 * { "functions": [ { "name": "main", "blocks": [ { "label": "entry",
 *       "instructions": [ {"op": "call", "callee": "f"}, {"op": "op"}, {"op": "ret"} ] } ] },
 *     { "name": "puts", "external": true } ],
 *   "queries": [ { "name": "q", "start": "main:entry:0", "target": "main:entry:2", "stack": [] } ] }
 * </pre>
 */
public final class JsonProgramReader {

  private static final Logger log = LoggerFactory.getLogger(
    JsonProgramReader.class
  );

  public ProgramDocument read(Path file) throws IOException, ProgramFormatException {
    String text = Files.readString(file, StandardCharsets.UTF_8);
    ProgramDocument doc = parse(text);
    log.info(
      "Loaded {}: {} functions, {} queries",
      file,
      doc.program().functions().size(),
      doc.queries().size()
    );
    return doc;
  }

  public ProgramDocument parse(String text) throws ProgramFormatException {
    try {
      JSONObject root = new JSONObject(text);
      Program program = readProgram(root.getJSONArray("functions"));
      List<DistanceQuery> queries = readQueries(root.optJSONArray("queries"));
      return new ProgramDocument(program, queries);
    } catch (JSONException | IllegalArgumentException | IllegalStateException e) {
      throw new ProgramFormatException(e.getMessage(), e);
    }
  }

  private static Program readProgram(JSONArray functions)
    throws ProgramFormatException {
    ProgramBuilder builder = new ProgramBuilder();
    for (int i = 0; i < functions.length(); i++) {
      JSONObject fn = functions.getJSONObject(i);
      String name = fn.getString("name");
      if (fn.optBoolean("external", false)) {
        builder.external(name);
        continue;
      }
      builder.function(name);
      if (fn.optBoolean("intrinsic", false)) builder.intrinsic();

      JSONArray blocks = fn.getJSONArray("blocks");
      for (int b = 0; b < blocks.length(); b++) {
        JSONObject block = blocks.getJSONObject(b);
        builder.block(block.getString("label"));
        JSONArray instructions = block.getJSONArray("instructions");
        for (int k = 0; k < instructions.length(); k++) {
          appendInstruction(builder, name, instructions.getJSONObject(k));
        }
      }
    }
    return builder.build();
  }

  private static void appendInstruction(
    ProgramBuilder builder,
    String function,
    JSONObject inst
  ) throws ProgramFormatException {
    String op = inst.getString("op").toLowerCase(Locale.ROOT);
    switch (op) {
      case "call":
        builder.call(inst.getString("callee"));
        break;
      case "ret":
        builder.ret();
        break;
      case "br":
        builder.br(strings(inst.optJSONArray("targets")).toArray(new String[0]));
        break;
      case "op":
        int count = inst.optInt("count", 1);
        if (count <= 0) throw new ProgramFormatException(
          "op count must be positive, got " + count + " in function " + function
        );
        builder.op(count);
        break;
      default:
        throw new ProgramFormatException(
          "unknown op '" + op + "' in function " + function
        );
    }
  }

  private static List<DistanceQuery> readQueries(JSONArray queries) {
    List<DistanceQuery> out = new ArrayList<>();
    if (queries == null) return out;
    for (int i = 0; i < queries.length(); i++) {
      JSONObject q = queries.getJSONObject(i);
      out.add(
        new DistanceQuery(
          q.optString("name", "q" + i),
          q.getString("start"),
          q.getString("target"),
          strings(q.optJSONArray("stack"))
        )
      );
    }
    return out;
  }

  private static List<String> strings(JSONArray array) {
    List<String> out = new ArrayList<>();
    if (array == null) return out;
    for (int i = 0; i < array.length(); i++) out.add(array.getString(i));
    return out;
  }
}
