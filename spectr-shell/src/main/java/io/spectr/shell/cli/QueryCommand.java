package io.spectr.shell.cli;

import io.spectr.markdown.api.Document;
import io.spectr.markdown.api.LineIndex;
import io.spectr.markdown.api.NodeHandle;
import io.spectr.markdown.api.Query;
import io.spectr.markdown.api.QuerySyntaxException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import picocli.CommandLine;

@CommandLine.Command(
    name = "query",
    description = "Print the nodes matching a selector, e.g. 'h2 task[checked=false]'",
    mixinStandardHelpOptions = true)
public final class QueryCommand extends DocumentCommand {

  @CommandLine.Parameters(index = "1", paramLabel = "SELECTOR", description = "Node selector")
  String selector;

  @CommandLine.Option(
      names = {"-l", "--limit"},
      description = "Maximum number of matches to print")
  Integer limit;

  @CommandLine.Option(
      names = {"-c", "--count"},
      description = "Print only the number of matches")
  boolean count;

  @CommandLine.Option(names = "--json", description = "Print matches as JSON")
  boolean json;

  @Override
  int run(Document doc) {
    Query query;
    try {
      query = doc.query(selector);
    } catch (QuerySyntaxException e) {
      System.err.println("Error: Invalid selector: " + e.getMessage());
      return 1;
    }
    if (count) {
      System.out.println(query.count());
      return 0;
    }
    LineIndex lines = doc.lineIndex();
    List<Map<String, Object>> rows = new ArrayList<>();
    int n = 0;
    for (NodeHandle node : query) {
      if (limit != null && n++ >= limit) {
        break;
      }
      LineIndex.Position pos = lines.position(node.start());
      if (json) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("kind", node.kind().name().toLowerCase(Locale.ROOT));
        row.put("line", pos.line());
        row.put("column", pos.column());
        row.put("start", node.start());
        row.put("end", node.end());
        row.put("text", node.text());
        rows.add(row);
      } else {
        System.out.println(pos + " " + node.kind() + " " + firstLine(node.text()));
      }
    }
    if (json) {
      System.out.println(Json.GSON.toJson(rows));
    }
    return 0;
  }

  private static String firstLine(String text) {
    int eol = text.indexOf('\n');
    return eol < 0 ? text : text.substring(0, eol) + " ...";
  }
}
