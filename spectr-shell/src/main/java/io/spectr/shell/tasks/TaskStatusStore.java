package io.spectr.shell.tasks;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.Strictness;
import com.google.gson.stream.JsonReader;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Task statuses read from a {@code tasks.jsonc} file.
 *
 * <p>The file is JSON that may carry {@code //}, {@code #} and block comments and trailing
 * commas before a closing brace or bracket:
 *
 * <pre>{@code
 * {
 *   "version": 1,
 *   "tasks": [
 *     {"id": "1.1", "section": "Setup", "description": "...", "status": "completed",
 *      "children": [ ... ]}
 *   ]
 * }
 * }</pre>
 *
 * Nested {@code children} are flattened; a later entry for the same id wins. Statuses other
 * than the known ones are read as {@link TaskStatus#PENDING}.
 */
public final class TaskStatusStore {
  private static final Logger log = LoggerFactory.getLogger(TaskStatusStore.class);

  private final int version;
  private final Map<String, TaskStatus> statuses;

  private TaskStatusStore(int version, Map<String, TaskStatus> statuses) {
    this.version = version;
    this.statuses = Collections.unmodifiableMap(statuses);
  }

  public static TaskStatusStore read(Path path) throws TaskStoreException {
    String text;
    try {
      text = Files.readString(path, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new TaskStoreException("Failed to read " + path + ": " + e.getMessage(), e);
    }
    return parse(text, path.toString());
  }

  public static TaskStatusStore parse(String json) throws TaskStoreException {
    return parse(json, "<string>");
  }

  private static TaskStatusStore parse(String text, String source) throws TaskStoreException {
    JsonElement root;
    try {
      JsonReader reader = new JsonReader(new StringReader(stripTrailingCommas(text)));
      reader.setStrictness(Strictness.LENIENT);
      root = JsonParser.parseReader(reader);
    } catch (JsonParseException e) {
      throw new TaskStoreException("Malformed task file " + source + ": " + e.getMessage(), e);
    }
    if (!root.isJsonObject()) {
      throw new TaskStoreException("Task file " + source + " is not a JSON object");
    }
    JsonObject obj = root.getAsJsonObject();
    int version = 0;
    try {
      if (obj.has("version") && obj.get("version").isJsonPrimitive()) {
        version = obj.get("version").getAsInt();
      }
    } catch (NumberFormatException e) {
      throw new TaskStoreException("Invalid version in " + source + ": " + obj.get("version"), e);
    }
    Map<String, TaskStatus> statuses = new LinkedHashMap<>();
    JsonElement tasks = obj.get("tasks");
    if (tasks != null && !tasks.isJsonNull()) {
      if (!tasks.isJsonArray()) {
        throw new TaskStoreException("'tasks' in " + source + " is not an array");
      }
      collect(tasks.getAsJsonArray(), statuses, source);
    }
    log.debug("Read {} task statuses from {} (version {})", statuses.size(), source, version);
    return new TaskStatusStore(version, statuses);
  }

  /**
   * Removes every comma that is followed, after whitespace and comments only, by a closing
   * bracket or brace. Gson's lenient mode reads such a comma in an array as a null element and rejects
   * it in an object. String literals and comments are copied unchanged.
   */
  static String stripTrailingCommas(String text) {
    StringBuilder out = new StringBuilder(text.length());
    int n = text.length();
    int i = 0;
    while (i < n) {
      char c = text.charAt(i);
      if (c == '"' || c == '\'') {
        int end = skipString(text, i);
        out.append(text, i, end);
        i = end;
      } else if (isCommentStart(text, i)) {
        int end = skipComment(text, i);
        out.append(text, i, end);
        i = end;
      } else if (c == ',') {
        int next = skipTrivia(text, i + 1);
        if (next >= n || (text.charAt(next) != '}' && text.charAt(next) != ']')) {
          out.append(c);
        }
        i++;
      } else {
        out.append(c);
        i++;
      }
    }
    return out.toString();
  }

  private static int skipString(String text, int start) {
    char quote = text.charAt(start);
    int i = start + 1;
    while (i < text.length()) {
      char c = text.charAt(i);
      if (c == '\\') {
        i += 2;
      } else if (c == quote) {
        return i + 1;
      } else {
        i++;
      }
    }
    return text.length();
  }

  private static boolean isCommentStart(String text, int i) {
    char c = text.charAt(i);
    if (c == '#') {
      return true;
    }
    return c == '/' && i + 1 < text.length() && (text.charAt(i + 1) == '/' || text.charAt(i + 1) == '*');
  }

  private static int skipComment(String text, int start) {
    if (text.charAt(start) == '/' && text.charAt(start + 1) == '*') {
      int close = text.indexOf("*/", start + 2);
      return close < 0 ? text.length() : close + 2;
    }
    int newline = text.indexOf('\n', start);
    return newline < 0 ? text.length() : newline;
  }

  private static int skipTrivia(String text, int from) {
    int i = from;
    while (i < text.length()) {
      if (Character.isWhitespace(text.charAt(i))) {
        i++;
      } else if (isCommentStart(text, i)) {
        i = skipComment(text, i);
      } else {
        break;
      }
    }
    return i;
  }

  private static void collect(JsonArray tasks, Map<String, TaskStatus> out, String source)
      throws TaskStoreException {
    for (JsonElement e : tasks) {
      // lenient parsing reads an empty slot such as [a,,b] as a null element
      if (e == null || e.isJsonNull()) {
        continue;
      }
      if (!e.isJsonObject()) {
        throw new TaskStoreException("Task entry in " + source + " is not an object: " + e);
      }
      JsonObject task = e.getAsJsonObject();
      JsonElement id = task.get("id");
      if (id == null || !id.isJsonPrimitive()) {
        throw new TaskStoreException("Task entry in " + source + " has no id: " + task);
      }
      JsonElement statusValue = task.get("status");
      String raw = statusValue != null && statusValue.isJsonPrimitive() ? statusValue.getAsString() : "";
      TaskStatus status = TaskStatus.of(raw);
      if (status == null) {
        log.debug("Unknown status '{}' for task {}, reading it as pending", raw, id.getAsString());
        status = TaskStatus.PENDING;
      }
      out.put(id.getAsString(), status);
      JsonElement children = task.get("children");
      if (children != null && children.isJsonArray()) {
        collect(children.getAsJsonArray(), out, source);
      }
    }
  }

  public int version() {
    return version;
  }

  /** Statuses by task id, in file order. */
  public Map<String, TaskStatus> statuses() {
    return statuses;
  }

  public TaskStatus status(String id) {
    return statuses.get(id);
  }
}
