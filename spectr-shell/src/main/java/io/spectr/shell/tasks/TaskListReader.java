package io.spectr.shell.tasks;

import io.spectr.markdown.api.Document;
import io.spectr.markdown.api.LineIndex;
import io.spectr.markdown.api.NodeHandle;
import io.spectr.markdown.api.NodeKind;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the sections and tasks of a parsed {@code tasks.md} document.
 *
 * <p>A level-2 header opens a section. {@code ## 3. Name} takes its number from the header;
 * a header without a number takes the next automatic one. Task items at any nesting depth
 * belong to the current section. A task without a written id gets {@code <section>.<n>}, where
 * {@code n} counts the section's tasks without ids, or just {@code n} before the first section.
 * Indented lines inside a task item that are not themselves tasks are appended to the task's
 * description. Finally tasks are arranged by id: {@code 1.2.3} becomes a subtask of {@code 1.2}
 * when that task exists in the same section.
 */
public final class TaskListReader {
  private static final Logger log = LoggerFactory.getLogger(TaskListReader.class);

  private static final Pattern NUMBERED_SECTION = Pattern.compile("^(\\d+)\\.\\s+(.+)$");

  private final Document doc;
  private final byte[] src;
  private final LineIndex lines;

  private final List<TaskSection> sections = new ArrayList<>();
  private int autoSection;
  private int autoTask;
  private int sectionNumber;
  private String sectionName = "";
  private List<FlatTask> flat = new ArrayList<>();

  private TaskListReader(Document doc) {
    this.doc = doc;
    this.src = doc.printBytes();
    this.lines = doc.lineIndex();
  }

  public static TaskList read(Document doc) {
    TaskListReader reader = new TaskListReader(doc);
    reader.run();
    TaskList list = TaskList.of(reader.sections);
    log.debug(
        "Read {} sections, {} tasks ({} completed)",
        list.sections().size(),
        list.summary().total(),
        list.summary().completed());
    return list;
  }

  private void run() {
    for (NodeHandle block : doc.root().contentChildren()) {
      if (block.kind() == NodeKind.HEADER && block.level() == 2) {
        finishSection();
        startSection(block.text().strip());
      } else {
        collect(block);
      }
    }
    finishSection();
  }

  private void startSection(String text) {
    Matcher m = NUMBERED_SECTION.matcher(text);
    if (m.matches()) {
      sectionNumber = parseNumber(m.group(1));
      sectionName = m.group(2).strip();
    } else {
      sectionNumber = ++autoSection;
      sectionName = text;
    }
    autoTask = 0;
  }

  private static int parseNumber(String digits) {
    try {
      return Integer.parseInt(digits);
    } catch (NumberFormatException e) {
      return Integer.MAX_VALUE;
    }
  }

  // tasks ahead of the first section are kept in a section numbered 0
  private void finishSection() {
    if (!flat.isEmpty() || sectionNumber != 0 || !sectionName.isEmpty()) {
      sections.add(new TaskSection(sectionNumber, sectionName, hierarchy(flat)));
    }
    flat = new ArrayList<>();
  }

  private void collect(NodeHandle node) {
    if (node.kind() == NodeKind.TASK_ITEM) {
      task(node);
    }
    for (NodeHandle child : node.contentChildren()) {
      if (!child.isLeaf()) {
        collect(child);
      }
    }
  }

  private void task(NodeHandle item) {
    String description = item.description();
    String id = item.taskId();
    if (description.isEmpty() && id == null) {
      return;
    }
    if (id == null) {
      autoTask++;
      id = sectionNumber > 0 ? sectionNumber + "." + autoTask : Integer.toString(autoTask);
    }
    StringBuilder text = new StringBuilder(description);
    appendDetails(item, text);
    flat.add(new FlatTask(id, text.toString(), item.checked()));
  }

  private void appendDetails(NodeHandle item, StringBuilder out) {
    List<NodeHandle> nested = new ArrayList<>();
    nestedTasks(item, nested);
    int first = lines.line(item.start());
    int last = lines.line(Math.max(item.start(), item.end() - 1));
    for (int line = first + 1; line <= last; line++) {
      int start = lines.lineStart(line);
      if (insideAny(nested, start) || !indented(start)) {
        continue;
      }
      String detail = new String(src, start, lines.lineEnd(line) - start, StandardCharsets.UTF_8).strip();
      if (detail.isEmpty()) {
        continue;
      }
      if (out.length() > 0) {
        out.append('\n');
      }
      out.append(detail);
    }
  }

  private static void nestedTasks(NodeHandle node, List<NodeHandle> out) {
    for (NodeHandle child : node.contentChildren()) {
      if (child.kind() == NodeKind.TASK_ITEM) {
        out.add(child);
      } else if (!child.isLeaf()) {
        nestedTasks(child, out);
      }
    }
  }

  private static boolean insideAny(List<NodeHandle> nodes, int offset) {
    for (NodeHandle n : nodes) {
      if (offset >= n.start() && offset < n.end()) {
        return true;
      }
    }
    return false;
  }

  private boolean indented(int lineStart) {
    if (lineStart < src.length && src[lineStart] == '\t') {
      return true;
    }
    return lineStart + 1 < src.length && isSpace(src[lineStart]) && isSpace(src[lineStart + 1]);
  }

  private static boolean isSpace(byte b) {
    return b == ' ' || b == '\t';
  }

  /** Arranges tasks under the task whose id is their id minus its last segment. */
  static List<Task> hierarchy(List<FlatTask> tasks) {
    Map<String, Node> byId = new LinkedHashMap<>();
    for (FlatTask t : tasks) {
      byId.putIfAbsent(t.id, new Node(t));
    }
    List<Node> roots = new ArrayList<>();
    for (FlatTask t : tasks) {
      Node node = new Node(t);
      Node registered = byId.get(t.id);
      if (registered.task == t) {
        node = registered;
      }
      Node parent = byId.get(parentId(t.id));
      if (parent != null && parent != node) {
        parent.children.add(node);
      } else {
        roots.add(node);
      }
    }
    List<Task> out = new ArrayList<>(roots.size());
    for (Node root : roots) {
      out.add(root.freeze());
    }
    return out;
  }

  static String parentId(String id) {
    int dot = id.lastIndexOf('.');
    return dot < 0 ? "" : id.substring(0, dot);
  }

  record FlatTask(String id, String description, boolean completed) {}

  private static final class Node {
    final FlatTask task;
    final List<Node> children = new ArrayList<>();

    Node(FlatTask task) {
      this.task = task;
    }

    Task freeze() {
      List<Task> subtasks = new ArrayList<>(children.size());
      for (Node child : children) {
        subtasks.add(child.freeze());
      }
      return new Task(task.id, task.description, task.completed, subtasks);
    }
  }
}
