package io.spectr.shell.tasks;

import io.spectr.markdown.api.Document;
import io.spectr.markdown.api.EncodingException;
import io.spectr.markdown.api.Markdown;
import io.spectr.markdown.api.NodeHandle;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Brings the checkboxes of {@code tasks.md} in line with the statuses in {@code tasks.jsonc}.
 *
 * <p>Only tasks with a written id that appears in the status file are touched, and only the
 * checkbox byte of those whose state differs changes. Everything else in the file is written
 * back byte for byte.
 */
public final class TaskSync {
  private static final Logger log = LoggerFactory.getLogger(TaskSync.class);

  public static final String STATUS_FILE = "tasks.jsonc";
  public static final String TASKS_FILE = "tasks.md";

  private TaskSync() {}

  /** A synced document and the number of tasks whose checkbox changed. */
  public record Result(Document document, int updated) {}

  public static Result apply(Document doc, Map<String, TaskStatus> statuses) {
    Document current = doc;
    int updated = 0;
    for (NodeHandle task : doc.query("task")) {
      String id = task.taskId();
      if (id == null) {
        continue;
      }
      TaskStatus status = statuses.get(id);
      if (status == null || task.checked() == status.checked()) {
        continue;
      }
      current = current.withTaskChecked(current.node(task.id()), status.checked());
      updated++;
    }
    return new Result(current, updated);
  }

  /**
   * Syncs {@code tasks.md} in {@code changeDir} from its {@code tasks.jsonc}. A directory
   * missing either file is left alone.
   *
   * @return the number of tasks updated
   */
  public static int syncDirectory(Path changeDir)
      throws IOException, EncodingException, TaskStoreException {
    Path statusFile = changeDir.resolve(STATUS_FILE);
    Path tasksFile = changeDir.resolve(TASKS_FILE);
    if (!Files.exists(statusFile)) {
      log.debug("No {} in {}, nothing to sync", STATUS_FILE, changeDir);
      return 0;
    }
    TaskStatusStore store = TaskStatusStore.read(statusFile);
    if (!Files.exists(tasksFile)) {
      log.debug("No {} in {}, nothing to sync", TASKS_FILE, changeDir);
      return 0;
    }
    Result result = apply(Markdown.read(tasksFile), store.statuses());
    if (result.updated() > 0) {
      Files.write(tasksFile, result.document().printBytes());
    }
    log.debug("Synced {} tasks in {}", result.updated(), tasksFile);
    return result.updated();
  }
}
