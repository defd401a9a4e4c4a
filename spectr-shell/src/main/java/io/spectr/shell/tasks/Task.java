package io.spectr.shell.tasks;

import java.util.List;

/**
 * A task item of a {@code tasks.md} file.
 *
 * @param id dotted identifier, written or generated from the section number
 * @param description task text with its indented detail lines appended, one per line
 * @param completed whether the checkbox is checked
 * @param subtasks tasks whose id extends this one by one segment
 */
public record Task(String id, String description, boolean completed, List<Task> subtasks) {

  public Task {
    subtasks = List.copyOf(subtasks);
  }

  /** Number of tasks in this subtree, this task included. */
  public int total() {
    int n = 1;
    for (Task t : subtasks) {
      n += t.total();
    }
    return n;
  }

  /** Number of completed tasks in this subtree, this task included. */
  public int completedCount() {
    int n = completed ? 1 : 0;
    for (Task t : subtasks) {
      n += t.completedCount();
    }
    return n;
  }
}
