package io.spectr.shell.tasks;

import java.util.List;

/** Parsed content of a {@code tasks.md} file. */
public record TaskList(List<TaskSection> sections, Summary summary) {

  /** Task counts over all sections, subtasks included. */
  public record Summary(int total, int completed) {}

  public TaskList {
    sections = List.copyOf(sections);
  }

  static TaskList of(List<TaskSection> sections) {
    int total = 0;
    int completed = 0;
    for (TaskSection section : sections) {
      for (Task task : section.tasks()) {
        total += task.total();
        completed += task.completedCount();
      }
    }
    return new TaskList(sections, new Summary(total, completed));
  }
}
