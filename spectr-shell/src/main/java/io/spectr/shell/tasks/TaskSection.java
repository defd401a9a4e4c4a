package io.spectr.shell.tasks;

import java.util.List;

/** A {@code ## N. Name} section of a {@code tasks.md} file and its top-level tasks. */
public record TaskSection(int number, String name, List<Task> tasks) {

  public TaskSection {
    tasks = List.copyOf(tasks);
  }
}
