package io.spectr.shell.cli;

import io.spectr.markdown.api.Document;
import io.spectr.shell.tasks.Task;
import io.spectr.shell.tasks.TaskList;
import io.spectr.shell.tasks.TaskListReader;
import io.spectr.shell.tasks.TaskSection;
import picocli.CommandLine;

@CommandLine.Command(
    name = "tasks",
    description = "Show the sections and tasks of a tasks.md file",
    mixinStandardHelpOptions = true)
public final class TasksCommand extends DocumentCommand {

  @CommandLine.Option(names = "--json", description = "Print tasks as JSON")
  boolean json;

  @Override
  int run(Document doc) {
    TaskList list = TaskListReader.read(doc);
    if (json) {
      System.out.println(Json.GSON.toJson(list));
      return 0;
    }
    for (TaskSection section : list.sections()) {
      System.out.println(
          section.number() == 0 && section.name().isEmpty()
              ? "(no section)"
              : section.number() + ". " + section.name());
      for (Task task : section.tasks()) {
        print(task, "  ");
      }
    }
    TaskList.Summary summary = list.summary();
    System.out.println(summary.completed() + "/" + summary.total() + " tasks completed");
    return 0;
  }

  private static void print(Task task, String indent) {
    String[] lines = task.description().split("\n");
    System.out.println(indent + (task.completed() ? "[x] " : "[ ] ") + task.id() + " " + lines[0]);
    for (Task sub : task.subtasks()) {
      print(sub, indent + "  ");
    }
  }
}
