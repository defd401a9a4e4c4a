package io.spectr.shell.cli;

import io.spectr.markdown.api.EncodingException;
import io.spectr.shell.tasks.TaskStoreException;
import io.spectr.shell.tasks.TaskSync;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "sync",
    description = "Update the checkboxes of tasks.md from tasks.jsonc in a change directory",
    mixinStandardHelpOptions = true)
public final class SyncCommand implements Callable<Integer> {

  @CommandLine.Parameters(index = "0", paramLabel = "DIR", description = "Change directory")
  Path dir;

  @Override
  public Integer call() {
    if (!Files.isDirectory(dir)) {
      System.err.println("Error: Directory not found: " + dir);
      return 1;
    }
    try {
      int updated = TaskSync.syncDirectory(dir);
      System.out.println("Updated " + updated + (updated == 1 ? " task" : " tasks"));
      return 0;
    } catch (TaskStoreException e) {
      System.err.println("Error: " + e.getMessage());
      return 1;
    } catch (EncodingException e) {
      System.err.println("Error: " + TaskSync.TASKS_FILE + " is not valid UTF-8: " + e.getMessage());
      return 1;
    } catch (IOException e) {
      System.err.println("Error: Failed to sync " + dir + ": " + e.getMessage());
      return 1;
    }
  }
}
